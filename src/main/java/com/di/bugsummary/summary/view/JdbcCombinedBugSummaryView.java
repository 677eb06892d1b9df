package com.di.bugsummary.summary.view;

import com.di.bugsummary.sql.SqlQueriesProperties;
import com.di.bugsummary.summary.store.BugSummaryJdbcSupport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Reads the {@code combinedbugsummary} SQL view in a single statement, so the aggregate rows and
 * journal entries come from one snapshot and a concurrent rollup cannot count a delta twice or
 * not at all.
 */
@Component
@ConditionalOnProperty(name = "bugsummary.persistence-enabled", havingValue = "true")
public class JdbcCombinedBugSummaryView implements CombinedBugSummaryView {

    private static final RowMapper<CombinedSummaryRow> ROW_MAPPER = (rs, rowNum) ->
            new CombinedSummaryRow(rs.getLong("id"), BugSummaryJdbcSupport.mapKey(rs), rs.getInt("count"));

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcCombinedBugSummaryView(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    @Override
    public Stream<CombinedSummaryRow> query(BugSummaryFilter filter) {
        BugSummaryFilterSql.Fragment fragment = BugSummaryFilterSql.render(filter);
        return jdbc.query(fragment.appendTo(sql.getCombined().getSelectAll(), ""), ROW_MAPPER, fragment.argArray())
                .stream();
    }
}
