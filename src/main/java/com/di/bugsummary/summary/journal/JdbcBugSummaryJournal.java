package com.di.bugsummary.summary.journal;

import com.di.bugsummary.sql.SqlQueriesProperties;
import com.di.bugsummary.summary.model.BugSummaryDelta;
import com.di.bugsummary.summary.store.BugSummaryJdbcSupport;
import com.di.bugsummary.summary.view.BugSummaryFilter;
import com.di.bugsummary.summary.view.BugSummaryFilterSql;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.OptionalLong;

/**
 * JDBC implementation of BugSummaryJournal over {@code bugsummaryjournal}.
 * Enable with bugsummary.persistence-enabled=true and a configured datasource.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "bugsummary.persistence-enabled", havingValue = "true")
public class JdbcBugSummaryJournal implements BugSummaryJournal {

    private static final RowMapper<JournalEntry> ENTRY_ROW_MAPPER = (rs, rowNum) ->
            new JournalEntry(rs.getLong("id"), BugSummaryJdbcSupport.mapKey(rs), rs.getInt("count"));

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcBugSummaryJournal(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    @Override
    public int append(List<BugSummaryDelta> deltas) {
        List<BugSummaryDelta> net = BugSummaryDelta.net(deltas);
        if (net.isEmpty()) {
            return 0;
        }
        List<Object[]> batch = new ArrayList<>(net.size());
        for (BugSummaryDelta d : net) {
            batch.add(BugSummaryJdbcSupport.args(d.key(), d.delta()));
        }
        jdbc.batchUpdate(sql.getJournal().getInsert(), batch);
        log.debug("[JOURNAL] Appended {} entries ({} deltas before netting)", net.size(), deltas.size());
        return net.size();
    }

    @Override
    public OptionalLong highWaterMark(Integer batchSize) {
        Long mark = batchSize == null
                ? jdbc.queryForObject(sql.getJournal().getHighWaterMark(), Long.class)
                : jdbc.queryForObject(sql.getJournal().getHighWaterMarkBatch(), Long.class, Math.max(1, batchSize));
        return mark == null ? OptionalLong.empty() : OptionalLong.of(mark);
    }

    @Override
    public List<JournalEntry> readUpTo(long mark) {
        return jdbc.query(sql.getJournal().getReadUpTo(), ENTRY_ROW_MAPPER, mark);
    }

    @Override
    public int delete(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        List<Object[]> batch = new ArrayList<>(ids.size());
        for (Long id : ids) {
            batch.add(new Object[]{id});
        }
        int[] counts = jdbc.batchUpdate(sql.getJournal().getDeleteById(), batch);
        return Arrays.stream(counts).map(c -> Math.max(c, 0)).sum();
    }

    @Override
    public long size() {
        Long count = jdbc.queryForObject(sql.getJournal().getCount(), Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public List<JournalEntry> findAll(BugSummaryFilter filter) {
        BugSummaryFilterSql.Fragment fragment = BugSummaryFilterSql.render(filter);
        return jdbc.query(fragment.appendTo(sql.getJournal().getSelectAll(), " ORDER BY id"),
                ENTRY_ROW_MAPPER, fragment.argArray());
    }
}
