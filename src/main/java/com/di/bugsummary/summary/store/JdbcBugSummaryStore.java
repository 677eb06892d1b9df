package com.di.bugsummary.summary.store;

import com.di.bugsummary.config.BugSummaryConfiguration;
import com.di.bugsummary.exception.SummaryCorruptionException;
import com.di.bugsummary.sql.SqlQueriesProperties;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.view.BugSummaryFilter;
import com.di.bugsummary.summary.view.BugSummaryFilterSql;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.OptionalInt;

/**
 * JDBC implementation of BugSummaryStore over the {@code bugsummary} table.
 * Enable with bugsummary.persistence-enabled=true and a configured datasource.
 *
 * <p>The insert runs under its own savepoint: on PostgreSQL a unique violation aborts the whole
 * transaction, and the caller must be able to retry the update after losing the race.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "bugsummary.persistence-enabled", havingValue = "true")
public class JdbcBugSummaryStore implements BugSummaryStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final TransactionOperations nestedTx;

    public JdbcBugSummaryStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql,
                               @Qualifier(BugSummaryConfiguration.NESTED_TX) TransactionOperations nestedTx) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.nestedTx = nestedTx;
    }

    @Override
    public int increment(BugSummaryKey key, int delta) {
        try {
            return jdbc.update(sql.getSummary().getIncrement(), BugSummaryJdbcSupport.args(key, delta));
        } catch (DataIntegrityViolationException e) {
            throw SummaryCorruptionException.overflow(key, delta, e);
        }
    }

    @Override
    public void insert(BugSummaryKey key, int count) {
        nestedTx.executeWithoutResult(status ->
                jdbc.update(sql.getSummary().getInsert(), BugSummaryJdbcSupport.args(key, count, key.canonical())));
    }

    @Override
    public OptionalInt findCount(BugSummaryKey key) {
        List<Integer> counts = jdbc.queryForList(sql.getSummary().getFindCount(), Integer.class,
                BugSummaryJdbcSupport.args(key));
        return counts.isEmpty() ? OptionalInt.empty() : OptionalInt.of(counts.get(0));
    }

    @Override
    public int deleteIfZero(BugSummaryKey key) {
        return jdbc.update(sql.getSummary().getDeleteIfZero(), BugSummaryJdbcSupport.args(key));
    }

    @Override
    public void lockForRollup() {
        List<Integer> locked = jdbc.queryForList(sql.getSummary().getLockForRollup(), Integer.class);
        if (locked.isEmpty()) {
            throw new IllegalStateException("Rollup lock row is missing from bugsummary_rollup_lock");
        }
        log.debug("[ROLLUP] Acquired rollup lock row");
    }

    @Override
    public List<BugSummaryRow> findAll(BugSummaryFilter filter) {
        BugSummaryFilterSql.Fragment fragment = BugSummaryFilterSql.render(filter);
        return jdbc.query(fragment.appendTo(sql.getSummary().getSelectAll(), " ORDER BY id"),
                BugSummaryJdbcSupport.ROW_MAPPER, fragment.argArray());
    }

    @Override
    public List<BugSummaryRow> findNonPositive() {
        return jdbc.query(sql.getSummary().getFindNonPositive(), BugSummaryJdbcSupport.ROW_MAPPER);
    }
}
