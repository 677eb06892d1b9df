package com.di.bugsummary.summary.access;

import com.di.bugsummary.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads access policy grants from {@code accesspolicygrant}.
 */
@Component
@ConditionalOnProperty(name = "bugsummary.persistence-enabled", havingValue = "true")
public class JdbcAccessViewerSet implements AccessViewerSet {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcAccessViewerSet(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    @Override
    public Set<Long> viewersOf(long policyId) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(
                jdbc.queryForList(sql.getAccess().getFindGrantees(), Long.class, policyId)));
    }

    @Override
    public Set<Long> policiesGrantedTo(long userId) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(
                jdbc.queryForList(sql.getAccess().getFindPoliciesByGrantee(), Long.class, userId)));
    }
}
