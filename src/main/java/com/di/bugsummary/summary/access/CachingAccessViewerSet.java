package com.di.bugsummary.summary.access;

import com.di.bugsummary.config.BugSummaryProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Cache in front of {@link JdbcAccessViewerSet} when persistence and the access cache are enabled.
 * A grant change is seen by the fan-out after {@code bugsummary.access-cache.expire-after-write-minutes}
 * unless {@link #invalidatePolicy} / {@link #invalidateUser} is called.
 */
@Service
@Primary
@ConditionalOnProperty(prefix = "bugsummary", name = {"persistence-enabled", "access-cache.enabled"}, havingValue = "true")
public class CachingAccessViewerSet implements AccessViewerSet {

    private final AccessViewerSet delegate;
    private final Cache<Long, Set<Long>> viewersByPolicy;
    private final Cache<Long, Set<Long>> policiesByUser;

    @Autowired
    public CachingAccessViewerSet(JdbcAccessViewerSet delegate, BugSummaryProperties properties) {
        this((AccessViewerSet) delegate, properties);
    }

    CachingAccessViewerSet(AccessViewerSet delegate, BugSummaryProperties properties) {
        this.delegate = delegate;
        BugSummaryProperties.AccessCache cfg = properties.getAccessCache();
        this.viewersByPolicy = Caffeine.newBuilder()
                .maximumSize(cfg.getMaxSize())
                .expireAfterWrite(cfg.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
                .build();
        this.policiesByUser = Caffeine.newBuilder()
                .maximumSize(cfg.getMaxSize())
                .expireAfterWrite(cfg.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
                .build();
    }

    @Override
    public Set<Long> viewersOf(long policyId) {
        return viewersByPolicy.get(policyId, delegate::viewersOf);
    }

    @Override
    public Set<Long> policiesGrantedTo(long userId) {
        return policiesByUser.get(userId, delegate::policiesGrantedTo);
    }

    public void invalidatePolicy(long policyId) {
        viewersByPolicy.invalidate(policyId);
        policiesByUser.invalidateAll();
    }

    public void invalidateUser(long userId) {
        policiesByUser.invalidate(userId);
        viewersByPolicy.invalidateAll();
    }
}
