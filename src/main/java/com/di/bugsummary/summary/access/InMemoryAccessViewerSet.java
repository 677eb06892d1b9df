package com.di.bugsummary.summary.access;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory grants. Suitable for single-node and testing.
 * When bugsummary.persistence-enabled=true, JdbcAccessViewerSet is used instead.
 */
@Component
@ConditionalOnProperty(name = "bugsummary.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryAccessViewerSet implements AccessViewerSet {

    private final Map<Long, Set<Long>> granteesByPolicy = new ConcurrentHashMap<>();

    public void grant(long policyId, long userId) {
        granteesByPolicy.computeIfAbsent(policyId, p -> ConcurrentHashMap.newKeySet()).add(userId);
    }

    public void revoke(long policyId, long userId) {
        granteesByPolicy.computeIfPresent(policyId, (p, grantees) -> {
            grantees.remove(userId);
            return grantees.isEmpty() ? null : grantees;
        });
    }

    @Override
    public Set<Long> viewersOf(long policyId) {
        Set<Long> grantees = granteesByPolicy.get(policyId);
        return grantees == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(grantees));
    }

    @Override
    public Set<Long> policiesGrantedTo(long userId) {
        return granteesByPolicy.entrySet().stream()
                .filter(e -> e.getValue().contains(userId))
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
