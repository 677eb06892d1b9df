package com.di.bugsummary.summary.counter;

import com.di.bugsummary.config.BugSummaryProperties;
import com.di.bugsummary.exception.InvariantViolationException;
import com.di.bugsummary.exception.SummaryCorruptionException;
import com.di.bugsummary.exception.TransientConflictException;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.store.BugSummaryStore;
import com.di.bugsummary.util.BugSummaryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * Applies a net delta to one aggregate row without lost updates under concurrent writers.
 *
 * <p>Each attempt first updates the existing row in place; if there is none it inserts one, and
 * an insert that loses the race to a concurrent writer goes back to the update. A row left at
 * exactly zero is deleted afterwards. Deltas to one bucket commute, so concurrent rollups and
 * writers converge to the same count in any order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BugSummaryCounter {

    private final BugSummaryStore store;
    private final BugSummaryMetrics metrics;
    private final BugSummaryProperties properties;

    /**
     * @throws InvariantViolationException  if the key's target is not a valid container
     * @throws TransientConflictException   if every attempt lost the insert race
     * @throws SummaryCorruptionException   if the count would overflow
     */
    public void apply(BugSummaryKey key, int delta) {
        key.getTarget().validate();
        if (delta == 0) {
            return;
        }

        int maxAttempts = properties.getUpsert().getMaxAttempts();
        DuplicateKeyException lastConflict = null;
        boolean applied = false;
        for (int attempt = 1; attempt <= maxAttempts && !applied; attempt++) {
            if (store.increment(key, delta) > 0) {
                applied = true;
            } else {
                try {
                    store.insert(key, delta);
                    applied = true;
                } catch (DuplicateKeyException e) {
                    lastConflict = e;
                    metrics.recordUpsertConflict();
                    log.debug("[UPSERT] Insert lost race for {} (attempt {}/{})", key, attempt, maxAttempts);
                }
            }
        }
        if (!applied) {
            metrics.recordUpsertExhausted();
            log.warn("[UPSERT] Giving up on {} after {} attempts", key, maxAttempts);
            throw new TransientConflictException(key, maxAttempts, lastConflict);
        }

        store.deleteIfZero(key);

        OptionalInt count = store.findCount(key);
        if (count.isPresent() && count.getAsInt() < 0) {
            metrics.recordCorruption();
            log.error("[UPSERT] Negative aggregate count {} for {} after applying {}", count.getAsInt(), key, delta);
        }
    }
}
