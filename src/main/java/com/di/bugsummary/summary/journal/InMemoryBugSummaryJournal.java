package com.di.bugsummary.summary.journal;

import com.di.bugsummary.summary.model.BugSummaryDelta;
import com.di.bugsummary.summary.store.InMemorySummaryTransactionManager;
import com.di.bugsummary.summary.view.BugSummaryFilter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of BugSummaryJournal. Suitable for single-node and testing.
 * When bugsummary.persistence-enabled=true, JdbcBugSummaryJournal is used instead.
 * Appends and deletes are undone when the surrounding in-memory transaction rolls back.
 */
@Component
@ConditionalOnProperty(name = "bugsummary.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryBugSummaryJournal implements BugSummaryJournal {

    private final NavigableMap<Long, JournalEntry> entries = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public int append(List<BugSummaryDelta> deltas) {
        List<BugSummaryDelta> net = BugSummaryDelta.net(deltas);
        for (BugSummaryDelta d : net) {
            long id = sequence.incrementAndGet();
            entries.put(id, new JournalEntry(id, d.key(), d.delta()));
            InMemorySummaryTransactionManager.onRollback(() -> entries.remove(id));
        }
        return net.size();
    }

    @Override
    public OptionalLong highWaterMark(Integer batchSize) {
        if (entries.isEmpty()) {
            return OptionalLong.empty();
        }
        if (batchSize == null) {
            return OptionalLong.of(entries.lastKey());
        }
        long mark = -1;
        int seen = 0;
        Iterator<Long> ids = entries.keySet().iterator();
        while (ids.hasNext() && seen < Math.max(1, batchSize)) {
            mark = ids.next();
            seen++;
        }
        return mark < 0 ? OptionalLong.empty() : OptionalLong.of(mark);
    }

    @Override
    public List<JournalEntry> readUpTo(long mark) {
        return new ArrayList<>(entries.headMap(mark, true).values());
    }

    @Override
    public int delete(Collection<Long> ids) {
        int deleted = 0;
        for (Long id : ids) {
            JournalEntry removed = entries.remove(id);
            if (removed != null) {
                InMemorySummaryTransactionManager.onRollback(() -> entries.put(removed.id(), removed));
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public long size() {
        return entries.size();
    }

    @Override
    public List<JournalEntry> findAll(BugSummaryFilter filter) {
        BugSummaryFilter f = filter != null ? filter : BugSummaryFilter.ALL;
        return entries.values().stream().filter(e -> f.matches(e.key())).toList();
    }
}
