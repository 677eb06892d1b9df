package com.di.bugsummary.summary.view;

import com.di.bugsummary.summary.journal.BugSummaryJournal;
import com.di.bugsummary.summary.journal.JournalEntry;
import com.di.bugsummary.summary.store.BugSummaryRow;
import com.di.bugsummary.summary.store.BugSummaryStore;
import com.di.bugsummary.summary.store.InMemorySummaryTransactionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Combined view over the in-memory stores. Both sources are copied under the read lock of
 * {@link InMemorySummaryTransactionManager}, so a rollup batch is seen either entirely before or
 * entirely after it commits.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "bugsummary.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryCombinedBugSummaryView implements CombinedBugSummaryView {

    private final BugSummaryStore store;
    private final BugSummaryJournal journal;
    private final InMemorySummaryTransactionManager transactionManager;

    @Override
    public Stream<CombinedSummaryRow> query(BugSummaryFilter filter) {
        List<CombinedSummaryRow> rows = transactionManager.readLocked(() -> {
            List<BugSummaryRow> aggregate = store.findAll(filter);
            List<JournalEntry> pending = journal.findAll(filter);
            List<CombinedSummaryRow> snapshot = new ArrayList<>(aggregate.size() + pending.size());
            aggregate.forEach(r -> snapshot.add(new CombinedSummaryRow(r.id(), r.key(), r.count())));
            pending.forEach(e -> snapshot.add(new CombinedSummaryRow(-e.id(), e.key(), e.delta())));
            return snapshot;
        });
        return rows.stream();
    }
}
