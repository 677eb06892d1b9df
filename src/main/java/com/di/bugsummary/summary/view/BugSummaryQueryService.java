package com.di.bugsummary.summary.view;

import com.di.bugsummary.summary.access.AccessViewerSet;
import com.di.bugsummary.summary.model.BugSummaryDimension;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.model.BugTaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads over the combined view. Counts are summed here, per key or per tag, and zero sums are
 * dropped so a bucket whose pending deltas cancel its aggregate row does not show up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BugSummaryQueryService {

    private final CombinedBugSummaryView view;
    private final AccessViewerSet accessViewerSet;

    /**
     * Current count per bucket matching {@code filter}, in first-seen order, zero counts dropped.
     */
    public Stream<BugSummaryCount> queryAggregates(BugSummaryFilter filter) {
        Map<BugSummaryKey, Long> sums = new LinkedHashMap<>();
        try (Stream<CombinedSummaryRow> rows = view.query(filter)) {
            rows.forEach(r -> sums.merge(r.key(), (long) r.count(), Long::sum));
        }
        return sums.entrySet().stream()
                .filter(e -> e.getValue() != 0L)
                .map(e -> new BugSummaryCount(e.getKey(), e.getValue()));
    }

    /**
     * Restricts {@code filter} to what a reader may see.
     *
     * @param userId      reader, or null for anonymous (public rows only)
     * @param viaPolicies read private bugs through the per-policy rows of the policies granted to
     *                    the reader instead of the reader's own rows
     */
    public BugSummaryFilter forReader(BugSummaryFilter filter, Long userId, boolean viaPolicies) {
        BugSummaryFilter.Builder b = filter.toBuilder();
        if (userId == null) {
            b.publicOnly();
        } else if (viaPolicies) {
            b.visibleThroughPolicies(accessViewerSet.policiesGrantedTo(userId));
        } else {
            b.visibleTo(userId);
        }
        return b.build();
    }

    /**
     * Open bug counts per tag in a context, highest count first then by tag, at most
     * {@code tagLimit} of them. Every tag in {@code includeTags} is reported, with 0 when it has no
     * open bugs, even past the limit.
     *
     * @param context  context filter, e.g. from {@link BugSummaryContexts}
     * @param userId   reader, or null for anonymous
     * @param tagLimit maximum number of tags before adding {@code includeTags}; null for no limit
     */
    public List<TagCount> tagOpenCounts(BugSummaryFilter context, Long userId, Integer tagLimit,
                                        Collection<String> includeTags) {
        if (tagLimit != null && tagLimit < 0) {
            throw new IllegalArgumentException("tagLimit must not be negative: " + tagLimit);
        }
        BugSummaryFilter filter = forReader(context, userId, false).toBuilder()
                .statuses(BugTaskStatus.UNRESOLVED)
                .whereNotNull(BugSummaryDimension.TAG)
                .build();

        Map<String, Long> byTag = new LinkedHashMap<>();
        try (Stream<CombinedSummaryRow> rows = view.query(filter)) {
            rows.forEach(r -> byTag.merge(r.key().getTag(), (long) r.count(), Long::sum));
        }

        List<TagCount> ranked = byTag.entrySet().stream()
                .filter(e -> e.getValue() != 0L)
                .map(e -> new TagCount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(TagCount::count).reversed().thenComparing(TagCount::tag))
                .limit(tagLimit != null ? tagLimit : Long.MAX_VALUE)
                .toList();

        List<TagCount> result = new ArrayList<>(ranked);
        if (includeTags != null && !includeTags.isEmpty()) {
            Set<String> present = new LinkedHashSet<>();
            ranked.forEach(t -> present.add(t.tag()));
            for (String tag : new LinkedHashSet<>(includeTags)) {
                if (tag != null && present.add(tag)) {
                    result.add(new TagCount(tag, byTag.getOrDefault(tag, 0L)));
                }
            }
        }
        log.debug("[VIEW] {} tag counts for {}", result.size(), context);
        return result;
    }
}
