package com.di.bugsummary.summary.fanout;

import com.di.bugsummary.exception.InvariantViolationException;
import com.di.bugsummary.summary.access.AccessViewerSet;
import com.di.bugsummary.summary.model.BugSummaryDelta;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.model.BugTarget;
import com.di.bugsummary.summary.model.BugTaskFact;
import com.di.bugsummary.summary.model.Viewer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands one bug task row into the summary buckets it is counted in.
 *
 * <p>A non-duplicate task is counted once for every combination of
 * <ul>
 *   <li>its target, plus the broader target when a source package or OCI axis narrows it,</li>
 *   <li>each distinct tag, plus the all-tags bucket (tag NULL),</li>
 *   <li>each viewer: the public copy for public bugs; one copy per grantee and one per policy
 *       for private bugs.</li>
 * </ul>
 * Duplicate bugs are not counted at all.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BugSummaryFanOut {

    private final AccessViewerSet accessViewerSet;

    /**
     * Distinct buckets the fact is counted in, in a stable order. Empty for duplicates.
     *
     * @throws InvariantViolationException if the fact's target is not a valid container
     */
    public List<BugSummaryKey> computeBuckets(BugTaskFact fact) {
        if (fact.getTarget() == null) {
            throw new InvariantViolationException("Bug task " + fact.getTaskId() + " has no target");
        }
        fact.getTarget().validate();
        if (fact.getStatus() == null || fact.getImportance() == null) {
            throw new InvariantViolationException("Bug task " + fact.getTaskId() + " has no status or importance");
        }
        if (fact.isDuplicate()) {
            return List.of();
        }

        BugSummaryKey base = BugSummaryKey.builder()
                .target(fact.getTarget())
                .status(fact.getStatus())
                .importance(fact.getImportance())
                .milestone(fact.getMilestone())
                .hasPatch(fact.isHasPatch())
                .build();

        Set<BugSummaryKey> buckets = new LinkedHashSet<>();
        for (BugTarget target : targets(fact.getTarget())) {
            for (String tag : tags(fact)) {
                for (Viewer viewer : viewers(fact)) {
                    buckets.add(base.withTarget(target).withTag(tag).withViewer(viewer));
                }
            }
        }
        return List.copyOf(buckets);
    }

    public List<BugSummaryDelta> forInsert(BugTaskFact fact) {
        return computeBuckets(fact).stream().map(BugSummaryDelta::plus).toList();
    }

    public List<BugSummaryDelta> forDelete(BugTaskFact fact) {
        return computeBuckets(fact).stream().map(BugSummaryDelta::minus).toList();
    }

    /**
     * Old buckets decremented and new buckets incremented, netted per key so a bucket that both
     * rows fall in produces nothing.
     *
     * @throws InvariantViolationException if the task moved to another bug
     */
    public List<BugSummaryDelta> forUpdate(BugTaskFact oldFact, BugTaskFact newFact) {
        if (oldFact.getTaskId() != newFact.getTaskId()) {
            throw new InvariantViolationException("Update changes task id " + oldFact.getTaskId()
                    + " to " + newFact.getTaskId());
        }
        if (oldFact.getBugId() != newFact.getBugId()) {
            throw new InvariantViolationException("Bug task " + oldFact.getTaskId() + " cannot move from bug "
                    + oldFact.getBugId() + " to bug " + newFact.getBugId());
        }
        List<BugSummaryDelta> deltas = new ArrayList<>(forDelete(oldFact));
        deltas.addAll(forInsert(newFact));
        List<BugSummaryDelta> net = BugSummaryDelta.net(deltas);
        log.debug("[FANOUT] task={} update: {} raw deltas, {} after netting", newFact.getTaskId(), deltas.size(), net.size());
        return net;
    }

    private static List<BugTarget> targets(BugTarget target) {
        if (!target.hasNarrowAxis()) {
            return List.of(target);
        }
        return List.of(target, target.broader());
    }

    /** Distinct non-blank tags followed by the all-tags bucket. */
    private static List<String> tags(BugTaskFact fact) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String tag : fact.getTags()) {
            if (tag != null && !tag.isBlank()) {
                distinct.add(tag);
            }
        }
        List<String> tags = new ArrayList<>(distinct);
        tags.add(null);
        return tags;
    }

    private List<Viewer> viewers(BugTaskFact fact) {
        if (fact.isPublic()) {
            return List.of(Viewer.PUBLIC);
        }
        long policy = fact.getAccessPolicy();
        List<Viewer> viewers = new ArrayList<>();
        for (Long grantee : accessViewerSet.viewersOf(policy)) {
            viewers.add(Viewer.grantee(grantee));
        }
        viewers.add(Viewer.policy(policy));
        return viewers;
    }
}
