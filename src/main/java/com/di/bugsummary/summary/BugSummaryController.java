package com.di.bugsummary.summary;

import com.di.bugsummary.summary.model.BugSummaryDimension;
import com.di.bugsummary.summary.model.BugTarget;
import com.di.bugsummary.summary.model.BugTaskStatus;
import com.di.bugsummary.summary.rollup.RollupResult;
import com.di.bugsummary.summary.store.BugSummaryRow;
import com.di.bugsummary.summary.view.BugSummaryContexts;
import com.di.bugsummary.summary.view.BugSummaryCount;
import com.di.bugsummary.summary.view.BugSummaryFilter;
import com.di.bugsummary.summary.view.BugSummaryQueryService;
import com.di.bugsummary.summary.view.TagCount;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API over the bug summary: manual rollup, journal status, counts and tag counts by context,
 * and the integrity check. Use with context path: e.g. GET /api/bugsummary/tags?product=1
 */
@RestController
@RequestMapping("/api/bugsummary")
@RequiredArgsConstructor
public class BugSummaryController {

    private static final int MAX_TAG_LIMIT = 1000;

    private final BugSummaryService service;
    private final BugSummaryQueryService queryService;

    /**
     * Runs one rollup batch.
     *
     * @param batchSize optional; journal entries to fold at most, all when absent
     */
    @PostMapping(value = "/rollup", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RollupResult> rollup(@RequestParam(required = false) Integer batchSize) {
        return ResponseEntity.ok(service.runCompaction(batchSize));
    }

    @GetMapping(value = "/journal", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JournalStatus> journal() {
        long size = service.journalSize();
        return ResponseEntity.ok(new JournalStatus(size, size == 0));
    }

    /**
     * Current counts per bucket in a context, including deltas not yet rolled up.
     *
     * @param tag         optional; only buckets of this tag (the all-tags buckets when absent)
     * @param status      optional; only these statuses
     * @param userId      optional reader; anonymous readers see public bugs only
     * @param viaPolicies optional; count the reader's private bugs through the policies granted
     */
    @GetMapping(value = "/counts", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CountsResponse> counts(
            @ModelAttribute ContextParams context,
            @RequestParam(required = false) String tag,
            @RequestParam(required = false) List<BugTaskStatus> status,
            @RequestParam(required = false) Long userId,
            @RequestParam(required = false, defaultValue = "false") boolean viaPolicies) {
        BugSummaryFilter.Builder b = context.toFilter().toBuilder().where(BugSummaryDimension.TAG, tag);
        if (status != null && !status.isEmpty()) {
            b.statuses(status);
        }
        BugSummaryFilter filter = queryService.forReader(b.build(), userId, viaPolicies);
        List<BugSummaryCount> buckets = service.queryAggregates(filter).toList();
        long total = buckets.stream().mapToLong(BugSummaryCount::count).sum();
        return ResponseEntity.ok(new CountsResponse(total, buckets));
    }

    /**
     * Open bug counts per tag in a context.
     *
     * @param limit   optional; default 10, at most 1000
     * @param include optional; tags always reported, 0 when unused
     */
    @GetMapping(value = "/tags", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<TagCount>> tags(
            @ModelAttribute ContextParams context,
            @RequestParam(required = false) Long userId,
            @RequestParam(required = false, defaultValue = "10") int limit,
            @RequestParam(required = false) List<String> include) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        return ResponseEntity.ok(service.tagOpenCounts(context.toFilter(), userId,
                Math.min(limit, MAX_TAG_LIMIT), include));
    }

    @GetMapping(value = "/integrity", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<BugSummaryRow>> integrity() {
        return ResponseEntity.ok(service.checkIntegrity());
    }

    public record JournalStatus(long pendingEntries, boolean drained) {
    }

    public record CountsResponse(long total, List<BugSummaryCount> buckets) {
    }

    /**
     * Context selection from query parameters: a milestone, a project group, a single target, or
     * everything when none is given.
     */
    @Data
    public static class ContextParams {
        private Long product;
        private Long productSeries;
        private Long distribution;
        private Long distroSeries;
        private Long sourcePackageName;
        private Long ociProject;
        private Long ociProjectSeries;
        private Integer packageType;
        private String channel;
        private List<Long> projectGroup;
        private Long milestone;

        BugSummaryFilter toFilter() {
            if (milestone != null) {
                return BugSummaryContexts.milestone(milestone);
            }
            if (projectGroup != null && !projectGroup.isEmpty()) {
                return BugSummaryContexts.projectGroup(projectGroup);
            }
            BugTarget target = new BugTarget(product, productSeries, distribution, distroSeries,
                    sourcePackageName, ociProject, ociProjectSeries, packageType, channel);
            if (target.equals(new BugTarget(null, null, null, null, null, null, null))) {
                return BugSummaryContexts.all();
            }
            return BugSummaryContexts.forTarget(target);
        }
    }
}
