package com.di.bugsummary.summary.view;

import com.di.bugsummary.summary.model.BugSummaryDimension;
import com.di.bugsummary.summary.model.BugTarget;

import java.util.Collection;

/**
 * Filters selecting the buckets of one bug context without double counting.
 *
 * <p>A narrowed task is counted both under its own target and under the broader target, so a
 * context must pin every container axis, including the ones that are NULL: the distribution
 * context only reads rows whose source package, package and OCI axes are NULL.
 */
public final class BugSummaryContexts {

    private static final BugSummaryDimension[] CONTAINER_AXES = {
            BugSummaryDimension.PRODUCT,
            BugSummaryDimension.PRODUCT_SERIES,
            BugSummaryDimension.DISTRIBUTION,
            BugSummaryDimension.DISTRO_SERIES,
            BugSummaryDimension.SOURCE_PACKAGE_NAME,
            BugSummaryDimension.OCI_PROJECT,
            BugSummaryDimension.OCI_PROJECT_SERIES,
            BugSummaryDimension.PACKAGE_TYPE,
            BugSummaryDimension.CHANNEL
    };

    private BugSummaryContexts() {
    }

    /** Every bucket, all visibilities. */
    public static BugSummaryFilter all() {
        return BugSummaryFilter.ALL;
    }

    /**
     * Buckets of exactly this target: each container axis equal to the target's, NULL axes
     * matching NULL.
     */
    public static BugSummaryFilter forTarget(BugTarget target) {
        target.validate();
        Object[] values = {
                target.product(),
                target.productSeries(),
                target.distribution(),
                target.distroSeries(),
                target.sourcePackageName(),
                target.ociProject(),
                target.ociProjectSeries(),
                target.packageType(),
                target.channel()
        };
        BugSummaryFilter.Builder b = BugSummaryFilter.builder();
        for (int i = 0; i < CONTAINER_AXES.length; i++) {
            b.where(CONTAINER_AXES[i], values[i]);
        }
        return b.build();
    }

    /** Buckets of all products in a project group, each counted at product level. */
    public static BugSummaryFilter projectGroup(Collection<Long> productIds) {
        if (productIds == null || productIds.isEmpty()) {
            throw new IllegalArgumentException("Project group has no products");
        }
        return BugSummaryFilter.builder()
                .whereIn(BugSummaryDimension.PRODUCT, productIds)
                .where(BugSummaryDimension.OCI_PROJECT, null)
                .where(BugSummaryDimension.OCI_PROJECT_SERIES, null)
                .build();
    }

    /**
     * Buckets of one milestone, read from the pillar-level tasks only (broad rows, no series
     * tasks) so a bug is counted once.
     */
    public static BugSummaryFilter milestone(long milestoneId) {
        return BugSummaryFilter.builder()
                .where(BugSummaryDimension.MILESTONE, milestoneId)
                .where(BugSummaryDimension.PRODUCT_SERIES, null)
                .where(BugSummaryDimension.DISTRO_SERIES, null)
                .where(BugSummaryDimension.SOURCE_PACKAGE_NAME, null)
                .where(BugSummaryDimension.OCI_PROJECT, null)
                .where(BugSummaryDimension.OCI_PROJECT_SERIES, null)
                .build();
    }
}
