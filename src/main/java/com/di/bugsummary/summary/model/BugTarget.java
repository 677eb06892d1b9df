package com.di.bugsummary.summary.model;

import com.di.bugsummary.exception.InvariantViolationException;

/**
 * Container axes of a bug task or summary bucket. A target names exactly one container:
 * a product, a product series, a distribution or a distro series, optionally narrowed by a
 * source package name (with its package type and channel) or an OCI project (series).
 *
 * <p>Allowed shapes:
 * <ul>
 *   <li>{@code product}, optionally with {@code ociProject} or {@code ociProjectSeries}</li>
 *   <li>{@code productSeries} alone</li>
 *   <li>{@code distribution}, optionally with {@code sourcePackageName} or an OCI axis</li>
 *   <li>{@code distroSeries}, optionally with {@code sourcePackageName}</li>
 * </ul>
 * A distribution or distro series source package may carry a {@code packageType}, and a
 * package type may carry a {@code channel}. The channel is kept as its JSON text.
 */
public record BugTarget(
        Long product,
        Long productSeries,
        Long distribution,
        Long distroSeries,
        Long sourcePackageName,
        Long ociProject,
        Long ociProjectSeries,
        Integer packageType,
        String channel) {

    public BugTarget(Long product, Long productSeries, Long distribution, Long distroSeries,
                     Long sourcePackageName, Long ociProject, Long ociProjectSeries) {
        this(product, productSeries, distribution, distroSeries, sourcePackageName, ociProject, ociProjectSeries,
                null, null);
    }

    public static BugTarget product(long product) {
        return new BugTarget(product, null, null, null, null, null, null);
    }

    public static BugTarget productSeries(long productSeries) {
        return new BugTarget(null, productSeries, null, null, null, null, null);
    }

    public static BugTarget distribution(long distribution) {
        return new BugTarget(null, null, distribution, null, null, null, null);
    }

    public static BugTarget distroSeries(long distroSeries) {
        return new BugTarget(null, null, null, distroSeries, null, null, null);
    }

    public static BugTarget sourcePackage(long distribution, long sourcePackageName) {
        return new BugTarget(null, null, distribution, null, sourcePackageName, null, null);
    }

    public static BugTarget seriesSourcePackage(long distroSeries, long sourcePackageName) {
        return new BugTarget(null, null, null, distroSeries, sourcePackageName, null, null);
    }

    public static BugTarget productOciProject(long product, long ociProject) {
        return new BugTarget(product, null, null, null, null, ociProject, null);
    }

    public static BugTarget distributionOciProject(long distribution, long ociProject) {
        return new BugTarget(null, null, distribution, null, null, ociProject, null);
    }

    public BugTarget withOciProjectSeries(Long series) {
        return new BugTarget(product, productSeries, distribution, distroSeries, sourcePackageName, ociProject, series,
                packageType, channel);
    }

    public BugTarget withOciProject(Long project) {
        return new BugTarget(product, productSeries, distribution, distroSeries, sourcePackageName, project,
                ociProjectSeries, packageType, channel);
    }

    /**
     * The same source package restricted to one package type and, optionally, one channel.
     */
    public BugTarget withPackage(Integer type, String channelJson) {
        return new BugTarget(product, productSeries, distribution, distroSeries, sourcePackageName, ociProject,
                ociProjectSeries, type, channelJson);
    }

    /**
     * True when a source package, package or OCI axis narrows the container.
     */
    public boolean hasNarrowAxis() {
        return sourcePackageName != null || ociProject != null || ociProjectSeries != null
                || packageType != null || channel != null;
    }

    /**
     * The same container with the narrowing axes cleared.
     */
    public BugTarget broader() {
        return new BugTarget(product, productSeries, distribution, distroSeries, null, null, null, null, null);
    }

    /**
     * Checks the container assignment rules and returns this target.
     *
     * @throws InvariantViolationException if the combination of axes is not an allowed shape
     */
    public BugTarget validate() {
        int containers = count(product) + count(productSeries) + count(distribution) + count(distroSeries);
        if (containers != 1) {
            throw invalid("exactly one of product, productSeries, distribution, distroSeries must be set");
        }
        if (ociProject != null && ociProjectSeries != null) {
            throw invalid("ociProject and ociProjectSeries are mutually exclusive");
        }
        boolean oci = ociProject != null || ociProjectSeries != null;
        if (sourcePackageName != null && oci) {
            throw invalid("sourcePackageName cannot be combined with an OCI axis");
        }
        if (productSeries != null && hasNarrowAxis()) {
            throw invalid("productSeries cannot be narrowed");
        }
        if (product != null && sourcePackageName != null) {
            throw invalid("sourcePackageName requires a distribution or distroSeries");
        }
        if (distroSeries != null && oci) {
            throw invalid("OCI axes require a product or distribution");
        }
        if (packageType != null && sourcePackageName == null) {
            throw invalid("packageType requires a sourcePackageName");
        }
        if (channel != null && packageType == null) {
            throw invalid("channel requires a packageType");
        }
        return this;
    }

    private InvariantViolationException invalid(String reason) {
        return new InvariantViolationException("Invalid bug target " + this + ": " + reason);
    }

    private static int count(Long axis) {
        return axis != null ? 1 : 0;
    }
}
