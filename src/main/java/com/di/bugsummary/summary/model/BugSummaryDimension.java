package com.di.bugsummary.summary.model;

import java.sql.Types;
import java.util.function.Function;

/**
 * Dimensions of a summary bucket in column order. Every SQL statement that binds a whole key
 * binds its parameters in this order.
 */
public enum BugSummaryDimension {
    PRODUCT("product", Types.BIGINT, k -> k.getTarget().product()),
    PRODUCT_SERIES("productseries", Types.BIGINT, k -> k.getTarget().productSeries()),
    DISTRIBUTION("distribution", Types.BIGINT, k -> k.getTarget().distribution()),
    DISTRO_SERIES("distroseries", Types.BIGINT, k -> k.getTarget().distroSeries()),
    SOURCE_PACKAGE_NAME("sourcepackagename", Types.BIGINT, k -> k.getTarget().sourcePackageName()),
    OCI_PROJECT("ociproject", Types.BIGINT, k -> k.getTarget().ociProject()),
    OCI_PROJECT_SERIES("ociprojectseries", Types.BIGINT, k -> k.getTarget().ociProjectSeries()),
    PACKAGE_TYPE("packagetype", Types.INTEGER, k -> k.getTarget().packageType()),
    CHANNEL("channel", Types.VARCHAR, k -> k.getTarget().channel()),
    VIEWED_BY("viewed_by", Types.BIGINT, BugSummaryKey::getViewedBy),
    ACCESS_POLICY("access_policy", Types.BIGINT, BugSummaryKey::getAccessPolicy),
    TAG("tag", Types.VARCHAR, BugSummaryKey::getTag),
    STATUS("status", Types.INTEGER, k -> k.getStatus().getValue()),
    MILESTONE("milestone", Types.BIGINT, BugSummaryKey::getMilestone),
    IMPORTANCE("importance", Types.INTEGER, k -> k.getImportance().getValue()),
    HAS_PATCH("has_patch", Types.BOOLEAN, BugSummaryKey::isHasPatch);

    private final String column;
    private final int sqlType;
    private final Function<BugSummaryKey, Object> extractor;

    BugSummaryDimension(String column, int sqlType, Function<BugSummaryKey, Object> extractor) {
        this.column = column;
        this.sqlType = sqlType;
        this.extractor = extractor;
    }

    public String getColumn() {
        return column;
    }

    public int getSqlType() {
        return sqlType;
    }

    /**
     * Value of this dimension in the form it is bound to a JDBC statement.
     */
    public Object valueOf(BugSummaryKey key) {
        return extractor.apply(key);
    }

    /**
     * Normalizes a filter value (enum constants become their stored int) to its JDBC form.
     */
    public static Object toJdbc(Object value) {
        if (value instanceof BugTaskStatus status) {
            return status.getValue();
        }
        if (value instanceof BugTaskImportance importance) {
            return importance.getValue();
        }
        return value;
    }
}
