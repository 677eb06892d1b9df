package com.di.bugsummary.summary.store;

import com.di.bugsummary.summary.model.BugSummaryDimension;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.model.BugTarget;
import com.di.bugsummary.summary.model.BugTaskImportance;
import com.di.bugsummary.summary.model.BugTaskStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Binding and mapping of summary keys shared by the JDBC stores and the combined view.
 * Parameters are typed so NULL dimensions bind correctly in {@code IS NOT DISTINCT FROM ?}.
 */
public final class BugSummaryJdbcSupport {

    private static final BugSummaryDimension[] DIMENSIONS = BugSummaryDimension.values();

    public static final RowMapper<BugSummaryRow> ROW_MAPPER = (rs, rowNum) ->
            new BugSummaryRow(rs.getLong("id"), mapKey(rs), rs.getInt("count"));

    private BugSummaryJdbcSupport() {
    }

    /**
     * {@code leading} values followed by the key dimensions in column order.
     */
    public static Object[] args(BugSummaryKey key, Object... leading) {
        Object[] args = new Object[leading.length + DIMENSIONS.length];
        System.arraycopy(leading, 0, args, 0, leading.length);
        for (int i = 0; i < DIMENSIONS.length; i++) {
            BugSummaryDimension d = DIMENSIONS[i];
            args[leading.length + i] = new SqlParameterValue(d.getSqlType(), d.valueOf(key));
        }
        return args;
    }

    public static BugSummaryKey mapKey(ResultSet rs) throws SQLException {
        BugTarget target = new BugTarget(
                rs.getObject("product", Long.class),
                rs.getObject("productseries", Long.class),
                rs.getObject("distribution", Long.class),
                rs.getObject("distroseries", Long.class),
                rs.getObject("sourcepackagename", Long.class),
                rs.getObject("ociproject", Long.class),
                rs.getObject("ociprojectseries", Long.class),
                rs.getObject("packagetype", Integer.class),
                rs.getString("channel"));
        return BugSummaryKey.builder()
                .target(target)
                .viewedBy(rs.getObject("viewed_by", Long.class))
                .accessPolicy(rs.getObject("access_policy", Long.class))
                .tag(rs.getString("tag"))
                .status(BugTaskStatus.fromValue(rs.getInt("status")))
                .milestone(rs.getObject("milestone", Long.class))
                .importance(BugTaskImportance.fromValue(rs.getInt("importance")))
                .hasPatch(rs.getBoolean("has_patch"))
                .build();
    }
}
