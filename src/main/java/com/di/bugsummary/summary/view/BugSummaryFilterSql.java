package com.di.bugsummary.summary.view;

import com.di.bugsummary.summary.model.BugSummaryDimension;
import org.springframework.jdbc.core.SqlParameterValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a {@link BugSummaryFilter} as a WHERE clause over the summary columns, for appending to
 * the {@code select-all} statements of the aggregate table, the journal and the combined view.
 */
public final class BugSummaryFilterSql {

    private BugSummaryFilterSql() {
    }

    /**
     * @param where " WHERE ..." or empty when the filter is unrestricted
     * @param args  bind values for the placeholders in {@code where}
     */
    public record Fragment(String where, List<Object> args) {

        public Object[] argArray() {
            return args.toArray();
        }

        /** Appends the clause to a base statement, then {@code suffix} (may be empty). */
        public String appendTo(String baseSql, String suffix) {
            return baseSql.strip() + where + suffix;
        }
    }

    public static Fragment render(BugSummaryFilter filter) {
        if (filter == null || filter.isUnrestricted()) {
            return new Fragment("", List.of());
        }
        List<String> predicates = new ArrayList<>();
        List<Object> args = new ArrayList<>();

        for (Map.Entry<BugSummaryDimension, List<Object>> e : filter.getAllowed().entrySet()) {
            BugSummaryDimension d = e.getKey();
            List<Object> values = e.getValue();
            boolean admitsNull = values.contains(null);
            List<Object> present = new ArrayList<>(values);
            present.removeAll(Collections.singleton(null));

            StringJoiner alternatives = new StringJoiner(" OR ", "(", ")");
            if (admitsNull) {
                alternatives.add(d.getColumn() + " IS NULL");
            }
            if (present.size() == 1) {
                alternatives.add(d.getColumn() + " = ?");
                args.add(new SqlParameterValue(d.getSqlType(), present.get(0)));
            } else if (!present.isEmpty()) {
                alternatives.add(d.getColumn() + " IN (" + placeholders(present.size()) + ")");
                present.forEach(v -> args.add(new SqlParameterValue(d.getSqlType(), v)));
            }
            predicates.add(alternatives.toString());
        }

        for (BugSummaryDimension d : filter.getNotNull()) {
            predicates.add(d.getColumn() + " IS NOT NULL");
        }

        BugSummaryFilter.Visibility visibility = filter.getVisibility();
        if (visibility != null) {
            StringJoiner visible = new StringJoiner(" OR ", "(", ")");
            visible.add("(viewed_by IS NULL AND access_policy IS NULL)");
            if (visibility.userId() != null) {
                visible.add("viewed_by = ?");
                args.add(visibility.userId());
            }
            if (!visibility.policies().isEmpty()) {
                visible.add("(viewed_by IS NULL AND access_policy IN (" + placeholders(visibility.policies().size()) + "))");
                args.addAll(visibility.policies());
            }
            predicates.add(visible.toString());
        }

        return new Fragment(" WHERE " + String.join(" AND ", predicates), List.copyOf(args));
    }

    private static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }
}
