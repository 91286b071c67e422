package com.chaincollector.collector;

import com.chaincollector.domain.enums.ExpiryRule;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Index by expiry-rule table of resolved dates with days to expiry, e.g.
 *
 * <pre>
 * INDEX      this_week        next_week        this_month       next_month
 * ---------  ---------------  ---------------  ---------------  ---------------
 * NIFTY      2025-06-19 (2)   2025-06-26 (9)   2025-06-26 (9)   2025-07-31 (44)
 * </pre>
 *
 * A rule that fails to resolve shows {@value #ERROR_CELL}.
 */
public final class ExpiryMatrix {

    static final String ERROR_CELL = "ERR";

    private ExpiryMatrix() {}

    public static String render(
            List<String> indices, BiFunction<String, ExpiryRule, LocalDate> resolver, LocalDate today) {
        List<String[]> rows = new ArrayList<>();
        String[] header = new String[ExpiryRule.values().length + 1];
        header[0] = "INDEX";
        for (ExpiryRule rule : ExpiryRule.values()) {
            header[rule.ordinal() + 1] = rule.getCode();
        }
        rows.add(header);
        for (String index : indices) {
            String[] row = new String[header.length];
            row[0] = index;
            for (ExpiryRule rule : ExpiryRule.values()) {
                row[rule.ordinal() + 1] = cell(index, rule, resolver, today);
            }
            rows.add(row);
        }

        int[] widths = new int[header.length];
        for (String[] row : rows) {
            for (int c = 0; c < row.length; c++) {
                widths[c] = Math.max(widths[c], row[c].length());
            }
        }
        StringBuilder out = new StringBuilder();
        appendRow(out, header, widths);
        String[] rule = new String[header.length];
        for (int c = 0; c < rule.length; c++) {
            rule[c] = "-".repeat(widths[c]);
        }
        appendRow(out, rule, widths);
        for (String[] row : rows.subList(1, rows.size())) {
            appendRow(out, row, widths);
        }
        return out.toString();
    }

    private static String cell(
            String index, ExpiryRule rule, BiFunction<String, ExpiryRule, LocalDate> resolver, LocalDate today) {
        try {
            LocalDate date = resolver.apply(index, rule);
            return date + " (" + ChronoUnit.DAYS.between(today, date) + ")";
        } catch (RuntimeException e) {
            return ERROR_CELL;
        }
    }

    private static void appendRow(StringBuilder out, String[] cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int c = 0; c < cells.length; c++) {
            if (c > 0) {
                line.append("  ");
            }
            line.append(String.format("%-" + widths[c] + "s", cells[c]));
        }
        out.append(line.toString().stripTrailing()).append('\n');
    }
}
