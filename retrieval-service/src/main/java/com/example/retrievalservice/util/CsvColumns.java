package com.example.retrievalservice.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a single named column from a simple CSV file.
 *
 * The header row comes first. Cells may be wrapped in double quotes but may not contain a
 * comma, quoted or not; a line with a quoted cell split by a comma is rejected.
 */
public final class CsvColumns {

    private CsvColumns() {
    }

    /**
     * @return the non-empty trimmed values of {@code column}, in file order
     * @throws IllegalArgumentException if the header has no such column, or a line has a
     *         quoted cell containing a comma
     */
    public static Set<String> read(List<String> lines, String column) {
        if (lines.isEmpty()) {
            return Collections.emptySet();
        }
        String[] header = cells(lines.get(0), 1);
        int index = -1;
        for (int i = 0; i < header.length; i++) {
            if (unquote(header[i]).equalsIgnoreCase(column)) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            throw new IllegalArgumentException("CSV header has no '" + column + "' column");
        }

        Set<String> values = new LinkedHashSet<>();
        for (int lineNo = 2; lineNo <= lines.size(); lineNo++) {
            String[] cells = cells(lines.get(lineNo - 1), lineNo);
            if (cells.length > index) {
                String value = unquote(cells[index]);
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        }
        return Collections.unmodifiableSet(values);
    }

    private static String[] cells(String line, int lineNo) {
        String[] cells = line.split(",", -1);
        for (String cell : cells) {
            String value = cell.trim();
            boolean opens = value.startsWith("\"");
            boolean closes = value.length() >= 2 && value.endsWith("\"");
            if (opens != closes) {
                throw new IllegalArgumentException(
                        "CSV line " + lineNo + " has a quoted cell containing a comma: " + line);
            }
        }
        return cells;
    }

    private static String unquote(String cell) {
        String value = cell.trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1).trim();
        }
        return value;
    }
}
