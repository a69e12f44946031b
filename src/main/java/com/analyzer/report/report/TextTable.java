package com.analyzer.report.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Helper class to lay out information in table form.
 *
 * Columns are declared first; entries then fill rows left to right, a new row starting every
 * {@link #getTotalColumns()} entries. Column widths grow with the entries and are only final
 * once all rows are in, so rows are buffered and laid out in {@link #render()}.
 */
public class TextTable {

    static final int MIN_WIDTH = 5;

    private static final Pattern LOWERCASE = Pattern.compile("[a-z]");

    private enum RowKind { CELLS, HEADER, DIVIDER }

    private record Row(RowKind kind, List<String> cells) {
    }

    /** Abbreviation to full column name, in declaration order. */
    private final Map<String, String> abbreviations = new LinkedHashMap<>();

    private final List<String> header = new ArrayList<>();
    private final List<String> columnNames = new ArrayList<>();
    private final List<Integer> widths = new ArrayList<>();
    private final List<Row> rows = new ArrayList<>();

    private List<String> currentRow = new ArrayList<>();

    /** Set once rows start; no more columns can be declared. */
    private boolean sealed;

    public void declareColumn(String name) {
        declareColumn(name, false);
    }

    /**
     * Adds a column. Abbreviated headers keep only the characters that are not lower-case
     * letters, with apostrophes appended until the abbreviation is unique.
     */
    public void declareColumn(String name, boolean abbreviate) {
        if (sealed) {
            throw new SchemaFrozenException(name);
        }
        String headerName = name;
        if (abbreviate) {
            headerName = LOWERCASE.matcher(name).replaceAll("");
            while (abbreviations.containsKey(headerName)) {
                headerName = headerName + "'";
            }
            abbreviations.put(headerName, name);
        }
        widths.add(Math.max(MIN_WIDTH, headerName.length() + 1));
        header.add(headerName);
        columnNames.add(name);
    }

    public void addEntry(Object entry) {
        if (header.isEmpty()) {
            throw new MalformedTableException("Cannot add entries to a table without columns");
        }
        sealed = true;
        String text = String.valueOf(entry);
        int pos = currentRow.size();
        widths.set(pos, Math.max(widths.get(pos), text.length() + 1));
        currentRow.add(text);

        if (pos + 1 == header.size()) {
            rows.add(new Row(RowKind.CELLS, currentRow));
            currentRow = new ArrayList<>();
        }
    }

    /**
     * Adds the header titles. OK to do so more than once in long tables.
     */
    public void addHeader() {
        ensureRowBoundary("header");
        rows.add(new Row(RowKind.HEADER, header));
    }

    /**
     * Adds a row of dashes to divide sections of the table.
     */
    public void addDivider() {
        ensureRowBoundary("divider");
        rows.add(new Row(RowKind.DIVIDER, List.of()));
    }

    public int getTotalColumns() {
        return header.size();
    }

    public int getWidth(int column) {
        return widths.get(column);
    }

    public List<String> getHeader() {
        return Collections.unmodifiableList(header);
    }

    public Map<String, String> getAbbreviations() {
        return Collections.unmodifiableMap(abbreviations);
    }

    /**
     * Text layout for a terminal: the first column aligned left, all others aligned right,
     * followed by the abbreviation legend.
     */
    public String render() {
        ensureComplete();
        StringBuilder sb = new StringBuilder();
        sb.append('\n');
        for (Row row : rows) {
            List<String> cells = cellsOf(row);
            for (int i = 0; i < header.size(); i++) {
                String entry = cells.get(i);
                sb.append(i == 0 ? padRight(entry, widths.get(i)) : padLeft(entry, widths.get(i) + 1));
            }
            sb.append('\n');
        }
        sb.append("\nWhere:\n");
        for (Map.Entry<String, String> abbreviation : abbreviations.entrySet()) {
            sb.append(padRight("  " + abbreviation.getKey() + ":", 7));
            sb.append(' ').append(abbreviation.getValue()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Comma-separated layout. The first header uses full column names; repeated headers and
     * dividers are left out.
     */
    public String renderCsv() {
        ensureComplete();
        StringBuilder sb = new StringBuilder();
        boolean headerWritten = false;
        for (Row row : rows) {
            List<String> cells;
            switch (row.kind()) {
                case HEADER -> {
                    if (headerWritten) {
                        continue;
                    }
                    headerWritten = true;
                    cells = columnNames;
                }
                case DIVIDER -> {
                    continue;
                }
                default -> cells = row.cells();
            }
            for (int i = 0; i < cells.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(csvEscape(cells.get(i)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    private List<String> cellsOf(Row row) {
        if (row.kind() != RowKind.DIVIDER) {
            return row.cells();
        }
        List<String> dashes = new ArrayList<>(widths.size());
        for (int width : widths) {
            dashes.add("-".repeat(width));
        }
        return dashes;
    }

    private void ensureRowBoundary(String what) {
        if (!currentRow.isEmpty()) {
            throw new MalformedTableException("Cannot add a " + what + " in the middle of a row ("
                    + currentRow.size() + " of " + header.size() + " entries added)");
        }
        sealed = true;
    }

    private void ensureComplete() {
        if (!currentRow.isEmpty()) {
            throw new MalformedTableException("Incomplete last row: " + currentRow.size() + " of "
                    + header.size() + " entries added");
        }
    }

    private static String padRight(String text, int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }

    private static String padLeft(String text, int width) {
        return text.length() >= width ? text : " ".repeat(width - text.length()) + text;
    }

    private static String csvEscape(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
