package com.energyweather.recon.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered-column table of nullable cells. Used for master snapshots, the merged output and as the
 * input of quality reports. Instances are immutable.
 */
public final class FlatTable {
    private final List<String> columns;
    private final Map<String, Integer> index;
    private final List<List<Object>> rows;

    private FlatTable(List<String> columns, List<List<Object>> rows) {
        this.columns = List.copyOf(columns);
        Map<String, Integer> idx = new LinkedHashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            idx.putIfAbsent(this.columns.get(i), i);
        }
        this.index = Collections.unmodifiableMap(idx);
        this.rows = Collections.unmodifiableList(rows);
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String name) {
        return name != null && index.containsKey(name);
    }

    public Object cell(int row, String column) {
        Integer col = index.get(column);
        if (col == null) {
            throw new IllegalArgumentException("unknown column: " + column);
        }
        return rows.get(row).get(col);
    }

    public List<Object> row(int row) {
        return rows.get(row);
    }

    /** Values of one column, top to bottom. Nulls are kept. */
    public List<Object> column(String name) {
        Integer col = index.get(name);
        if (col == null) {
            throw new IllegalArgumentException("unknown column: " + name);
        }
        List<Object> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            out.add(row.get(col));
        }
        return Collections.unmodifiableList(out);
    }

    public Map<String, Object> rowAsMap(int row) {
        Map<String, Object> out = new LinkedHashMap<>();
        List<Object> cells = rows.get(row);
        for (int i = 0; i < columns.size(); i++) {
            out.put(columns.get(i), cells.get(i));
        }
        return out;
    }

    public static final class Builder {
        private final List<String> columns;
        private final List<List<Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            if (columns == null) {
                throw new IllegalArgumentException("columns must not be null");
            }
            this.columns = List.copyOf(columns);
        }

        public Builder addRow(List<?> cells) {
            if (cells == null || cells.size() != columns.size()) {
                throw new IllegalArgumentException("row width " + (cells == null ? 0 : cells.size())
                        + " does not match column count " + columns.size());
            }
            rows.add(Collections.unmodifiableList(new ArrayList<>(cells)));
            return this;
        }

        public Builder addRow(Map<String, ?> cells) {
            List<Object> out = new ArrayList<>(columns.size());
            for (String column : columns) {
                out.add(cells == null ? null : cells.get(column));
            }
            rows.add(Collections.unmodifiableList(out));
            return this;
        }

        public FlatTable build() {
            return new FlatTable(columns, new ArrayList<>(rows));
        }
    }
}
