package com.fundfeed.provider.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tabular vendor payload: ordered column headers and rows keyed by header.
 * Column names are whatever the vendor sent, so consumers locate them through
 * {@link ColumnResolver} rather than by exact name.
 */
public final class VendorTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private VendorTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    /** Builds a table whose columns are the union of row keys in first-seen order. */
    public static VendorTable fromRows(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> copies = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
            copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return new VendorTable(new ArrayList<>(columns), copies);
    }

    /** Builds a table from a header list and positional rows, e.g. a Tushare {@code fields/items} pair. */
    public static VendorTable fromColumns(List<String> columns, List<List<Object>> items) {
        List<Map<String, Object>> rows = new ArrayList<>(items.size());
        for (List<Object> item : items) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size() && i < item.size(); i++) {
                row.put(columns.get(i), item.get(i));
            }
            rows.add(Collections.unmodifiableMap(row));
        }
        return new VendorTable(new ArrayList<>(columns), rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
