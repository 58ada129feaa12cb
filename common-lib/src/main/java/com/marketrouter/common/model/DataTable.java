package com.marketrouter.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable tabular payload: an ordered column list plus rows keyed by column name.
 *
 * <p>Cells may be {@code null}. Every row exposes every column; cells a source row did
 * not carry are filled with {@code null} at construction time so downstream stages never
 * have to distinguish "missing key" from "null value".
 */
public final class DataTable {

    private static final DataTable EMPTY = new DataTable(List.of(), List.of());

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private DataTable(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows    = rows;
    }

    public static DataTable empty() {
        return EMPTY;
    }

    /**
     * Builds a table from rows alone; the column order is the first-seen order of keys
     * across all rows.
     */
    public static DataTable fromRows(List<? extends Map<String, ?>> rows) {
        if (rows == null || rows.isEmpty()) {
            return EMPTY;
        }
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            if (row != null) {
                columns.addAll(row.keySet());
            }
        }
        return of(new ArrayList<>(columns), rows);
    }

    public static DataTable of(List<String> columns, List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(columns, "columns");
        List<String> cols = List.copyOf(columns);
        if (rows == null || rows.isEmpty()) {
            return cols.isEmpty() ? EMPTY : new DataTable(cols, List.of());
        }
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (String col : cols) {
                normalized.put(col, row == null ? null : row.get(col));
            }
            copied.add(Collections.unmodifiableMap(normalized));
        }
        return new DataTable(cols, Collections.unmodifiableList(copied));
    }

    @JsonProperty("columns")
    public List<String> columns() {
        return columns;
    }

    @JsonProperty("rows")
    public List<Map<String, Object>> rows() {
        return rows;
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

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /** All values of one column in row order; empty if the column does not exist. */
    public List<Object> columnValues(String column) {
        if (!columns.contains(column)) {
            return List.of();
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Returns a copy with columns renamed. Columns absent from {@code renames} keep their
     * name. If two columns would end up with the same name the first one wins and the
     * later one keeps its original name, suffixed with {@code _n} if that is taken too.
     */
    public DataTable renameColumns(Map<String, String> renames) {
        if (renames == null || renames.isEmpty()) {
            return this;
        }
        Map<String, String> effective = new LinkedHashMap<>();
        Set<String> taken = new LinkedHashSet<>();
        for (String col : columns) {
            String target = renames.getOrDefault(col, col);
            if (!taken.add(target)) {
                target = col;
                for (int n = 1; !taken.add(target); n++) {
                    target = col + "_" + n;
                }
            }
            effective.put(col, target);
        }
        List<String> newColumns = new ArrayList<>(effective.values());
        List<Map<String, Object>> newRows = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> renamed = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : effective.entrySet()) {
                renamed.put(e.getValue(), row.get(e.getKey()));
            }
            newRows.add(renamed);
        }
        return of(newColumns, newRows);
    }

    /** Returns a copy with each row replaced by {@code mapper(row)}; columns are unchanged. */
    public DataTable mapRows(Function<Map<String, Object>, Map<String, Object>> mapper) {
        List<Map<String, Object>> mapped = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            mapped.add(mapper.apply(row));
        }
        return of(columns, mapped);
    }

    /** Returns a copy keeping only rows where at least one cell is non-null. */
    public DataTable dropEmptyRows() {
        List<Map<String, Object>> kept = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (row.values().stream().anyMatch(Objects::nonNull)) {
                kept.add(row);
            }
        }
        return kept.size() == rows.size() ? this : of(columns, kept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataTable other)) return false;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "DataTable[columns=" + columns + ", rows=" + rows.size() + "]";
    }
}
