package com.wangbin.reconciler.core.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 不可变行集
 * 有序列名加有序行；所有变换返回新行集，不修改已发布的行集。
 * 行中缺少某列时按空标记处理。
 */
public final class RowSet {

    private final List<String> columns;
    private final List<Row> rows;

    private RowSet(List<String> columns, List<Row> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    public static RowSet of(List<String> columns, List<Row> rows) {
        return new RowSet(new ArrayList<>(new LinkedHashSet<>(columns)), new ArrayList<>(rows));
    }

    public static RowSet empty(List<String> columns) {
        return of(columns, Collections.emptyList());
    }

    public List<String> columns() {
        return columns;
    }

    public List<Row> rows() {
        return rows;
    }

    public Row row(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * 返回行集中不存在的列
     */
    public List<String> missingColumns(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!columns.contains(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    public List<Object> column(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Row row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    public RowSet filter(Predicate<Row> predicate) {
        List<Row> kept = new ArrayList<>();
        for (Row row : rows) {
            if (predicate.test(row)) {
                kept.add(row);
            }
        }
        return new RowSet(new ArrayList<>(columns), kept);
    }

    /**
     * 稳定排序
     */
    public RowSet sorted(Comparator<Row> comparator) {
        List<Row> copy = new ArrayList<>(rows);
        copy.sort(comparator);
        return new RowSet(new ArrayList<>(columns), copy);
    }

    /**
     * 只保留给定列中已存在的列，顺序按给定顺序
     */
    public RowSet select(List<String> wanted) {
        List<String> kept = new ArrayList<>();
        for (String column : wanted) {
            if (columns.contains(column) && !kept.contains(column)) {
                kept.add(column);
            }
        }
        List<Row> projected = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String column : kept) {
                values.put(column, row.get(column));
            }
            projected.add(Row.of(values));
        }
        return new RowSet(kept, projected);
    }

    public RowSet dropColumns(Collection<String> dropped) {
        List<String> kept = new ArrayList<>(columns);
        kept.removeAll(dropped);
        List<Row> stripped = new ArrayList<>(rows.size());
        for (Row row : rows) {
            stripped.add(row.without(dropped));
        }
        return new RowSet(kept, stripped);
    }

    /**
     * 重命名列，不在映射中的列保持原名
     */
    public RowSet renameColumns(Map<String, String> mapping) {
        List<String> renamed = new ArrayList<>(columns.size());
        for (String column : columns) {
            String target = mapping.getOrDefault(column, column);
            if (!renamed.contains(target)) {
                renamed.add(target);
            }
        }
        List<Row> converted = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : row.asMap().entrySet()) {
                values.put(mapping.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
            }
            converted.add(Row.of(values));
        }
        return new RowSet(renamed, converted);
    }

    /**
     * 追加（或覆盖）一列，列值由函数按行计算
     */
    public RowSet withColumn(String column, Function<Row, Object> valueFunction) {
        List<String> newColumns = new ArrayList<>(columns);
        if (!newColumns.contains(column)) {
            newColumns.add(column);
        }
        List<Row> converted = new ArrayList<>(rows.size());
        for (Row row : rows) {
            converted.add(row.with(column, valueFunction.apply(row)));
        }
        return new RowSet(newColumns, converted);
    }

    /**
     * 按行变换，并声明变换可能新增的列
     */
    public RowSet mapRows(List<String> addedColumns, Function<Row, Row> mapper) {
        Set<String> newColumns = new LinkedHashSet<>(columns);
        newColumns.addAll(addedColumns);
        List<Row> converted = new ArrayList<>(rows.size());
        for (Row row : rows) {
            converted.add(mapper.apply(row));
        }
        return new RowSet(new ArrayList<>(newColumns), converted);
    }

    /**
     * 纵向拼接，列取并集，缺失列补空标记
     */
    public RowSet concat(RowSet other) {
        Set<String> union = new LinkedHashSet<>(columns);
        union.addAll(other.columns);
        List<Row> combined = new ArrayList<>(rows.size() + other.rows.size());
        for (Row row : rows) {
            combined.add(fill(row, union));
        }
        for (Row row : other.rows) {
            combined.add(fill(row, union));
        }
        return new RowSet(new ArrayList<>(union), combined);
    }

    /**
     * 行去重，保留首次出现的行
     */
    public RowSet distinct() {
        return new RowSet(new ArrayList<>(columns), new ArrayList<>(new LinkedHashSet<>(rows)));
    }

    private static Row fill(Row row, Set<String> allColumns) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String column : allColumns) {
            values.put(column, row.get(column));
        }
        return Row.of(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RowSet)) {
            return false;
        }
        RowSet other = (RowSet) o;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return "RowSet{columns=" + columns.size() + ", rows=" + rows.size() + "}";
    }
}
