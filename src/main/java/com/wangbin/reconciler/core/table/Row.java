package com.wangbin.reconciler.core.table;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 不可变数据行
 * 列名到值的有序映射；值为null表示空标记（缺失值），与空字符串不同。
 * 修改操作均返回新行，原行保持不变。
 */
public final class Row {

    private final Map<String, Object> values;

    private Row(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Row of(Map<String, ?> values) {
        return new Row(new LinkedHashMap<>(values));
    }

    public static Row empty() {
        return new Row(new LinkedHashMap<>());
    }

    /**
     * 取值，列不存在时同样返回null
     */
    public Object get(String column) {
        return values.get(column);
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value != null ? value.toString() : null;
    }

    /**
     * 取字符串，空标记返回空串
     */
    public String getStringOrEmpty(String column) {
        Object value = values.get(column);
        return value != null ? value.toString() : "";
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public boolean isNull(String column) {
        return values.get(column) == null;
    }

    public Row with(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new Row(copy);
    }

    public Row withAll(Map<String, ?> additions) {
        if (additions.isEmpty()) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(additions);
        return new Row(copy);
    }

    public Row without(Collection<String> columns) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.keySet().removeAll(columns);
        return new Row(copy);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Row)) {
            return false;
        }
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
