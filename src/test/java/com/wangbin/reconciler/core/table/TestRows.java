package com.wangbin.reconciler.core.table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用行构造，允许null值
 */
public final class TestRows {

    private TestRows() {
    }

    public static Row row(Object... keyValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Row.of(values);
    }

    /**
     * 列取各行键的并集
     */
    public static RowSet table(Row... rows) {
        List<String> columns = new ArrayList<>();
        for (Row row : rows) {
            for (String column : row.asMap().keySet()) {
                if (!columns.contains(column)) {
                    columns.add(column);
                }
            }
        }
        return RowSet.of(columns, List.of(rows));
    }
}
