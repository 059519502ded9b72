package com.wangbin.reconciler.core.merge;

import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * 行集连接与索引工具
 * 空标记键永不参与连接；右表重复键命中左表行时按调用方给定的处理方式终止或保留首条。
 */
@Slf4j
public final class JoinSupport {

    private JoinSupport() {
    }

    /**
     * 按列建立分组索引，保持各组内行的原始顺序，空标记键跳过
     */
    public static Map<String, List<Row>> index(RowSet table, String keyColumn) {
        Map<String, List<Row>> index = new LinkedHashMap<>();
        for (Row row : table.rows()) {
            String key = row.getString(keyColumn);
            if (key != null) {
                index.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }
        return index;
    }

    /**
     * 按列建立唯一索引，重复键保留首条
     *
     * @param onDuplicate 重复键处理，为空时保留首条并告警；返回的异常会被抛出
     */
    public static Map<String, Row> uniqueIndex(RowSet table, String keyColumn, String stage,
                                               BiFunction<String, List<String>, ReconcileException> onDuplicate) {
        Map<String, Row> unique = new LinkedHashMap<>();
        List<String> offending = new ArrayList<>();
        index(table, keyColumn).forEach((key, rows) -> {
            unique.put(key, rows.get(0));
            if (rows.size() > 1) {
                rows.forEach(row -> offending.add(key + " -> " + row));
            }
        });
        if (!offending.isEmpty()) {
            if (onDuplicate != null) {
                offending.forEach(line -> log.error("{}: 重复键 {}", stage, line));
                throw onDuplicate.apply(stage, offending);
            }
            log.warn("{}: 存在重复键，已保留首条: {} 行受影响", stage, offending.size());
        }
        return unique;
    }

    /**
     * 左连接
     *
     * @param onDuplicate 重复键处理，为空时保留首条并告警；返回的异常会被抛出
     */
    public static RowSet leftJoin(RowSet left, RowSet right, String keyColumn, String stage,
                                  BiFunction<String, List<String>, ReconcileException> onDuplicate) {
        List<String> added = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (String column : right.columns()) {
            if (column.equals(keyColumn)) {
                continue;
            }
            if (left.hasColumn(column)) {
                skipped.add(column);
            } else {
                added.add(column);
            }
        }
        if (!skipped.isEmpty()) {
            log.warn("{}: 右表列与已有列同名，保留左表值: {}", stage, skipped);
        }

        Map<String, List<Row>> index = index(right, keyColumn);
        List<String> offending = new ArrayList<>();
        List<Row> joined = new ArrayList<>(left.size());
        for (Row row : left.rows()) {
            String key = row.getString(keyColumn);
            List<Row> matches = key != null ? index.get(key) : null;
            Map<String, Object> additions = new LinkedHashMap<>();
            for (String column : added) {
                additions.put(column, null);
            }
            if (matches != null) {
                if (matches.size() > 1) {
                    for (Row match : matches) {
                        offending.add(key + " -> " + match);
                    }
                }
                Row match = matches.get(0);
                for (String column : added) {
                    additions.put(column, match.get(column));
                }
            }
            joined.add(row.withAll(additions));
        }

        if (!offending.isEmpty()) {
            if (onDuplicate != null) {
                offending.forEach(line -> log.error("{}: 重复连接键 {}", stage, line));
                throw onDuplicate.apply(stage, offending);
            }
            log.warn("{}: 右表存在重复连接键，已保留首条: {} 行受影响", stage, offending.size());
        }
        List<String> columns = new ArrayList<>(left.columns());
        columns.addAll(added);
        return RowSet.of(columns, joined);
    }
}
