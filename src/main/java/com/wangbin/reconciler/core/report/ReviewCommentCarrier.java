package com.wangbin.reconciler.core.report;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 人工复核意见沿用
 * 按通用地址把上一版缺陷报告的 Review Status / Comments 复制到新报告，新报告中已有的意见不覆盖。
 */
@Slf4j
public final class ReviewCommentCarrier {

    static final List<String> REVIEW_COLUMNS = List.of(ColumnNames.REVIEW_STATUS, ColumnNames.COMMENTS);

    private ReviewCommentCarrier() {
    }

    public static RowSet carryOver(RowSet previous, RowSet current) {
        if (!previous.hasColumn(ColumnNames.GENERIC_POINT_ADDRESS)) {
            log.warn("上一版缺陷报告没有 {} 列，跳过复核意见沿用", ColumnNames.GENERIC_POINT_ADDRESS);
            return withReviewColumns(current);
        }

        Map<String, Row> reviewed = new HashMap<>();
        long previousComments = 0;
        for (Row row : previous.rows()) {
            String address = row.getString(ColumnNames.GENERIC_POINT_ADDRESS);
            if (address == null || !hasReview(row)) {
                continue;
            }
            previousComments++;
            reviewed.putIfAbsent(address, row);
        }

        int[] copied = {0};
        RowSet result = withReviewColumns(current).mapRows(REVIEW_COLUMNS, row -> {
            Row source = reviewed.get(row.getString(ColumnNames.GENERIC_POINT_ADDRESS));
            if (source == null || hasReview(row)) {
                return row;
            }
            Map<String, Object> values = new LinkedHashMap<>();
            for (String column : REVIEW_COLUMNS) {
                values.put(column, source.get(column));
            }
            copied[0]++;
            return row.withAll(values);
        });
        log.info("复核意见沿用: 上一版 {} 条, 复制 {} 条", previousComments, copied[0]);
        return result;
    }

    static RowSet withReviewColumns(RowSet table) {
        RowSet result = table;
        for (String column : REVIEW_COLUMNS) {
            if (!result.hasColumn(column)) {
                result = result.withColumn(column, row -> null);
            }
        }
        return result;
    }

    private static boolean hasReview(Row row) {
        for (String column : REVIEW_COLUMNS) {
            String value = row.getString(column);
            if (value != null && !value.isBlank()) {
                return true;
            }
        }
        return false;
    }
}
