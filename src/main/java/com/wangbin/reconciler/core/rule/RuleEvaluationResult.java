package com.wangbin.reconciler.core.rule;

import com.wangbin.reconciler.core.table.RowSet;

import java.util.Map;

/**
 * 判定结果：追加了判定列的合并表，以及各判定命中行数（按规则库顺序）
 */
public record RuleEvaluationResult(RowSet table, Map<String, Long> defectCounts) {
}
