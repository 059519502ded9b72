package com.wangbin.reconciler.core.service;

import com.wangbin.reconciler.core.merge.MergeScope;
import com.wangbin.reconciler.core.table.RowSet;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 核对运行结果
 */
public record ReconciliationOutcome(MergeScope scope, RowSet table, Map<String, Long> defectCounts,
                                    boolean fromCache, List<Path> reports) {
}
