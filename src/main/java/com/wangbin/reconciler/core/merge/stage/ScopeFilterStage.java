package com.wangbin.reconciler.core.merge.stage;

import com.wangbin.reconciler.core.merge.AbstractMergeStage;
import com.wangbin.reconciler.core.merge.MergeContext;
import com.wangbin.reconciler.core.merge.MergeScope;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

/**
 * 按RTU或变电站收窄范围，须在告警/控制挂接之前执行
 */
@Slf4j
public class ScopeFilterStage extends AbstractMergeStage {

    public ScopeFilterStage() {
        super("scope_filter", 20);
    }

    @Override
    public boolean preservesCardinality() {
        return false;
    }

    @Override
    protected RowSet doApply(RowSet input, MergeContext context) {
        MergeScope scope = context.getScope();
        if (scope.isAll()) {
            return input;
        }
        RowSet filtered = input.filter(scope::matches);
        if (filtered.isEmpty()) {
            log.warn("范围 {} 内没有点位", scope);
        }
        return filtered;
    }
}
