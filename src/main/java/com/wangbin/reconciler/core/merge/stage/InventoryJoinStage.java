package com.wangbin.reconciler.core.merge.stage;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.config.ReconcilerProperties.DuplicatePolicy;
import com.wangbin.reconciler.core.merge.AbstractMergeStage;
import com.wangbin.reconciler.core.merge.JoinSupport;
import com.wangbin.reconciler.core.merge.MergeContext;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.BiFunction;

/**
 * 按通用地址左连接匹配比对报告与PowerOn台账
 * 台账是每个地址唯一的权威来源，任何重复地址（含不对应点位的控制地址）均终止合并，除非配置为保留首条。
 */
@Slf4j
public class InventoryJoinStage extends AbstractMergeStage {

    public InventoryJoinStage() {
        super("inventory_join", 40);
    }

    @Override
    protected RowSet doApply(RowSet input, MergeContext context) {
        RowSet compare = context.getInputs().getHabddeCompare();
        RowSet merged = JoinSupport.leftJoin(input, compare, ColumnNames.GENERIC_POINT_ADDRESS,
                getName() + "/habdde_compare", ReconcileException::duplicateJoinKey);
        merged = merged.dropColumns(List.of(ColumnNames.HAB_COMP_KEY));

        RowSet inventory = context.getInputs().getInventory();
        DuplicatePolicy policy = context.getMergeConfig().getDuplicateInventoryPolicy();
        if (policy == DuplicatePolicy.KEEP_FIRST) {
            log.warn("台账重复地址策略为 KEEP_FIRST，重复地址将保留首条记录");
        } else {
            // 不对应任何点位的控制地址也要检查
            JoinSupport.uniqueIndex(inventory, ColumnNames.GENERIC_POINT_ADDRESS, getName() + "/inventory",
                    duplicateHandler(policy));
        }
        return JoinSupport.leftJoin(merged, inventory, ColumnNames.GENERIC_POINT_ADDRESS,
                getName() + "/inventory", duplicateHandler(policy));
    }

    /**
     * FAIL 策略下重复地址终止，KEEP_FIRST 时只告警
     */
    public static BiFunction<String, List<String>, ReconcileException> duplicateHandler(DuplicatePolicy policy) {
        return policy == DuplicatePolicy.FAIL ? ReconcileException::duplicateAddress : null;
    }
}
