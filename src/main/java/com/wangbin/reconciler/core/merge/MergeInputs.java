package com.wangbin.reconciler.core.merge;

import com.wangbin.reconciler.core.importer.ComponentAliasLookup;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;

/**
 * 合并引擎的全部输入表（已由各导入器规范化）
 */
@Getter
@Builder
public class MergeInputs {

    /** eTerra点表 */
    private final RowSet points;

    /** eTerra模拟量表 */
    private final RowSet analogs;

    /** eTerra控制表 */
    private final RowSet controls;

    /** eTerra设定值表 */
    private final RowSet setpoints;

    /** 点位匹配比对报告 */
    private final RowSet habddeCompare;

    /** PowerOn台账 */
    private final RowSet inventory;

    /** 自动控制测试 */
    private final RowSet autoTests;

    /** 人工调试记录 */
    private final RowSet commissioning;

    /** 告警比对 */
    private final RowSet alarms;

    /** PowerOn组件别名查询，可为空 */
    private final ComponentAliasLookup aliasLookup;

    public RowSet getPoints() {
        return orEmpty(points);
    }

    public RowSet getAnalogs() {
        return orEmpty(analogs);
    }

    public RowSet getControls() {
        return orEmpty(controls);
    }

    public RowSet getSetpoints() {
        return orEmpty(setpoints);
    }

    public RowSet getHabddeCompare() {
        return orEmpty(habddeCompare);
    }

    public RowSet getInventory() {
        return orEmpty(inventory);
    }

    public RowSet getAutoTests() {
        return orEmpty(autoTests);
    }

    public RowSet getCommissioning() {
        return orEmpty(commissioning);
    }

    public RowSet getAlarms() {
        return orEmpty(alarms);
    }

    private static RowSet orEmpty(RowSet table) {
        return table != null ? table : RowSet.empty(Collections.emptyList());
    }
}
