package com.wangbin.reconciler.core.rule.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Set;

/**
 * 命名缺陷判定，结果写入与名称同名的布尔列
 */
@Getter
@Builder
public class DefectPredicate {

    /** 结果列名，如 Report1 */
    private final String name;

    /** 描述，如 Missing Analog Components */
    private final String title;

    /** 缺失时补空串列的列 */
    @Singular
    private final List<String> requiredColumns;

    /** 是否输出逐条件命中数 */
    private final boolean debug;

    private final CriteriaGroup root;

    public Set<String> referencedColumns() {
        return root.referencedColumns();
    }

    @Override
    public String toString() {
        return name + "(" + title + ")";
    }
}
