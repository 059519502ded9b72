package com.wangbin.reconciler.core.merge;

import com.wangbin.reconciler.core.table.RowSet;

/**
 * 合并阶段接口
 * 每个阶段接收上一阶段发布的不可变行集，返回追加了新列（或筛选后）的新行集。
 */
public interface MergeStage {

    /**
     * 获取阶段名称
     */
    String getName();

    /**
     * 执行顺序，越小越先执行
     */
    int getOrder();

    /**
     * 是否必须保持行数不变
     */
    boolean preservesCardinality();

    /**
     * 执行阶段
     */
    RowSet apply(RowSet input, MergeContext context);
}
