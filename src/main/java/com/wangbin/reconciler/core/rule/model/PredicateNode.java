package com.wangbin.reconciler.core.rule.model;

import java.util.Set;

/**
 * 判定树节点：叶子为单个条件，内部节点为条件组
 */
public interface PredicateNode {

    <R> R accept(PredicateVisitor<R> visitor);

    /**
     * 子树引用到的全部列
     */
    Set<String> referencedColumns();
}
