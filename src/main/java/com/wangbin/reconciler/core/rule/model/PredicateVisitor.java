package com.wangbin.reconciler.core.rule.model;

/**
 * 判定树访问者
 */
public interface PredicateVisitor<R> {

    R visitCriterion(Criterion criterion);

    R visitGroup(CriteriaGroup group);
}
