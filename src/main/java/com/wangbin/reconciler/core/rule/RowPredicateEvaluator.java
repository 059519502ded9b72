package com.wangbin.reconciler.core.rule;

import com.wangbin.reconciler.core.rule.model.CriteriaGroup;
import com.wangbin.reconciler.core.rule.model.Criterion;
import com.wangbin.reconciler.core.rule.model.PredicateNode;
import com.wangbin.reconciler.core.rule.model.PredicateVisitor;
import com.wangbin.reconciler.core.table.Row;

/**
 * 对单行深度优先求值判定树
 * 条件组从组合方式的单位元开始，依次并入每个子节点结果（不短路，保持与逐列求值一致）。
 */
public class RowPredicateEvaluator implements PredicateVisitor<Boolean> {

    private final Row row;

    public RowPredicateEvaluator(Row row) {
        this.row = row;
    }

    public static boolean evaluate(PredicateNode node, Row row) {
        return node.accept(new RowPredicateEvaluator(row));
    }

    @Override
    public Boolean visitCriterion(Criterion criterion) {
        return CriterionEvaluator.evaluate(criterion, row);
    }

    @Override
    public Boolean visitGroup(CriteriaGroup group) {
        boolean result = group.combinator().identity();
        for (PredicateNode child : group.children()) {
            result = group.combinator().combine(result, child.accept(this));
        }
        return result;
    }
}
