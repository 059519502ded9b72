package com.wangbin.reconciler.core.rule.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 条件组，子节点可以是条件或嵌套条件组
 */
public record CriteriaGroup(Combinator combinator, List<PredicateNode> children) implements PredicateNode {

    public CriteriaGroup {
        children = List.copyOf(children);
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public Set<String> referencedColumns() {
        Set<String> columns = new LinkedHashSet<>();
        for (PredicateNode child : children) {
            columns.addAll(child.referencedColumns());
        }
        return columns;
    }
}
