package com.wangbin.reconciler.core.rule.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 单个条件：(列, 运算符, 比较值)
 * 列按竖线分组、组内按逗号分隔，如 "Ctrl1Addr,Ctrl1ConfigHealth,Ctrl1TestResult|Ctrl2Addr,..."。
 */
public record Criterion(String expression, List<List<String>> columnGroups, Operator operator, Object value)
        implements PredicateNode {

    public Criterion {
        columnGroups = columnGroups.stream().map(List::copyOf).toList();
    }

    /**
     * 第一列，单列运算符使用
     */
    public String column() {
        return columnGroups.get(0).get(0);
    }

    /**
     * 所有组的列按顺序展开
     */
    public List<String> columns() {
        return columnGroups.stream().flatMap(List::stream).toList();
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitCriterion(this);
    }

    @Override
    public Set<String> referencedColumns() {
        return new LinkedHashSet<>(columns());
    }

    @Override
    public String toString() {
        return value == null
                ? expression + " " + operator.getCode()
                : expression + " " + operator.getCode() + " " + value;
    }
}
