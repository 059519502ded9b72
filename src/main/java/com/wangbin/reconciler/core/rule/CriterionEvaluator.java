package com.wangbin.reconciler.core.rule;

import com.wangbin.reconciler.common.constant.ReconcileConstant;
import com.wangbin.reconciler.core.rule.model.Criterion;
import com.wangbin.reconciler.core.table.Row;

import java.util.Collection;
import java.util.List;

/**
 * 单个条件的逐行求值
 *
 * <p>空标记语义：== 遇空标记恒为false，!= 遇空标记恒为true；数值之间按数值比较（布尔视为0/1），
 * 字符串与数值永不相等；endswith 对非字符串为false；no_zeros 中空标记不算0。
 */
public final class CriterionEvaluator {

    private static final String OK = "OK";

    private CriterionEvaluator() {
    }

    public static boolean evaluate(Criterion criterion, Row row) {
        Object expected = criterion.value();
        return switch (criterion.operator()) {
            case EQ -> valueEquals(row.get(criterion.column()), expected);
            case NE -> !valueEquals(row.get(criterion.column()), expected);
            case IN -> in(row.get(criterion.column()), expected);
            case ENDS_WITH -> row.get(criterion.column()) instanceof String s
                    && expected != null && s.endsWith(expected.toString());
            case NOT_NA -> !isNull(row.get(criterion.column()));
            case NOT_NA_OR_BLANK -> !isNullOrBlank(row.get(criterion.column()));
            case IS_NA_OR_BLANK -> isNullOrBlank(row.get(criterion.column()));
            case IS_NULL_OR_ZERO -> isNull(row.get(criterion.column())) || isZero(row.get(criterion.column()));
            case ANY_NOT_NA -> criterion.columns().stream().anyMatch(c -> !isNull(row.get(c)));
            case ALL_NULL -> criterion.columns().stream().allMatch(c -> isNull(row.get(c)));
            case ANY_ZERO -> criterion.columns().stream().anyMatch(c -> isZero(row.get(c)));
            case NO_ZEROS -> criterion.columns().stream().noneMatch(c -> isZero(row.get(c)));
            case NO_TRUE_OR_ONE -> criterion.columns().stream().allMatch(c -> isFalseOrNull(row.get(c)));
            case NOT_NA_PAIR, PAIRED_NOT_NA -> criterion.columnGroups().stream()
                    .allMatch(group -> group.stream().noneMatch(c -> isNull(row.get(c))));
            case CTRL_TEST_OK -> criterion.columnGroups().stream().allMatch(group ->
                    !isNull(row.get(group.get(0)))
                            && valueEquals(row.get(group.get(1)), ReconcileConstant.CONFIG_HEALTH_GOOD)
                            && valueEquals(row.get(group.get(2)), OK));
            case NOT_IN_PO_TEST_OK -> criterion.columnGroups().stream().allMatch(group ->
                    !isNull(row.get(group.get(0)))
                            && !valueEquals(row.get(group.get(1)), OK)
                            && !valueEquals(row.get(group.get(2)), OK));
            case NAME_WITHOUT_CONFIG -> criterion.columnGroups().stream().allMatch(group ->
                    !isNull(row.get(group.get(0)))
                            && !valueEquals(row.get(group.get(1)), ReconcileConstant.CONFIG_HEALTH_GOOD));
            case ALWAYS_FALSE -> false;
        };
    }

    /**
     * 空标记（含NaN）
     */
    static boolean isNull(Object value) {
        return value == null || (value instanceof Double d && d.isNaN());
    }

    static boolean isNullOrBlank(Object value) {
        return isNull(value) || "".equals(value);
    }

    static boolean isZero(Object value) {
        Double number = numeric(value);
        return number != null && number == 0.0;
    }

    private static boolean isFalseOrNull(Object value) {
        return !valueEquals(value, Boolean.TRUE) && !valueEquals(value, 1L);
    }

    static boolean valueEquals(Object actual, Object expected) {
        if (isNull(actual) || isNull(expected)) {
            return false;
        }
        Double left = numeric(actual);
        Double right = numeric(expected);
        if (left != null || right != null) {
            return left != null && right != null && left.doubleValue() == right.doubleValue();
        }
        return actual.toString().equals(expected.toString());
    }

    private static boolean in(Object actual, Object expected) {
        if (isNull(actual)) {
            return false;
        }
        Collection<?> candidates = expected instanceof Collection<?> c ? c : List.of(expected);
        for (Object candidate : candidates) {
            if (valueEquals(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 数值与布尔转为double，其他类型返回null
     */
    private static Double numeric(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return null;
    }
}
