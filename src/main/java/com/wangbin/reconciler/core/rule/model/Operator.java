package com.wangbin.reconciler.core.rule.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 判定运算符
 */
public enum Operator {

    EQ("==", Arity.SINGLE, true),
    NE("!=", Arity.SINGLE, true),
    IN("in", Arity.SINGLE, true),
    ENDS_WITH("endswith", Arity.SINGLE, true),
    NOT_NA("notna", Arity.SINGLE, false),
    NOT_NA_OR_BLANK("notna_or_blank", Arity.SINGLE, false),
    IS_NA_OR_BLANK("isna_or_blank", Arity.SINGLE, false),
    IS_NULL_OR_ZERO("isnull_or_zero", Arity.SINGLE, false),
    ANY_NOT_NA("any_notna", Arity.LIST, false),
    ALL_NULL("all_null", Arity.LIST, false),
    ANY_ZERO("any_zero", Arity.LIST, false),
    NO_ZEROS("no_zeros", Arity.LIST, false),
    NO_TRUE_OR_ONE("no_true_or_one", Arity.LIST, false),
    NOT_NA_PAIR("notna_pair", Arity.GROUPS, false),
    PAIRED_NOT_NA("paired_notna", Arity.GROUPS, false),
    CTRL_TEST_OK("ctrl_test_ok", Arity.TRIPLES, false),
    NOT_IN_PO_TEST_OK("notinpo_test_ok", Arity.TRIPLES, false),
    NAME_WITHOUT_CONFIG("name_without_config", Arity.PAIRS, false),
    ALWAYS_FALSE("always_false", Arity.NONE, false);

    /**
     * 列参数形式
     */
    public enum Arity {
        // 单列
        SINGLE,
        // 逗号分隔的多列
        LIST,
        // 竖线分隔的列组，组内逗号分隔
        GROUPS,
        // 每组2列
        PAIRS,
        // 每组3列
        TRIPLES,
        // 不读任何列
        NONE
    }

    private static final Map<String, Operator> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toMap(Operator::getCode, Function.identity()));

    private final String code;
    private final Arity arity;
    private final boolean requiresValue;

    Operator(String code, Arity arity, boolean requiresValue) {
        this.code = code;
        this.arity = arity;
        this.requiresValue = requiresValue;
    }

    public String getCode() {
        return code;
    }

    public Arity getArity() {
        return arity;
    }

    public boolean requiresValue() {
        return requiresValue;
    }

    /**
     * 按运算符名称查找，未知名称返回null
     */
    public static Operator fromCode(String code) {
        return code == null ? null : BY_CODE.get(code);
    }
}
