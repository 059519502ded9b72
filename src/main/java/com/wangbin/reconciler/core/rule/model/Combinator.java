package com.wangbin.reconciler.core.rule.model;

/**
 * 条件组合方式，组的初始值为该组合方式的单位元
 */
public enum Combinator {

    AND("and", true),
    OR("or", false);

    private final String code;
    private final boolean identity;

    Combinator(String code, boolean identity) {
        this.code = code;
        this.identity = identity;
    }

    public String getCode() {
        return code;
    }

    public boolean identity() {
        return identity;
    }

    public boolean combine(boolean accumulated, boolean next) {
        return this == AND ? accumulated && next : accumulated || next;
    }

    /**
     * 未指定时按 and 处理，其他值返回null
     */
    public static Combinator fromCode(String code) {
        if (code == null || code.isBlank()) {
            return AND;
        }
        for (Combinator combinator : values()) {
            if (combinator.code.equalsIgnoreCase(code.trim())) {
                return combinator;
            }
        }
        return null;
    }
}
