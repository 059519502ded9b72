package com.wangbin.reconciler.core.importer;

/**
 * 目标系统组件别名查询
 */
@FunctionalInterface
public interface ComponentAliasLookup {

    boolean aliasExists(String alias);
}
