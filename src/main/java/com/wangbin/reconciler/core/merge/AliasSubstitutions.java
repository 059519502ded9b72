package com.wangbin.reconciler.core.merge;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.core.config.ReconcilerProperties.AliasSubstitution;
import com.wangbin.reconciler.core.table.Row;

import java.util.List;

/**
 * 控制别名替换表
 * 个别设备族的控制挂在另一个点位ID下（如 TCP 档位点的控制记录在 TAP 下），查找控制前按点位ID替换别名。
 */
public final class AliasSubstitutions {

    private final List<AliasSubstitution> substitutions;

    public AliasSubstitutions(List<AliasSubstitution> substitutions) {
        this.substitutions = substitutions != null ? List.copyOf(substitutions) : List.of();
    }

    /**
     * 点位查找控制时使用的别名
     */
    public String controlAlias(Row point) {
        String alias = point.getString(ColumnNames.ETERRA_ALIAS);
        if (alias == null) {
            return null;
        }
        String pointId = point.getString(ColumnNames.POINT_ID);
        for (AliasSubstitution substitution : substitutions) {
            if (substitution.getPointId() != null && substitution.getPointId().equals(pointId)) {
                alias = alias.replace(substitution.getFrom(), substitution.getTo());
            }
        }
        return alias;
    }
}
