package com.wangbin.reconciler.core.merge;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.core.table.Row;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 核对范围：全部、单个RTU或单个变电站
 */
@Getter
@EqualsAndHashCode
public final class MergeScope {

    public enum Kind {
        ALL, RTU, SUBSTATION
    }

    private static final MergeScope ALL = new MergeScope(Kind.ALL, null);

    private final Kind kind;
    private final String value;

    private MergeScope(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    public static MergeScope all() {
        return ALL;
    }

    public static MergeScope rtu(String rtuName) {
        return new MergeScope(Kind.RTU, rtuName);
    }

    public static MergeScope substation(String substation) {
        return new MergeScope(Kind.SUBSTATION, substation);
    }

    /**
     * 按命令行参数构建，二者同时给出时报错
     */
    public static MergeScope of(String rtuName, String substation) {
        if (rtuName != null && substation != null) {
            throw new IllegalArgumentException("--rtu 与 --substation 只能指定一个");
        }
        if (rtuName != null) {
            return rtu(rtuName);
        }
        if (substation != null) {
            return substation(substation);
        }
        return all();
    }

    public boolean isAll() {
        return kind == Kind.ALL;
    }

    public boolean matches(Row row) {
        return switch (kind) {
            case ALL -> true;
            case RTU -> value.equals(row.getString(ColumnNames.RTU));
            case SUBSTATION -> value.equals(row.getString(ColumnNames.SUB));
        };
    }

    /**
     * 缓存键与报表文件名后缀
     */
    public String key() {
        return switch (kind) {
            case ALL -> "all";
            case RTU -> "rtu_" + value;
            case SUBSTATION -> "sub_" + value;
        };
    }

    public String label() {
        return isAll() ? "all" : value;
    }

    @Override
    public String toString() {
        return key();
    }
}
