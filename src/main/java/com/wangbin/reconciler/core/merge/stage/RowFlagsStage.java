package com.wangbin.reconciler.core.merge.stage;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.constant.ReconcileConstant;
import com.wangbin.reconciler.core.importer.ComponentAliasLookup;
import com.wangbin.reconciler.core.importer.ImportSupport;
import com.wangbin.reconciler.core.merge.AbstractMergeStage;
import com.wangbin.reconciler.core.merge.JoinSupport;
import com.wangbin.reconciler.core.merge.MergeContext;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 行级标志
 * Type、Ignore、RTUComms，以及PowerOn别名存在/关联标志（导出中已有值时保留）。
 */
@Slf4j
public class RowFlagsStage extends AbstractMergeStage {

    static final String POWERON_ALIAS = "PowerOn Alias";

    public RowFlagsStage() {
        super("row_flags", 70);
    }

    @Override
    protected RowSet doApply(RowSet input, MergeContext context) {
        String sentinel = context.getMergeConfig().getSentinelRtuId();
        ComponentAliasLookup aliasLookup = context.getInputs().getAliasLookup();
        if (aliasLookup == null) {
            log.info("未配置PowerOn组件库，别名存在标志按台账关联结果推导");
        }

        Map<String, Long> linkedCounts = new HashMap<>();
        JoinSupport.index(context.getInputs().getInventory(), ColumnNames.PO_ALIAS)
                .forEach((alias, rows) -> linkedCounts.put(alias, (long) rows.size()));

        List<String> added = List.of(ColumnNames.TYPE, ColumnNames.IGNORE, ColumnNames.RTU_COMMS,
                ColumnNames.POWERON_ALIAS_EXISTS, ColumnNames.POWERON_ALIAS_LINKED);
        return input.mapRows(added, row -> {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put(ColumnNames.TYPE, sentinel.equals(row.getString(ColumnNames.RTU_ID))
                    ? ReconcileConstant.TYPE_DUMMY : row.get(ColumnNames.GENERIC_TYPE));
            values.put(ColumnNames.IGNORE, isIgnored(row));
            values.put(ColumnNames.RTU_COMMS,
                    ReconcileConstant.DEVICE_TYPE_RTU.equals(row.getString(ColumnNames.DEVICE_TYPE)));
            values.put(ColumnNames.POWERON_ALIAS_EXISTS, aliasExists(row, aliasLookup));
            values.put(ColumnNames.POWERON_ALIAS_LINKED, aliasLinked(row, linkedCounts));
            return row.withAll(values);
        });
    }

    static boolean isIgnored(Row row) {
        for (String flag : ImportSupport.IGNORE_FLAGS) {
            if (Boolean.TRUE.equals(ImportSupport.parseFlag(row.get(flag)))) {
                return true;
            }
        }
        return false;
    }

    private static Boolean aliasExists(Row row, ComponentAliasLookup aliasLookup) {
        if (row.get(ColumnNames.POWERON_ALIAS_EXISTS) instanceof Boolean existing) {
            return existing;
        }
        if (aliasLookup != null) {
            return aliasLookup.aliasExists(candidateAlias(row));
        }
        String poAlias = row.getString(ColumnNames.PO_ALIAS);
        return poAlias != null && !poAlias.isBlank();
    }

    /**
     * 查询PowerOn时使用的别名：导出中的PowerOn别名，其次台账别名，最后eTerra别名
     */
    static String candidateAlias(Row row) {
        for (String column : List.of(POWERON_ALIAS, ColumnNames.PO_ALIAS, ColumnNames.ETERRA_ALIAS)) {
            String value = row.getString(column);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static Object aliasLinked(Row row, Map<String, Long> linkedCounts) {
        Object existing = row.get(ColumnNames.POWERON_ALIAS_LINKED);
        if (existing != null) {
            return existing;
        }
        String poAlias = row.getString(ColumnNames.PO_ALIAS);
        return poAlias != null ? linkedCounts.getOrDefault(poAlias, 0L) : 0L;
    }
}
