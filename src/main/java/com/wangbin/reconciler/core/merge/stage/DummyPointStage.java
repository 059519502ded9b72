package com.wangbin.reconciler.core.merge.stage;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.constant.ReconcileConstant;
import com.wangbin.reconciler.core.importer.ImportSupport;
import com.wangbin.reconciler.core.merge.AbstractMergeStage;
import com.wangbin.reconciler.core.merge.AliasSubstitutions;
import com.wangbin.reconciler.core.merge.MergeContext;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 占位点生成
 * 控制表中有记录但点表中找不到对应别名的，补一行占位点，保证控制不会被丢弃。
 * 占位点的RTU标识为哨兵值，没有通用地址，行追加在末尾。
 */
@Slf4j
public class DummyPointStage extends AbstractMergeStage {

    private static final List<String> COPIED_COLUMNS = List.of(
            ColumnNames.ETERRA_ALIAS, ColumnNames.SUB, ColumnNames.DEVICE_TYPE, ColumnNames.DEVICE_ID,
            ColumnNames.DEVICE_NAME, ColumnNames.POINT_ID, ColumnNames.RTU, ColumnNames.RTU_ADDRESS,
            ColumnNames.PROTOCOL);

    public DummyPointStage() {
        super("dummy_points", 30);
    }

    @Override
    public boolean preservesCardinality() {
        return false;
    }

    @Override
    protected RowSet doApply(RowSet input, MergeContext context) {
        AliasSubstitutions substitutions =
                new AliasSubstitutions(context.getMergeConfig().getAliasSubstitutions());
        Set<String> knownAliases = new HashSet<>();
        for (Row row : input.rows()) {
            String alias = row.getString(ColumnNames.ETERRA_ALIAS);
            if (alias != null) {
                knownAliases.add(alias);
                knownAliases.add(substitutions.controlAlias(row));
            }
        }

        RowSet controls = context.getInputs().getControls().filter(context.getScope()::matches);
        Map<String, Row> firstControlByAlias = new LinkedHashMap<>();
        for (Row control : controls.rows()) {
            String alias = control.getString(ColumnNames.ETERRA_ALIAS);
            if (alias != null && !knownAliases.contains(alias)) {
                firstControlByAlias.putIfAbsent(alias, control);
            }
        }
        if (firstControlByAlias.isEmpty()) {
            return input;
        }

        String sentinel = context.getMergeConfig().getSentinelRtuId();
        List<Row> dummies = new ArrayList<>(firstControlByAlias.size());
        for (Row control : firstControlByAlias.values()) {
            dummies.add(dummyFor(control, sentinel));
        }
        log.info("为 {} 个无点位的控制别名生成占位点", dummies.size());
        return input.concat(RowSet.of(input.columns(), dummies));
    }

    static Row dummyFor(Row control, String sentinelRtuId) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String column : COPIED_COLUMNS) {
            values.put(column, control.get(column));
        }
        values.put(ColumnNames.RTU_ID, sentinelRtuId);
        values.put(ColumnNames.GENERIC_TYPE, ReconcileConstant.TYPE_DUMMY);
        values.put(ColumnNames.CONTROLLABLE, ReconcileConstant.CONTROLLABLE_YES);
        values.put(ColumnNames.GENERIC_POINT_ADDRESS, null);
        for (String flag : ImportSupport.IGNORE_FLAGS) {
            values.put(flag, Boolean.FALSE);
        }
        return Row.of(values);
    }
}
