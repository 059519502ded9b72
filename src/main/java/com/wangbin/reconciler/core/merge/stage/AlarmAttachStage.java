package com.wangbin.reconciler.core.merge.stage;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.constant.ReconcileConstant;
import com.wangbin.reconciler.core.importer.ImportSupport;
import com.wangbin.reconciler.core.merge.AbstractMergeStage;
import com.wangbin.reconciler.core.merge.JoinSupport;
import com.wangbin.reconciler.core.merge.MergeContext;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 告警比对挂接
 * 按eTerra别名分组，Matched 状态的记录排在组首；组首记录提供点位级告警区字段，
 * 全部记录按告警值（0-3）填入 Alarm{n} 三列，同一槽位先到先得，超出槽位的只计入告警数。
 */
@Slf4j
public class AlarmAttachStage extends AbstractMergeStage {

    static final List<String> POINT_LEVEL_COLUMNS = List.of(
            ColumnNames.COMP_ALARM_ETERRA_ALIAS,
            "CompAlarmPOAlias",
            "CompAlarmeTerraAlarmZone",
            "CompAlarmeTerraStatus",
            "CompAlarmPOsubstation",
            "CompAlarmPOAlarmZone",
            "CompAlarmPOAlarmRef",
            ColumnNames.COMP_ALARM_PO_STATUS,
            "CompAlarmAlarmZoneMatch");

    static final String ETERRA_MESSAGE = "eTerraMessage";
    static final String PO_MESSAGE = "POMessage";
    static final String MESSAGE_MATCH = "MessageMatch";

    private static final Comparator<Row> MATCHED_FIRST = Comparator.comparingInt(
            row -> ReconcileConstant.ALARM_STATUS_MATCHED.equals(row.getString(ColumnNames.COMP_ALARM_PO_STATUS)) ? 0 : 1);

    public AlarmAttachStage() {
        super("alarm_attach", 50);
    }

    @Override
    protected RowSet doApply(RowSet input, MergeContext context) {
        RowSet alarms = context.getInputs().getAlarms();
        List<String> pointColumns = new ArrayList<>();
        for (String column : POINT_LEVEL_COLUMNS) {
            if (!input.hasColumn(column)) {
                pointColumns.add(column);
            }
        }

        Map<String, AlarmSummary> summaries = new LinkedHashMap<>();
        JoinSupport.index(alarms, ColumnNames.COMP_ALARM_ETERRA_ALIAS)
                .forEach((alias, group) -> summaries.put(alias, summarize(group, pointColumns)));

        List<String> added = new ArrayList<>(pointColumns);
        added.addAll(alarmColumns());
        added.add(ColumnNames.NUM_ALARMS);
        added.add(ColumnNames.NUM_ALARMS_MATCHED);
        added.add(ColumnNames.PERCENT_ALARMS_MATCHED);

        int[] attached = {0};
        RowSet result = input.mapRows(added, row -> {
            AlarmSummary summary = summaries.get(row.getString(ColumnNames.ETERRA_ALIAS));
            if (summary == null) {
                return row.withAll(emptyValues(added));
            }
            attached[0]++;
            return row.withAll(summary.values());
        });
        log.info("告警比对 {} 条记录, {} 个别名, 挂接到 {} 行", alarms.size(), summaries.size(), attached[0]);
        return result;
    }

    static List<String> alarmColumns() {
        List<String> columns = new ArrayList<>();
        for (int slot = 0; slot < ReconcileConstant.ALARM_SLOTS; slot++) {
            columns.add(ColumnNames.alarm(slot, ETERRA_MESSAGE));
            columns.add(ColumnNames.alarm(slot, PO_MESSAGE));
            columns.add(ColumnNames.alarm(slot, MESSAGE_MATCH));
        }
        return columns;
    }

    private static Map<String, Object> emptyValues(List<String> columns) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String column : columns) {
            values.put(column, null);
        }
        values.put(ColumnNames.NUM_ALARMS, 0L);
        values.put(ColumnNames.NUM_ALARMS_MATCHED, 0L);
        return values;
    }

    private static AlarmSummary summarize(List<Row> group, List<String> pointColumns) {
        List<Row> ordered = new ArrayList<>(group);
        ordered.sort(MATCHED_FIRST);

        Map<String, Object> values = new LinkedHashMap<>();
        Row head = ordered.get(0);
        for (String column : pointColumns) {
            values.put(column, head.get(column));
        }
        for (String column : alarmColumns()) {
            values.put(column, null);
        }

        boolean[] filled = new boolean[ReconcileConstant.ALARM_SLOTS];
        long matched = 0;
        for (Row alarm : ordered) {
            if (Boolean.TRUE.equals(ImportSupport.parseFlag(alarm.get(ColumnNames.COMP_ALARM_MESSAGE_MATCH)))) {
                matched++;
            }
            Integer slot = slotOf(alarm.get(ColumnNames.COMP_ALARM_VALUE));
            if (slot == null) {
                log.debug("告警值不在槽位范围内: alias={}, value={}",
                        alarm.get(ColumnNames.COMP_ALARM_ETERRA_ALIAS), alarm.get(ColumnNames.COMP_ALARM_VALUE));
                continue;
            }
            if (filled[slot]) {
                continue;
            }
            filled[slot] = true;
            values.put(ColumnNames.alarm(slot, ETERRA_MESSAGE), alarm.get(ColumnNames.COMP_ALARM_ETERRA_MESSAGE));
            values.put(ColumnNames.alarm(slot, PO_MESSAGE), alarm.get(ColumnNames.COMP_ALARM_PO_MESSAGE));
            values.put(ColumnNames.alarm(slot, MESSAGE_MATCH), alarm.get(ColumnNames.COMP_ALARM_MESSAGE_MATCH));
        }
        if (group.size() > ReconcileConstant.ALARM_SLOTS) {
            log.warn("别名 {} 有 {} 条告警比对记录，只保留前 {} 个槽位",
                    head.get(ColumnNames.COMP_ALARM_ETERRA_ALIAS), group.size(), ReconcileConstant.ALARM_SLOTS);
        }

        values.put(ColumnNames.NUM_ALARMS, (long) group.size());
        values.put(ColumnNames.NUM_ALARMS_MATCHED, matched);
        values.put(ColumnNames.PERCENT_ALARMS_MATCHED, matched * 100.0 / group.size());
        return new AlarmSummary(values);
    }

    /**
     * 告警值对应的槽位，非 0-3 的整数返回null
     */
    static Integer slotOf(Object tokenValue) {
        Long value = ImportSupport.toLong(tokenValue);
        if (value == null || value < 0 || value >= ReconcileConstant.ALARM_SLOTS) {
            return null;
        }
        return value.intValue();
    }

    private record AlarmSummary(Map<String, Object> values) {
    }
}
