package com.wangbin.reconciler.core.report;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.constant.ReconcileConstant;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RTU报表点位部分
 * 只收录数字量（SD/DD），附带控制与告警摘要；不可控点的控制列为空串，无告警比对的点告警列为空串。
 */
public final class PointsSectionBuilder {

    static final List<String> ALARM_SUMMARY_COLUMNS = List.of(
            "CompAlarmeTerraAlarmZone", "CompAlarmeTerraStatus", "CompAlarmPOsubstation",
            "CompAlarmPOAlarmZone", "CompAlarmPOAlarmRef", ColumnNames.COMP_ALARM_PO_STATUS,
            "CompAlarmAlarmZoneMatch", "Alarm0_MessageMatch", "Alarm1_MessageMatch",
            "Alarm2_MessageMatch", "Alarm3_MessageMatch");

    static final List<String> REPORT_FLAGS = List.of("Report1", "Report2", "Report3");

    private PointsSectionBuilder() {
    }

    public static List<String> columns() {
        List<String> columns = new ArrayList<>(List.of(
                "Type", "SCADA Address", "eTerra Key", "PowerOn Alias", "ICCP Flag",
                "Habdde Match Status", "PowerOn Config Health Status", "Control Zone Status",
                "Ctrl1Addr", "Ctrl1Name", "Ctrl2Addr", "Ctrl2Name"));
        columns.addAll(ALARM_SUMMARY_COLUMNS);
        columns.addAll(REPORT_FLAGS);
        return columns;
    }

    public static RowSet build(RowSet merged) {
        List<Row> points = new ArrayList<>();
        for (Row row : merged.rows()) {
            String genericType = row.getString(ColumnNames.GENERIC_TYPE);
            if (!ReconcileConstant.TYPE_SD.equals(genericType) && !ReconcileConstant.TYPE_DD.equals(genericType)) {
                continue;
            }
            points.add(point(row));
        }
        return RowSet.of(columns(), points);
    }

    private static Row point(Row row) {
        Map<String, Object> point = new LinkedHashMap<>();
        point.put("Type", row.getStringOrEmpty(ColumnNames.GENERIC_TYPE));
        point.put("SCADA Address", row.getStringOrEmpty(ColumnNames.GENERIC_POINT_ADDRESS));
        point.put("eTerra Key", row.getStringOrEmpty(ColumnNames.ETERRA_KEY));
        point.put("PowerOn Alias", row.getStringOrEmpty(ColumnNames.PO_ALIAS));
        point.put("ICCP Flag", row.getStringOrEmpty("ICCPFlag"));
        point.put("Habdde Match Status", row.getStringOrEmpty(ColumnNames.HABDDE_COMPARE_STATUS));
        point.put("PowerOn Config Health Status", row.getStringOrEmpty(ColumnNames.CONFIG_HEALTH));
        point.put("Control Zone Status", row.getStringOrEmpty("CompAlarmAlarmZoneMatch"));

        boolean controllable = ReconcileConstant.CONTROLLABLE_YES.equals(row.getString(ColumnNames.CONTROLLABLE));
        for (int n = 1; n <= ReconcileConstant.MAX_CONTROLS; n++) {
            String address = controllable ? row.getStringOrEmpty(ColumnNames.ctrl(n, "Addr")) : "";
            point.put(ColumnNames.ctrl(n, "Addr"), address);
            point.put(ColumnNames.ctrl(n, "Name"), address.isEmpty() ? "" : row.getStringOrEmpty(ColumnNames.ctrl(n, "Name")));
        }

        boolean hasAlarms = !row.getStringOrEmpty(ColumnNames.COMP_ALARM_ETERRA_ALIAS).isEmpty();
        for (String column : ALARM_SUMMARY_COLUMNS) {
            point.put(column, hasAlarms ? row.get(column) : "");
        }
        for (String flag : REPORT_FLAGS) {
            point.put(flag, row.has(flag) ? row.get(flag) : "");
        }
        return Row.of(point);
    }
}
