package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.core.table.CsvTableReader;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 告警文本比对导入器
 * 每条记录是某点某个告警槽位（CompAlarmValue，0..3）的eTerra/PowerOn告警文本比对结果。
 */
@Slf4j
public class AlarmCompareImporter {

    private static final Map<String, String> RENAMES = Map.ofEntries(
            Map.entry("RTU_Name", "CompAlarmRTU"),
            Map.entry("RTU_Address", "CompAlarmRTUAddress"),
            Map.entry("eTerra Alias", ColumnNames.COMP_ALARM_ETERRA_ALIAS),
            Map.entry("PO Alias", "CompAlarmPOAlias"),
            Map.entry("Type", "CompAlarmType"),
            Map.entry("Card", "CompAlarmCard"),
            Map.entry("Offset", "CompAlarmOffset"),
            Map.entry("Value", ColumnNames.COMP_ALARM_VALUE),
            Map.entry("eTerraSubstation", "CompAlarmeTerraSubstation"),
            Map.entry("eTerraAlarmMessage", ColumnNames.COMP_ALARM_ETERRA_MESSAGE),
            Map.entry("eTerraAlarmZone", "CompAlarmeTerraAlarmZone"),
            Map.entry("eTerraStatus", "CompAlarmeTerraStatus"),
            Map.entry("POSubstation", "CompAlarmPOsubstation"),
            Map.entry("POAlarmMessage", ColumnNames.COMP_ALARM_PO_MESSAGE),
            Map.entry("POAlarmZone", "CompAlarmPOAlarmZone"),
            Map.entry("POAlarmValue", "CompAlarmPOAlarmValue"),
            Map.entry("POAlarmRef", "CompAlarmPOAlarmRef"),
            Map.entry("POStatus", ColumnNames.COMP_ALARM_PO_STATUS),
            Map.entry("etoken1", "eToken1"),
            Map.entry("etoken2", "eToken2"),
            Map.entry("etoken3", "eToken3"),
            Map.entry("etoken4", "eToken4"),
            Map.entry("etoken5", "eToken5"),
            Map.entry("ptoken1", "pToken1"),
            Map.entry("ptoken2", "pToken2"),
            Map.entry("ptoken3", "pToken3"),
            Map.entry("ptoken4", "pToken4"),
            Map.entry("ptoken5", "pToken5"),
            Map.entry("new_match", "CompAlarmNewMatch"),
            Map.entry("MatchScore", "CompAlarmMatchScore"),
            Map.entry("AlarmMessageMatch", ColumnNames.COMP_ALARM_MESSAGE_MATCH),
            Map.entry("AlarmZoneMatch", "CompAlarmAlarmZoneMatch"),
            Map.entry("TemplateAlias", "CompAlarmTemplateAlias"),
            Map.entry("TemplateName", "CompAlarmTemplateName"),
            Map.entry("TemplateType", "CompAlarmTemplateType"),
            Map.entry("StateIndex", "CompAlarmStateIndex"),
            Map.entry("DCB", "IsDCB"),
            Map.entry("314", "Is314"),
            Map.entry("SC1E", "IsSC1E"),
            Map.entry("SC2E", "IsSC2E"));

    private static final List<String> COLUMNS = List.of(
            "CompAlarmRTU", "CompAlarmRTUAddress", ColumnNames.COMP_ALARM_ETERRA_ALIAS, "CompAlarmPOAlias",
            "CompAlarmType", "CompAlarmCard", "CompAlarmOffset", ColumnNames.COMP_ALARM_VALUE,
            "CompAlarmeTerraSubstation", ColumnNames.COMP_ALARM_ETERRA_MESSAGE, "CompAlarmeTerraAlarmZone",
            "CompAlarmeTerraStatus", "CompAlarmPOsubstation", ColumnNames.COMP_ALARM_PO_MESSAGE,
            "CompAlarmPOAlarmZone", "CompAlarmPOAlarmValue", "CompAlarmPOAlarmRef", ColumnNames.COMP_ALARM_PO_STATUS,
            "eToken1", "eToken2", "eToken3", "eToken4", "eToken5",
            "pToken1", "pToken2", "pToken3", "pToken4", "pToken5",
            "T1Match", "T2Match", "T3Match", "T4Match", "T5Match",
            "CompAlarmNewMatch", "CompAlarmMatchScore", ColumnNames.COMP_ALARM_MESSAGE_MATCH,
            "CompAlarmAlarmZoneMatch", "CompAlarmTemplateAlias", "CompAlarmTemplateName", "CompAlarmTemplateType",
            "CompAlarmStateIndex", "IsDCB", "Is314", "IsSC1E", "IsSC2E");

    // 数值列与布尔列，表格导出中原为数值/布尔类型
    private static final List<String> NUMERIC_COLUMNS = List.of(
            ColumnNames.COMP_ALARM_VALUE, "CompAlarmPOAlarmRef", "CompAlarmPOAlarmValue", "CompAlarmMatchScore");
    private static final List<String> BOOLEAN_COLUMNS = List.of(
            ColumnNames.COMP_ALARM_MESSAGE_MATCH, "CompAlarmAlarmZoneMatch");

    public RowSet load(Path file) {
        return clean(CsvTableReader.read(file));
    }

    public RowSet clean(RowSet raw) {
        RowSet table = raw.renameColumns(RENAMES).select(COLUMNS);
        for (String column : NUMERIC_COLUMNS) {
            if (table.hasColumn(column)) {
                table = table.withColumn(column, row -> ImportSupport.toNumber(row.get(column)));
            }
        }
        for (String column : BOOLEAN_COLUMNS) {
            if (table.hasColumn(column)) {
                table = table.withColumn(column, row -> {
                    Boolean flag = ImportSupport.parseFlag(row.get(column));
                    return flag != null ? flag : row.get(column);
                });
            }
        }
        log.info("告警比对导入完成: {} 行", table.size());
        return table;
    }
}
