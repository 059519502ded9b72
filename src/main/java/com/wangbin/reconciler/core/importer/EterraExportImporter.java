package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.constant.ReconcileConstant;
import com.wangbin.reconciler.core.address.AddressCodec;
import com.wangbin.reconciler.core.address.AddressFields;
import com.wangbin.reconciler.core.address.RtuId;
import com.wangbin.reconciler.core.table.CsvTableReader;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * eTerra工程导出导入器
 * 处理点表、模拟量表、控制表、设定值表四个分页（各导出为一个CSV），
 * 统一列名后逐行推导 RTUId / eTerraAlias / 通用点位地址。
 */
@Slf4j
public class EterraExportImporter {

    private static final Map<String, String> POINT_RENAMES = Map.ofEntries(
            Map.entry("sub", ColumnNames.SUB),
            Map.entry("devtyp", ColumnNames.DEVICE_TYPE),
            Map.entry("device_id", ColumnNames.DEVICE_ID),
            Map.entry("device_name", ColumnNames.DEVICE_NAME),
            Map.entry("point_id", ColumnNames.POINT_ID),
            Map.entry("point_name", ColumnNames.POINT_NAME),
            Map.entry("area", "eTerraZone"),
            Map.entry("rtu", ColumnNames.RTU),
            Map.entry("address1", ColumnNames.CASDU),
            Map.entry("rtu_address", ColumnNames.RTU_ADDRESS),
            Map.entry("card", ColumnNames.CARD),
            Map.entry("phyadr", ColumnNames.WORD),
            Map.entry("pnttyp", "eTerraPtyType"),
            Map.entry("sinvt", "Inverted"),
            Map.entry("protocol", ColumnNames.PROTOCOL),
            Map.entry("ctrlable", ColumnNames.CONTROLLABLE));

    private static final Map<String, String> ANALOG_RENAMES = Map.ofEntries(
            Map.entry("sub", ColumnNames.SUB),
            Map.entry("devtyp", ColumnNames.DEVICE_TYPE),
            Map.entry("device_id", ColumnNames.DEVICE_ID),
            Map.entry("device_name", ColumnNames.DEVICE_NAME),
            Map.entry("analog_id", ColumnNames.POINT_ID),
            Map.entry("lo_reas", "LoReas"),
            Map.entry("hi_reas", "HiReas"),
            Map.entry("area", "eTerraZone"),
            Map.entry("rtu", ColumnNames.RTU),
            Map.entry("address1", ColumnNames.CASDU),
            Map.entry("rtu_address", ColumnNames.RTU_ADDRESS),
            Map.entry("card", ColumnNames.CARD),
            Map.entry("word", ColumnNames.WORD),
            Map.entry("rawhigh", "RawHigh"),
            Map.entry("rawlow", "RawLow"),
            Map.entry("enghigh", "EngHigh"),
            Map.entry("englow", "EngLow"),
            Map.entry("protocol", ColumnNames.PROTOCOL),
            Map.entry("clmpdbnd", "ClmpDbnd"),
            Map.entry("pospolar", "PosPolar"),
            Map.entry("negpolar", "NegPolar"),
            Map.entry("negate", "Negate"));

    private static final Map<String, String> CONTROL_RENAMES = Map.ofEntries(
            Map.entry("sub", ColumnNames.SUB),
            Map.entry("devtyp", ColumnNames.DEVICE_TYPE),
            Map.entry("device_id", ColumnNames.DEVICE_ID),
            Map.entry("device_name", ColumnNames.DEVICE_NAME),
            Map.entry("point_id", ColumnNames.POINT_ID),
            Map.entry("control_id", ColumnNames.CONTROL_ID),
            Map.entry("rtu", ColumnNames.RTU),
            Map.entry("rtu_address", ColumnNames.RTU_ADDRESS),
            Map.entry("card", ColumnNames.CARD),
            Map.entry("phyadr", ColumnNames.WORD),
            Map.entry("mdlparm1", "Parm1"),
            Map.entry("mdlparm2", "Parm2"),
            Map.entry("mdlparm3", "Parm3"),
            Map.entry("protocol", ColumnNames.PROTOCOL),
            Map.entry("ctrlfunc", ColumnNames.CTRL_FUNC),
            Map.entry("address", ColumnNames.CASDU));

    private static final Map<String, String> SETPOINT_RENAMES = Map.ofEntries(
            Map.entry("sub", ColumnNames.SUB),
            Map.entry("devtyp", ColumnNames.DEVICE_TYPE),
            Map.entry("device_id", ColumnNames.DEVICE_ID),
            Map.entry("device_name", ColumnNames.DEVICE_NAME),
            Map.entry("analog_id", ColumnNames.POINT_ID),
            Map.entry("rtu", ColumnNames.RTU),
            Map.entry("rtu_address", ColumnNames.RTU_ADDRESS),
            Map.entry("address1", ColumnNames.CASDU),
            Map.entry("card", ColumnNames.IOA1),
            Map.entry("phyadr", ColumnNames.IOA2),
            Map.entry("protocol", ColumnNames.PROTOCOL),
            Map.entry("mdlparm2", ColumnNames.CTRL_FUNC),
            Map.entry("enghigh", "EngHigh"),
            Map.entry("englow", "EngLow"));

    private static final List<String> POINT_COLUMNS = List.of(
            ColumnNames.ETERRA_KEY, ColumnNames.ETERRA_ALIAS, ColumnNames.SUB, ColumnNames.DEVICE_TYPE,
            ColumnNames.DEVICE_ID, ColumnNames.DEVICE_NAME, ColumnNames.POINT_ID, ColumnNames.POINT_NAME,
            "eTerraZone", ColumnNames.RTU, ColumnNames.RTU_ADDRESS, ColumnNames.CARD, ColumnNames.WORD,
            ColumnNames.CASDU, ColumnNames.IOA, ColumnNames.IOA1, ColumnNames.IOA2, ColumnNames.SIZE,
            "Inverted", ColumnNames.PROTOCOL, ColumnNames.CONTROLLABLE, "eTerraPtyType", ColumnNames.RTU_ID,
            ColumnNames.GENERIC_POINT_ADDRESS, ColumnNames.GENERIC_TYPE);

    private static final List<String> ANALOG_COLUMNS = List.of(
            ColumnNames.ETERRA_KEY, ColumnNames.ETERRA_ALIAS, ColumnNames.SUB, ColumnNames.DEVICE_TYPE,
            ColumnNames.DEVICE_ID, ColumnNames.DEVICE_NAME, ColumnNames.POINT_ID, "LoReas", "HiReas",
            "eTerraZone", ColumnNames.RTU, ColumnNames.RTU_ADDRESS, ColumnNames.CARD, ColumnNames.WORD,
            "RawHigh", "RawLow", "EngHigh", "EngLow", ColumnNames.PROTOCOL, "ClmpDbnd", "PosPolar",
            "NegPolar", "Negate", ColumnNames.RTU_ID, ColumnNames.GENERIC_POINT_ADDRESS, ColumnNames.GENERIC_TYPE,
            ColumnNames.CASDU, ColumnNames.IOA, ColumnNames.IOA1, ColumnNames.IOA2, ColumnNames.CONTROLLABLE);

    private static final List<String> CONTROL_COLUMNS = List.of(
            ColumnNames.ETERRA_KEY, ColumnNames.ETERRA_ALIAS, ColumnNames.SUB, ColumnNames.DEVICE_TYPE,
            ColumnNames.DEVICE_ID, ColumnNames.DEVICE_NAME, ColumnNames.POINT_ID, ColumnNames.CONTROL_ID,
            ColumnNames.RTU, ColumnNames.RTU_ADDRESS, ColumnNames.CARD, ColumnNames.WORD, "Parm1", "Parm2",
            "Parm3", ColumnNames.CTRL_FUNC, ColumnNames.PROTOCOL, ColumnNames.RTU_ID,
            ColumnNames.GENERIC_POINT_ADDRESS, ColumnNames.GENERIC_TYPE, ColumnNames.CASDU, ColumnNames.IOA,
            ColumnNames.IOA1, ColumnNames.IOA2);

    private static final List<String> SETPOINT_COLUMNS = List.of(
            ColumnNames.ETERRA_KEY, ColumnNames.ETERRA_ALIAS, ColumnNames.SUB, ColumnNames.DEVICE_TYPE,
            ColumnNames.DEVICE_ID, ColumnNames.DEVICE_NAME, ColumnNames.POINT_ID, ColumnNames.RTU,
            ColumnNames.RTU_ADDRESS, ColumnNames.CASDU, ColumnNames.IOA1, ColumnNames.IOA2,
            ColumnNames.CTRL_FUNC, "EngHigh", "EngLow", ColumnNames.PROTOCOL, ColumnNames.RTU_ID,
            ColumnNames.GENERIC_POINT_ADDRESS, ColumnNames.GENERIC_TYPE);

    private static final List<String> DERIVED_ADDRESS_COLUMNS = List.of(
            ColumnNames.CASDU, ColumnNames.IOA, ColumnNames.IOA1, ColumnNames.IOA2, ColumnNames.GENERIC_POINT_ADDRESS);

    /** 模拟量表中视为可控的点位ID（有载调压档位） */
    private final Set<String> controllableAnalogPointIds;

    public EterraExportImporter(Set<String> controllableAnalogPointIds) {
        this.controllableAnalogPointIds = Set.copyOf(controllableAnalogPointIds);
    }

    public RowSet loadPointTab(Path file) {
        return cleanPointTab(CsvTableReader.read(file));
    }

    public RowSet loadAnalogTab(Path file) {
        return cleanAnalogTab(CsvTableReader.read(file));
    }

    public RowSet loadControlTab(Path file) {
        return cleanControlTab(CsvTableReader.read(file));
    }

    public RowSet loadSetpointTab(Path file) {
        return cleanSetpointTab(CsvTableReader.read(file));
    }

    /**
     * 点表：concat_conect 0/1 转为 Size 1/2，Card 与 CASDU 均为空的行视为占位点
     */
    public RowSet cleanPointTab(RowSet raw) {
        RowSet table = withIdentity(raw.renameColumns(POINT_RENAMES));
        table = table.withColumn(ColumnNames.SIZE, row -> {
            Long connect = ImportSupport.toLong(row.get("concat_conect"));
            if (connect == null) {
                return null;
            }
            return connect == 1 ? 2L : connect == 0 ? 1L : connect;
        });
        table = table.withColumn(ColumnNames.GENERIC_TYPE, EterraExportImporter::derivePointType);
        table = withAddresses(table);
        return finish(table, POINT_COLUMNS, true, "eTerra点表");
    }

    /**
     * 模拟量表：类型固定为 A，仅调压档位点可控
     */
    public RowSet cleanAnalogTab(RowSet raw) {
        RowSet table = withIdentity(raw.renameColumns(ANALOG_RENAMES));
        table = table.withColumn(ColumnNames.GENERIC_TYPE, row -> ReconcileConstant.TYPE_ANALOG);
        table = withAddresses(table);
        table = table.withColumn(ColumnNames.CONTROLLABLE,
                row -> controllableAnalogPointIds.contains(row.getString(ColumnNames.POINT_ID)) ? "1" : "0");
        return finish(table, ANALOG_COLUMNS, true, "eTerra模拟量表");
    }

    public RowSet cleanControlTab(RowSet raw) {
        RowSet table = withIdentity(raw.renameColumns(CONTROL_RENAMES));
        table = table.withColumn(ColumnNames.GENERIC_TYPE, row -> ReconcileConstant.TYPE_CTRL);
        table = withAddresses(table);
        return finish(table, CONTROL_COLUMNS, false, "eTerra控制表");
    }

    /**
     * 设定值表：卡号/物理地址即IOA高低字段，仅用于IEC RTU
     */
    public RowSet cleanSetpointTab(RowSet raw) {
        RowSet table = withIdentity(raw.renameColumns(SETPOINT_RENAMES));
        table = table.withColumn(ColumnNames.GENERIC_TYPE, row -> ReconcileConstant.TYPE_SETPOINT);
        table = table.withColumn(ColumnNames.CARD, row -> row.get(ColumnNames.IOA1));
        table = table.withColumn(ColumnNames.WORD, row -> row.get(ColumnNames.IOA2));
        table = withAddresses(table);
        return finish(table, SETPOINT_COLUMNS, false, "eTerra设定值表");
    }

    private static String derivePointType(Row row) {
        if (row.isNull(ColumnNames.CARD) && row.isNull(ColumnNames.CASDU)) {
            return ReconcileConstant.TYPE_DUMMY;
        }
        Object size = row.get(ColumnNames.SIZE);
        if (Long.valueOf(1L).equals(size)) {
            return ReconcileConstant.TYPE_SD;
        }
        if (Long.valueOf(2L).equals(size)) {
            return ReconcileConstant.TYPE_DD;
        }
        return null;
    }

    private static RowSet withIdentity(RowSet table) {
        return table
                .withColumn(ColumnNames.ETERRA_ALIAS, ImportSupport::alias)
                .withColumn(ColumnNames.RTU_ID, row -> RtuId.format(row.getString(ColumnNames.RTU),
                        row.get(ColumnNames.RTU_ADDRESS)))
                .withColumn(ColumnNames.ETERRA_KEY, row -> ImportSupport.strip(row.getString(ColumnNames.ETERRA_KEY)));
    }

    private static RowSet withAddresses(RowSet table) {
        return table.mapRows(DERIVED_ADDRESS_COLUMNS, row -> {
            AddressCodec.DerivedAddress derived = AddressCodec.derive(AddressFields.builder()
                    .rtu(row.getString(ColumnNames.RTU))
                    .rtuAddress(row.getString(ColumnNames.RTU_ADDRESS))
                    .protocol(row.getString(ColumnNames.PROTOCOL))
                    .card(row.getString(ColumnNames.CARD))
                    .word(row.getString(ColumnNames.WORD))
                    .casdu(row.getString(ColumnNames.CASDU))
                    .genericType(row.getString(ColumnNames.GENERIC_TYPE))
                    .ctrlFunc(row.getString(ColumnNames.CTRL_FUNC))
                    .build());
            Map<String, Object> values = new LinkedHashMap<>();
            values.put(ColumnNames.CASDU, derived.casdu());
            values.put(ColumnNames.IOA, derived.ioa());
            values.put(ColumnNames.IOA1, derived.ioa1());
            values.put(ColumnNames.IOA2, derived.ioa2());
            values.put(ColumnNames.GENERIC_POINT_ADDRESS, derived.genericPointAddress());
            return row.withAll(values);
        });
    }

    private static RowSet finish(RowSet table, List<String> columns, boolean withSupplementary, String tableName) {
        List<String> keep = new ArrayList<>(columns);
        if (withSupplementary) {
            keep.addAll(ImportSupport.SUPPLEMENTARY_COLUMNS);
        }
        RowSet result = ImportSupport.dropSpurious(table.select(keep), tableName);
        if (withSupplementary) {
            result = ImportSupport.normalizeFlags(result);
        }
        log.info("{}导入完成: {} 行", tableName, result.size());
        return result;
    }
}
