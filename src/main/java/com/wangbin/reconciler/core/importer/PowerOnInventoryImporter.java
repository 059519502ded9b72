package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.constant.ReconcileConstant;
import com.wangbin.reconciler.common.enums.TelecontrolProtocol;
import com.wangbin.reconciler.core.address.AddressCodec;
import com.wangbin.reconciler.core.address.IoaUtils;
import com.wangbin.reconciler.core.address.RtuDirectory;
import com.wangbin.reconciler.core.address.RtuId;
import com.wangbin.reconciler.core.table.CsvTableReader;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PowerOn全量RTU台账导入器
 * 台账是每个通用地址唯一的权威数据源；此处只处理已知的上游重复问题，
 * 其余重复地址留给合并引擎拒绝。
 */
@Slf4j
public class PowerOnInventoryImporter {

    private static final Map<String, String> RENAMES = Map.ofEntries(
            Map.entry("RTU", ColumnNames.PO_RTU),
            Map.entry("RTU Address", ColumnNames.RTU_ADDRESS),
            Map.entry("eterra_sub", ColumnNames.SUB),
            Map.entry("eterra_dev_type", ColumnNames.DEVICE_TYPE),
            Map.entry("eterra_dev_id", ColumnNames.DEVICE_ID),
            Map.entry("eterra_point_id", ColumnNames.POINT_ID),
            Map.entry("addr1", ColumnNames.CARD),
            Map.entry("addr2", ColumnNames.WORD),
            Map.entry("comp_alias", ColumnNames.PO_ALIAS),
            Map.entry("comp_name", "POName"),
            Map.entry("control_val", ColumnNames.CONTROL_ID),
            Map.entry("config_extra_info", "ConfigInfo"),
            Map.entry("config_health", ColumnNames.CONFIG_HEALTH),
            Map.entry("desc", "PODescription"),
            Map.entry("recordType", ColumnNames.PO_TYPE),
            Map.entry("scan_row", "ScanInputRow"),
            Map.entry("interpretation", "POInterpretation"),
            Map.entry("shift", "Shift"),
            Map.entry("siref1", "ScanInputRef"),
            Map.entry("size", ColumnNames.SIZE),
            Map.entry("symbol_menu", "Menu"),
            Map.entry("symbol_name", ColumnNames.SYMBOL),
            Map.entry("telecontrol_action", ColumnNames.TC_ACTION),
            Map.entry("user_tag", "UserTag"));

    // 派生后改为 PO_ 前缀，避免与eTerra列冲突
    private static final Map<String, String> PREFIX_RENAMES = Map.of(
            ColumnNames.PROTOCOL, ColumnNames.PO_PROTOCOL,
            ColumnNames.CARD, ColumnNames.PO_CARD,
            ColumnNames.WORD, ColumnNames.PO_WORD,
            ColumnNames.IOA1, "PO_IOA1",
            ColumnNames.IOA2, "PO_IOA2",
            "Offset", "PO_Offset",
            ColumnNames.GENERIC_TYPE, ColumnNames.PO_GENERIC_TYPE,
            ColumnNames.ETERRA_ALIAS, "PO_eTerraAlias",
            ColumnNames.SIZE, "PO_Size");

    private static final List<String> COLUMNS = List.of(
            ColumnNames.PO_PROTOCOL, ColumnNames.PO_RTU, ColumnNames.PO_CARD, ColumnNames.PO_WORD,
            "PO_IOA1", "PO_IOA2", "PO_Offset", ColumnNames.PO_ALIAS, "POName", "ConfigInfo",
            ColumnNames.CONFIG_HEALTH, "PODescription", ColumnNames.PO_TYPE, "ScanInputRow", "Shift",
            "ScanInputRef", "UserTag", "PO_Size", "POInterpretation", "Menu", ColumnNames.SYMBOL,
            ColumnNames.TC_ACTION, ColumnNames.PO_GENERIC_TYPE, ColumnNames.GENERIC_POINT_ADDRESS, "PO_eTerraAlias");

    private static final List<String> DERIVED_COLUMNS = List.of(
            ColumnNames.GENERIC_TYPE, ColumnNames.RTU, ColumnNames.RTU_ID, ColumnNames.ETERRA_ALIAS,
            ColumnNames.IOA1, ColumnNames.IOA2, "Offset", ColumnNames.GENERIC_POINT_ADDRESS);

    private final Set<String> excludedRtus;

    public PowerOnInventoryImporter(Set<String> excludedRtus) {
        this.excludedRtus = Set.copyOf(excludedRtus);
    }

    public RowSet load(Path file) {
        return clean(CsvTableReader.read(file));
    }

    public RowSet clean(RowSet raw) {
        RowSet table = raw.renameColumns(RENAMES);
        table = table.mapRows(List.of(ColumnNames.CARD, ColumnNames.WORD, "Shift", ColumnNames.SIZE), row -> {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (String column : List.of(ColumnNames.CARD, ColumnNames.WORD, "Shift", ColumnNames.SIZE)) {
                normalized.put(column, ImportSupport.normalizeInteger(row.getString(column)));
            }
            return row.withAll(normalized);
        });
        table = table.mapRows(DERIVED_COLUMNS, PowerOnInventoryImporter::derive);
        table = table.renameColumns(PREFIX_RENAMES).select(COLUMNS);

        int before = table.size();
        table = table.filter(row -> !excludedRtus.contains(row.getString(ColumnNames.PO_RTU)));
        if (table.size() != before) {
            log.info("剔除排除RTU {} 的台账记录 {} 行", excludedRtus, before - table.size());
        }

        table = dropIecDuplicates(table);
        warnDuplicateAddresses(table);
        log.info("PowerOn台账导入完成: {} 行", table.size());
        return table;
    }

    /**
     * 台账记录类型转通用类型
     */
    public static String genericTypeOf(String poType) {
        if (poType == null) {
            return "Unknown";
        }
        return switch (poType) {
            case "A1", "A2", "A4" -> ReconcileConstant.TYPE_ANALOG;
            case "DI" -> ReconcileConstant.TYPE_SD;
            case "DD" -> ReconcileConstant.TYPE_DD;
            case "DO" -> ReconcileConstant.TYPE_TAG_CONTROL;
            case "AO" -> ReconcileConstant.TYPE_SETPOINT;
            default -> "Unknown";
        };
    }

    /**
     * MK2A偏移量：DI 为 字*8+位；DD 为 (字*8+位)/2；其余为字地址；再加1对齐eTerra的1起始字地址。
     * IEC协议直接取IOA。
     */
    public static String computeOffset(String protocol, String poType, String word, String shift, String rtu) {
        Integer wordValue = AddressCodec.parseInteger(word);
        if (TelecontrolProtocol.IEC60870_101.getCode().equals(protocol)) {
            return wordValue != null ? String.valueOf(wordValue) : null;
        }
        Integer shiftValue = AddressCodec.parseInteger(shift);
        if (wordValue == null || shiftValue == null) {
            log.warn("偏移量计算失败，字地址或位移不是整数: r{}:w{}:b{}", rtu, word, shift);
            return null;
        }
        int offset;
        if ("DI".equals(poType)) {
            offset = wordValue * 8 + shiftValue;
        } else if ("DD".equals(poType)) {
            offset = (wordValue * 8 + shiftValue) / 2;
        } else {
            offset = wordValue;
        }
        return String.valueOf(offset + 1);
    }

    private static Row derive(Row row) {
        String poRtu = row.getString(ColumnNames.PO_RTU);
        String rtu = poRtu != null ? RtuDirectory.toEterraName(poRtu) : null;
        String genericType = genericTypeOf(row.getString(ColumnNames.PO_TYPE));
        String rtuId = RtuId.format(rtu, row.get(ColumnNames.RTU_ADDRESS));
        String protocol = row.getString(ColumnNames.PROTOCOL);
        String card = row.getString(ColumnNames.CARD);
        String word = row.getString(ColumnNames.WORD);

        String ioa1 = null;
        String ioa2 = null;
        Long ioa = ImportSupport.toLong(word);
        if (ioa != null && ioa >= 0 && ioa <= 0xFFFFFFFFL) {
            IoaUtils.IoaParts parts = IoaUtils.split(ioa);
            ioa1 = String.valueOf(parts.ioa1());
            ioa2 = String.valueOf(parts.ioa2());
        }
        String offset = computeOffset(protocol, row.getString(ColumnNames.PO_TYPE), word,
                row.getString("Shift"), poRtu);

        String controlId = row.getString(ColumnNames.CONTROL_ID);
        String ctrlTag = AddressCodec.isBlank(controlId) ? ""
                : AddressCodec.deriveControlFunctionTag(controlId.trim(), genericType);
        String typeTag = AddressCodec.typeTag(genericType);

        String address;
        if (TelecontrolProtocol.IEC60870_101.getCode().equals(protocol)) {
            address = AddressCodec.isBlank(card) || ioa == null ? null
                    : AddressCodec.format(rtuId, card, ioa, ctrlTag, typeTag);
        } else {
            address = AddressCodec.isBlank(card) || offset == null ? null
                    : AddressCodec.format(rtuId, card, offset, ctrlTag, typeTag);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        values.put(ColumnNames.GENERIC_TYPE, genericType);
        values.put(ColumnNames.RTU, rtu);
        values.put(ColumnNames.RTU_ID, rtuId);
        values.put(ColumnNames.ETERRA_ALIAS, ImportSupport.alias(row));
        values.put(ColumnNames.IOA1, ioa1);
        values.put(ColumnNames.IOA2, ioa2);
        values.put("Offset", offset);
        values.put(ColumnNames.GENERIC_POINT_ADDRESS, address);
        return row.withAll(values);
    }

    /**
     * IEC非控制记录在 (RTU, 卡号, 字地址) 上重复时，按记录类型排序保留最后一条
     */
    static RowSet dropIecDuplicates(RowSet table) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < table.size(); i++) {
            Row row = table.row(i);
            if (!TelecontrolProtocol.IEC60870_101.getCode().equals(row.getString(ColumnNames.PO_PROTOCOL))
                    || ReconcileConstant.TYPE_TAG_CONTROL.equals(row.getString(ColumnNames.PO_GENERIC_TYPE))) {
                continue;
            }
            String key = row.getString(ColumnNames.PO_RTU) + "|" + row.getString(ColumnNames.PO_CARD)
                    + "|" + row.getString(ColumnNames.PO_WORD);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }

        Set<Integer> dropped = new HashSet<>();
        for (Map.Entry<String, List<Integer>> group : groups.entrySet()) {
            if (group.getValue().size() < 2) {
                continue;
            }
            List<Integer> indices = new ArrayList<>(group.getValue());
            indices.sort(Comparator.comparing(i -> nullToEmpty(table.row(i).getString(ColumnNames.PO_TYPE))));
            List<Integer> losers = indices.subList(0, indices.size() - 1);
            dropped.addAll(losers);
            log.warn("台账IEC地址重复 {}，按记录类型保留最后一条，丢弃 {} 条", group.getKey(), losers.size());
        }
        if (dropped.isEmpty()) {
            return table;
        }
        List<Row> kept = new ArrayList<>();
        for (int i = 0; i < table.size(); i++) {
            if (!dropped.contains(i)) {
                kept.add(table.row(i));
            }
        }
        return RowSet.of(table.columns(), kept);
    }

    private static void warnDuplicateAddresses(RowSet table) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Row row : table.rows()) {
            String address = row.getString(ColumnNames.GENERIC_POINT_ADDRESS);
            if (address != null) {
                counts.merge(address, 1, Integer::sum);
            }
        }
        counts.forEach((address, count) -> {
            if (count > 1) {
                log.warn("台账通用地址重复: '{}' 出现 {} 次", address, count);
            }
        });
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
