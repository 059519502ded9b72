package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * 导入公共方法：列名规范化后的通用派生字段、标志位归一化、数值转换
 */
@Slf4j
public final class ImportSupport {

    /** 上游忽略标志，缺失时视为false */
    public static final List<String> IGNORE_FLAGS =
            List.of(ColumnNames.IGNORE_RTU, ColumnNames.IGNORE_POINT, ColumnNames.OLD_DATA);

    /** eTerra点表/模拟量表可能附带的补充列 */
    public static final List<String> SUPPLEMENTARY_COLUMNS = List.of(
            ColumnNames.IGNORE_RTU,
            ColumnNames.IGNORE_POINT,
            ColumnNames.OLD_DATA,
            "GridIncomer",
            "eTerra Alias",
            "ICCP_POINTNAME",
            "ICCP->PO",
            "ICCP_ALIAS",
            "PowerOn Alias",
            ColumnNames.POWERON_ALIAS_EXISTS,
            ColumnNames.POWERON_ALIAS_LINKED);

    private static final Set<String> TRUE_VALUES = Set.of("TRUE", "1", "Y", "YES", "1.0");
    private static final Set<String> FALSE_VALUES = Set.of("FALSE", "0", "N", "NO", "0.0");

    private ImportSupport() {
    }

    /**
     * 层级别名：Sub/DeviceType/DeviceId/PointId，任一段缺失时为空标记
     */
    public static String alias(Row row) {
        String sub = row.getString(ColumnNames.SUB);
        String deviceType = row.getString(ColumnNames.DEVICE_TYPE);
        String deviceId = row.getString(ColumnNames.DEVICE_ID);
        String pointId = row.getString(ColumnNames.POINT_ID);
        if (sub == null || deviceType == null || deviceId == null || pointId == null) {
            return null;
        }
        return sub + "/" + deviceType + "/" + deviceId + "/" + pointId;
    }

    /**
     * 伪点判定：点名含 SPURIOUS ALARM、设备ID含 SPURIOUS，或 UNUSED/SPURIOUS 设备
     */
    public static boolean isSpurious(Row row) {
        String pointName = row.getString(ColumnNames.POINT_NAME);
        if (pointName != null && pointName.contains("SPURIOUS ALARM")) {
            return true;
        }
        String deviceId = row.getString(ColumnNames.DEVICE_ID);
        if (deviceId != null && deviceId.contains("SPURIOUS")) {
            return true;
        }
        return "UNUSED".equals(row.getString(ColumnNames.DEVICE_TYPE)) && "SPURIOUS".equals(deviceId);
    }

    public static RowSet dropSpurious(RowSet table, String tableName) {
        RowSet kept = table.filter(row -> !isSpurious(row));
        if (kept.size() != table.size()) {
            log.info("{}: 过滤伪点 {} 行", tableName, table.size() - kept.size());
        }
        return kept;
    }

    /**
     * 忽略标志归一化为布尔值，缺失列补false；PowerOn别名存在标志仅在有值时转换
     */
    public static RowSet normalizeFlags(RowSet table) {
        RowSet result = table;
        for (String flag : IGNORE_FLAGS) {
            result = result.withColumn(flag, row -> {
                Boolean value = parseFlag(row.get(flag));
                return value != null ? value : Boolean.FALSE;
            });
        }
        if (result.hasColumn(ColumnNames.POWERON_ALIAS_EXISTS)) {
            result = result.withColumn(ColumnNames.POWERON_ALIAS_EXISTS,
                    row -> parseFlag(row.get(ColumnNames.POWERON_ALIAS_EXISTS)));
        }
        if (result.hasColumn(ColumnNames.POWERON_ALIAS_LINKED)) {
            result = result.withColumn(ColumnNames.POWERON_ALIAS_LINKED,
                    row -> toLong(row.get(ColumnNames.POWERON_ALIAS_LINKED)));
        }
        return result;
    }

    /**
     * 解析布尔标志，无法识别或为空时返回null
     */
    public static Boolean parseFlag(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        String text = value.toString().trim().toUpperCase();
        if (TRUE_VALUES.contains(text)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(text)) {
            return Boolean.FALSE;
        }
        return null;
    }

    public static Long toLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return new BigDecimal(value.toString().trim()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 数值列转换：整数转Long，其余可解析的转Double，无法解析时保留原文
     */
    public static Object toNumber(Object value) {
        Long asLong = toLong(value);
        if (asLong != null) {
            return asLong;
        }
        Double asDouble = toDouble(value);
        return asDouble != null ? asDouble : value;
    }

    /**
     * 整数形式的文本规范化，如 "12.0" -> "12"；无法解析时原样返回
     */
    public static String normalizeInteger(String value) {
        Long asLong = toLong(value);
        return asLong != null ? asLong.toString() : value;
    }

    public static String strip(String value) {
        return value == null ? null : value.strip();
    }
}
