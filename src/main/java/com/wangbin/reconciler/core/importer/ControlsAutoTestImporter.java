package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.core.address.RtuDirectory;
import com.wangbin.reconciler.core.table.CsvTableReader;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 自动控制测试报告导入器
 * 控制地址 "卡号:字地址:控制标识" 结合RTU目录还原为控制点通用地址。
 */
@Slf4j
public class ControlsAutoTestImporter {

    private static final Map<String, String> RENAMES = Map.of(
            "control_address", "AutoTestAddress",
            "control_status", ColumnNames.AUTO_TEST_STATUS,
            "control_result", "AutoTestResult",
            "component_alias", "AutoTestAlias",
            "control_attribute", "AutoTestAttribute",
            "telecontrol_action", "AutoTestAction");

    private static final List<String> COLUMNS = List.of(
            "AutoTestAddress", ColumnNames.AUTO_TEST_STATUS, "AutoTestResult", "AutoTestAlias",
            "AutoTestAttribute", "AutoTestAction", ColumnNames.GENERIC_POINT_ADDRESS);

    private final RtuDirectory rtuDirectory;

    public ControlsAutoTestImporter(RtuDirectory rtuDirectory) {
        this.rtuDirectory = rtuDirectory;
    }

    public RowSet load(Path file) {
        return clean(CsvTableReader.read(file));
    }

    public RowSet clean(RowSet raw) {
        RowSet table = raw.renameColumns(RENAMES);
        table = table.withColumn(ColumnNames.GENERIC_POINT_ADDRESS, row -> rtuDirectory.resolveControlAddress(
                row.getString(ColumnNames.RTU), row.getString("AutoTestAddress")));
        RowSet result = table.select(COLUMNS);
        long unresolved = result.column(ColumnNames.GENERIC_POINT_ADDRESS).stream().filter(v -> v == null).count();
        log.info("自动控制测试导入完成: {} 行, 未能解析地址 {} 行", result.size(), unresolved);
        return result;
    }
}
