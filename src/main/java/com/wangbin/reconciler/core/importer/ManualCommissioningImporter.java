package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.address.RtuDirectory;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.util.Map;

/**
 * 人工调试记录导入器（SQLite test_results 表）
 */
@Slf4j
public class ManualCommissioningImporter {

    private static final String SQL_SELECT_RESULTS = "SELECT * FROM test_results";

    private static final Map<String, String> RENAMES = Map.ofEntries(
            Map.entry("testset", "CommissioningTestset"),
            Map.entry("testdate", ColumnNames.COMMISSIONING_TEST_DATE),
            Map.entry("user", "CommissioningUser"),
            Map.entry("control_address", ColumnNames.COMMISSIONING_CONTROL_ADDRESS),
            Map.entry("test_name", ColumnNames.COMMISSIONING_TEST_NAME),
            Map.entry("result", ColumnNames.COMMISSIONING_RESULT),
            Map.entry("comments", "CommissioningComments"),
            Map.entry("RTUname", ColumnNames.COMMISSIONING_RTU_NAME),
            Map.entry("voltage_group", "CommissioningVoltageGroup"),
            Map.entry("test_area", "CommissioningTestArea"),
            Map.entry("alias", "CommissioningAlias"));

    private final RtuDirectory rtuDirectory;

    public ManualCommissioningImporter(RtuDirectory rtuDirectory) {
        this.rtuDirectory = rtuDirectory;
    }

    public RowSet load(Path databaseFile) {
        try {
            JdbcTemplate jdbcTemplate = SqliteSupport.jdbcTemplate(databaseFile);
            return clean(SqliteSupport.query(jdbcTemplate, SQL_SELECT_RESULTS));
        } catch (DataAccessException e) {
            throw ReconcileException.sourceLoadError(databaseFile.toString(), e);
        }
    }

    public RowSet clean(RowSet raw) {
        RowSet table = raw.renameColumns(RENAMES);
        table = table.withColumn(ColumnNames.GENERIC_POINT_ADDRESS, row -> rtuDirectory.resolveControlAddress(
                row.getString(ColumnNames.COMMISSIONING_RTU_NAME),
                row.getString(ColumnNames.COMMISSIONING_CONTROL_ADDRESS)));
        log.info("人工调试记录导入完成: {} 行", table.size());
        return table;
    }
}
