package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.address.RtuDirectory;
import com.wangbin.reconciler.core.table.RowSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqliteImportersTest {

    @TempDir
    Path tempDir;

    @Test
    void commissioningResultsResolveControlAddress() {
        Path db = tempDir.resolve("controls.db");
        JdbcTemplate jdbcTemplate = SqliteSupport.jdbcTemplate(db);
        jdbcTemplate.execute("CREATE TABLE test_results (testdate INTEGER, control_address TEXT, "
                + "test_name TEXT, result TEXT, RTUname TEXT)");
        jdbcTemplate.update("INSERT INTO test_results VALUES (?, ?, ?, ?, ?)",
                20240101, "252:6:1", "Action Verified", "OK", "AREC_RTU");

        RtuDirectory directory = new RtuDirectory(Map.of("AREC", new RtuDirectory.RtuEndpoint("AREC", "141", "MK2A")));
        RowSet results = new ManualCommissioningImporter(directory).load(db);

        assertEquals(1, results.size());
        assertEquals("[(AREC:141):252:6-1 C]", results.row(0).get("GenericPointAddress"));
        assertEquals(20240101L, results.row(0).get("CommissioningTestdate"));
        assertEquals("Action Verified", results.row(0).get("CommissioningTestName"));
    }

    @Test
    void missingTableIsLoadError() {
        Path db = tempDir.resolve("empty.db");
        SqliteSupport.jdbcTemplate(db).execute("CREATE TABLE other (id INTEGER)");

        RtuDirectory directory = new RtuDirectory(Map.of());
        assertThrows(ReconcileException.class, () -> new ManualCommissioningImporter(directory).load(db));
    }

    @Test
    void componentLookupFindsExistingAlias() {
        Path db = tempDir.resolve("poweron.db");
        JdbcTemplate jdbcTemplate = SqliteSupport.jdbcTemplate(db);
        jdbcTemplate.execute("CREATE TABLE component_header (component_id TEXT, component_alias TEXT)");
        jdbcTemplate.update("INSERT INTO component_header VALUES (?, ?)", "C-1", "AREC-CB-L1");

        PowerOnComponentLookup lookup = PowerOnComponentLookup.open(db);

        assertTrue(lookup.aliasExists("AREC-CB-L1"));
        assertTrue(lookup.aliasExists("AREC-CB-L1"));
        assertFalse(lookup.aliasExists("MISSING"));
        assertFalse(lookup.aliasExists(" "));
        assertTrue(lookup.getStatsSummary().contains("hitCount=1"));
        assertTrue(lookup.getStatsSummary().contains("missCount=2"));
    }
}
