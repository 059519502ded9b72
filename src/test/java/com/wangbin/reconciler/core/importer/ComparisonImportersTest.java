package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.core.address.RtuDirectory;
import com.wangbin.reconciler.core.table.CsvTableReader;
import com.wangbin.reconciler.core.table.RowSet;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ComparisonImportersTest {

    private static RowSet csv(String text) throws IOException {
        return CsvTableReader.read(new StringReader(text));
    }

    @Test
    void habddeKeepsStatusAddressAndKey() throws IOException {
        RowSet habdde = new HabddeCompareImporter().clean(csv(
                "matched_status,GenericPointAddress,Key,Other\n"
                        + "MATCHED,[(AREC:141):109:4- SD],K1,x\n"));

        assertEquals(List.of("HbddeCompareStatus", "GenericPointAddress", "HabCompKey"), habdde.columns());
        assertEquals("MATCHED", habdde.row(0).get("HbddeCompareStatus"));
    }

    @Test
    void autoTestAddressResolvedThroughRtuDirectory() throws IOException {
        RtuDirectory directory = new RtuDirectory(Map.of("AREC", new RtuDirectory.RtuEndpoint("AREC", "141", "MK2A")));

        RowSet tests = new ControlsAutoTestImporter(directory).clean(csv(
                "RTU,control_address,control_status,control_result\n"
                        + "AREC_RTU,252:6:1,OK,PASS\n"
                        + "GONE_RTU,1:1:1,OK,PASS\n"));

        assertEquals("[(AREC:141):252:6-1 C]", tests.row(0).get("GenericPointAddress"));
        assertEquals("OK", tests.row(0).get("AutoTestStatus"));
        assertNull(tests.row(1).get("GenericPointAddress"));
    }

    @Test
    void alarmValuesAndMatchFlagsAreTyped() throws IOException {
        RowSet alarms = new AlarmCompareImporter().clean(csv(
                "eTerra Alias,Value,AlarmMessageMatch,POStatus,eTerraAlarmMessage\n"
                        + "AREC/CB/L1/ST,2,True,Matched,TRIP\n"
                        + "AREC/CB/L1/ST,x,,Unmatched,CLOSE\n"));

        assertEquals(2L, alarms.row(0).get("CompAlarmValue"));
        assertEquals(Boolean.TRUE, alarms.row(0).get("CompAlarmAlarmMessageMatch"));
        assertEquals("x", alarms.row(1).get("CompAlarmValue"));
        assertNull(alarms.row(1).get("CompAlarmAlarmMessageMatch"));
        assertEquals("TRIP", alarms.row(0).get("CompAlarmeTerraAlarmMessage"));
    }

    @Test
    void flagParsing() {
        assertEquals(Boolean.TRUE, ImportSupport.parseFlag("yes"));
        assertEquals(Boolean.FALSE, ImportSupport.parseFlag("0.0"));
        assertEquals(Boolean.TRUE, ImportSupport.parseFlag(2L));
        assertNull(ImportSupport.parseFlag("maybe"));
        assertNull(ImportSupport.parseFlag(null));
    }

    @Test
    void integerNormalization() {
        assertEquals("12", ImportSupport.normalizeInteger("12.0"));
        assertEquals("12.5", ImportSupport.normalizeInteger("12.5"));
        assertNull(ImportSupport.normalizeInteger(null));
        assertEquals(3L, ImportSupport.toNumber("3"));
        assertEquals(3.5, ImportSupport.toNumber("3.5"));
    }
}
