package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.core.table.CsvTableReader;
import com.wangbin.reconciler.core.table.RowSet;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PowerOnInventoryImporterTest {

    private static final String HEADER =
            "RTU,RTU Address,Protocol,addr1,addr2,shift,recordType,comp_alias,control_val,config_health\n";

    private final PowerOnInventoryImporter importer = new PowerOnInventoryImporter(Set.of("CUMW_RTU"));

    private RowSet clean(String rows) throws IOException {
        return importer.clean(CsvTableReader.read(new StringReader(HEADER + rows)));
    }

    @Test
    void mk2aDigitalInputOffsetIsBitAddressPlusOne() throws IOException {
        RowSet inventory = clean("ANDE3_RTU,33018,MK2A,2000,12,3,DI,ANDE-CB-L1,,GOOD\n");

        assertEquals("[(ANDE3:33018):2000:100- SD]", inventory.row(0).get("GenericPointAddress"));
        assertEquals("SD", inventory.row(0).get("PO_GenericType"));
        assertEquals("100", inventory.row(0).get("PO_Offset"));
    }

    @Test
    void mk2aDoubleAndControlRecords() throws IOException {
        RowSet inventory = clean(
                "ANDE3_RTU,33018,MK2A,2000,25,0,DD,ANDE-CB-L1,,GOOD\n"
                        + "AREC_RTU,141,MK2A,252,5,0,DO,AREC-CB-L1,1,GOOD\n");

        assertEquals("[(ANDE3:33018):2000:101- DD]", inventory.row(0).get("GenericPointAddress"));
        assertEquals("[(AREC:141):252:6-1 C]", inventory.row(1).get("GenericPointAddress"));
    }

    @Test
    void iecUsesCardAndIoa() throws IOException {
        RowSet inventory = clean("ARIE3_RTU,33053,IEC60870-101,312,203,0,A1,ARIE-TX-MW,,GOOD\n");

        assertEquals("[(ARIE3:33053):312:203- A]", inventory.row(0).get("GenericPointAddress"));
        assertEquals("0", inventory.row(0).get("PO_IOA1"));
        assertEquals("203", inventory.row(0).get("PO_IOA2"));
    }

    @Test
    void excludedRtuIsDropped() throws IOException {
        RowSet inventory = clean(
                "CUMW_RTU,1,MK2A,1,1,0,DI,X,,GOOD\n"
                        + "ANDE3_RTU,33018,MK2A,2000,12,3,DI,Y,,GOOD\n");

        assertEquals(1, inventory.size());
        assertEquals("Y", inventory.row(0).get("POAlias"));
    }

    @Test
    void iecDuplicateKeepsLastRecordTypeInOrder() throws IOException {
        RowSet inventory = clean(
                "ARIE3_RTU,33053,IEC60870-101,312,203,0,DI,FIRST,,GOOD\n"
                        + "ARIE3_RTU,33053,IEC60870-101,312,203,0,A1,SECOND,,GOOD\n");

        assertEquals(1, inventory.size());
        assertEquals("FIRST", inventory.row(0).get("POAlias"));
    }

    @Test
    void genericTypeMapping() {
        assertEquals("A", PowerOnInventoryImporter.genericTypeOf("A2"));
        assertEquals("C", PowerOnInventoryImporter.genericTypeOf("DO"));
        assertEquals("SETPOINT", PowerOnInventoryImporter.genericTypeOf("AO"));
        assertEquals("Unknown", PowerOnInventoryImporter.genericTypeOf("XX"));
        assertEquals("Unknown", PowerOnInventoryImporter.genericTypeOf(null));
    }
}
