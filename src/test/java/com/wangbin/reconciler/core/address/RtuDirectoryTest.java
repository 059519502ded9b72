package com.wangbin.reconciler.core.address;

import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RtuDirectoryTest {

    private RtuDirectory directory() {
        RowSet points = RowSet.of(List.of("RTU", "RTUAddress", "Protocol"), List.of(
                Row.of(Map.of("RTU", "AREC", "RTUAddress", "141", "Protocol", "MK2A")),
                Row.of(Map.of("RTU", "AREC", "RTUAddress", "999", "Protocol", "MK2A")),
                Row.of(Map.of("RTU", "ARIE3", "RTUAddress", "33053", "Protocol", "IEC60870-101"))));
        return RtuDirectory.fromPointTable(points);
    }

    @Test
    void firstOccurrenceWins() {
        RtuDirectory directory = directory();

        assertEquals(2, directory.size());
        assertEquals("141", directory.resolve("AREC").rtuAddress());
    }

    @Test
    void poweronSuffixIsStripped() {
        assertEquals("(AREC:141)", directory().resolve("AREC_RTU").rtuId());
        assertNull(directory().resolve("UNKNOWN_RTU"));
    }

    @Test
    void controlAddressResolvesToGenericAddress() {
        RtuDirectory directory = directory();

        assertEquals("[(AREC:141):252:6-1 C]", directory.resolveControlAddress("AREC_RTU", "252:6:1"));
        assertEquals("[(AREC:141):252:6-1 C]", directory.resolveControlAddress("ANY", "[(AREC:141):252:6-1 C]"));
        assertNull(directory.resolveControlAddress("AREC_RTU", "252:6"));
        assertNull(directory.resolveControlAddress("MISSING_RTU", "252:6:1"));
        assertNull(directory.resolveControlAddress("AREC_RTU", " "));
    }
}
