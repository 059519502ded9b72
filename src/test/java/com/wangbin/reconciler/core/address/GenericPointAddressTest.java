package com.wangbin.reconciler.core.address;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class GenericPointAddressTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "[(ANDE3:33018):2000:100- DD]",
            "[(AREC:141):109:4- SD]",
            "[(ARIE3:33053):312:203- A]",
            "[(AREC:141):252:6-1 C]"})
    void parseThenFormatIsIdentity(String text) {
        assertEquals(text, GenericPointAddress.parse(text).format());
    }

    @Test
    void parseExposesFields() {
        GenericPointAddress address = GenericPointAddress.parse("[(AREC:141):252:6-1 C]");

        assertEquals("AREC", address.getRtuName());
        assertEquals("141", address.getRtuAddress());
        assertEquals("252", address.getKey1());
        assertEquals("6", address.getKey2());
        assertEquals("1", address.getCtrlTag());
        assertTrue(address.isControl());
        assertEquals("(AREC:141)", address.getRtuId());
    }

    @Test
    void nonControlHasEmptyControlTag() {
        GenericPointAddress address = GenericPointAddress.parse("[(AREC:141):109:4- SD]");

        assertEquals("", address.getCtrlTag());
        assertFalse(address.isControl());
    }

    @Test
    void malformedAddressIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> GenericPointAddress.parse("(AREC:141):109:4 SD"));
        assertThrows(IllegalArgumentException.class, () -> GenericPointAddress.parse(""));
        assertThrows(IllegalArgumentException.class, () -> GenericPointAddress.parse(null));
    }
}
