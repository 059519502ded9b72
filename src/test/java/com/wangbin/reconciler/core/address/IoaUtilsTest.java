package com.wangbin.reconciler.core.address;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IoaUtilsTest {

    @Test
    void combineAndSplitAreInverse() {
        int[][] samples = {{0, 0}, {0, 203}, {1, 0}, {0xFFFF, 0xFFFF}, {312, 65535}};
        for (int[] sample : samples) {
            IoaUtils.IoaParts parts = IoaUtils.split(IoaUtils.combine(sample[0], sample[1]));
            assertEquals(sample[0], parts.ioa1());
            assertEquals(sample[1], parts.ioa2());
        }
    }

    @Test
    void combineShiftsHighField() {
        assertEquals(65536L, IoaUtils.combine(1, 0));
        assertEquals(4294967295L, IoaUtils.combine(0xFFFF, 0xFFFF));
    }

    @Test
    void outOfRangeFieldsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> IoaUtils.combine(65536, 0));
        assertThrows(IllegalArgumentException.class, () -> IoaUtils.combine(0, -1));
        assertThrows(IllegalArgumentException.class, () -> IoaUtils.split(-1));
    }
}
