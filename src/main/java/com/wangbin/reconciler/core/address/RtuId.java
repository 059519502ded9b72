package com.wangbin.reconciler.core.address;

/**
 * RTU标识：(RTU名:RTU地址)
 */
public final class RtuId {

    private RtuId() {
    }

    public static String format(String rtuName, Object rtuAddress) {
        return "(" + nullToEmpty(rtuName) + ":" + (rtuAddress == null ? "" : rtuAddress.toString()) + ")";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
