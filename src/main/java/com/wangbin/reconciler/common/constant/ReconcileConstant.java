package com.wangbin.reconciler.common.constant;

/**
 * 核对常量
 */
public final class ReconcileConstant {

    private ReconcileConstant() {
    }

    // 协议
    public static final String PROTOCOL_MK2A = "MK2A";
    public static final String PROTOCOL_IEC101 = "IEC60870-101";

    // 通用类型
    public static final String TYPE_SD = "SD";
    public static final String TYPE_DD = "DD";
    public static final String TYPE_ANALOG = "A";
    public static final String TYPE_SETPOINT = "SETPOINT";
    public static final String TYPE_DUMMY = "DUMMY";
    public static final String TYPE_CTRL = "CTRL";
    public static final String TYPE_TAG_CONTROL = "C";

    // 占位RTU标识
    public static final String DEFAULT_SENTINEL_RTU_ID = "(€€€€€€€€:)";

    // 每点最多控制数与告警槽位数
    public static final int MAX_CONTROLS = 2;
    public static final int ALARM_SLOTS = 4;

    public static final String SETPOINT_CONTROL_NAME = "SETPOINT";
    public static final String CONFIG_HEALTH_GOOD = "GOOD";
    public static final String ALARM_STATUS_MATCHED = "Matched";
    public static final String DEVICE_TYPE_RTU = "RTU";
    public static final String PO_RTU_SUFFIX = "_RTU";
    public static final String CONTROLLABLE_YES = "1";
}
