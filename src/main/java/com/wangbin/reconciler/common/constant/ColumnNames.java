package com.wangbin.reconciler.common.constant;

/**
 * 合并表列名常量
 * 各导入器统一重命名后的规范列名，合并引擎与判定规则都按这些名称访问。
 */
public final class ColumnNames {

    private ColumnNames() {
    }

    // ==================== 点位标识 ====================

    public static final String GENERIC_POINT_ADDRESS = "GenericPointAddress";
    public static final String GENERIC_TYPE = "GenericType";
    public static final String ETERRA_ALIAS = "eTerraAlias";
    public static final String ETERRA_KEY = "eTerraKey";
    public static final String SUB = "Sub";
    public static final String DEVICE_TYPE = "DeviceType";
    public static final String DEVICE_ID = "DeviceId";
    public static final String DEVICE_NAME = "DeviceName";
    public static final String POINT_ID = "PointId";
    public static final String POINT_NAME = "PointName";
    public static final String CONTROL_ID = "ControlId";
    public static final String CTRL_FUNC = "CtrlFunc";
    public static final String CONTROLLABLE = "Controllable";

    // ==================== 地址字段 ====================

    public static final String RTU = "RTU";
    public static final String RTU_ADDRESS = "RTUAddress";
    public static final String RTU_ID = "RTUId";
    public static final String PROTOCOL = "Protocol";
    public static final String CARD = "Card";
    public static final String WORD = "Word";
    public static final String CASDU = "CASDU";
    public static final String IOA = "IOA";
    public static final String IOA1 = "IOA1";
    public static final String IOA2 = "IOA2";
    public static final String SIZE = "Size";

    // ==================== 上游标志 ====================

    public static final String IGNORE_RTU = "IGNORE_RTU";
    public static final String IGNORE_POINT = "IGNORE_POINT";
    public static final String OLD_DATA = "OLD_DATA";
    public static final String POWERON_ALIAS_EXISTS = "PowerOn Alias Exists";
    public static final String POWERON_ALIAS_LINKED = "PowerOn Alias Linked to SCADA";

    // ==================== 比对报告 / 台账 ====================

    public static final String HABDDE_COMPARE_STATUS = "HbddeCompareStatus";
    public static final String HAB_COMP_KEY = "HabCompKey";
    public static final String PO_ALIAS = "POAlias";
    public static final String PO_RTU = "PO_RTU";
    public static final String PO_TYPE = "POType";
    public static final String PO_GENERIC_TYPE = "PO_GenericType";
    public static final String PO_PROTOCOL = "PO_Protocol";
    public static final String PO_CARD = "PO_Card";
    public static final String PO_WORD = "PO_Word";
    public static final String CONFIG_HEALTH = "ConfigHealth";
    public static final String TC_ACTION = "TC Action";
    public static final String SYMBOL = "Symbol";

    // ==================== 告警比对 ====================

    public static final String COMP_ALARM_ETERRA_ALIAS = "CompAlarmEterraAlias";
    public static final String COMP_ALARM_PO_STATUS = "CompAlarmPOStatus";
    public static final String COMP_ALARM_VALUE = "CompAlarmValue";
    public static final String COMP_ALARM_ETERRA_MESSAGE = "CompAlarmeTerraAlarmMessage";
    public static final String COMP_ALARM_PO_MESSAGE = "CompAlarmPOAlarmMessage";
    public static final String COMP_ALARM_MESSAGE_MATCH = "CompAlarmAlarmMessageMatch";

    public static final String NUM_ALARMS = "NumAlarms";
    public static final String NUM_ALARMS_MATCHED = "NumAlarmsMatched";
    public static final String PERCENT_ALARMS_MATCHED = "PercentAlarmsMatched";

    // ==================== 控制 / 调试 ====================

    public static final String AUTO_TEST_STATUS = "AutoTestStatus";
    public static final String COMMISSIONING_CONTROL_ADDRESS = "CommissioningControlAddress";
    public static final String COMMISSIONING_TEST_NAME = "CommissioningTestName";
    public static final String COMMISSIONING_RESULT = "CommissioningResult";
    public static final String COMMISSIONING_TEST_DATE = "CommissioningTestdate";
    public static final String COMMISSIONING_RTU_NAME = "CommissioningRTUname";

    public static final String NUM_CONTROLS = "NumControls";
    public static final String NUM_CONTROLS_COMMISSION_OK = "NumControlsCommissionOk";
    public static final String NUM_CONTROLS_ALL_COMMISSION_OK = "NumControlsAllCommissionOk";
    public static final String PERCENT_CONTROLS_COMMISSION_OK = "PercentControlsCommissionOk";
    public static final String PERCENT_CONTROLS_ALL_COMMISSION_OK = "PercentControlsAllCommissionOk";

    // ==================== 行级标志 ====================

    public static final String TYPE = "Type";
    public static final String IGNORE = "Ignore";
    public static final String RTU_COMMS = "RTUComms";

    // ==================== 人工复核 ====================

    public static final String REVIEW_STATUS = "Review Status";
    public static final String COMMENTS = "Comments";

    /**
     * 控制列名，如 ctrl(1, "Addr") -> Ctrl1Addr
     */
    public static String ctrl(int index, String suffix) {
        return "Ctrl" + index + suffix;
    }

    /**
     * 告警列名，如 alarm(0, "eTerraMessage") -> Alarm0_eTerraMessage
     */
    public static String alarm(int slot, String suffix) {
        return "Alarm" + slot + "_" + suffix;
    }
}
