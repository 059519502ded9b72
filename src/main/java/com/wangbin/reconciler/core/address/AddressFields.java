package com.wangbin.reconciler.core.address;

import lombok.Builder;
import lombok.Getter;

/**
 * 推导通用点位地址所需的协议字段
 */
@Getter
@Builder
public class AddressFields {

    /** RTU名称 */
    private final String rtu;

    /** RTU地址 */
    private final String rtuAddress;

    /** 协议（MK2A / IEC60870-101） */
    private final String protocol;

    /** MK2A卡号，或IEC的IOA高16位 */
    private final String card;

    /** MK2A字地址，或IEC的IOA低16位 */
    private final String word;

    /** IEC公共地址 */
    private final String casdu;

    /** 通用类型（SD/DD/A/CTRL/SETPOINT/DUMMY） */
    private final String genericType;

    /** 原始控制功能标识，非控制记录为空 */
    private final String ctrlFunc;

    public String getRtuId() {
        return RtuId.format(rtu, rtuAddress);
    }
}
