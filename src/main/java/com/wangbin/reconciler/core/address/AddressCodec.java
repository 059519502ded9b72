package com.wangbin.reconciler.core.address;

import com.wangbin.reconciler.common.constant.ReconcileConstant;
import com.wangbin.reconciler.common.enums.TelecontrolProtocol;
import lombok.extern.slf4j.Slf4j;

/**
 * 通用点位地址编解码器
 * 把不同协议、不同导出格式的点位/控制字段推导为同一个规范地址字符串，作为跨系统连接键。
 */
@Slf4j
public final class AddressCodec {

    private AddressCodec() {
    }

    /**
     * 控制功能标记规范化：设定值控制为 "2"；原始标识为 "1" 时为 "1"；其余一律为 "0"
     */
    public static String deriveControlFunctionTag(String rawControlId, String genericType) {
        if (ReconcileConstant.TYPE_SETPOINT.equals(genericType)) {
            return "2";
        }
        return "1".equals(rawControlId) ? "1" : "0";
    }

    /**
     * 类型标记：控制和设定值记录为 "C"，否则为通用类型本身
     */
    public static String typeTag(String genericType) {
        if (ReconcileConstant.TYPE_CTRL.equals(genericType)
                || ReconcileConstant.TYPE_SETPOINT.equals(genericType)
                || ReconcileConstant.TYPE_TAG_CONTROL.equals(genericType)) {
            return ReconcileConstant.TYPE_TAG_CONTROL;
        }
        return genericType;
    }

    public static boolean isControlType(String genericType) {
        return ReconcileConstant.TYPE_TAG_CONTROL.equals(typeTag(genericType));
    }

    /**
     * 按协议拼接地址字符串
     */
    public static String format(String rtuId, Object key1, Object key2, String ctrlTag, String typeTag) {
        return "[" + rtuId + ":" + key1 + ":" + key2 + "-" + (ctrlTag == null ? "" : ctrlTag) + " " + typeTag + "]";
    }

    /**
     * 由eTerra导出字段推导地址
     * MK2A 直接使用卡号/字地址原文；IEC 需把卡号/字地址解析为整数并打包为IOA，
     * 解析失败时记录RTU/卡号/字地址并返回空地址，该行保留但不会参与连接。
     */
    public static DerivedAddress derive(AddressFields fields) {
        String genericType = fields.getGenericType();
        if (ReconcileConstant.TYPE_DUMMY.equals(genericType)) {
            return new DerivedAddress(fields.getCasdu(), null, null, null, null);
        }

        String typeTag = typeTag(genericType);
        String ctrlTag = "";
        if (ReconcileConstant.TYPE_TAG_CONTROL.equals(typeTag) && !isBlank(fields.getCtrlFunc())) {
            ctrlTag = deriveControlFunctionTag(fields.getCtrlFunc().trim(), genericType);
        }

        TelecontrolProtocol protocol = TelecontrolProtocol.fromCode(fields.getProtocol());
        if (protocol == TelecontrolProtocol.MK2A) {
            if (isBlank(fields.getCard()) || isBlank(fields.getWord())) {
                log.warn("MK2A地址字段缺失: r{}:c{}:w{} ({})",
                        fields.getRtu(), fields.getCard(), fields.getWord(), genericType);
                return new DerivedAddress(null, null, null, null, null);
            }
            String address = format(fields.getRtuId(), fields.getCard(), fields.getWord(), ctrlTag, typeTag);
            return new DerivedAddress(null, null, null, null, address);
        }

        Integer ioa1 = parseInteger(fields.getCard());
        Integer ioa2 = parseInteger(fields.getWord());
        if (ioa1 == null || ioa2 == null || ioa1 < 0 || ioa1 > 0xFFFF || ioa2 < 0 || ioa2 > 0xFFFF) {
            log.warn("地址字段不是有效整数: r{}:c{}:w{} ({})",
                    fields.getRtu(), fields.getCard(), fields.getWord(), genericType);
            return new DerivedAddress(fields.getCasdu(), null, null, null, null);
        }
        long ioa = IoaUtils.combine(ioa1, ioa2);
        String address = format(fields.getRtuId(), fields.getCasdu(), ioa, ctrlTag, typeTag);
        return new DerivedAddress(fields.getCasdu(), String.valueOf(ioa),
                String.valueOf(ioa1), String.valueOf(ioa2), address);
    }

    /**
     * 整数解析，失败返回null
     */
    public static Integer parseInteger(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * 地址推导结果，IEC协议下同时给出 CASDU 与 IOA 各字段
     */
    public record DerivedAddress(String casdu, String ioa, String ioa1, String ioa2, String genericPointAddress) {
    }
}
