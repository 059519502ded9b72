package com.wangbin.reconciler.common.enums;

/**
 * 远动协议枚举
 */
public enum TelecontrolProtocol {

    // 卡号+字地址
    MK2A("MK2A", "MK2A协议"),

    // CASDU+打包的32位信息对象地址
    IEC60870_101("IEC60870-101", "IEC 60870-5-101协议");

    private final String code;
    private final String description;

    TelecontrolProtocol(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    // 根据code获取枚举
    public static TelecontrolProtocol fromCode(String code) {
        for (TelecontrolProtocol protocol : values()) {
            if (protocol.getCode().equals(code)) {
                return protocol;
            }
        }
        return null;
    }
}
