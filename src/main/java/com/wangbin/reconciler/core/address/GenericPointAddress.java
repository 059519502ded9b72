package com.wangbin.reconciler.core.address;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 通用点位地址
 * 跨协议的规范连接键，格式：
 * <pre>
 * [(RTU名:RTU地址):键1:键2-控制标记 类型标记]
 * </pre>
 * MK2A 的键为卡号/字地址，IEC60870-101 的键为 CASDU/IOA。
 * 非控制点的控制标记为空串。
 */
@Getter
@EqualsAndHashCode
public final class GenericPointAddress {

    private static final Pattern PATTERN =
            Pattern.compile("^\\[\\(([^():]*):([^()]*)\\):([^:]*):(.*)-([012]?) ([A-Z]+)]$");

    private final String rtuName;
    private final String rtuAddress;
    private final String key1;
    private final String key2;
    private final String ctrlTag;
    private final String typeTag;

    public GenericPointAddress(String rtuName, String rtuAddress, String key1, String key2,
                               String ctrlTag, String typeTag) {
        this.rtuName = rtuName;
        this.rtuAddress = rtuAddress;
        this.key1 = key1;
        this.key2 = key2;
        this.ctrlTag = ctrlTag == null ? "" : ctrlTag;
        this.typeTag = typeTag;
    }

    public String getRtuId() {
        return RtuId.format(rtuName, rtuAddress);
    }

    public boolean isControl() {
        return "C".equals(typeTag);
    }

    public String format() {
        return "[" + getRtuId() + ":" + key1 + ":" + key2 + "-" + ctrlTag + " " + typeTag + "]";
    }

    /**
     * 解析地址字符串，格式不符时抛出 IllegalArgumentException
     */
    public static GenericPointAddress parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("通用点位地址不能为空");
        }
        Matcher matcher = PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("通用点位地址格式错误: " + text);
        }
        return new GenericPointAddress(matcher.group(1), matcher.group(2), matcher.group(3),
                matcher.group(4), matcher.group(5), matcher.group(6));
    }

    @Override
    public String toString() {
        return format();
    }
}
