package com.wangbin.reconciler.core.address;

/**
 * IEC 60870-101 信息对象地址工具类
 * 点位的两个原始地址字段（各16位）打包为一个32位IOA。
 */
public final class IoaUtils {

    private static final int HALF_MAX = 0xFFFF;

    private IoaUtils() {
    }

    /**
     * 组合IOA：ioa1 << 16 | ioa2
     */
    public static long combine(int ioa1, int ioa2) {
        checkHalf(ioa1, "ioa1");
        checkHalf(ioa2, "ioa2");
        return ((long) ioa1 << 16) | ioa2;
    }

    /**
     * 拆分IOA为高低两个16位字段
     */
    public static IoaParts split(long ioa) {
        if (ioa < 0 || ioa > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("IOA超出32位范围: " + ioa);
        }
        return new IoaParts((int) (ioa >> 16), (int) (ioa & HALF_MAX));
    }

    private static void checkHalf(int value, String name) {
        if (value < 0 || value > HALF_MAX) {
            throw new IllegalArgumentException(name + " 必须在 0..65535 之间: " + value);
        }
    }

    /**
     * IOA高低字段
     */
    public record IoaParts(int ioa1, int ioa2) {
    }
}
