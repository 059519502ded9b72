package com.wangbin.reconciler.common.enums;

/**
 * 核对任务结果码枚举
 */
public enum ResultCode {

    // 数据完整性错误
    DUPLICATE_ADDRESS(2001, "目标系统台账存在重复的通用点位地址"),
    ROW_COUNT_CHANGED(2002, "合并阶段行数发生意外变化"),
    UNDEFINED_COLUMN(2003, "判定规则引用了未定义的列"),

    // 配置相关错误
    CONFIG_ERROR(3000, "配置错误"),
    SOURCE_NOT_FOUND(3001, "源数据文件不存在"),
    SOURCE_LOAD_ERROR(3002, "源数据加载错误"),
    UNKNOWN_OPERATOR(3003, "未知的判定运算符"),
    PREDICATE_INVALID(3004, "判定规则定义无效"),

    // 运行错误
    CACHE_ERROR(5003, "缓存错误"),
    REPORT_ERROR(5006, "报表输出错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 是否属于数据完整性错误（源数据问题，而非配置问题）
     */
    public boolean isDataError() {
        return code >= 2000 && code < 3000;
    }
}
