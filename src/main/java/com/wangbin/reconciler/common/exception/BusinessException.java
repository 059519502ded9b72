package com.wangbin.reconciler.common.exception;

import com.wangbin.reconciler.common.enums.ResultCode;
import lombok.Getter;

/**
 * 业务异常
 * data 为诊断附带数据（如出错行），可为空
 */
@Getter
public class BusinessException extends RuntimeException {

    private final int code;
    private final Object data;

    public BusinessException(ResultCode resultCode, String message, Object data) {
        super(message != null ? message : resultCode.getMessage());
        this.code = resultCode.getCode();
        this.data = data;
    }
}
