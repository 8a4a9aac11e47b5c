package com.wangbin.hostkeeper.common.exception;

import com.wangbin.hostkeeper.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 引擎错误类型
 */
@Getter
public enum ErrorKind {

    CONFIG("CONFIG", "配置错误", ResultCode.CONFIG_INVALID),
    CONNECTION("CONNECTION", "连接错误", ResultCode.CONNECTION_ERROR),
    EXECUTION("EXECUTION", "执行错误", ResultCode.EXECUTION_ERROR),
    TIMEOUT("TIMEOUT", "执行超时", ResultCode.TIMEOUT_ERROR),
    PARSE("PARSE", "解析错误", ResultCode.PARSE_ERROR),
    VALIDATION("VALIDATION", "参数校验失败", ResultCode.VALIDATION_FAILED),
    UNSUPPORTED_PLATFORM("UNSUPPORTED_PLATFORM", "不支持的平台", ResultCode.UNSUPPORTED_PLATFORM),
    NOT_FOUND("NOT_FOUND", "资源不存在", ResultCode.DATA_NOT_FOUND);

    private final String code;
    private final String description;
    private final ResultCode resultCode;

    ErrorKind(String code, String description, ResultCode resultCode) {
        this.code = code;
        this.description = description;
        this.resultCode = resultCode;
    }
}
