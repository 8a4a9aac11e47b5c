package com.wangbin.hostkeeper.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),
    DATA_NOT_FOUND(1001, "数据不存在"),
    VALIDATION_FAILED(1005, "验证失败"),

    // 主机调用相关错误
    CONNECTION_ERROR(2001, "连接错误"),
    EXECUTION_ERROR(2002, "命令执行错误"),
    PARSE_ERROR(2003, "结果解析错误"),
    UNSUPPORTED_PLATFORM(2004, "不支持的平台"),

    // 配置相关错误
    CONFIG_INVALID(3002, "配置无效"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),
    TIMEOUT_ERROR(5005, "超时错误");

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
}
