package com.wangbin.hostkeeper.common.exception;

import lombok.Getter;

/**
 * 主机编排引擎异常
 */
@Getter
public class KeeperException extends BusinessException {

    private final ErrorKind kind;
    private final String hostId;
    private final String moduleId;

    public KeeperException(ErrorKind kind, String message, String hostId, String moduleId) {
        super(kind.getResultCode().getCode(), message);
        this.kind = kind;
        this.hostId = hostId;
        this.moduleId = moduleId;
    }

    public KeeperException(ErrorKind kind, String message, String hostId, String moduleId, Throwable cause) {
        this(kind, message, hostId, moduleId);
        initCause(cause);
    }

    // 创建配置异常
    public static KeeperException configException(String message) {
        return new KeeperException(ErrorKind.CONFIG, message, null, null);
    }

    public static KeeperException configException(String message, String hostId, Throwable cause) {
        return new KeeperException(ErrorKind.CONFIG, message, hostId, null, cause);
    }

    // 创建连接异常
    public static KeeperException connectionException(String message, String hostId) {
        return new KeeperException(ErrorKind.CONNECTION, message, hostId, null);
    }

    public static KeeperException connectionException(String message, String hostId, Throwable cause) {
        return new KeeperException(ErrorKind.CONNECTION, message, hostId, null, cause);
    }

    // 创建超时异常，命令可能已在远端执行
    public static KeeperException timeoutException(String hostId, long timeoutMillis) {
        return new KeeperException(ErrorKind.TIMEOUT,
                String.format("命令执行超时(%dms)", timeoutMillis), hostId, null);
    }

    // 创建执行异常
    public static KeeperException executionException(String message, String hostId) {
        return new KeeperException(ErrorKind.EXECUTION, message, hostId, null);
    }

    // 创建解析异常
    public static KeeperException parseException(String message, String hostId, String moduleId) {
        return new KeeperException(ErrorKind.PARSE, message, hostId, moduleId);
    }

    public static KeeperException parseException(String message, String hostId, String moduleId, Throwable cause) {
        return new KeeperException(ErrorKind.PARSE, message, hostId, moduleId, cause);
    }

    // 创建参数校验异常
    public static KeeperException validationException(String message, String hostId, String moduleId) {
        return new KeeperException(ErrorKind.VALIDATION, message, hostId, moduleId);
    }

    public static KeeperException unsupportedPlatform(String hostId, String moduleId) {
        return new KeeperException(ErrorKind.UNSUPPORTED_PLATFORM, "不支持的平台", hostId, moduleId);
    }

    public static KeeperException notFound(String message, String hostId, String moduleId) {
        return new KeeperException(ErrorKind.NOT_FOUND, message, hostId, moduleId);
    }

    public boolean is(ErrorKind errorKind) {
        return this.kind == errorKind;
    }
}
