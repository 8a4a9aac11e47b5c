package com.wangbin.hostkeeper.common.enums;

import lombok.Getter;

/**
 * 主机状态枚举
 */
@Getter
public enum HostStatus {

    UNINITIALIZED("UNINITIALIZED", "未初始化"),
    INITIALIZING_LIVE("INITIALIZING_LIVE", "实时初始化中"),
    INITIALIZED_FROM_CACHE("INITIALIZED_FROM_CACHE", "已从缓存初始化"),
    INITIALIZED("INITIALIZED", "已初始化"),
    UNREACHABLE("UNREACHABLE", "不可达");

    private final String code;
    private final String description;

    HostStatus(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public static HostStatus fromCode(String code) {
        for (HostStatus status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        return UNINITIALIZED;
    }

    // 判断是否正在初始化
    public boolean isInitializing() {
        return this == INITIALIZING_LIVE || this == INITIALIZED_FROM_CACHE;
    }
}
