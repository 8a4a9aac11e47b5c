package com.wangbin.hostkeeper.common.enums;

import lombok.Getter;

/**
 * 连接状态枚举
 */
@Getter
public enum ConnectionStatus {

    DISCONNECTED("DISCONNECTED", "已断开", 0),
    CONNECTING("CONNECTING", "连接中", 1),
    CONNECTED("CONNECTED", "已连接", 2),
    ERROR("ERROR", "错误", 3);

    private final String code;
    private final String description;
    private final int level;

    ConnectionStatus(String code, String description, int level) {
        this.code = code;
        this.description = description;
        this.level = level;
    }

    public static ConnectionStatus fromCode(String code) {
        for (ConnectionStatus status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        return DISCONNECTED;
    }

    public boolean isConnected() {
        return this == CONNECTED;
    }
}
