package com.wangbin.hostkeeper.core.config.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 主机级开关
 */
public enum HostSetting {
    USE_SUDO("use_sudo");

    private final String key;

    HostSetting(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static HostSetting fromKey(String key) {
        for (HostSetting setting : values()) {
            if (setting.key.equalsIgnoreCase(key) || setting.name().equalsIgnoreCase(key)) {
                return setting;
            }
        }
        throw new IllegalArgumentException("未知主机设置: " + key);
    }
}
