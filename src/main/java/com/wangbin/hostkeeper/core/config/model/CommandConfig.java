package com.wangbin.hostkeeper.core.config.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 命令模块配置
 */
@Data
public class CommandConfig {

    private String version;
    private Boolean enabled;
    /**
     * 覆盖模块内置的输入校验正则
     */
    private String inputPattern;
    private Map<String, String> settings = new LinkedHashMap<>();

    public CommandConfig mergedWith(CommandConfig override) {
        CommandConfig merged = copy();
        if (override == null) {
            return merged;
        }
        if (override.version != null) {
            merged.version = override.version;
        }
        if (override.enabled != null) {
            merged.enabled = override.enabled;
        }
        if (override.inputPattern != null) {
            merged.inputPattern = override.inputPattern;
        }
        if (override.settings != null) {
            merged.settings.putAll(override.settings);
        }
        return merged;
    }

    public CommandConfig copy() {
        CommandConfig copy = new CommandConfig();
        copy.version = version;
        copy.enabled = enabled;
        copy.inputPattern = inputPattern;
        copy.settings = settings != null ? new LinkedHashMap<>(settings) : new LinkedHashMap<>();
        return copy;
    }

    public boolean isEnabledOrDefault() {
        return enabled == null || enabled;
    }
}
