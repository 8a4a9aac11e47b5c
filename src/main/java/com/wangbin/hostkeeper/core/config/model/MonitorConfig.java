package com.wangbin.hostkeeper.core.config.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 监控模块配置
 */
@Data
public class MonitorConfig {

    private String version;
    private Boolean enabled;
    private Boolean isCritical;
    private Map<String, String> settings = new LinkedHashMap<>();

    /**
     * 合并上层配置，settings 按键合并，标量仅在上层显式设置时覆盖
     */
    public MonitorConfig mergedWith(MonitorConfig override) {
        MonitorConfig merged = copy();
        if (override == null) {
            return merged;
        }
        if (override.version != null) {
            merged.version = override.version;
        }
        if (override.enabled != null) {
            merged.enabled = override.enabled;
        }
        if (override.isCritical != null) {
            merged.isCritical = override.isCritical;
        }
        if (override.settings != null) {
            merged.settings.putAll(override.settings);
        }
        return merged;
    }

    public MonitorConfig copy() {
        MonitorConfig copy = new MonitorConfig();
        copy.version = version;
        copy.enabled = enabled;
        copy.isCritical = isCritical;
        copy.settings = settings != null ? new LinkedHashMap<>(settings) : new LinkedHashMap<>();
        return copy;
    }

    public boolean isEnabledOrDefault() {
        return enabled == null || enabled;
    }

    public boolean isCriticalOrDefault() {
        return isCritical != null && isCritical;
    }
}
