package com.wangbin.hostkeeper.core.config.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 连接器配置
 */
@Data
public class ConnectorConfig {

    private Map<String, String> settings = new LinkedHashMap<>();

    public ConnectorConfig mergedWith(ConnectorConfig override) {
        ConnectorConfig merged = new ConnectorConfig();
        if (settings != null) {
            merged.settings.putAll(settings);
        }
        if (override != null && override.settings != null) {
            merged.settings.putAll(override.settings);
        }
        return merged;
    }
}
