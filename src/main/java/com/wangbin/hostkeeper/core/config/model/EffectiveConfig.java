package com.wangbin.hostkeeper.core.config.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 主机的有效配置（模板、分组、主机三层合并结果），不可变
 */
@Getter
@ToString
@EqualsAndHashCode
public final class EffectiveConfig {

    private final String hostId;
    private final String address;
    private final String fqdn;
    private final List<String> groups;
    private final Set<HostSetting> hostSettings;
    private final Map<String, MonitorConfig> monitors;
    private final Map<String, CommandConfig> commands;
    private final Map<String, ConnectorConfig> connectors;

    public EffectiveConfig(String hostId,
                           String address,
                           String fqdn,
                           List<String> groups,
                           Set<HostSetting> hostSettings,
                           Map<String, MonitorConfig> monitors,
                           Map<String, CommandConfig> commands,
                           Map<String, ConnectorConfig> connectors) {
        this.hostId = hostId;
        this.address = address;
        this.fqdn = fqdn;
        this.groups = List.copyOf(groups);
        this.hostSettings = Set.copyOf(hostSettings);
        this.monitors = Collections.unmodifiableMap(new LinkedHashMap<>(monitors));
        this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
        this.connectors = Collections.unmodifiableMap(new LinkedHashMap<>(connectors));
    }

    public boolean useSudo() {
        return hostSettings.contains(HostSetting.USE_SUDO);
    }

    /**
     * 读取监控模块设置，未定义时返回默认值
     */
    public String monitorSetting(String monitorId, String key, String defaultValue) {
        MonitorConfig config = monitors.get(monitorId);
        if (config == null || config.getSettings() == null) {
            return defaultValue;
        }
        return config.getSettings().getOrDefault(key, defaultValue);
    }

    public Map<String, String> connectorSettings(String connectorType) {
        ConnectorConfig config = connectors.get(connectorType);
        if (config == null || config.getSettings() == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(config.getSettings());
    }

    public boolean isMonitorCritical(String monitorId) {
        MonitorConfig config = monitors.get(monitorId);
        return config != null && config.isCriticalOrDefault();
    }
}
