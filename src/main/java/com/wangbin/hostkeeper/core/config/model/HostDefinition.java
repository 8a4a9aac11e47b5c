package com.wangbin.hostkeeper.core.config.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 主机定义
 */
@Data
public class HostDefinition {

    private String address = "0.0.0.0";
    private String fqdn = "";
    private List<String> groups = new ArrayList<>();
    private List<HostSetting> settings = new ArrayList<>();
    private Map<String, MonitorConfig> monitors = new LinkedHashMap<>();
    private Map<String, CommandConfig> commands = new LinkedHashMap<>();
    private Map<String, ConnectorConfig> connectors = new LinkedHashMap<>();
}
