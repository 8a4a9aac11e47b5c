package com.wangbin.hostkeeper.core.config.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 配置模板，可被分组引用的模块配置集合
 */
@Data
public class TemplateDefinition {

    private Map<String, MonitorConfig> monitors = new LinkedHashMap<>();
    private Map<String, CommandConfig> commands = new LinkedHashMap<>();
    private Map<String, ConnectorConfig> connectors = new LinkedHashMap<>();
    private List<HostSetting> hostSettings = new ArrayList<>();
}
