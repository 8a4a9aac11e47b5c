package com.wangbin.hostkeeper.core.config.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次加载得到的全部定义
 */
@Data
public class ConfigDefinitions {

    private Map<String, TemplateDefinition> templates = new LinkedHashMap<>();
    private Map<String, GroupDefinition> groups = new LinkedHashMap<>();
    private Map<String, HostDefinition> hosts = new LinkedHashMap<>();
}
