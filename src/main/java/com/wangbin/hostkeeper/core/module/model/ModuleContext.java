package com.wangbin.hostkeeper.core.module.model;

import java.util.Map;

/**
 * 构建命令和解析结果时可见的主机信息
 *
 * @param hostId   主机ID
 * @param platform 平台信息
 * @param useSudo  是否使用 sudo
 * @param settings 模块的有效设置
 */
public record ModuleContext(String hostId, PlatformInfo platform, boolean useSudo, Map<String, String> settings) {

    public ModuleContext {
        platform = platform != null ? platform : PlatformInfo.UNKNOWN;
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }

    public String setting(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
