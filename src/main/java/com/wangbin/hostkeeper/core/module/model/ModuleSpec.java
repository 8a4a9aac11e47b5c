package com.wangbin.hostkeeper.core.module.model;

/**
 * 模块标识
 *
 * @param id      模块ID
 * @param version 版本
 */
public record ModuleSpec(String id, String version) {

    public static final String LATEST = "latest";

    public static ModuleSpec of(String id, String version) {
        return new ModuleSpec(id, version);
    }

    @Override
    public String toString() {
        return id + "@" + version;
    }
}
