package com.wangbin.hostkeeper.core.module;

import java.util.Map;

/**
 * 模块创建器，参数为模块的有效设置
 */
@FunctionalInterface
public interface ModuleCreator {

    Module create(Map<String, String> settings);
}
