package com.wangbin.hostkeeper.core.module;

/**
 * 模块能力
 */
public enum ModuleCapability {
    BUILDS_COMMAND,
    PARSES_RESULT,
    REQUIRES_CONFIRMATION,
    REQUIRES_INPUT
}
