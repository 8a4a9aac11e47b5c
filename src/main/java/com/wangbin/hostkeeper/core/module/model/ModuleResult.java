package com.wangbin.hostkeeper.core.module.model;

import com.wangbin.hostkeeper.common.enums.Criticality;

/**
 * 模块执行结果：监控数据或命令结果
 */
public sealed interface ModuleResult permits DataPoint, CommandResult {

    Criticality getCriticality();

    long getTimestamp();
}
