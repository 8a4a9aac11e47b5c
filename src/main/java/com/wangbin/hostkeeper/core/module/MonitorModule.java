package com.wangbin.hostkeeper.core.module;

import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;

/**
 * 监控模块
 */
public non-sealed interface MonitorModule extends Module {

    /**
     * 构建远程命令，不应有副作用
     *
     * @param context 主机上下文
     * @param prior   上一次的数据点，可能为 null
     */
    String buildCommand(ModuleContext context, DataPoint prior);

    /**
     * 解析命令输出
     *
     * @throws Exception 输出格式不符合预期
     */
    DataPoint parseResult(ModuleContext context, CommandResponse response) throws Exception;
}
