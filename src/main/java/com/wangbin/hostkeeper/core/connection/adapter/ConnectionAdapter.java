package com.wangbin.hostkeeper.core.connection.adapter;

import com.wangbin.hostkeeper.common.enums.ConnectionStatus;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.connection.model.ConnectionConfig;
import com.wangbin.hostkeeper.core.connection.model.ConnectionMetrics;

/**
 * 连接适配器接口，一个实例对应一个远程会话
 */
public interface ConnectionAdapter {

    /**
     * 建立连接
     */
    void connect() throws Exception;

    /**
     * 断开连接
     */
    void disconnect() throws Exception;

    /**
     * 执行远程命令
     *
     * 非零退出码正常返回，由调用方决定如何处理；传输失败或超时抛出异常
     *
     * @param command       命令文本
     * @param timeoutMillis 超时时间（毫秒）
     * @return 命令响应
     */
    CommandResponse execute(String command, long timeoutMillis) throws Exception;

    ConnectionStatus getStatus();

    ConnectionConfig getConfig();

    ConnectionMetrics getMetrics();

    boolean isConnected();

    String getConnectionId();

    String getHostId();

    long getLastActivityTime();

    /**
     * 执行连接健康检查
     * @return 连接是否健康
     */
    boolean healthCheck();
}
