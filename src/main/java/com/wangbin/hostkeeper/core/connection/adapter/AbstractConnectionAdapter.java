package com.wangbin.hostkeeper.core.connection.adapter;

import com.wangbin.hostkeeper.common.enums.ConnectionStatus;
import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.connection.model.ConnectionConfig;
import com.wangbin.hostkeeper.core.connection.model.ConnectionMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * 抽象连接适配器，处理状态流转与指标统计
 */
@Slf4j
public abstract class AbstractConnectionAdapter implements ConnectionAdapter {

    protected final ConnectionConfig config;
    protected volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    protected final ConnectionMetrics metrics;
    protected final String connectionId;
    protected volatile long lastActivityTime;

    protected AbstractConnectionAdapter(ConnectionConfig config) {
        this.config = config;
        this.connectionId = generateConnectionId();
        this.metrics = new ConnectionMetrics();
        this.metrics.setConnectionId(connectionId);
        this.metrics.setHostId(config.getHostId());
        this.lastActivityTime = System.currentTimeMillis();
    }

    @Override
    public synchronized void connect() throws Exception {
        if (status == ConnectionStatus.CONNECTED) {
            log.debug("连接已经建立: {}", connectionId);
            return;
        }
        log.debug("开始连接: {} -> {}", connectionId, config.getAddress());
        try {
            status = ConnectionStatus.CONNECTING;
            metrics.setStatus(status);

            doConnect();

            status = ConnectionStatus.CONNECTED;
            lastActivityTime = System.currentTimeMillis();
            metrics.setConnectTime(lastActivityTime);
            metrics.setStatus(status);
            metrics.setLastError(null);
            log.info("连接成功: {} ({})", config.getHostId(), connectionId);
        } catch (Exception e) {
            status = ConnectionStatus.ERROR;
            metrics.setStatus(status);
            metrics.recordError(e.getMessage());
            log.warn("连接失败: {} ({}): {}", config.getHostId(), connectionId, e.getMessage());
            throw e;
        }
    }

    @Override
    public synchronized void disconnect() throws Exception {
        if (status == ConnectionStatus.DISCONNECTED) {
            return;
        }
        try {
            doDisconnect();
            log.debug("断开连接成功: {}", connectionId);
        } finally {
            status = ConnectionStatus.DISCONNECTED;
            metrics.setStatus(status);
            metrics.setDisconnectTime(System.currentTimeMillis());
        }
    }

    @Override
    public CommandResponse execute(String command, long timeoutMillis) throws Exception {
        if (!isConnected()) {
            throw KeeperException.connectionException("连接未建立", config.getHostId());
        }
        long start = System.currentTimeMillis();
        try {
            CommandResponse response = doExecute(command, timeoutMillis);
            metrics.recordCommand(System.currentTimeMillis() - start, response.isSuccess());
            lastActivityTime = System.currentTimeMillis();
            log.debug("命令执行完成: {}, 退出码: {}, 耗时: {}ms",
                    config.getHostId(), response.exitCode(), System.currentTimeMillis() - start);
            return response;
        } catch (Exception e) {
            status = ConnectionStatus.ERROR;
            metrics.setStatus(status);
            metrics.recordError(e.getMessage());
            throw e;
        }
    }

    @Override
    public boolean healthCheck() {
        if (status != ConnectionStatus.CONNECTED) {
            return false;
        }
        try {
            return doHealthCheck();
        } catch (Exception e) {
            log.debug("连接健康检查失败: {}", connectionId, e);
            return false;
        }
    }

    @Override
    public ConnectionStatus getStatus() {
        return status;
    }

    @Override
    public ConnectionConfig getConfig() {
        return config;
    }

    @Override
    public ConnectionMetrics getMetrics() {
        return metrics;
    }

    @Override
    public boolean isConnected() {
        return status.isConnected();
    }

    @Override
    public String getConnectionId() {
        return connectionId;
    }

    @Override
    public String getHostId() {
        return config.getHostId();
    }

    @Override
    public long getLastActivityTime() {
        return lastActivityTime;
    }

    protected String generateConnectionId() {
        return config.getConnectionType() + "-" + config.getHostId() + "-"
                + UUID.randomUUID().toString().substring(0, 8);
    }

    protected abstract void doConnect() throws Exception;

    protected abstract void doDisconnect() throws Exception;

    protected abstract CommandResponse doExecute(String command, long timeoutMillis) throws Exception;

    protected boolean doHealthCheck() throws Exception {
        return true;
    }
}
