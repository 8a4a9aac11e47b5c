package com.wangbin.hostkeeper.core.connection.model;

import com.wangbin.hostkeeper.common.enums.ConnectionStatus;
import lombok.Data;

/**
 * 连接指标
 */
@Data
public class ConnectionMetrics {

    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private String connectionId;
    private String hostId;

    private long connectTime;
    private long disconnectTime;
    private long lastActivityTime;
    private long lastErrorTime;

    private long commandsExecuted;
    private long failedCommands;
    private long errors;
    private long totalResponseTime;
    private long maxResponseTime;

    private String lastError;

    /**
     * 记录一次命令耗时
     */
    public synchronized void recordCommand(long elapsedMillis, boolean success) {
        commandsExecuted++;
        if (!success) {
            failedCommands++;
        }
        totalResponseTime += elapsedMillis;
        maxResponseTime = Math.max(maxResponseTime, elapsedMillis);
        lastActivityTime = System.currentTimeMillis();
    }

    public synchronized void recordError(String error) {
        errors++;
        lastError = error;
        lastErrorTime = System.currentTimeMillis();
    }

    public synchronized double getAverageResponseTime() {
        return commandsExecuted == 0 ? 0 : (double) totalResponseTime / commandsExecuted;
    }

    public long getConnectionDuration() {
        if (connectTime == 0) {
            return 0;
        }
        long endTime = disconnectTime > 0 ? disconnectTime : System.currentTimeMillis();
        return endTime - connectTime;
    }
}
