package com.wangbin.hostkeeper;

import com.wangbin.hostkeeper.core.cache.manager.HostStateCache;
import com.wangbin.hostkeeper.core.connection.manager.ConnectionManager;
import com.wangbin.hostkeeper.core.dispatch.InvocationDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

/**
 * 优雅停机：停止调度 → 保存状态缓存 → 关闭所有连接
 */
@Slf4j
@Component
public class GracefulShutdown implements ApplicationListener<ContextClosedEvent> {

    private final InvocationDispatcher dispatcher;
    private final HostStateCache stateCache;
    private final ConnectionManager connectionManager;

    public GracefulShutdown(InvocationDispatcher dispatcher,
                            HostStateCache stateCache,
                            ConnectionManager connectionManager) {
        this.dispatcher = dispatcher;
        this.stateCache = stateCache;
        this.connectionManager = connectionManager;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("开始优雅停机...");
        stopDispatcher();
        saveCurrentState();
        closeAllConnections();
        log.info("优雅停机完成");
    }

    private void stopDispatcher() {
        try {
            log.info("停止调用调度...");
            dispatcher.stop();
        } catch (Exception e) {
            log.error("停止调用调度失败", e);
        }
    }

    private void saveCurrentState() {
        try {
            log.info("保存主机状态缓存...");
            stateCache.persist();
        } catch (Exception e) {
            log.error("保存状态失败", e);
        }
    }

    private void closeAllConnections() {
        try {
            log.info("关闭所有连接...");
            connectionManager.closeAll();
        } catch (Exception e) {
            log.error("关闭连接失败", e);
        }
    }
}
