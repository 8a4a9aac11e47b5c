package com.wangbin.hostkeeper.core.connection.manager;

import com.wangbin.hostkeeper.common.exception.ErrorKind;
import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.config.manager.ConfigResolver;
import com.wangbin.hostkeeper.core.connection.adapter.ConnectionAdapter;
import com.wangbin.hostkeeper.core.connection.factory.ConnectionFactory;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.connection.model.ConnectionConfig;
import com.wangbin.hostkeeper.core.connection.model.ConnectionMetrics;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 连接管理器 - 按主机维护会话池
 *
 * 会话懒创建，池大小独立于调度器的并发上限。
 * invalidate 后池被替换，旧池中借出的会话归还时直接断开。
 */
@Slf4j
@Component
public class ConnectionManager {

    private final ConnectionFactory connectionFactory;
    private final ConfigResolver configResolver;
    private final KeeperProperties properties;

    // 会话池：hostId -> HostSessionPool
    private final Map<String, HostSessionPool> pools = new ConcurrentHashMap<>();

    public ConnectionManager(ConnectionFactory connectionFactory,
                             ConfigResolver configResolver,
                             KeeperProperties properties) {
        this.connectionFactory = connectionFactory;
        this.configResolver = configResolver;
        this.properties = properties;
    }

    @PreDestroy
    public void destroy() {
        log.info("开始关闭所有连接...");
        closeAll();
        log.info("所有连接已关闭");
    }

    /**
     * 借出会话
     *
     * @param hostId 主机ID
     * @return 会话，使用完毕后必须关闭
     * @throws KeeperException 连接失败或等待超时抛出 CONNECTION；主机配置不存在抛出 CONFIG
     */
    public Session acquireSession(String hostId) {
        HostSessionPool pool = pools.computeIfAbsent(hostId, this::createPool);
        return pool.acquire();
    }

    /**
     * 执行命令
     *
     * @throws KeeperException 传输失败为 CONNECTION，超时为 TIMEOUT（两者会话均被丢弃），非零退出码为 EXECUTION
     */
    public CommandResponse execute(Session session, String command, long timeoutMillis) {
        if (session.isClosed()) {
            throw KeeperException.connectionException("会话已关闭", session.getHostId());
        }
        CommandResponse response;
        try {
            response = session.getAdapter().execute(command, timeoutMillis);
        } catch (KeeperException e) {
            if (e.is(ErrorKind.CONNECTION) || e.is(ErrorKind.TIMEOUT)) {
                session.markBroken();
            }
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.markBroken();
            throw KeeperException.connectionException("命令执行被中断", session.getHostId(), e);
        } catch (Exception e) {
            session.markBroken();
            throw KeeperException.connectionException("命令执行失败: " + e.getMessage(), session.getHostId(), e);
        }

        if (!response.isSuccess()) {
            throw KeeperException.executionException(
                    String.format("命令退出码 %d: %s", response.exitCode(), response.errorText()),
                    session.getHostId());
        }
        return response;
    }

    /**
     * 使主机的会话失效，配置变更或主机删除时调用
     */
    public void invalidate(String hostId) {
        HostSessionPool pool = pools.remove(hostId);
        if (pool != null) {
            pool.invalidate();
            log.info("主机会话已失效: {}", hostId);
        }
    }

    public void closeAll() {
        for (String hostId : new ArrayList<>(pools.keySet())) {
            invalidate(hostId);
        }
    }

    /**
     * 获取主机所有会话的指标
     */
    public List<ConnectionMetrics> getMetrics(String hostId) {
        HostSessionPool pool = pools.get(hostId);
        return pool != null ? pool.metrics() : List.of();
    }

    public int getIdleSessionCount(String hostId) {
        HostSessionPool pool = pools.get(hostId);
        return pool != null ? pool.idleCount() : 0;
    }

    private HostSessionPool createPool(String hostId) {
        ConnectionConfig config = ConnectionConfig.from(configResolver.resolve(hostId), properties);
        int size = Math.max(1, properties.getConnection().getSessionPoolSize());
        log.debug("创建会话池: {}, 类型: {}, 大小: {}", hostId, config.getConnectionType(), size);
        return new HostSessionPool(hostId, config, size);
    }

    /**
     * 单个主机的会话池
     */
    final class HostSessionPool {

        @Getter
        private final String hostId;
        private final ConnectionConfig config;
        private final Semaphore permits;
        private final Deque<ConnectionAdapter> idle = new ArrayDeque<>();
        private final List<ConnectionAdapter> all = new ArrayList<>();
        private volatile boolean invalidated;

        HostSessionPool(String hostId, ConnectionConfig config, int size) {
            this.hostId = hostId;
            this.config = config;
            this.permits = new Semaphore(size, true);
        }

        Session acquire() {
            try {
                if (!permits.tryAcquire(config.getCommandTimeout(), TimeUnit.MILLISECONDS)) {
                    throw KeeperException.connectionException("等待可用会话超时", hostId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw KeeperException.connectionException("等待会话被中断", hostId, e);
            }

            ConnectionAdapter adapter;
            synchronized (this) {
                adapter = idle.pollFirst();
            }
            if (adapter != null && adapter.isConnected()) {
                return new Session(hostId, adapter, this);
            }
            if (adapter != null) {
                forget(adapter);
                adapter = null;
            }

            try {
                adapter = connectionFactory.createConnection(config);
                adapter.connect();
            } catch (KeeperException e) {
                permits.release();
                if (adapter != null) {
                    discard(adapter);
                }
                throw e.is(ErrorKind.CONNECTION) || e.is(ErrorKind.CONFIG)
                        ? e
                        : KeeperException.connectionException(e.getMessage(), hostId, e);
            } catch (Exception e) {
                permits.release();
                if (adapter != null) {
                    discard(adapter);
                }
                throw KeeperException.connectionException("建立连接失败: " + e.getMessage(), hostId, e);
            }
            synchronized (this) {
                all.add(adapter);
            }
            return new Session(hostId, adapter, this);
        }

        void release(Session session) {
            ConnectionAdapter adapter = session.getAdapter();
            try {
                if (invalidated || session.isBroken() || !adapter.isConnected()) {
                    discard(adapter);
                } else {
                    synchronized (this) {
                        idle.addFirst(adapter);
                    }
                }
            } finally {
                permits.release();
            }
        }

        void invalidate() {
            invalidated = true;
            List<ConnectionAdapter> toClose;
            synchronized (this) {
                toClose = new ArrayList<>(idle);
                idle.clear();
            }
            toClose.forEach(this::discard);
        }

        synchronized int idleCount() {
            return idle.size();
        }

        synchronized List<ConnectionMetrics> metrics() {
            return all.stream().map(ConnectionAdapter::getMetrics).toList();
        }

        private void discard(ConnectionAdapter adapter) {
            forget(adapter);
            try {
                adapter.disconnect();
            } catch (Exception e) {
                log.warn("断开连接失败: {} ({})", hostId, adapter.getConnectionId(), e);
            }
        }

        private synchronized void forget(ConnectionAdapter adapter) {
            all.remove(adapter);
        }
    }
}
