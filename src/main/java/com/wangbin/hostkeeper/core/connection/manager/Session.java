package com.wangbin.hostkeeper.core.connection.manager;

import com.wangbin.hostkeeper.core.connection.adapter.ConnectionAdapter;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 从连接池借出的会话，关闭即归还
 */
public class Session implements AutoCloseable {

    @Getter
    private final String hostId;
    @Getter
    private final ConnectionAdapter adapter;
    private final ConnectionManager.HostSessionPool pool;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean broken;

    Session(String hostId, ConnectionAdapter adapter, ConnectionManager.HostSessionPool pool) {
        this.hostId = hostId;
        this.adapter = adapter;
        this.pool = pool;
    }

    /**
     * 传输出错的会话归还时直接丢弃
     */
    void markBroken() {
        this.broken = true;
    }

    public boolean isBroken() {
        return broken;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            pool.release(this);
        }
    }
}
