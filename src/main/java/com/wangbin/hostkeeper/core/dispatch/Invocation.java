package com.wangbin.hostkeeper.core.dispatch;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次模块调用，结果投递后即被丢弃
 */
@Getter
@ToString
public class Invocation {

    public enum Kind {
        MONITOR,
        COMMAND
    }

    private final long id;
    private final String hostId;
    private final String moduleId;
    private final Kind kind;
    private final List<String> params;
    private final long issuedAt;
    @ToString.Exclude
    private final Runnable completionCallback;
    private final AtomicReference<InvocationState> state = new AtomicReference<>(InvocationState.PENDING);

    Invocation(long id, String hostId, String moduleId, Kind kind, List<String> params, Runnable completionCallback) {
        this.id = id;
        this.hostId = hostId;
        this.moduleId = moduleId;
        this.kind = kind;
        this.params = params != null ? List.copyOf(params) : List.of();
        this.issuedAt = System.currentTimeMillis();
        this.completionCallback = completionCallback;
    }

    public InvocationState getState() {
        return state.get();
    }

    public boolean isDone() {
        return state.get().isTerminal();
    }

    public boolean isMonitor() {
        return kind == Kind.MONITOR;
    }

    /**
     * 从 PENDING 转换到终态，只有第一次调用成功
     */
    boolean complete(InvocationState target) {
        return state.compareAndSet(InvocationState.PENDING, target);
    }

    void runCallback() {
        if (completionCallback != null) {
            completionCallback.run();
        }
    }
}
