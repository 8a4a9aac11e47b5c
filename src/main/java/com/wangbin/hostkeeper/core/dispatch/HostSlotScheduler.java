package com.wangbin.hostkeeper.core.dispatch;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 按主机限制并发的调度器
 *
 * 每台主机最多 maxConcurrentPerHost 个任务同时运行，其余按 FIFO 排队，
 * 排队中的任务不占用线程。不同主机之间互不阻塞。
 */
@Slf4j
public class HostSlotScheduler {

    private final int maxConcurrentPerHost;
    private final Executor executor;
    private final Map<String, HostSlots> hosts = new ConcurrentHashMap<>();

    public HostSlotScheduler(int maxConcurrentPerHost, Executor executor) {
        this.maxConcurrentPerHost = Math.max(1, maxConcurrentPerHost);
        this.executor = executor;
    }

    /**
     * 提交任务，有空闲槽位时立即执行，否则排队
     */
    public void submit(String hostId, long invocationId, Runnable task) {
        HostSlots slots = hosts.computeIfAbsent(hostId, id -> new HostSlots());
        Ticket ticket = new Ticket(hostId, invocationId, task);
        boolean admitted;
        synchronized (slots) {
            admitted = slots.running < maxConcurrentPerHost;
            if (admitted) {
                slots.admit(ticket);
            } else {
                slots.waiting.addLast(ticket);
            }
        }
        if (admitted) {
            start(slots, ticket);
        } else {
            log.debug("主机 {} 并发已满，调用 {} 排队", hostId, invocationId);
        }
    }

    /**
     * 取消任务：排队中的直接移除，运行中的提前释放槽位
     *
     * @return 是否找到该任务
     */
    public boolean cancel(String hostId, long invocationId) {
        HostSlots slots = hosts.get(hostId);
        if (slots == null) {
            return false;
        }
        Ticket running;
        synchronized (slots) {
            Iterator<Ticket> iterator = slots.waiting.iterator();
            while (iterator.hasNext()) {
                if (iterator.next().invocationId == invocationId) {
                    iterator.remove();
                    return true;
                }
            }
            running = slots.active.get(invocationId);
        }
        if (running == null) {
            return false;
        }
        release(slots, running);
        return true;
    }

    /**
     * 移除主机所有排队中的任务
     *
     * @return 被移除的调用ID
     */
    public List<Long> drainQueued(String hostId) {
        HostSlots slots = hosts.get(hostId);
        if (slots == null) {
            return List.of();
        }
        List<Long> drained = new ArrayList<>();
        synchronized (slots) {
            slots.waiting.forEach(ticket -> drained.add(ticket.invocationId));
            slots.waiting.clear();
        }
        return drained;
    }

    public List<Long> drainAll() {
        List<Long> drained = new ArrayList<>();
        hosts.keySet().forEach(hostId -> drained.addAll(drainQueued(hostId)));
        return drained;
    }

    public int getRunningCount(String hostId) {
        HostSlots slots = hosts.get(hostId);
        if (slots == null) {
            return 0;
        }
        synchronized (slots) {
            return slots.running;
        }
    }

    public int getQueuedCount(String hostId) {
        HostSlots slots = hosts.get(hostId);
        if (slots == null) {
            return 0;
        }
        synchronized (slots) {
            return slots.waiting.size();
        }
    }

    public int getMaxConcurrentPerHost() {
        return maxConcurrentPerHost;
    }

    private void start(HostSlots slots, Ticket ticket) {
        try {
            executor.execute(() -> {
                try {
                    ticket.task.run();
                } finally {
                    release(slots, ticket);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("调用 {} 被线程池拒绝: {}", ticket.invocationId, ticket.hostId);
            release(slots, ticket);
        }
    }

    private void release(HostSlots slots, Ticket ticket) {
        if (!ticket.released.compareAndSet(false, true)) {
            return;
        }
        Ticket next;
        synchronized (slots) {
            slots.running--;
            slots.active.remove(ticket.invocationId);
            next = slots.waiting.pollFirst();
            if (next != null) {
                slots.admit(next);
            }
        }
        if (next != null) {
            start(slots, next);
        }
    }

    private static final class HostSlots {

        private int running;
        private final Deque<Ticket> waiting = new ArrayDeque<>();
        private final Map<Long, Ticket> active = new HashMap<>();

        void admit(Ticket ticket) {
            running++;
            active.put(ticket.invocationId, ticket);
        }
    }

    private static final class Ticket {

        private final String hostId;
        private final long invocationId;
        private final Runnable task;
        private final AtomicBoolean released = new AtomicBoolean(false);

        Ticket(String hostId, long invocationId, Runnable task) {
            this.hostId = hostId;
            this.invocationId = invocationId;
            this.task = task;
        }
    }
}
