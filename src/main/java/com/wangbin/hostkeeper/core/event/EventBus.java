package com.wangbin.hostkeeper.core.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 进程内事件总线
 *
 * 发布方写入有界队列，单个工作线程按发布顺序分发给订阅者。
 * 队列满时按 {@link OverflowStrategy} 处理：阻塞、丢弃最新或丢弃最旧。
 */
@Slf4j
public class EventBus implements AutoCloseable {

    private final BlockingQueue<KeeperEvent> queue;
    private final OverflowStrategy overflowStrategy;
    private final Map<Class<? extends KeeperEvent>, CopyOnWriteArrayList<Consumer<? super KeeperEvent>>> subscribers =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<? super KeeperEvent>> globalSubscribers = new CopyOnWriteArrayList<>();
    private final Thread workerThread;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong droppedCount = new AtomicLong();

    public EventBus(int capacity, OverflowStrategy overflowStrategy) {
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
        this.overflowStrategy = overflowStrategy != null ? overflowStrategy : OverflowStrategy.BLOCK;
        this.workerThread = new Thread(this::processLoop, "event-bus");
        this.workerThread.setDaemon(true);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread.start();
            log.info("事件总线已启动，容量: {}，溢出策略: {}", queue.remainingCapacity(), overflowStrategy);
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            workerThread.interrupt();
            int pending = queue.size();
            queue.clear();
            log.info("事件总线已停止，丢弃未分发事件: {}", pending);
        }
    }

    /**
     * 订阅某类事件
     */
    @SuppressWarnings("unchecked")
    public <T extends KeeperEvent> void subscribe(Class<T> eventType, Consumer<? super T> listener) {
        if (eventType == null || listener == null) {
            return;
        }
        subscribers.computeIfAbsent(eventType, key -> new CopyOnWriteArrayList<>())
                .add(event -> listener.accept((T) event));
    }

    /**
     * 订阅全部事件
     */
    public void subscribeAll(Consumer<? super KeeperEvent> listener) {
        if (listener != null) {
            globalSubscribers.add(listener);
        }
    }

    public void publish(KeeperEvent event) {
        if (event == null) {
            return;
        }
        if (!running.get()) {
            log.debug("事件总线未运行，忽略事件: {}", event);
            return;
        }
        switch (overflowStrategy) {
            case DROP_LATEST:
                if (!queue.offer(event)) {
                    dropped(event);
                }
                break;
            case DROP_OLDEST:
                while (!queue.offer(event)) {
                    KeeperEvent oldest = queue.poll();
                    if (oldest != null) {
                        dropped(oldest);
                    }
                }
                break;
            case BLOCK:
            default:
                try {
                    queue.put(event);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    dropped(event);
                }
                break;
        }
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public int getPendingCount() {
        return queue.size();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void dropped(KeeperEvent event) {
        droppedCount.incrementAndGet();
        log.warn("事件队列已满，丢弃事件: {}", event.getClass().getSimpleName());
    }

    private void processLoop() {
        while (running.get()) {
            try {
                KeeperEvent event = queue.poll(500, TimeUnit.MILLISECONDS);
                if (event != null) {
                    dispatch(event);
                }
            } catch (InterruptedException e) {
                if (!running.get()) {
                    Thread.currentThread().interrupt();
                    break;
                }
            } catch (Exception ex) {
                log.warn("事件分发异常", ex);
            }
        }
    }

    private void dispatch(KeeperEvent event) {
        List<Consumer<? super KeeperEvent>> typed = subscribers.get(event.getClass());
        if (typed != null) {
            typed.forEach(listener -> deliver(listener, event));
        }
        globalSubscribers.forEach(listener -> deliver(listener, event));
    }

    private void deliver(Consumer<? super KeeperEvent> listener, KeeperEvent event) {
        try {
            listener.accept(event);
        } catch (Exception ex) {
            log.warn("事件监听处理失败: {}", event.getClass().getSimpleName(), ex);
        }
    }

    @Override
    public void close() {
        stop();
    }
}
