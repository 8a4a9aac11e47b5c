package com.wangbin.hostkeeper.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.event.EventBus;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    private final int cpuCores = Runtime.getRuntime().availableProcessors();

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 调用执行线程池（IO密集型，任务阻塞在远程命令上）
     */
    @Bean(name = "invocationExecutor", destroyMethod = "shutdown")
    public ExecutorService invocationExecutor() {
        int corePoolSize = Math.max(8, cpuCores * 4);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                corePoolSize,
                corePoolSize * 2,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(10000),
                buildNamedThreadFactory("invocation", true),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * 事件总线
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public EventBus eventBus(KeeperProperties properties) {
        KeeperProperties.EventBusConfig config = properties.getEventBus();
        return new EventBus(config.getCapacity(), config.getOverflowStrategy());
    }

    /**
     * 定时任务线程池
     */
    @Bean("taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("scheduled-task-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
