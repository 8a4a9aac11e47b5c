package com.wangbin.hostkeeper.core.config;

import com.wangbin.hostkeeper.core.config.model.GroupMergeOrder;
import com.wangbin.hostkeeper.core.event.OverflowStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 主机编排引擎配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "keeper")
public class KeeperProperties {

    /**
     * 主机/分组/模板定义
     */
    private DefinitionConfig config = new DefinitionConfig();

    /**
     * 调度配置
     */
    private DispatcherConfig dispatcher = new DispatcherConfig();

    /**
     * 连接配置
     */
    private ConnectionConfig connection = new ConnectionConfig();

    /**
     * 状态缓存配置
     */
    private CacheConfig cache = new CacheConfig();

    /**
     * 事件总线配置
     */
    private EventBusConfig eventBus = new EventBusConfig();

    // =============== 配置类定义 ===============

    @Data
    public static class DefinitionConfig {
        private String directory = "./config";
        private boolean writeDefaults = true;
        private GroupMergeOrder groupMergeOrder = GroupMergeOrder.LAST_WINS;
        private int resolvedCacheSize = 1024;
    }

    @Data
    public static class DispatcherConfig {
        private int maxConcurrentPerHost = 2;
        private long commandTimeout = 30000;
        private long retryBackoff = 1000;
        private int maxConnectionRetries = 1;
        // 等待确认的命令过期时间（毫秒）
        private long confirmationTimeout = 600000;
        private boolean initializeOnStart = false;
    }

    @Data
    public static class ConnectionConfig {
        private String defaultType = "ssh";
        private int sessionPoolSize = 2;
        private long connectTimeout = 10000;
        private String sshBinary = "ssh";
        private String controlDirectory = System.getProperty("java.io.tmpdir");
        private long controlPersist = 600;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private String file = "./data/host-state.json";
        private boolean provideInitialValue = true;
        private long initialValueTimeToLive = 7 * 24 * 3600L;
        private long timeToLive = 3600;
        private long persistInterval = 60000;
    }

    @Data
    public static class EventBusConfig {
        private int capacity = 10000;
        private OverflowStrategy overflowStrategy = OverflowStrategy.BLOCK;
    }
}
