package com.wangbin.hostkeeper.core.connection.factory;

import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.core.connection.adapter.ConnectionAdapter;
import com.wangbin.hostkeeper.core.connection.adapter.SshConnectionAdapter;
import com.wangbin.hostkeeper.core.connection.model.ConnectionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 连接工厂，按连接器类型创建适配器
 *
 * 新的传输方式通过 {@link #register(String, Function)} 注册，无需修改调度器
 */
@Slf4j
@Component
public class ConnectionFactory {

    public static final String SSH = "ssh";

    private final Map<String, Function<ConnectionConfig, ConnectionAdapter>> creators = new ConcurrentHashMap<>();

    public ConnectionFactory() {
        register(SSH, SshConnectionAdapter::new);
    }

    /**
     * 注册连接器类型
     */
    public void register(String connectionType, Function<ConnectionConfig, ConnectionAdapter> creator) {
        creators.put(normalize(connectionType), creator);
        log.info("注册连接器类型: {}", connectionType);
    }

    public boolean supports(String connectionType) {
        return connectionType != null && creators.containsKey(normalize(connectionType));
    }

    /**
     * 创建连接适配器
     */
    public ConnectionAdapter createConnection(ConnectionConfig config) {
        if (config == null || !config.isValid()) {
            throw KeeperException.configException("连接配置无效");
        }
        Function<ConnectionConfig, ConnectionAdapter> creator = creators.get(normalize(config.getConnectionType()));
        if (creator == null) {
            throw KeeperException.configException(
                    String.format("不支持的连接类型: %s", config.getConnectionType()), config.getHostId(), null);
        }
        try {
            return creator.apply(config);
        } catch (Exception e) {
            log.error("创建{}连接失败: {}", config.getConnectionType(), config.getHostId(), e);
            throw KeeperException.connectionException("创建连接失败", config.getHostId(), e);
        }
    }

    private static String normalize(String connectionType) {
        return connectionType.trim().toLowerCase(Locale.ROOT);
    }
}
