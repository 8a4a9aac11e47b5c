package com.wangbin.hostkeeper.core.connection.model;

import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.config.model.EffectiveConfig;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 连接配置，由主机有效配置推导，每次重新加载后重建
 */
@Data
public class ConnectionConfig {

    private String hostId;
    private String connectionType;
    private String address;
    private Integer port;
    private String username;
    private String privateKeyPath;

    private long connectTimeout = 10000;
    private long commandTimeout = 30000;

    // ssh 专用
    private String sshBinary = "ssh";
    private String controlDirectory;
    private long controlPersist = 600;

    /**
     * 连接器的原始设置，供自定义传输读取
     */
    private Map<String, String> settings = new LinkedHashMap<>();

    /**
     * 从主机有效配置推导连接配置
     *
     * 主机只配置了一个连接器时使用该连接器，否则使用默认类型
     */
    public static ConnectionConfig from(EffectiveConfig effective, KeeperProperties properties) {
        KeeperProperties.ConnectionConfig defaults = properties.getConnection();

        String type = defaults.getDefaultType();
        if (effective.getConnectors().size() == 1) {
            type = effective.getConnectors().keySet().iterator().next();
        }
        Map<String, String> settings = effective.connectorSettings(type);

        ConnectionConfig config = new ConnectionConfig();
        config.setHostId(effective.getHostId());
        config.setConnectionType(type);
        config.setSettings(new LinkedHashMap<>(settings));

        String address = settings.getOrDefault("address", effective.getAddress());
        if ((address == null || address.isBlank() || "0.0.0.0".equals(address))
                && effective.getFqdn() != null && !effective.getFqdn().isBlank()) {
            address = effective.getFqdn();
        }
        config.setAddress(address);
        config.setPort(parseInt(settings.get("port")));
        config.setUsername(settings.get("username"));
        config.setPrivateKeyPath(settings.get("private_key_path"));
        config.setConnectTimeout(parseLong(settings.get("connect_timeout"), defaults.getConnectTimeout()));
        config.setCommandTimeout(parseLong(settings.get("command_timeout"),
                properties.getDispatcher().getCommandTimeout()));
        config.setSshBinary(defaults.getSshBinary());
        config.setControlDirectory(defaults.getControlDirectory());
        config.setControlPersist(defaults.getControlPersist());
        return config;
    }

    public boolean isValid() {
        return hostId != null && !hostId.isBlank()
                && connectionType != null && !connectionType.isBlank();
    }

    /**
     * user@address 形式的目标
     */
    public String getDestination() {
        return username != null && !username.isBlank() ? username + "@" + address : address;
    }

    private static Integer parseInt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static long parseLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
