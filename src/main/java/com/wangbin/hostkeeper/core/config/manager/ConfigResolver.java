package com.wangbin.hostkeeper.core.config.manager;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.common.utils.ValidatorUtil;
import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.config.model.CommandConfig;
import com.wangbin.hostkeeper.core.config.model.ConfigDefinitions;
import com.wangbin.hostkeeper.core.config.model.ConfigUpdateEvent;
import com.wangbin.hostkeeper.core.config.model.ConnectorConfig;
import com.wangbin.hostkeeper.core.config.model.EffectiveConfig;
import com.wangbin.hostkeeper.core.config.model.GroupDefinition;
import com.wangbin.hostkeeper.core.config.model.GroupMergeOrder;
import com.wangbin.hostkeeper.core.config.model.HostDefinition;
import com.wangbin.hostkeeper.core.config.model.HostSetting;
import com.wangbin.hostkeeper.core.config.model.MonitorConfig;
import com.wangbin.hostkeeper.core.config.model.TemplateDefinition;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 配置解析器 - 负责主机有效配置的计算与快照切换
 *
 * 合并顺序：分组引用的模板（按分组顺序、模板顺序） → 分组 → 主机自身覆盖。
 * 重新加载先完整校验并解析所有主机，成功后原子替换快照；失败时保留旧快照。
 */
@Slf4j
@Component
public class ConfigResolver {

    private final KeeperProperties properties;
    private final DefinitionLoader definitionLoader;
    private final ApplicationEventPublisher eventPublisher;

    private final AtomicReference<ConfigSnapshot> snapshot;

    public ConfigResolver(KeeperProperties properties,
                          DefinitionLoader definitionLoader,
                          ApplicationEventPublisher eventPublisher) {
        this.properties = properties;
        this.definitionLoader = definitionLoader;
        this.eventPublisher = eventPublisher;
        this.snapshot = new AtomicReference<>(emptySnapshot());
    }

    @PostConstruct
    public void init() {
        log.info("配置解析器初始化开始...");
        try {
            reloadAll("startup");
        } catch (KeeperException e) {
            log.error("初始配置加载失败，以空配置启动: {}", e.getMessage());
        }
        log.info("配置解析器初始化完成");
    }

    /**
     * 获取主机有效配置
     *
     * @param hostId 主机ID
     * @return 有效配置
     * @throws KeeperException 主机不存在或定义无效时抛出 CONFIG 类型异常
     */
    public EffectiveConfig resolve(String hostId) {
        Objects.requireNonNull(hostId, "主机ID不能为空");
        ConfigSnapshot current = snapshot.get();
        if (!current.definitions().getHosts().containsKey(hostId)) {
            throw KeeperException.configException("主机不存在: " + hostId, hostId, null);
        }
        return current.cache().get(hostId, id -> resolve(current.definitions(), id, groupMergeOrder()));
    }

    /**
     * 重新加载全部定义
     *
     * @return 配置更新事件
     * @throws KeeperException 定义无效时抛出，当前快照不变
     */
    public ConfigUpdateEvent reloadAll() {
        return reloadAll("reload");
    }

    public synchronized ConfigUpdateEvent reloadAll(String source) {
        ConfigDefinitions definitions = definitionLoader.load();
        return apply(definitions, source);
    }

    /**
     * 校验并应用一组定义
     */
    public synchronized ConfigUpdateEvent apply(ConfigDefinitions definitions, String source) {
        GroupMergeOrder mergeOrder = groupMergeOrder();
        validate(definitions);

        Map<String, EffectiveConfig> resolved = new LinkedHashMap<>();
        for (String hostId : definitions.getHosts().keySet()) {
            resolved.put(hostId, resolve(definitions, hostId, mergeOrder));
        }

        ConfigSnapshot previous = snapshot.get();
        ConfigSnapshot next = new ConfigSnapshot(previous.version() + 1, definitions, newCache());
        next.cache().putAll(resolved);

        List<String> added = new ArrayList<>();
        List<String> changed = new ArrayList<>();
        for (Map.Entry<String, EffectiveConfig> entry : resolved.entrySet()) {
            String hostId = entry.getKey();
            if (!previous.definitions().getHosts().containsKey(hostId)) {
                added.add(hostId);
            } else if (!entry.getValue().equals(
                    previous.cache().get(hostId, id -> resolve(previous.definitions(), id, mergeOrder)))) {
                changed.add(hostId);
            }
        }
        List<String> removed = new ArrayList<>();
        for (String hostId : previous.definitions().getHosts().keySet()) {
            if (!resolved.containsKey(hostId)) {
                removed.add(hostId);
            }
        }

        snapshot.set(next);
        ConfigUpdateEvent event = ConfigUpdateEvent.reloaded(source, previous.version(), next.version(),
                added, removed, changed);
        log.info(event.getSummary());
        eventPublisher.publishEvent(event);
        return event;
    }

    public List<String> getHostIds() {
        return new ArrayList<>(snapshot.get().definitions().getHosts().keySet());
    }

    public boolean hasHost(String hostId) {
        return hostId != null && snapshot.get().definitions().getHosts().containsKey(hostId);
    }

    public long getVersion() {
        return snapshot.get().version();
    }

    /**
     * 结构校验：分组/模板引用存在、分组不引用分组、输入正则合法
     */
    void validate(ConfigDefinitions definitions) {
        for (Map.Entry<String, GroupDefinition> entry : definitions.getGroups().entrySet()) {
            String groupName = entry.getKey();
            GroupDefinition group = entry.getValue();
            if (group.getGroups() != null && !group.getGroups().isEmpty()) {
                throw KeeperException.configException(
                        String.format("分组 %s 不能引用其他分组: %s", groupName, group.getGroups()));
            }
            for (String template : nullSafe(group.getTemplates())) {
                if (!definitions.getTemplates().containsKey(template)) {
                    throw KeeperException.configException(
                            String.format("分组 %s 引用了不存在的模板: %s", groupName, template));
                }
            }
            validatePatterns(group.getCommands(), "分组 " + groupName);
        }
        for (Map.Entry<String, TemplateDefinition> entry : definitions.getTemplates().entrySet()) {
            validatePatterns(entry.getValue().getCommands(), "模板 " + entry.getKey());
        }
        for (Map.Entry<String, HostDefinition> entry : definitions.getHosts().entrySet()) {
            String hostId = entry.getKey();
            if (!ValidatorUtil.isHostId(hostId)) {
                throw KeeperException.configException("非法的主机ID: " + hostId, hostId, null);
            }
            for (String group : nullSafe(entry.getValue().getGroups())) {
                if (!definitions.getGroups().containsKey(group)) {
                    throw KeeperException.configException(
                            String.format("主机 %s 引用了不存在的分组: %s", hostId, group), hostId, null);
                }
            }
            validatePatterns(entry.getValue().getCommands(), "主机 " + hostId);
        }
    }

    private void validatePatterns(Map<String, CommandConfig> commands, String owner) {
        if (commands == null) {
            return;
        }
        commands.forEach((commandId, config) -> {
            if (config != null && config.getInputPattern() != null
                    && !ValidatorUtil.isValidRegex(config.getInputPattern())) {
                throw KeeperException.configException(
                        String.format("%s 的命令 %s 输入校验正则无效: %s", owner, commandId, config.getInputPattern()));
            }
        });
    }

    /**
     * 纯函数：根据定义计算主机有效配置
     */
    static EffectiveConfig resolve(ConfigDefinitions definitions, String hostId, GroupMergeOrder mergeOrder) {
        HostDefinition host = definitions.getHosts().get(hostId);
        if (host == null) {
            throw KeeperException.configException("主机不存在: " + hostId, hostId, null);
        }

        List<String> groupNames = new ArrayList<>(nullSafe(host.getGroups()));
        if (mergeOrder == GroupMergeOrder.FIRST_WINS) {
            Collections.reverse(groupNames);
        }

        List<TemplateDefinition> layers = new ArrayList<>();
        List<GroupDefinition> groups = new ArrayList<>();
        for (String groupName : groupNames) {
            GroupDefinition group = definitions.getGroups().get(groupName);
            if (group == null) {
                throw KeeperException.configException(
                        String.format("主机 %s 引用了不存在的分组: %s", hostId, groupName), hostId, null);
            }
            groups.add(group);
            for (String templateName : nullSafe(group.getTemplates())) {
                TemplateDefinition template = definitions.getTemplates().get(templateName);
                if (template == null) {
                    throw KeeperException.configException(
                            String.format("分组 %s 引用了不存在的模板: %s", groupName, templateName), hostId, null);
                }
                layers.add(template);
            }
        }
        layers.addAll(groups);

        Map<String, MonitorConfig> monitors = new LinkedHashMap<>();
        Map<String, CommandConfig> commands = new LinkedHashMap<>();
        Map<String, ConnectorConfig> connectors = new LinkedHashMap<>();
        List<HostSetting> hostSettings = new ArrayList<>();

        for (TemplateDefinition layer : layers) {
            mergeLayer(monitors, commands, connectors, layer.getMonitors(), layer.getCommands(), layer.getConnectors());
            if (layer.getHostSettings() != null && !layer.getHostSettings().isEmpty()) {
                hostSettings = new ArrayList<>(layer.getHostSettings());
            }
        }
        mergeLayer(monitors, commands, connectors, host.getMonitors(), host.getCommands(), host.getConnectors());
        if (host.getSettings() != null && !host.getSettings().isEmpty()) {
            hostSettings = new ArrayList<>(host.getSettings());
        }

        return new EffectiveConfig(hostId,
                host.getAddress() != null ? host.getAddress() : "0.0.0.0",
                host.getFqdn() != null ? host.getFqdn() : "",
                nullSafe(host.getGroups()),
                new LinkedHashSet<>(hostSettings),
                monitors, commands, connectors);
    }

    private static void mergeLayer(Map<String, MonitorConfig> monitors,
                                   Map<String, CommandConfig> commands,
                                   Map<String, ConnectorConfig> connectors,
                                   Map<String, MonitorConfig> layerMonitors,
                                   Map<String, CommandConfig> layerCommands,
                                   Map<String, ConnectorConfig> layerConnectors) {
        if (layerMonitors != null) {
            layerMonitors.forEach((id, config) ->
                    monitors.put(id, monitors.getOrDefault(id, new MonitorConfig()).mergedWith(config)));
        }
        if (layerCommands != null) {
            layerCommands.forEach((id, config) ->
                    commands.put(id, commands.getOrDefault(id, new CommandConfig()).mergedWith(config)));
        }
        if (layerConnectors != null) {
            layerConnectors.forEach((id, config) ->
                    connectors.put(id, connectors.getOrDefault(id, new ConnectorConfig()).mergedWith(config)));
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }

    private GroupMergeOrder groupMergeOrder() {
        GroupMergeOrder order = properties.getConfig().getGroupMergeOrder();
        return order != null ? order : GroupMergeOrder.LAST_WINS;
    }

    private Cache<String, EffectiveConfig> newCache() {
        return Caffeine.newBuilder()
                .maximumSize(Math.max(16, properties.getConfig().getResolvedCacheSize()))
                .build();
    }

    private ConfigSnapshot emptySnapshot() {
        return new ConfigSnapshot(0, new ConfigDefinitions(), newCache());
    }

    /**
     * 不可变配置快照，解析结果按快照缓存
     */
    private record ConfigSnapshot(long version, ConfigDefinitions definitions, Cache<String, EffectiveConfig> cache) {
    }
}
