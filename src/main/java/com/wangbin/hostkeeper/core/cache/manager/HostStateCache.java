package com.wangbin.hostkeeper.core.cache.manager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.common.enums.HostStatus;
import com.wangbin.hostkeeper.core.cache.model.HostState;
import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.ModuleResult;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 主机状态缓存
 *
 * 每台主机保存一个不可变 {@link HostState}，写入通过 {@link ConcurrentHashMap#compute} 替换，
 * 读取方总能拿到一致的快照。定时及停机时持久化到 JSON 文件，启动时读取一次。
 */
@Slf4j
@Component
public class HostStateCache {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final KeeperProperties.CacheConfig cacheConfig;
    private final Map<String, HostState> states = new ConcurrentHashMap<>();
    private final AtomicBoolean dirty = new AtomicBoolean(false);
    private volatile Clock clock = Clock.systemUTC();

    public HostStateCache(KeeperProperties properties) {
        this.cacheConfig = properties.getCache();
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!cacheConfig.isEnabled()) {
            clearFile();
            return;
        }
        load();
    }

    /**
     * 记录模块结果，覆盖同一模块的旧值
     *
     * @return 写入后的主机状态
     */
    public HostState recordResult(String hostId, String moduleId, ModuleResult result) {
        long now = clock.millis();
        HostState updated = states.compute(hostId, (id, state) -> {
            HostState current = state != null ? state : HostState.empty(id);
            if (result instanceof DataPoint dataPoint) {
                return current.withMonitorData(moduleId, dataPoint, now);
            }
            return current.withCommandResult(moduleId, (CommandResult) result, now);
        });
        dirty.set(true);
        return updated;
    }

    /**
     * 更新主机状态
     *
     * @return 更新前的状态
     */
    public HostStatus setStatus(String hostId, HostStatus status) {
        HostStatus[] previous = new HostStatus[1];
        states.compute(hostId, (id, state) -> {
            HostState current = state != null ? state : HostState.empty(id);
            previous[0] = current.getStatus();
            return current.toBuilder().status(status).build();
        });
        return previous[0];
    }

    /**
     * 仅当当前状态为 expected 之一时更新
     *
     * @return 是否更新成功
     */
    public boolean compareAndSetStatus(String hostId, List<HostStatus> expected, HostStatus status) {
        boolean[] updated = new boolean[1];
        states.compute(hostId, (id, state) -> {
            HostState current = state != null ? state : HostState.empty(id);
            if (!expected.contains(current.getStatus())) {
                return current;
            }
            updated[0] = true;
            return current.toBuilder().status(status).build();
        });
        return updated[0];
    }

    public void setPlatform(String hostId, PlatformInfo platform) {
        states.compute(hostId, (id, state) -> {
            HostState current = state != null ? state : HostState.empty(id);
            return current.toBuilder().platform(platform != null ? platform : PlatformInfo.UNKNOWN).build();
        });
        dirty.set(true);
    }

    public void setHostFacts(String hostId, String address, String fqdn) {
        states.compute(hostId, (id, state) -> {
            HostState current = state != null ? state : HostState.empty(id);
            return current.toBuilder().address(address).fqdn(fqdn).build();
        });
    }

    public void setCriticality(String hostId, Criticality criticality) {
        states.computeIfPresent(hostId, (id, state) -> state.toBuilder().lastCriticality(criticality).build());
    }

    public Optional<HostState> get(String hostId) {
        return Optional.ofNullable(states.get(hostId));
    }

    public HostStatus getStatus(String hostId) {
        HostState state = states.get(hostId);
        return state != null ? state.getStatus() : HostStatus.UNINITIALIZED;
    }

    public PlatformInfo getPlatform(String hostId) {
        HostState state = states.get(hostId);
        return state != null ? state.getPlatform() : PlatformInfo.UNKNOWN;
    }

    public DataPoint getMonitorData(String hostId, String monitorId) {
        HostState state = states.get(hostId);
        return state != null ? state.getMonitorData(monitorId) : null;
    }

    /**
     * 是否有可用于初始化的缓存数据
     */
    public boolean hasInitialValue(String hostId) {
        if (!cacheConfig.isEnabled() || !cacheConfig.isProvideInitialValue()) {
            return false;
        }
        HostState state = states.get(hostId);
        if (state == null || state.getMonitorData().isEmpty()) {
            return false;
        }
        long age = clock.millis() - state.getUpdatedAt();
        return age <= cacheConfig.getInitialValueTimeToLive() * 1000;
    }

    /**
     * 监控数据是否仍在有效期内
     */
    public boolean isFresh(String hostId, String monitorId) {
        DataPoint dataPoint = getMonitorData(hostId, monitorId);
        if (dataPoint == null || dataPoint.isError()) {
            return false;
        }
        return clock.millis() - dataPoint.getTimestamp() <= cacheConfig.getTimeToLive() * 1000;
    }

    public void remove(String hostId) {
        if (states.remove(hostId) != null) {
            dirty.set(true);
        }
    }

    public List<String> getHostIds() {
        return new ArrayList<>(states.keySet());
    }

    @Scheduled(fixedDelayString = "${keeper.cache.persist-interval:60000}")
    public void scheduledPersist() {
        if (dirty.get()) {
            persist();
        }
    }

    /**
     * 写入缓存文件，先写临时文件再原子替换
     */
    public synchronized void persist() {
        if (!cacheConfig.isEnabled()) {
            return;
        }
        Path file = cacheFile();
        dirty.set(false);
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            MAPPER.writeValue(temp.toFile(), new TreeMap<>(states));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("主机状态缓存已保存: {} 台主机", states.size());
        } catch (IOException e) {
            dirty.set(true);
            log.error("保存主机状态缓存失败: {}", file, e);
        }
    }

    /**
     * 从缓存文件读取，状态统一重置为未初始化
     */
    public synchronized void load() {
        Path file = cacheFile();
        if (!Files.exists(file)) {
            return;
        }
        try {
            Map<String, HostState> loaded = MAPPER.readValue(file.toFile(), new TypeReference<Map<String, HostState>>() {
            });
            loaded.forEach((hostId, state) ->
                    states.put(hostId, state.toBuilder().hostId(hostId).status(HostStatus.UNINITIALIZED).build()));
            log.info("已加载主机状态缓存: {} 台主机", loaded.size());
        } catch (IOException e) {
            log.warn("读取主机状态缓存失败，忽略缓存文件: {}", file, e);
        }
    }

    private void clearFile() {
        try {
            if (Files.deleteIfExists(cacheFile())) {
                log.info("缓存已禁用，已删除缓存文件: {}", cacheFile());
            }
        } catch (IOException e) {
            log.warn("删除缓存文件失败: {}", cacheFile(), e);
        }
    }

    private Path cacheFile() {
        return Paths.get(cacheConfig.getFile());
    }
}
