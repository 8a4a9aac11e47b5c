package com.wangbin.hostkeeper.core.cache.manager;

import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.core.event.EventBus;
import com.wangbin.hostkeeper.core.event.KeeperEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 主机严重程度汇总
 *
 * 汇总值为所有非 IGNORE 监控的最大严重程度，没有有效监控时为 NO_DATA。
 * 汇总值变化时发布一次 MonitorStateChanged，值不变不发布。
 */
@Slf4j
@Component
public class CriticalityTracker {

    private final EventBus eventBus;
    private final Map<String, HostEntries> hosts = new ConcurrentHashMap<>();

    public CriticalityTracker(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * 记录监控的严重程度
     *
     * @param ignoreFromSummary 不计入汇总
     * @return 汇总值发生变化时返回新值
     */
    public Optional<Criticality> record(String hostId, String monitorId, Criticality criticality,
                                        boolean ignoreFromSummary) {
        Criticality effective = ignoreFromSummary || criticality == null ? Criticality.IGNORE : criticality;
        HostEntries entries = hosts.computeIfAbsent(hostId, id -> new HostEntries());

        Criticality changed;
        synchronized (entries) {
            entries.values.put(monitorId, effective);
            Criticality aggregate = entries.aggregate();
            if (aggregate == entries.last) {
                return Optional.empty();
            }
            log.debug("主机 {} 汇总严重程度变化: {} -> {} (监控: {})", hostId, entries.last, aggregate, monitorId);
            entries.last = aggregate;
            changed = aggregate;
            // 在锁内发布，保证同一主机的变化事件按顺序入队
            eventBus.publish(new KeeperEvent.MonitorStateChanged(hostId, monitorId, aggregate));
        }
        return Optional.of(changed);
    }

    public Criticality aggregate(String hostId) {
        HostEntries entries = hosts.get(hostId);
        if (entries == null) {
            return Criticality.NO_DATA;
        }
        synchronized (entries) {
            return entries.aggregate();
        }
    }

    public Criticality get(String hostId, String monitorId) {
        HostEntries entries = hosts.get(hostId);
        if (entries == null) {
            return null;
        }
        synchronized (entries) {
            return entries.values.get(monitorId);
        }
    }

    public void remove(String hostId) {
        hosts.remove(hostId);
    }

    private static final class HostEntries {

        private final Map<String, Criticality> values = new LinkedHashMap<>();
        private Criticality last = Criticality.NO_DATA;

        Criticality aggregate() {
            Criticality result = null;
            for (Criticality value : values.values()) {
                if (value != Criticality.IGNORE) {
                    result = Criticality.max(result, value);
                }
            }
            return result != null ? result : Criticality.NO_DATA;
        }
    }
}
