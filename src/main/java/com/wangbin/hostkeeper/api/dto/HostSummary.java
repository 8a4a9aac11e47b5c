package com.wangbin.hostkeeper.api.dto;

import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.common.enums.HostStatus;
import com.wangbin.hostkeeper.core.cache.model.HostState;
import com.wangbin.hostkeeper.core.config.model.EffectiveConfig;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 主机概要
 */
@Data
@Builder
public class HostSummary {

    private String hostId;
    private String address;
    private String fqdn;
    private HostStatus status;
    private Criticality criticality;
    private PlatformInfo platform;
    private int monitorCount;
    private long updatedAt;
    /**
     * 标记为关键的监控处于 CRITICAL 时主机视为宕机
     */
    private boolean down;

    public static HostSummary from(String hostId, HostState state, EffectiveConfig config) {
        if (state == null) {
            return HostSummary.builder()
                    .hostId(hostId)
                    .status(HostStatus.UNINITIALIZED)
                    .criticality(Criticality.NO_DATA)
                    .platform(PlatformInfo.UNKNOWN)
                    .build();
        }
        return HostSummary.builder()
                .hostId(hostId)
                .address(state.getAddress())
                .fqdn(state.getFqdn())
                .status(state.getStatus())
                .criticality(state.getLastCriticality())
                .platform(state.getPlatform())
                .monitorCount(state.getMonitorData().size())
                .updatedAt(state.getUpdatedAt())
                .down(isDown(state, config))
                .build();
    }

    private static boolean isDown(HostState state, EffectiveConfig config) {
        return state.getMonitorData().entrySet().stream()
                .filter(entry -> config.isMonitorCritical(entry.getKey()))
                .map(Map.Entry::getValue)
                .map(DataPoint::getCriticality)
                .anyMatch(criticality -> criticality == Criticality.CRITICAL);
    }
}
