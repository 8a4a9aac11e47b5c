package com.wangbin.hostkeeper.core.cache.model;

import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.common.enums.HostStatus;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 主机状态快照，不可变，每次写入生成新实例
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class HostState {

    String hostId;
    @Builder.Default
    String address = "";
    @Builder.Default
    String fqdn = "";
    @Builder.Default
    HostStatus status = HostStatus.UNINITIALIZED;
    @Builder.Default
    PlatformInfo platform = PlatformInfo.UNKNOWN;
    /**
     * 监控ID -> 最近一次数据
     */
    @Builder.Default
    Map<String, DataPoint> monitorData = Map.of();
    /**
     * 命令ID -> 最近一次结果
     */
    @Builder.Default
    Map<String, CommandResult> commandResults = Map.of();
    @Builder.Default
    Criticality lastCriticality = Criticality.NO_DATA;
    /**
     * 最近一次写入时间（毫秒）
     */
    long updatedAt;

    public static HostState empty(String hostId) {
        return HostState.builder().hostId(hostId).build();
    }

    public HostState withMonitorData(String monitorId, DataPoint dataPoint, long now) {
        Map<String, DataPoint> data = new LinkedHashMap<>(monitorData);
        data.put(monitorId, dataPoint);
        return toBuilder().monitorData(Collections.unmodifiableMap(data)).updatedAt(now).build();
    }

    public HostState withCommandResult(String commandId, CommandResult result, long now) {
        Map<String, CommandResult> results = new LinkedHashMap<>(commandResults);
        results.put(commandId, result);
        return toBuilder().commandResults(Collections.unmodifiableMap(results)).updatedAt(now).build();
    }

    public DataPoint getMonitorData(String monitorId) {
        return monitorData.get(monitorId);
    }
}
