package com.wangbin.hostkeeper.core.config.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * 配置更新事件
 *
 * 配置重新加载成功并完成快照切换后发布，通知连接和模块组件按主机重建
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigUpdateEvent {

    /**
     * 事件ID
     */
    private String eventId;

    /**
     * 事件源: "startup", "reload", "api"
     */
    private String source;

    /**
     * 新快照版本号
     */
    private long configVersion;

    /**
     * 上一个快照版本号
     */
    private long previousVersion;

    @Builder.Default
    private List<String> addedHosts = new ArrayList<>();

    @Builder.Default
    private List<String> removedHosts = new ArrayList<>();

    /**
     * 有效配置发生变化的主机
     */
    @Builder.Default
    private List<String> changedHosts = new ArrayList<>();

    private Date createTime;

    /**
     * 创建重新加载事件
     */
    public static ConfigUpdateEvent reloaded(String source, long previousVersion, long configVersion,
                                             List<String> added, List<String> removed, List<String> changed) {
        return ConfigUpdateEvent.builder()
                .eventId(generateEventId())
                .source(source)
                .previousVersion(previousVersion)
                .configVersion(configVersion)
                .addedHosts(new ArrayList<>(added))
                .removedHosts(new ArrayList<>(removed))
                .changedHosts(new ArrayList<>(changed))
                .createTime(new Date())
                .build();
    }

    private static String generateEventId() {
        return String.format("EVT_%d_%d",
                System.currentTimeMillis(),
                (int) (Math.random() * 1000));
    }

    public boolean hasChanges() {
        return !addedHosts.isEmpty() || !removedHosts.isEmpty() || !changedHosts.isEmpty();
    }

    public String getSummary() {
        return String.format("配置更新事件: %s, 版本: %d -> %d, 新增: %s, 删除: %s, 变更: %s",
                eventId, previousVersion, configVersion, addedHosts, removedHosts, changedHosts);
    }
}
