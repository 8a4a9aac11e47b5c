package com.wangbin.hostkeeper.core.event;

import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.common.enums.HostStatus;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.InputSpec;

import java.util.List;

/**
 * 引擎对外发布的事件
 */
public sealed interface KeeperEvent {

    String hostId();

    /**
     * 主机数据有更新
     */
    record UpdateReceived(String hostId) implements KeeperEvent {
    }

    record HostInitialized(String hostId) implements KeeperEvent {
    }

    record HostInitializedFromCache(String hostId) implements KeeperEvent {
    }

    record HostStatusChanged(String hostId, HostStatus previous, HostStatus current) implements KeeperEvent {
    }

    /**
     * 主机汇总严重程度变化，monitorId 为触发变化的监控
     */
    record MonitorStateChanged(String hostId, String monitorId, Criticality criticality) implements KeeperEvent {
    }

    record MonitoringDataReceived(String hostId, String monitorId, long invocationId, DataPoint dataPoint)
            implements KeeperEvent {
    }

    record CommandResultReceived(String hostId, CommandResult result) implements KeeperEvent {
    }

    record ErrorReceived(String hostId, Criticality criticality, String message) implements KeeperEvent {
    }

    record ConfirmationDialogOpened(String hostId, String commandId, long invocationId, String confirmationText)
            implements KeeperEvent {
    }

    record DetailsDialogOpened(String hostId, long invocationId) implements KeeperEvent {
    }

    record TextDialogOpened(String hostId, long invocationId) implements KeeperEvent {
    }

    record InputDialogOpened(List<InputSpec> inputSpecs, String hostId, String commandId, List<String> params)
            implements KeeperEvent {

        public InputDialogOpened {
            inputSpecs = List.copyOf(inputSpecs);
            params = List.copyOf(params);
        }
    }
}
