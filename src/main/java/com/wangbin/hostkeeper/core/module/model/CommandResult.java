package com.wangbin.hostkeeper.core.module.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wangbin.hostkeeper.common.enums.Criticality;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 命令执行结果
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CommandResult implements ModuleResult {

    long invocationId;
    @Builder.Default
    String commandId = "";
    @Builder.Default
    String message = "";
    @Builder.Default
    String errorText = "";
    @Builder.Default
    Criticality criticality = Criticality.NORMAL;
    @Builder.Default
    boolean showInNotification = true;
    boolean opensDetailsDialog;
    @Builder.Default
    long timestamp = 0;

    public static CommandResult of(String message) {
        return CommandResult.builder().message(message).build();
    }

    /**
     * 不弹出通知的结果，常用于日志类输出
     */
    public static CommandResult hidden(String message) {
        return CommandResult.builder().message(message).showInNotification(false).build();
    }

    public static CommandResult error(String errorText, Criticality criticality) {
        return CommandResult.builder()
                .errorText(errorText != null ? errorText : "")
                .criticality(criticality)
                .build();
    }

    @JsonIgnore
    public boolean isError() {
        return !errorText.isEmpty();
    }

    public CommandResult correlate(long invocationId, String commandId, long timestamp) {
        return toBuilder().invocationId(invocationId).commandId(commandId).timestamp(timestamp).build();
    }
}
