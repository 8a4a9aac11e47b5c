package com.wangbin.hostkeeper.core.module.model;

import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.common.enums.UIAction;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 模块展示选项
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DisplayOptions {

    String category;
    @Builder.Default
    DisplayStyle displayStyle = DisplayStyle.TEXT;
    String displayText;
    @Builder.Default
    String unit = "";
    boolean useMultivalue;
    /**
     * 不计入主机汇总严重程度
     */
    boolean ignoreFromSummary;
    /**
     * 子命令挂载的父模块ID
     */
    @Builder.Default
    String parentId = "";
    /**
     * 多值树中的层级，从1开始
     */
    @Builder.Default
    int multivalueLevel = 0;
    /**
     * 命令执行前的确认文本，空表示无需确认
     */
    @Builder.Default
    String confirmationText = "";
    @Builder.Default
    UIAction action = UIAction.NONE;

    public boolean requiresConfirmation() {
        return confirmationText != null && !confirmationText.isEmpty();
    }
}
