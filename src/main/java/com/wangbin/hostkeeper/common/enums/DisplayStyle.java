package com.wangbin.hostkeeper.common.enums;

/**
 * 展示样式
 */
public enum DisplayStyle {
    TEXT,
    CRITICALITY_LEVEL,
    PROGRESS_BAR,
    ICON
}
