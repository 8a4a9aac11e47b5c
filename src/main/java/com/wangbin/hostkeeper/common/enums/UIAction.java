package com.wangbin.hostkeeper.common.enums;

/**
 * 命令结果的界面动作
 */
public enum UIAction {
    NONE,
    DETAILS_DIALOG,
    TEXT_VIEW,
    LOG_VIEW
}
