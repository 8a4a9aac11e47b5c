package com.wangbin.hostkeeper.core.dispatch;

import lombok.Getter;

/**
 * 调用状态
 */
@Getter
public enum InvocationState {

    PENDING("PENDING", "等待中"),
    COMPLETED("COMPLETED", "已完成"),
    FAILED("FAILED", "失败"),
    CANCELLED("CANCELLED", "已取消");

    private final String code;
    private final String description;

    InvocationState(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
