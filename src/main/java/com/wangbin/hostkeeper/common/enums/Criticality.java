package com.wangbin.hostkeeper.common.enums;

import lombok.Getter;

/**
 * 严重程度枚举
 *
 * 聚合时按 severity 取最大值，IGNORE 不参与聚合
 */
@Getter
public enum Criticality {

    IGNORE("IGNORE", "忽略", -1),
    NO_DATA("NO_DATA", "无数据", 0),
    NORMAL("NORMAL", "正常", 1),
    INFO("INFO", "信息", 2),
    WARNING("WARNING", "警告", 3),
    ERROR("ERROR", "错误", 4),
    CRITICAL("CRITICAL", "严重", 5);

    private final String code;
    private final String description;
    private final int severity;

    Criticality(String code, String description, int severity) {
        this.code = code;
        this.description = description;
        this.severity = severity;
    }

    public static Criticality fromCode(String code) {
        for (Criticality criticality : values()) {
            if (criticality.getCode().equalsIgnoreCase(code)) {
                return criticality;
            }
        }
        return NO_DATA;
    }

    public boolean isMoreSevereThan(Criticality other) {
        return other == null || this.severity > other.severity;
    }

    public static Criticality max(Criticality left, Criticality right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return right.isMoreSevereThan(left) ? right : left;
    }
}
