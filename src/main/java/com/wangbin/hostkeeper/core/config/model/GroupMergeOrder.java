package com.wangbin.hostkeeper.core.config.model;

/**
 * 多个分组设置相同键时的合并顺序
 */
public enum GroupMergeOrder {
    /** 后列出的分组覆盖先列出的 */
    LAST_WINS,
    /** 先列出的分组优先 */
    FIRST_WINS
}
