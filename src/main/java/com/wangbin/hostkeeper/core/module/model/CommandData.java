package com.wangbin.hostkeeper.core.module.model;

import java.util.List;

/**
 * 提供给展示层的命令描述
 *
 * @param commandId      命令ID
 * @param displayOptions 展示选项
 * @param inputs         输入项
 */
public record CommandData(String commandId, DisplayOptions displayOptions, List<InputSpec> inputs) {
}
