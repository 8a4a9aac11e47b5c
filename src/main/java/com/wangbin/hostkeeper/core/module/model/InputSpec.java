package com.wangbin.hostkeeper.core.module.model;

import java.util.List;

/**
 * 命令输入项定义
 *
 * @param label            提示文本
 * @param defaultValue     默认值
 * @param validatorPattern 校验正则，null 表示不校验
 * @param choices          可选值，空表示任意输入
 */
public record InputSpec(String label, String defaultValue, String validatorPattern, List<String> choices) {

    public InputSpec {
        choices = choices != null ? List.copyOf(choices) : List.of();
    }

    public static InputSpec text(String label, String defaultValue) {
        return new InputSpec(label, defaultValue, null, List.of());
    }

    public static InputSpec validated(String label, String defaultValue, String validatorPattern) {
        return new InputSpec(label, defaultValue, validatorPattern, List.of());
    }

    public InputSpec withPattern(String pattern) {
        return new InputSpec(label, defaultValue, pattern, choices);
    }
}
