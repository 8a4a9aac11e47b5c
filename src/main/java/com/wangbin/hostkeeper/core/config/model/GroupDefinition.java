package com.wangbin.hostkeeper.core.config.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * 分组定义
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class GroupDefinition extends TemplateDefinition {

    /**
     * 引用的模板，按顺序合并
     */
    private List<String> templates = new ArrayList<>();

    /**
     * 分组不允许引用其他分组，非空即为配置错误
     */
    private List<String> groups = new ArrayList<>();
}
