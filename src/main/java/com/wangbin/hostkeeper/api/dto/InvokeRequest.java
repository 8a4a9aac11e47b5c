package com.wangbin.hostkeeper.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块调用请求
 */
@Data
public class InvokeRequest {

    @NotBlank(message = "模块ID不能为空")
    private String moduleId;

    /**
     * 命令参数，分页参数 page_number、page_size 追加在末尾
     */
    private List<String> params = new ArrayList<>();
}
