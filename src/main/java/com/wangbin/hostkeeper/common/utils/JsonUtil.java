package com.wangbin.hostkeeper.common.utils;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;

/**
 * JSON工具类，用于解析远程命令返回的JSON文本
 */
public class JsonUtil {

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * 解析JSON数组，格式错误时抛出 {@link JSONException}
     */
    public static JSONArray parseArrayStrict(String json) {
        if (json == null || json.isBlank()) {
            throw new JSONException("JSON内容为空");
        }
        return JSON.parseArray(json.trim());
    }
}
