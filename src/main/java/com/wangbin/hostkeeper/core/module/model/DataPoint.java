package com.wangbin.hostkeeper.core.module.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wangbin.hostkeeper.common.enums.Criticality;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 监控数据点，multivalue 为子数据点（可多层嵌套）
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DataPoint implements ModuleResult {

    @Builder.Default
    String value = "";
    @Builder.Default
    String unit = "";
    @Builder.Default
    String label = "";
    @Builder.Default
    String description = "";
    @Builder.Default
    Criticality criticality = Criticality.NORMAL;
    /**
     * 下钻命令使用的参数
     */
    @Singular
    List<String> commandParams;
    @Singular
    List<String> tags;
    @Singular("child")
    List<DataPoint> multivalue;
    /**
     * 处理失败时的错误信息
     */
    @Builder.Default
    String errorText = "";
    @Builder.Default
    long timestamp = 0;

    public static DataPoint of(String value) {
        return DataPoint.builder().value(value).build();
    }

    public static DataPoint labeled(String label, String value, Criticality criticality) {
        return DataPoint.builder().label(label).value(value).criticality(criticality).build();
    }

    /**
     * 无数据的数据点，用于执行或解析失败
     */
    public static DataPoint noData(String errorText) {
        return DataPoint.builder()
                .criticality(Criticality.NO_DATA)
                .errorText(errorText != null ? errorText : "")
                .build();
    }

    public DataPoint withTimestamp(long timestamp) {
        return toBuilder().timestamp(timestamp).build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return value.isEmpty() && multivalue.isEmpty();
    }

    @JsonIgnore
    public boolean isError() {
        return !errorText.isEmpty();
    }
}
