package com.wangbin.hostkeeper.core.module.monitor;

import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.MonitorModule;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * 主机运行时长（天）
 */
public class UptimeMonitor implements MonitorModule {

    public static final String ID = "uptime";

    private static final DateTimeFormatter BOOT_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public UptimeMonitor(Map<String, String> settings) {
        this(settings, Clock.systemDefaultZone());
    }

    UptimeMonitor(Map<String, String> settings, Clock clock) {
        this.clock = clock;
    }

    @Override
    public ModuleSpec getSpec() {
        return ModuleSpec.of(ID, "0.0.1");
    }

    @Override
    public DisplayOptions getDisplayOptions() {
        return DisplayOptions.builder()
                .category("host")
                .displayText("运行时长")
                .displayStyle(DisplayStyle.TEXT)
                .unit("d")
                .build();
    }

    @Override
    public boolean isApplicable(PlatformInfo platform) {
        return platform.isLinux();
    }

    @Override
    public String buildCommand(ModuleContext context, DataPoint prior) {
        return "uptime -s";
    }

    @Override
    public DataPoint parseResult(ModuleContext context, CommandResponse response) {
        LocalDateTime bootTime = LocalDateTime.parse(response.stdout().strip(), BOOT_TIME_FORMAT);
        long days = Duration.between(bootTime, LocalDateTime.now(clock)).toDays();
        return DataPoint.of(String.valueOf(days));
    }
}
