package com.wangbin.hostkeeper.core.module.monitor;

import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.MonitorModule;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 平台信息采集（内部监控），主机初始化时最先执行
 */
public class PlatformInfoMonitor implements MonitorModule {

    public static final String ID = "platform-info";

    private static final String SUBSYSTEM_PREFIX = "subsystem=";

    /**
     * 命令名 -> 子系统名
     */
    private static final Map<String, String> SUBSYSTEM_PROBES = new LinkedHashMap<>();

    static {
        SUBSYSTEM_PROBES.put("docker", "docker");
        SUBSYSTEM_PROBES.put("docker-compose", "docker-compose");
        SUBSYSTEM_PROBES.put("systemctl", "systemd");
        SUBSYSTEM_PROBES.put("journalctl", "journald");
        SUBSYSTEM_PROBES.put("pvs", "lvm");
        SUBSYSTEM_PROBES.put("nixos-rebuild", "nixos");
        SUBSYSTEM_PROBES.put("apt", "apt");
    }

    private static final DisplayOptions DISPLAY_OPTIONS = DisplayOptions.builder()
            .category("host")
            .displayText("平台")
            .displayStyle(DisplayStyle.TEXT)
            .ignoreFromSummary(true)
            .build();

    public PlatformInfoMonitor(Map<String, String> settings) {
    }

    @Override
    public ModuleSpec getSpec() {
        return ModuleSpec.of(ID, "0.0.1");
    }

    @Override
    public DisplayOptions getDisplayOptions() {
        return DISPLAY_OPTIONS;
    }

    @Override
    public String buildCommand(ModuleContext context, DataPoint prior) {
        StringBuilder command = new StringBuilder("uname -sm; cat /etc/os-release 2>/dev/null; for c in");
        SUBSYSTEM_PROBES.keySet().forEach(name -> command.append(' ').append(name));
        command.append("; do command -v $c >/dev/null 2>&1 && echo \"")
                .append(SUBSYSTEM_PREFIX)
                .append("$c\"; done; true");
        return command.toString();
    }

    @Override
    public DataPoint parseResult(ModuleContext context, CommandResponse response) {
        PlatformInfo platform = parsePlatform(response.stdout());
        if (!platform.isKnown()) {
            throw new IllegalArgumentException("无法识别的平台输出");
        }
        DataPoint.DataPointBuilder builder = DataPoint.builder()
                .label("platform")
                .value((platform.getFlavor() + " " + platform.getVersion()).trim())
                .description(platform.getOs() + " " + platform.getArchitecture())
                .tags(platform.getSubsystems());
        builder.child(DataPoint.labeled("os", platform.getOs().name(), Criticality.NORMAL));
        builder.child(DataPoint.labeled("flavor", platform.getFlavor().name(), Criticality.NORMAL));
        builder.child(DataPoint.labeled("version", platform.getVersion(), Criticality.NORMAL));
        builder.child(DataPoint.labeled("architecture", platform.getArchitecture(), Criticality.NORMAL));
        return builder.build();
    }

    /**
     * 解析 uname 与 /etc/os-release 输出
     */
    public static PlatformInfo parsePlatform(String output) {
        if (output == null || output.isBlank()) {
            return PlatformInfo.UNKNOWN;
        }
        String[] lines = output.strip().split("\\R");
        String[] uname = lines[0].trim().split("\\s+");

        Map<String, String> osRelease = new LinkedHashMap<>();
        Set<String> subsystems = new LinkedHashSet<>();
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.startsWith(SUBSYSTEM_PREFIX)) {
                String probe = line.substring(SUBSYSTEM_PREFIX.length());
                subsystems.add(SUBSYSTEM_PROBES.getOrDefault(probe, probe));
                continue;
            }
            int separator = line.indexOf('=');
            if (separator > 0) {
                String value = line.substring(separator + 1).trim();
                if (value.length() >= 2 && (value.startsWith("\"") || value.startsWith("'"))) {
                    value = value.substring(1, value.length() - 1);
                }
                osRelease.put(line.substring(0, separator).trim(), value);
            }
        }

        return PlatformInfo.builder()
                .os(PlatformInfo.OperatingSystem.fromUname(uname[0]))
                .architecture(uname.length > 1 ? uname[1] : "")
                .flavor(PlatformInfo.Flavor.fromOsReleaseId(osRelease.get("ID")))
                .version(osRelease.getOrDefault("VERSION_ID", ""))
                .subsystems(Set.copyOf(subsystems))
                .build();
    }

    /**
     * 从缓存的数据点还原平台信息
     */
    public static PlatformInfo fromDataPoint(DataPoint dataPoint) {
        if (dataPoint == null || dataPoint.isError()) {
            return PlatformInfo.UNKNOWN;
        }
        Map<String, String> values = new LinkedHashMap<>();
        dataPoint.getMultivalue().forEach(child -> values.put(child.getLabel(), child.getValue()));
        try {
            return PlatformInfo.builder()
                    .os(PlatformInfo.OperatingSystem.valueOf(values.getOrDefault("os", "UNKNOWN")))
                    .flavor(PlatformInfo.Flavor.valueOf(values.getOrDefault("flavor", "UNKNOWN")))
                    .version(values.getOrDefault("version", ""))
                    .architecture(values.getOrDefault("architecture", ""))
                    .subsystems(Set.copyOf(dataPoint.getTags()))
                    .build();
        } catch (IllegalArgumentException e) {
            return PlatformInfo.UNKNOWN;
        }
    }
}
