package com.wangbin.hostkeeper.core.module.monitor;

import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.common.utils.ShellCommand;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.MonitorModule;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo.Flavor;

import java.util.Map;

/**
 * LVM 物理卷
 */
public class LvmPhysicalVolumeMonitor implements MonitorModule {

    public static final String ID = "storage-lvm-physical-volume";

    public LvmPhysicalVolumeMonitor(Map<String, String> settings) {
    }

    @Override
    public ModuleSpec getSpec() {
        return ModuleSpec.of(ID, "0.0.1");
    }

    @Override
    public DisplayOptions getDisplayOptions() {
        return DisplayOptions.builder()
                .category("storage")
                .displayText("物理卷")
                .displayStyle(DisplayStyle.CRITICALITY_LEVEL)
                .useMultivalue(true)
                .ignoreFromSummary(true)
                .build();
    }

    @Override
    public boolean isApplicable(PlatformInfo platform) {
        return platform.isSameOrGreater(Flavor.DEBIAN, "9")
                || platform.isSameOrGreater(Flavor.UBUNTU, "20")
                || platform.isSameOrGreater(Flavor.CENTOS, "8")
                || platform.isSameOrGreater(Flavor.REDHAT, "8");
    }

    @Override
    public String buildCommand(ModuleContext context, DataPoint prior) {
        return ShellCommand.of("pvs", "--separator", "|", "--options", "pv_name,pv_attr,pv_size", "--units", "H")
                .useSudo(context.useSudo())
                .toString();
    }

    @Override
    public DataPoint parseResult(ModuleContext context, CommandResponse response) {
        DataPoint.DataPointBuilder result = DataPoint.builder();
        String output = response.stdout();
        if (output == null || output.isBlank()) {
            return result.build();
        }

        String[] lines = output.split("\\R");
        // 第一行是表头
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            String[] parts = line.split("\\|");
            if (parts.length < 3) {
                throw new IllegalArgumentException("无法解析的 pvs 输出行: " + line);
            }
            String name = parts[0].trim();
            String attr = parts[1].trim();
            String size = parts[2].trim();

            DataPoint.DataPointBuilder volume = DataPoint.builder()
                    .label(name)
                    .value("OK")
                    .description("size: " + size)
                    .commandParam(name);
            if (attr.length() > 2 && attr.charAt(2) == 'm') {
                volume.value("Missing").criticality(Criticality.CRITICAL);
            }
            result.child(volume.build());
        }
        return result.build();
    }
}
