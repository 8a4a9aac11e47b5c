package com.wangbin.hostkeeper.core.module.monitor;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.common.utils.JsonUtil;
import com.wangbin.hostkeeper.common.utils.ShellCommand;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.MonitorModule;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * NixOS 配置代数
 */
public class NixosGenerationsMonitor implements MonitorModule {

    public static final String ID = "nixos-rebuild-generations";

    public NixosGenerationsMonitor(Map<String, String> settings) {
    }

    @Override
    public ModuleSpec getSpec() {
        return ModuleSpec.of(ID, "0.0.1");
    }

    @Override
    public DisplayOptions getDisplayOptions() {
        return DisplayOptions.builder()
                .category("nixos")
                .displayText("配置代数")
                .displayStyle(DisplayStyle.TEXT)
                .useMultivalue(true)
                .ignoreFromSummary(true)
                .build();
    }

    @Override
    public boolean isApplicable(PlatformInfo platform) {
        return platform.isSameOrGreater(PlatformInfo.Flavor.NIXOS, "20");
    }

    @Override
    public String buildCommand(ModuleContext context, DataPoint prior) {
        return ShellCommand.of("nixos-rebuild", "list-generations", "--json")
                .useSudo(context.useSudo())
                .ignoreStderr(true)
                .toString();
    }

    @Override
    public DataPoint parseResult(ModuleContext context, CommandResponse response) {
        JSONArray array = JsonUtil.parseArrayStrict(response.stdout());
        List<JSONObject> generations = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            generations.add(array.getJSONObject(i));
        }
        generations.sort(Comparator.comparingInt((JSONObject g) -> g.getIntValue("generation")).reversed());

        DataPoint.DataPointBuilder result = DataPoint.builder();
        for (JSONObject generation : generations) {
            String date = generation.getString("date");
            date = date != null ? date.replace("T", " ").replace("Z", "") : "";

            DataPoint.DataPointBuilder point = DataPoint.builder()
                    .label(String.format("#%d @ %s", generation.getIntValue("generation"), date))
                    .description(String.format("NixOS %s | Kernel %s",
                            generation.getString("nixosVersion"), generation.getString("kernelVersion")));
            if (generation.getBooleanValue("current")) {
                point.tag("Current");
            }
            result.child(point.build());
        }
        return result.build();
    }
}
