package com.wangbin.hostkeeper.core.module.command;

import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.common.utils.ShellCommand;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.CommandModule;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;

import java.util.List;
import java.util.Map;

/**
 * 关机，执行前需要确认
 */
public class ShutdownCommand implements CommandModule {

    public static final String ID = "shutdown";

    public ShutdownCommand(Map<String, String> settings) {
    }

    @Override
    public ModuleSpec getSpec() {
        return ModuleSpec.of(ID, "0.0.1");
    }

    @Override
    public DisplayOptions getDisplayOptions() {
        return DisplayOptions.builder()
                .category("host")
                .displayText("关机")
                .displayStyle(DisplayStyle.ICON)
                .confirmationText("确定要关闭主机吗？")
                .build();
    }

    @Override
    public boolean isApplicable(PlatformInfo platform) {
        return platform.isLinux();
    }

    @Override
    public String buildCommand(ModuleContext context, List<String> params) {
        return ShellCommand.of("poweroff").useSudo(context.useSudo()).toString();
    }

    @Override
    public CommandResult parseResult(ModuleContext context, CommandResponse response) {
        String output = response.stdout().strip();
        if (!output.isEmpty()) {
            return CommandResult.builder().message(output).criticality(Criticality.WARNING).build();
        }
        return CommandResult.of("");
    }
}
