package com.wangbin.hostkeeper.core.module.command;

import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.common.utils.ShellCommand;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.CommandModule;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.InputSpec;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import com.wangbin.hostkeeper.core.module.monitor.DockerComposeMonitor;

import java.util.List;
import java.util.Map;

/**
 * 启动 docker-compose 项目或单个服务
 */
public class DockerComposeStartCommand implements CommandModule {

    public static final String ID = "docker-compose-start";

    private static final List<InputSpec> INPUTS = List.of(InputSpec.text("compose 文件", null));

    public DockerComposeStartCommand(Map<String, String> settings) {
    }

    @Override
    public ModuleSpec getSpec() {
        return ModuleSpec.of(ID, "0.0.1");
    }

    @Override
    public DisplayOptions getDisplayOptions() {
        return DisplayOptions.builder()
                .category("docker-compose")
                .parentId(DockerComposeMonitor.ID)
                .displayText("启动")
                .displayStyle(DisplayStyle.ICON)
                .multivalueLevel(1)
                .build();
    }

    @Override
    public boolean isApplicable(PlatformInfo platform) {
        return platform.isLinux() && platform.hasSubsystem("docker");
    }

    @Override
    public List<InputSpec> getInputSpecs() {
        return INPUTS;
    }

    @Override
    public String buildCommand(ModuleContext context, List<String> params) {
        ShellCommand command = ShellCommand.of("docker-compose", "-f", params.get(0), "start");
        if (params.size() > 1 && !params.get(1).isBlank()) {
            command.argument(params.get(1));
        }
        return command.useSudo(context.useSudo()).toString();
    }

    @Override
    public CommandResult parseResult(ModuleContext context, CommandResponse response) {
        return CommandResult.of(response.stderr().isBlank() ? response.stdout().strip() : response.stderr().strip());
    }
}
