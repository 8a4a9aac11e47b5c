package com.wangbin.hostkeeper.core.module.command;

import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.common.utils.ShellCommand;
import com.wangbin.hostkeeper.common.utils.ValidatorUtil;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.CommandModule;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.InputSpec;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 屏蔽 systemd 服务
 */
public class SystemdServiceMaskCommand implements CommandModule {

    public static final String ID = "systemd-service-mask";

    private static final List<InputSpec> INPUTS = List.of(new InputSpec("服务名", null, null, List.of()));

    public SystemdServiceMaskCommand(Map<String, String> settings) {
    }

    @Override
    public ModuleSpec getSpec() {
        return ModuleSpec.of(ID, "0.0.1");
    }

    @Override
    public DisplayOptions getDisplayOptions() {
        return DisplayOptions.builder()
                .category("systemd")
                .parentId("systemd-service")
                .displayText("屏蔽")
                .displayStyle(DisplayStyle.ICON)
                .multivalueLevel(1)
                .build();
    }

    @Override
    public boolean isApplicable(PlatformInfo platform) {
        return platform.isLinux() && platform.hasSubsystem("systemd");
    }

    @Override
    public List<InputSpec> getInputSpecs() {
        return INPUTS;
    }

    @Override
    public Optional<String> validate(List<String> params) {
        if (params.isEmpty() || !ValidatorUtil.isValidUnitName(params.get(0))) {
            return Optional.of("非法的服务名: " + (params.isEmpty() ? "" : params.get(0)));
        }
        return Optional.empty();
    }

    @Override
    public String buildCommand(ModuleContext context, List<String> params) {
        return ShellCommand.of("systemctl", "mask", params.get(0))
                .useSudo(context.useSudo())
                .toString();
    }

    @Override
    public CommandResult parseResult(ModuleContext context, CommandResponse response) {
        return CommandResult.of(response.stdout().strip());
    }
}
