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

import java.util.List;
import java.util.Map;

/**
 * 升级单个软件包（apt）
 */
public class PackageUpdateCommand implements CommandModule {

    public static final String ID = "linux-packages-update";

    static final String PACKAGE_NAME_PATTERN = "^[a-z0-9][a-z0-9+.:-]*$";

    private static final List<InputSpec> INPUTS =
            List.of(InputSpec.validated("软件包", null, PACKAGE_NAME_PATTERN));

    public PackageUpdateCommand(Map<String, String> settings) {
    }

    @Override
    public ModuleSpec getSpec() {
        return ModuleSpec.of(ID, "0.0.1");
    }

    @Override
    public DisplayOptions getDisplayOptions() {
        return DisplayOptions.builder()
                .category("packages")
                .parentId("package")
                .displayText("升级软件包")
                .displayStyle(DisplayStyle.ICON)
                .multivalueLevel(1)
                .build();
    }

    @Override
    public boolean isApplicable(PlatformInfo platform) {
        return platform.isLinux() && platform.hasSubsystem("apt");
    }

    @Override
    public List<InputSpec> getInputSpecs() {
        return INPUTS;
    }

    @Override
    public String buildCommand(ModuleContext context, List<String> params) {
        return ShellCommand.of("apt", "--only-upgrade", "-y", "install", params.get(0))
                .useSudo(context.useSudo())
                .toString();
    }

    @Override
    public CommandResult parseResult(ModuleContext context, CommandResponse response) {
        return CommandResult.of(response.stdout().strip());
    }
}
