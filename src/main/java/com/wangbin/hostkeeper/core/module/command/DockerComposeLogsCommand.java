package com.wangbin.hostkeeper.core.module.command;

import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.common.enums.UIAction;
import com.wangbin.hostkeeper.common.utils.ShellCommand;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.CommandModule;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.InputSpec;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.Pagination;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo.Flavor;
import com.wangbin.hostkeeper.core.module.monitor.DockerComposeMonitor;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * docker-compose 服务日志
 *
 * 参数：compose 文件、服务或项目名、页码、每页行数
 */
public class DockerComposeLogsCommand implements CommandModule {

    public static final String ID = "docker-compose-logs";

    private static final List<InputSpec> INPUTS = List.of(
            InputSpec.text("compose 文件", null),
            InputSpec.text("服务", null));

    public DockerComposeLogsCommand(Map<String, String> settings) {
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
                .displayText("日志")
                .displayStyle(DisplayStyle.ICON)
                .action(UIAction.LOG_VIEW)
                .multivalueLevel(2)
                .build();
    }

    @Override
    public boolean isApplicable(PlatformInfo platform) {
        return usesPlugin(platform) || usesStandalone(platform);
    }

    @Override
    public List<InputSpec> getInputSpecs() {
        return INPUTS;
    }

    @Override
    public Optional<String> validate(List<String> params) {
        if (params.size() < 2 || params.get(0).isBlank() || params.get(1).isBlank()) {
            return Optional.of("缺少 compose 文件或服务名");
        }
        return Pagination.from(params, 2).validate();
    }

    @Override
    public String buildCommand(ModuleContext context, List<String> params) {
        Pagination page = Pagination.from(params, 2);
        ShellCommand command = usesPlugin(context.platform())
                ? ShellCommand.of("docker", "compose")
                : ShellCommand.of("docker-compose");
        command.arguments("-f", params.get(0), "logs", "--tail", String.valueOf(page.tailLines()),
                        "--no-color", "-t", params.get(1))
                .useSudo(context.useSudo());

        String result = command.toString();
        if (!page.isFirstPage()) {
            result += " | head -n " + page.pageSize();
        }
        return result;
    }

    /**
     * 去掉每行前缀 "project_service_1  |"
     */
    @Override
    public CommandResult parseResult(ModuleContext context, CommandResponse response) {
        String output = response.stdout().lines()
                .map(DockerComposeLogsCommand::stripServicePrefix)
                .collect(Collectors.joining("\n"));
        return CommandResult.hidden(output);
    }

    static String stripServicePrefix(String line) {
        int separator = line.indexOf('|');
        return separator >= 0 ? line.substring(separator + 1).stripLeading() : line;
    }

    private static boolean usesPlugin(PlatformInfo platform) {
        return platform.isSameOrGreater(Flavor.REDHAT, "8") || platform.isSameOrGreater(Flavor.CENTOS, "8");
    }

    private static boolean usesStandalone(PlatformInfo platform) {
        return platform.isSameOrGreater(Flavor.DEBIAN, "8") || platform.isSameOrGreater(Flavor.UBUNTU, "20")
                || platform.hasSubsystem("docker-compose");
    }
}
