package com.wangbin.hostkeeper.core.module.command;

import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.common.enums.UIAction;
import com.wangbin.hostkeeper.common.utils.ShellCommand;
import com.wangbin.hostkeeper.common.utils.ValidatorUtil;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.CommandModule;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.InputSpec;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.Pagination;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * journald 日志
 *
 * 参数：单元（"all"、"dmesg" 或单元名）、过滤正则、页码、每页行数
 */
public class LogsCommand implements CommandModule {

    public static final String ID = "logs";

    static final String ALL = "all";
    static final String DMESG = "dmesg";

    private static final List<InputSpec> INPUTS = List.of(
            InputSpec.text("单元", ALL),
            InputSpec.text("过滤", ""));

    public LogsCommand(Map<String, String> settings) {
    }

    @Override
    public ModuleSpec getSpec() {
        return ModuleSpec.of(ID, "0.0.1");
    }

    @Override
    public DisplayOptions getDisplayOptions() {
        return DisplayOptions.builder()
                .category("host")
                .displayText("查看日志")
                .displayStyle(DisplayStyle.ICON)
                .action(UIAction.LOG_VIEW)
                .build();
    }

    @Override
    public boolean isApplicable(PlatformInfo platform) {
        return platform.isLinux() && platform.hasSubsystem("journald");
    }

    @Override
    public List<InputSpec> getInputSpecs() {
        return INPUTS;
    }

    @Override
    public Optional<String> validate(List<String> params) {
        String unit = params.isEmpty() ? ALL : params.get(0);
        if (!unit.isEmpty() && !ALL.equals(unit) && !DMESG.equals(unit) && !ValidatorUtil.isValidUnitName(unit)) {
            return Optional.of("非法的单元名: " + unit);
        }
        return Pagination.from(params, 2).validate();
    }

    @Override
    public String buildCommand(ModuleContext context, List<String> params) {
        String unit = params.isEmpty() ? ALL : params.get(0);
        String filter = params.size() > 1 ? params.get(1) : "";
        Pagination page = Pagination.from(params, 2);

        ShellCommand command = ShellCommand.of("journalctl", "-q", "-n", String.valueOf(page.tailLines()))
                .useSudo(context.useSudo());
        if (DMESG.equals(unit)) {
            command.argument("--dmesg");
        } else if (!unit.isEmpty() && !ALL.equals(unit)) {
            command.arguments("-u", unit);
        }
        if (!filter.isEmpty()) {
            command.arguments("-g", filter);
        }

        String result = command.toString();
        if (!page.isFirstPage()) {
            result += " | head -n " + page.pageSize();
        }
        return result;
    }

    @Override
    public CommandResult parseResult(ModuleContext context, CommandResponse response) {
        return CommandResult.hidden(response.stdout());
    }
}
