package com.wangbin.hostkeeper.core.module;

import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.InputSpec;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 命令模块
 */
public non-sealed interface CommandModule extends Module {

    String buildCommand(ModuleContext context, List<String> params);

    CommandResult parseResult(ModuleContext context, CommandResponse response) throws Exception;

    /**
     * 需要用户填写的输入项
     */
    default List<InputSpec> getInputSpecs() {
        return List.of();
    }

    /**
     * 模块自定义参数校验
     *
     * @return 错误信息，通过时为空
     */
    default Optional<String> validate(List<String> params) {
        return Optional.empty();
    }

    @Override
    default Set<ModuleCapability> getCapabilities() {
        Set<ModuleCapability> capabilities = EnumSet.of(ModuleCapability.BUILDS_COMMAND, ModuleCapability.PARSES_RESULT);
        if (getDisplayOptions().requiresConfirmation()) {
            capabilities.add(ModuleCapability.REQUIRES_CONFIRMATION);
        }
        if (!getInputSpecs().isEmpty()) {
            capabilities.add(ModuleCapability.REQUIRES_INPUT);
        }
        return capabilities;
    }
}
