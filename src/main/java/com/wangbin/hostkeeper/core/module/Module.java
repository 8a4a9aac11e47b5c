package com.wangbin.hostkeeper.core.module;

import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;

import java.util.EnumSet;
import java.util.Set;

/**
 * 模块：监控或命令
 */
public sealed interface Module permits MonitorModule, CommandModule {

    ModuleSpec getSpec();

    DisplayOptions getDisplayOptions();

    default String getId() {
        return getSpec().id();
    }

    default String getCategory() {
        return getDisplayOptions().getCategory();
    }

    /**
     * 是否适用于该平台
     */
    default boolean isApplicable(PlatformInfo platform) {
        return true;
    }

    default Set<ModuleCapability> getCapabilities() {
        return EnumSet.of(ModuleCapability.BUILDS_COMMAND, ModuleCapability.PARSES_RESULT);
    }

    default boolean hasCapability(ModuleCapability capability) {
        return getCapabilities().contains(capability);
    }
}
