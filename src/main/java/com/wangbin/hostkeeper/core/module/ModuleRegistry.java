package com.wangbin.hostkeeper.core.module;

import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.core.cache.manager.HostStateCache;
import com.wangbin.hostkeeper.core.config.model.CommandConfig;
import com.wangbin.hostkeeper.core.config.model.EffectiveConfig;
import com.wangbin.hostkeeper.core.config.model.MonitorConfig;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.command.DockerComposeLogsCommand;
import com.wangbin.hostkeeper.core.module.command.DockerComposeStartCommand;
import com.wangbin.hostkeeper.core.module.command.LogsCommand;
import com.wangbin.hostkeeper.core.module.command.PackageUpdateCommand;
import com.wangbin.hostkeeper.core.module.command.ShutdownCommand;
import com.wangbin.hostkeeper.core.module.command.SystemdServiceMaskCommand;
import com.wangbin.hostkeeper.core.module.model.CommandData;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.InputSpec;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleResult;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import com.wangbin.hostkeeper.core.module.monitor.DockerComposeMonitor;
import com.wangbin.hostkeeper.core.module.monitor.LvmPhysicalVolumeMonitor;
import com.wangbin.hostkeeper.core.module.monitor.NixosGenerationsMonitor;
import com.wangbin.hostkeeper.core.module.monitor.PlatformInfoMonitor;
import com.wangbin.hostkeeper.core.module.monitor.UptimeMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 模块注册表
 *
 * 内置模块在启动时按ID注册；每台主机根据有效配置创建自己的模块实例。
 * 平台未知时只有 platform-info 适用。
 */
@Slf4j
@Component
public class ModuleRegistry {

    private final HostStateCache stateCache;

    private final Map<String, ModuleCreator> creators = new ConcurrentHashMap<>();

    // 主机模块：hostId -> HostModules
    private final Map<String, HostModules> hostModules = new ConcurrentHashMap<>();

    public ModuleRegistry(HostStateCache stateCache) {
        this.stateCache = stateCache;
        registerBuiltinModules();
    }

    /**
     * 注册模块
     */
    public void register(String moduleId, ModuleCreator creator) {
        creators.put(moduleId, creator);
        log.debug("注册模块: {}", moduleId);
    }

    public boolean supports(String moduleId) {
        return creators.containsKey(moduleId);
    }

    public Set<String> getRegisteredModuleIds() {
        return Collections.unmodifiableSet(new TreeSet<>(creators.keySet()));
    }

    /**
     * 根据有效配置创建主机的模块实例，替换旧实例
     */
    public void configure(EffectiveConfig config) {
        String hostId = config.getHostId();
        Map<String, MonitorModule> monitors = new LinkedHashMap<>();
        Map<String, CommandModule> commands = new LinkedHashMap<>();

        monitors.put(PlatformInfoMonitor.ID, new PlatformInfoMonitor(Map.of()));

        for (Map.Entry<String, MonitorConfig> entry : config.getMonitors().entrySet()) {
            String moduleId = entry.getKey();
            MonitorConfig monitorConfig = entry.getValue();
            if (!monitorConfig.isEnabledOrDefault() || PlatformInfoMonitor.ID.equals(moduleId)) {
                continue;
            }
            Module module = create(hostId, moduleId, monitorConfig.getSettings());
            if (module instanceof MonitorModule monitor) {
                monitors.put(moduleId, monitor);
            } else if (module != null) {
                log.warn("主机 {} 的模块 {} 不是监控模块，已跳过", hostId, moduleId);
            }
        }

        for (Map.Entry<String, CommandConfig> entry : config.getCommands().entrySet()) {
            String moduleId = entry.getKey();
            CommandConfig commandConfig = entry.getValue();
            if (!commandConfig.isEnabledOrDefault()) {
                continue;
            }
            Module module = create(hostId, moduleId, commandConfig.getSettings());
            if (module instanceof CommandModule command) {
                commands.put(moduleId, command);
            } else if (module != null) {
                log.warn("主机 {} 的模块 {} 不是命令模块，已跳过", hostId, moduleId);
            }
        }

        hostModules.put(hostId, new HostModules(config, monitors, commands));
        log.info("主机模块已配置: {}, 监控: {}, 命令: {}", hostId, monitors.keySet(), commands.keySet());
    }

    public void remove(String hostId) {
        hostModules.remove(hostId);
    }

    public boolean isConfigured(String hostId) {
        return hostModules.containsKey(hostId);
    }

    /**
     * 获取主机的模块
     *
     * @throws KeeperException 主机未配置或模块不存在时抛出 NOT_FOUND
     */
    public Module getModule(String hostId, String moduleId) {
        HostModules modules = requireHost(hostId);
        Module module = modules.monitors().get(moduleId);
        if (module == null) {
            module = modules.commands().get(moduleId);
        }
        if (module == null) {
            throw KeeperException.notFound("模块不存在或未启用: " + moduleId, hostId, moduleId);
        }
        return module;
    }

    /**
     * 适用于主机平台的模块
     *
     * @param category 分类，null 表示全部
     */
    public List<Module> applicableModules(String hostId, String category) {
        List<Module> result = new ArrayList<>(applicableMonitors(hostId, category));
        result.addAll(applicableCommands(hostId, category));
        return result;
    }

    public List<MonitorModule> applicableMonitors(String hostId, String category) {
        HostModules modules = hostModules.get(hostId);
        if (modules == null) {
            return List.of();
        }
        PlatformInfo platform = stateCache.getPlatform(hostId);
        return modules.monitors().values().stream()
                .filter(module -> isApplicable(module, platform))
                .filter(module -> category == null || category.equals(module.getCategory()))
                .toList();
    }

    public List<CommandModule> applicableCommands(String hostId, String category) {
        HostModules modules = hostModules.get(hostId);
        if (modules == null) {
            return List.of();
        }
        PlatformInfo platform = stateCache.getPlatform(hostId);
        return modules.commands().values().stream()
                .filter(module -> isApplicable(module, platform))
                .filter(module -> category == null || category.equals(module.getCategory()))
                .toList();
    }

    public boolean isApplicable(String hostId, Module module) {
        return isApplicable(module, stateCache.getPlatform(hostId));
    }

    /**
     * 构建监控命令
     */
    public String buildCommand(String hostId, MonitorModule module, DataPoint prior) {
        return module.buildCommand(contextFor(hostId, module), prior);
    }

    /**
     * 构建命令模块的远程命令
     */
    public String buildCommand(String hostId, CommandModule module, List<String> params) {
        return module.buildCommand(contextFor(hostId, module), params);
    }

    /**
     * 解析命令输出
     *
     * @throws KeeperException 输出格式不符合预期时抛出 PARSE
     */
    public ModuleResult parseResult(String hostId, Module module, CommandResponse response) {
        ModuleContext context = contextFor(hostId, module);
        try {
            if (module instanceof MonitorModule monitor) {
                return Objects.requireNonNull(monitor.parseResult(context, response), "解析结果为空");
            }
            return Objects.requireNonNull(((CommandModule) module).parseResult(context, response), "解析结果为空");
        } catch (KeeperException e) {
            throw e;
        } catch (Exception e) {
            throw KeeperException.parseException("无法解析输出: " + e.getMessage(), hostId, module.getId(), e);
        }
    }

    /**
     * 是否需要打开输入对话框补全参数
     */
    public boolean requiresInput(CommandModule module, List<String> params) {
        List<InputSpec> inputs = module.getInputSpecs();
        if (inputs.isEmpty()) {
            return false;
        }
        if (params == null || params.isEmpty()) {
            return true;
        }
        for (int i = params.size(); i < inputs.size(); i++) {
            if (inputs.get(i).defaultValue() == null) {
                return true;
            }
        }
        return false;
    }

    /**
     * 校验输入并补全默认值
     *
     * @return 补全后的参数，输入项之后的参数（如分页）原样保留
     * @throws KeeperException 校验失败时抛出 VALIDATION
     */
    public List<String> validateInput(String hostId, CommandModule module, List<String> params) {
        List<String> provided = params != null ? params : List.of();
        List<InputSpec> inputs = inputSpecsFor(hostId, module);
        List<String> completed = new ArrayList<>(provided);

        for (int i = 0; i < inputs.size(); i++) {
            InputSpec input = inputs.get(i);
            String value = i < provided.size() ? provided.get(i) : input.defaultValue();
            if (value == null) {
                throw KeeperException.validationException("缺少输入: " + input.label(), hostId, module.getId());
            }
            if (input.validatorPattern() != null && !matches(input.validatorPattern(), value)) {
                throw KeeperException.validationException(
                        String.format("输入 %s 不符合格式: %s", input.label(), value), hostId, module.getId());
            }
            if (!input.choices().isEmpty() && !input.choices().contains(value)) {
                throw KeeperException.validationException(
                        String.format("输入 %s 不是可选值之一: %s", input.label(), value), hostId, module.getId());
            }
            if (i >= completed.size()) {
                completed.add(value);
            }
        }

        Optional<String> error = module.validate(completed);
        if (error.isPresent()) {
            throw KeeperException.validationException(error.get(), hostId, module.getId());
        }
        return completed;
    }

    /**
     * 输入项，配置中的 input_pattern 覆盖模块内置正则
     */
    public List<InputSpec> inputSpecsFor(String hostId, CommandModule module) {
        HostModules modules = hostModules.get(hostId);
        CommandConfig config = modules != null ? modules.config().getCommands().get(module.getId()) : null;
        if (config == null || config.getInputPattern() == null) {
            return module.getInputSpecs();
        }
        return module.getInputSpecs().stream()
                .map(input -> input.withPattern(config.getInputPattern()))
                .toList();
    }

    /**
     * 主机可用的全部命令
     */
    public List<CommandData> getCommands(String hostId) {
        return applicableCommands(hostId, null).stream()
                .map(command -> toCommandData(hostId, command))
                .toList();
    }

    /**
     * 挂载在某个监控多值树层级上的命令
     */
    public List<CommandData> getChildCommands(String hostId, String category, String parentId, int level) {
        return applicableCommands(hostId, category).stream()
                .filter(command -> {
                    DisplayOptions options = command.getDisplayOptions();
                    return Objects.equals(parentId, options.getParentId()) && options.getMultivalueLevel() == level;
                })
                .map(command -> toCommandData(hostId, command))
                .toList();
    }

    /**
     * 构建模块上下文
     */
    public ModuleContext contextFor(String hostId, Module module) {
        HostModules modules = hostModules.get(hostId);
        if (modules == null) {
            return new ModuleContext(hostId, stateCache.getPlatform(hostId), false, Map.of());
        }
        EffectiveConfig config = modules.config();
        Map<String, String> settings;
        if (module instanceof MonitorModule) {
            MonitorConfig monitorConfig = config.getMonitors().get(module.getId());
            settings = monitorConfig != null ? monitorConfig.getSettings() : Map.of();
        } else {
            CommandConfig commandConfig = config.getCommands().get(module.getId());
            settings = commandConfig != null ? commandConfig.getSettings() : Map.of();
        }
        return new ModuleContext(hostId, stateCache.getPlatform(hostId), config.useSudo(), settings);
    }

    private CommandData toCommandData(String hostId, CommandModule command) {
        return new CommandData(command.getId(), command.getDisplayOptions(), inputSpecsFor(hostId, command));
    }

    private HostModules requireHost(String hostId) {
        HostModules modules = hostModules.get(hostId);
        if (modules == null) {
            throw KeeperException.notFound("主机模块未配置: " + hostId, hostId, null);
        }
        return modules;
    }

    private Module create(String hostId, String moduleId, Map<String, String> settings) {
        ModuleCreator creator = creators.get(moduleId);
        if (creator == null) {
            log.warn("主机 {} 配置了未知模块: {}，已跳过", hostId, moduleId);
            return null;
        }
        try {
            return creator.create(settings != null ? settings : Map.of());
        } catch (Exception e) {
            log.error("模块创建失败: {} [{}]", moduleId, hostId, e);
            return null;
        }
    }

    private static boolean isApplicable(Module module, PlatformInfo platform) {
        if (PlatformInfoMonitor.ID.equals(module.getId())) {
            return true;
        }
        return platform.isKnown() && module.isApplicable(platform);
    }

    private static boolean matches(String pattern, String value) {
        try {
            return Pattern.compile(pattern).matcher(value).matches();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    private void registerBuiltinModules() {
        // 监控
        register(PlatformInfoMonitor.ID, PlatformInfoMonitor::new);
        register(UptimeMonitor.ID, UptimeMonitor::new);
        register(DockerComposeMonitor.ID, DockerComposeMonitor::new);
        register(LvmPhysicalVolumeMonitor.ID, LvmPhysicalVolumeMonitor::new);
        register(NixosGenerationsMonitor.ID, NixosGenerationsMonitor::new);

        // 命令
        register(ShutdownCommand.ID, ShutdownCommand::new);
        register(LogsCommand.ID, LogsCommand::new);
        register(SystemdServiceMaskCommand.ID, SystemdServiceMaskCommand::new);
        register(PackageUpdateCommand.ID, PackageUpdateCommand::new);
        register(DockerComposeLogsCommand.ID, DockerComposeLogsCommand::new);
        register(DockerComposeStartCommand.ID, DockerComposeStartCommand::new);
    }

    private record HostModules(EffectiveConfig config,
                               Map<String, MonitorModule> monitors,
                               Map<String, CommandModule> commands) {
    }
}
