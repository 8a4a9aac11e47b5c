package com.wangbin.hostkeeper.core.module;

import com.wangbin.hostkeeper.common.exception.ErrorKind;
import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.core.cache.manager.HostStateCache;
import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.config.model.CommandConfig;
import com.wangbin.hostkeeper.core.config.model.EffectiveConfig;
import com.wangbin.hostkeeper.core.config.model.HostSetting;
import com.wangbin.hostkeeper.core.config.model.MonitorConfig;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.model.CommandData;
import com.wangbin.hostkeeper.core.module.model.InputSpec;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import com.wangbin.hostkeeper.core.module.monitor.UptimeMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModuleRegistryTest {

    private static final String HOST = "web-1";

    private static final PlatformInfo DEBIAN_DOCKER = PlatformInfo.builder()
            .os(PlatformInfo.OperatingSystem.LINUX)
            .flavor(PlatformInfo.Flavor.DEBIAN)
            .version("12")
            .subsystems(Set.of("docker", "apt", "journald"))
            .build();

    private HostStateCache stateCache;
    private ModuleRegistry registry;

    @BeforeEach
    void setUp() {
        stateCache = new HostStateCache(new KeeperProperties());
        registry = new ModuleRegistry(stateCache);

        Map<String, MonitorConfig> monitors = new LinkedHashMap<>();
        monitors.put("uptime", new MonitorConfig());
        monitors.put("docker-compose", new MonitorConfig());
        monitors.put("no-such-monitor", new MonitorConfig());

        CommandConfig packages = new CommandConfig();
        packages.setInputPattern("^[a-z]+$");
        CommandConfig disabled = new CommandConfig();
        disabled.setEnabled(false);

        Map<String, CommandConfig> commands = new LinkedHashMap<>();
        commands.put("shutdown", new CommandConfig());
        commands.put("logs", new CommandConfig());
        commands.put("linux-packages-update", packages);
        commands.put("docker-compose-logs", new CommandConfig());
        commands.put("docker-compose-start", new CommandConfig());
        commands.put("systemd-service-mask", disabled);

        registry.configure(new EffectiveConfig(HOST, "10.0.0.1", "", List.of(),
                Set.of(HostSetting.USE_SUDO), monitors, commands, Map.of()));
    }

    @Test
    void unknownAndDisabledModulesAreSkipped() {
        assertTrue(registry.isConfigured(HOST));
        assertNotNull(registry.getModule(HOST, "platform-info"));
        assertNotNull(registry.getModule(HOST, "uptime"));

        KeeperException unknown = assertThrows(KeeperException.class,
                () -> registry.getModule(HOST, "no-such-monitor"));
        assertTrue(unknown.is(ErrorKind.NOT_FOUND));
        assertThrows(KeeperException.class, () -> registry.getModule(HOST, "systemd-service-mask"));
    }

    @Test
    void onlyPlatformInfoAppliesWhilePlatformUnknown() {
        List<String> ids = registry.applicableModules(HOST, null).stream().map(Module::getId).toList();

        assertEquals(List.of("platform-info"), ids);
        assertTrue(registry.getCommands(HOST).isEmpty());
    }

    @Test
    void knownPlatformFiltersModules() {
        stateCache.setPlatform(HOST, DEBIAN_DOCKER);

        assertEquals(List.of("platform-info", "uptime", "docker-compose"),
                registry.applicableMonitors(HOST, null).stream().map(Module::getId).toList());
        assertEquals(List.of("shutdown", "logs", "linux-packages-update", "docker-compose-logs", "docker-compose-start"),
                registry.applicableCommands(HOST, null).stream().map(Module::getId).toList());
        assertEquals(List.of("docker-compose"),
                registry.applicableMonitors(HOST, "docker-compose").stream().map(Module::getId).toList());
    }

    @Test
    void childCommandsByParentAndLevel() {
        stateCache.setPlatform(HOST, DEBIAN_DOCKER);

        List<CommandData> level2 = registry.getChildCommands(HOST, "docker-compose", "docker-compose", 2);
        List<CommandData> level1 = registry.getChildCommands(HOST, "docker-compose", "docker-compose", 1);

        assertEquals(List.of("docker-compose-logs"), level2.stream().map(CommandData::commandId).toList());
        assertEquals(List.of("docker-compose-start"), level1.stream().map(CommandData::commandId).toList());
        assertTrue(registry.getChildCommands(HOST, "docker-compose", "other", 2).isEmpty());
    }

    @Test
    void requiresInputWhenMandatoryValueMissing() {
        CommandModule packages = command("linux-packages-update");
        CommandModule composeLogs = command("docker-compose-logs");

        assertTrue(registry.requiresInput(packages, List.of()));
        assertFalse(registry.requiresInput(packages, List.of("curl")));
        assertTrue(registry.requiresInput(composeLogs, List.of("/srv/shop/docker-compose.yml")));
        assertFalse(registry.requiresInput(command("shutdown"), List.of()));
        assertFalse(registry.requiresInput(command("logs"), List.of("nginx.service")));
    }

    @Test
    void validateInputCompletesDefaultsAndKeepsPaging() {
        CommandModule logs = command("logs");

        assertEquals(List.of("nginx.service", ""), registry.validateInput(HOST, logs, List.of("nginx.service")));
        assertEquals(List.of("all", "", "2", "50"), registry.validateInput(HOST, logs, List.of("all", "", "2", "50")));
    }

    @Test
    void configuredPatternOverridesModulePattern() {
        CommandModule packages = command("linux-packages-update");

        List<InputSpec> inputs = registry.inputSpecsFor(HOST, packages);
        assertEquals("^[a-z]+$", inputs.get(0).validatorPattern());

        assertEquals(List.of("curl"), registry.validateInput(HOST, packages, List.of("curl")));
        KeeperException e = assertThrows(KeeperException.class,
                () -> registry.validateInput(HOST, packages, List.of("libc6")));
        assertTrue(e.is(ErrorKind.VALIDATION));
    }

    @Test
    void moduleValidationIsApplied() {
        KeeperException e = assertThrows(KeeperException.class,
                () -> registry.validateInput(HOST, command("logs"), List.of("nginx;reboot")));
        assertTrue(e.is(ErrorKind.VALIDATION));
    }

    @Test
    void parseFailureBecomesParseError() {
        Module uptime = registry.getModule(HOST, "uptime");

        KeeperException e = assertThrows(KeeperException.class,
                () -> registry.parseResult(HOST, uptime, CommandResponse.ok("not a date")));
        assertTrue(e.is(ErrorKind.PARSE));
    }

    @Test
    void contextCarriesSudoSetting() {
        stateCache.setPlatform(HOST, DEBIAN_DOCKER);

        String command = registry.buildCommand(HOST, command("shutdown"), List.of());

        assertEquals("sudo poweroff", command);
        assertTrue(registry.contextFor(HOST, command("shutdown")).useSudo());
    }

    @Test
    void removedHostHasNoModules() {
        registry.remove(HOST);

        assertFalse(registry.isConfigured(HOST));
        assertTrue(registry.applicableModules(HOST, null).isEmpty());
        assertThrows(KeeperException.class, () -> registry.getModule(HOST, "uptime"));
    }

    @Test
    void customModulesCanBeRegistered() {
        assertFalse(registry.supports("custom"));
        registry.register("custom", UptimeMonitor::new);

        assertTrue(registry.supports("custom"));
        assertTrue(registry.getRegisteredModuleIds().contains("custom"));
    }

    private CommandModule command(String id) {
        return (CommandModule) registry.getModule(HOST, id);
    }
}
