package com.wangbin.hostkeeper.core.config.manager;

import com.wangbin.hostkeeper.common.exception.ErrorKind;
import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.config.model.ConfigDefinitions;
import com.wangbin.hostkeeper.core.config.model.ConfigUpdateEvent;
import com.wangbin.hostkeeper.core.config.model.EffectiveConfig;
import com.wangbin.hostkeeper.core.config.model.GroupMergeOrder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigResolverTest {

    private static final String TEMPLATES = """
            templates:
              base:
                connectors:
                  ssh:
                    settings:
                      port: "1"
                      username: root
            """;

    private static final String GROUPS = """
            groups:
              web:
                templates: [base]
                connectors:
                  ssh:
                    settings:
                      port: "2"
              g1:
                monitors:
                  uptime:
                    settings:
                      timeout: "5"
              g2:
                host_settings: [use_sudo]
                monitors:
                  uptime:
                    settings:
                      timeout: "10"
            """;

    @TempDir
    Path configDir;

    private KeeperProperties properties;
    private DefinitionLoader loader;
    private List<Object> publishedEvents;
    private ConfigResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new KeeperProperties();
        properties.getConfig().setDirectory(configDir.toString());
        properties.getConfig().setWriteDefaults(false);
        loader = new DefinitionLoader(properties);
        publishedEvents = new ArrayList<>();
        resolver = new ConfigResolver(properties, loader, publishedEvents::add);
    }

    @Test
    void hostOverrideAlwaysWins() {
        resolver.apply(loader.parse(TEMPLATES, GROUPS, """
                hosts:
                  h:
                    groups: [web]
                    connectors:
                      ssh:
                        settings:
                          port: "3"
                """), "test");
        assertEquals("3", resolver.resolve("h").connectorSettings("ssh").get("port"));
        assertEquals("root", resolver.resolve("h").connectorSettings("ssh").get("username"));

        resolver.apply(loader.parse(TEMPLATES, GROUPS, """
                hosts:
                  h:
                    groups: [web]
                """), "test");
        assertEquals("2", resolver.resolve("h").connectorSettings("ssh").get("port"));

        resolver.apply(loader.parse(TEMPLATES, """
                groups:
                  web:
                    templates: [base]
                """, """
                hosts:
                  h:
                    groups: [web]
                """), "test");
        assertEquals("1", resolver.resolve("h").connectorSettings("ssh").get("port"));
    }

    @Test
    void laterGroupWinsByDefault() {
        resolver.apply(loader.parse(TEMPLATES, GROUPS, """
                hosts:
                  h1:
                    groups: [g1, g2]
                """), "test");
        EffectiveConfig config = resolver.resolve("h1");
        assertEquals("10", config.monitorSetting("uptime", "timeout", null));
        assertTrue(config.useSudo());
    }

    @Test
    void firstGroupWinsWhenConfigured() {
        properties.getConfig().setGroupMergeOrder(GroupMergeOrder.FIRST_WINS);
        resolver.apply(loader.parse(TEMPLATES, GROUPS, """
                hosts:
                  h1:
                    groups: [g1, g2]
                """), "test");
        assertEquals("5", resolver.resolve("h1").monitorSetting("uptime", "timeout", null));
    }

    @Test
    void resolveIsDeterministic() {
        ConfigDefinitions definitions = loader.parse(TEMPLATES, GROUPS, """
                hosts:
                  h1:
                    groups: [web, g1, g2]
                    monitors:
                      uptime:
                        enabled: false
                """);
        EffectiveConfig first = ConfigResolver.resolve(definitions, "h1", GroupMergeOrder.LAST_WINS);
        EffectiveConfig second = ConfigResolver.resolve(definitions, "h1", GroupMergeOrder.LAST_WINS);
        assertEquals(first, second);

        resolver.apply(definitions, "test");
        assertEquals(first, resolver.resolve("h1"));
        assertEquals(resolver.resolve("h1"), resolver.resolve("h1"));
        assertFalse(first.getMonitors().get("uptime").isEnabledOrDefault());
        assertEquals("10", first.monitorSetting("uptime", "timeout", null));
    }

    @Test
    void missingOptionalKeysFallBackToDefaults() {
        resolver.apply(loader.parse(null, null, """
                hosts:
                  bare:
                """), "test");
        EffectiveConfig config = resolver.resolve("bare");
        assertEquals("0.0.0.0", config.getAddress());
        assertFalse(config.useSudo());
        assertEquals("fallback", config.monitorSetting("uptime", "timeout", "fallback"));
        assertTrue(config.connectorSettings("ssh").isEmpty());
    }

    @Test
    void unknownGroupReferenceIsConfigError() {
        KeeperException e = assertThrows(KeeperException.class, () -> resolver.apply(loader.parse(TEMPLATES, GROUPS, """
                hosts:
                  h1:
                    groups: [missing]
                """), "test"));
        assertTrue(e.is(ErrorKind.CONFIG));
    }

    @Test
    void unknownTemplateReferenceIsConfigError() {
        KeeperException e = assertThrows(KeeperException.class, () -> resolver.apply(loader.parse(TEMPLATES, """
                groups:
                  web:
                    templates: [nope]
                """, "hosts: {}"), "test"));
        assertTrue(e.is(ErrorKind.CONFIG));
    }

    @Test
    void groupReferencingGroupIsConfigError() {
        KeeperException e = assertThrows(KeeperException.class, () -> resolver.apply(loader.parse(TEMPLATES, """
                groups:
                  a:
                    templates: [base]
                  b:
                    groups: [a]
                """, "hosts: {}"), "test"));
        assertTrue(e.is(ErrorKind.CONFIG));
    }

    @Test
    void malformedInputPatternIsConfigError() {
        KeeperException e = assertThrows(KeeperException.class, () -> resolver.apply(loader.parse(null, null, """
                hosts:
                  h1:
                    commands:
                      logs:
                        input_pattern: "[unclosed"
                """), "test"));
        assertTrue(e.is(ErrorKind.CONFIG));
    }

    @Test
    void unknownHostIsConfigError() {
        KeeperException e = assertThrows(KeeperException.class, () -> resolver.resolve("ghost"));
        assertTrue(e.is(ErrorKind.CONFIG));
    }

    @Test
    void failedReloadKeepsPreviousSnapshot() throws IOException {
        Files.writeString(configDir.resolve(DefinitionLoader.TEMPLATES_FILE), TEMPLATES);
        Files.writeString(configDir.resolve(DefinitionLoader.GROUPS_FILE), GROUPS);
        Files.writeString(configDir.resolve(DefinitionLoader.HOSTS_FILE), """
                hosts:
                  h1:
                    groups: [web]
                """);
        resolver.reloadAll();
        long version = resolver.getVersion();
        EffectiveConfig before = resolver.resolve("h1");

        Files.writeString(configDir.resolve(DefinitionLoader.HOSTS_FILE), """
                hosts:
                  h1:
                    groups: [web, missing]
                """);
        assertThrows(KeeperException.class, () -> resolver.reloadAll());

        assertEquals(version, resolver.getVersion());
        assertEquals(before, resolver.resolve("h1"));
    }

    @Test
    void reloadPublishesAddedChangedAndRemovedHosts() {
        resolver.apply(loader.parse(TEMPLATES, GROUPS, """
                hosts:
                  keep:
                    groups: [web]
                  change:
                    groups: [g1]
                  drop:
                """), "first");
        ConfigUpdateEvent event = resolver.apply(loader.parse(TEMPLATES, GROUPS, """
                hosts:
                  keep:
                    groups: [web]
                  change:
                    groups: [g2]
                  fresh:
                """), "second");

        assertEquals(List.of("fresh"), event.getAddedHosts());
        assertEquals(List.of("change"), event.getChangedHosts());
        assertEquals(List.of("drop"), event.getRemovedHosts());
        assertEquals(2, publishedEvents.size());
        assertSame(event, publishedEvents.get(1));
        assertFalse(resolver.hasHost("drop"));
    }
}
