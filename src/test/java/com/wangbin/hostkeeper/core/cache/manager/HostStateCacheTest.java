package com.wangbin.hostkeeper.core.cache.manager;

import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.common.enums.HostStatus;
import com.wangbin.hostkeeper.core.cache.model.HostState;
import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HostStateCacheTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path dataDir;

    private KeeperProperties properties;

    @BeforeEach
    void setUp() {
        properties = new KeeperProperties();
        properties.getCache().setFile(dataDir.resolve("state/host-state.json").toString());
    }

    @Test
    void recordResultOverwritesPreviousEntry() {
        HostStateCache cache = newCache(NOW);
        cache.recordResult("h1", "uptime", DataPoint.of("1"));
        HostState state = cache.recordResult("h1", "uptime", DataPoint.of("2"));

        assertEquals("2", state.getMonitorData("uptime").getValue());
        assertEquals(1, state.getMonitorData().size());
        assertEquals(NOW.toEpochMilli(), state.getUpdatedAt());
    }

    @Test
    void readersKeepTheirSnapshot() {
        HostStateCache cache = newCache(NOW);
        cache.recordResult("h1", "uptime", DataPoint.of("1"));
        HostState before = cache.get("h1").orElseThrow();

        cache.recordResult("h1", "shutdown", CommandResult.of("ok"));

        assertTrue(before.getCommandResults().isEmpty());
        assertEquals("ok", cache.get("h1").orElseThrow().getCommandResults().get("shutdown").getMessage());
    }

    @Test
    void persistAndLoadRoundTripsState() {
        HostStateCache cache = newCache(NOW);
        PlatformInfo platform = PlatformInfo.builder()
                .os(PlatformInfo.OperatingSystem.LINUX)
                .flavor(PlatformInfo.Flavor.DEBIAN)
                .version("12")
                .architecture("x86_64")
                .subsystems(Set.of("docker"))
                .build();
        cache.setHostFacts("h1", "10.0.0.1", "h1.local");
        cache.setPlatform("h1", platform);
        cache.setStatus("h1", HostStatus.INITIALIZED);
        cache.recordResult("h1", "docker-compose", DataPoint.builder()
                .value("1/1")
                .criticality(Criticality.WARNING)
                .child(DataPoint.labeled("web", "running", Criticality.NORMAL))
                .timestamp(NOW.toEpochMilli())
                .build());
        cache.persist();

        assertTrue(Files.exists(Path.of(properties.getCache().getFile())));

        HostStateCache reloaded = newCache(NOW);
        reloaded.init();
        HostState state = reloaded.get("h1").orElseThrow();
        assertEquals("10.0.0.1", state.getAddress());
        assertEquals(HostStatus.UNINITIALIZED, state.getStatus());
        assertEquals(platform, state.getPlatform());
        DataPoint dataPoint = state.getMonitorData("docker-compose");
        assertEquals(Criticality.WARNING, dataPoint.getCriticality());
        assertEquals("web", dataPoint.getMultivalue().get(0).getLabel());
    }

    @Test
    void initialValueRespectsTimeToLive() {
        properties.getCache().setInitialValueTimeToLive(60);
        HostStateCache cache = newCache(NOW);
        assertFalse(cache.hasInitialValue("h1"));

        cache.recordResult("h1", "uptime", DataPoint.of("3"));
        assertTrue(cache.hasInitialValue("h1"));

        cache.setClock(Clock.fixed(NOW.plusSeconds(61), ZoneOffset.UTC));
        assertFalse(cache.hasInitialValue("h1"));
    }

    @Test
    void freshnessUsesDataPointTimestamp() {
        properties.getCache().setTimeToLive(10);
        HostStateCache cache = newCache(NOW);
        cache.recordResult("h1", "uptime", DataPoint.of("3").withTimestamp(NOW.toEpochMilli() - 5000));
        cache.recordResult("h1", "old", DataPoint.of("3").withTimestamp(NOW.toEpochMilli() - 20000));
        cache.recordResult("h1", "broken", DataPoint.noData("parse failed").withTimestamp(NOW.toEpochMilli()));

        assertTrue(cache.isFresh("h1", "uptime"));
        assertFalse(cache.isFresh("h1", "old"));
        assertFalse(cache.isFresh("h1", "broken"));
        assertFalse(cache.isFresh("h1", "missing"));
    }

    @Test
    void disabledCacheClearsFileAndProvidesNothing() throws Exception {
        Path file = Path.of(properties.getCache().getFile());
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{}");
        properties.getCache().setEnabled(false);

        HostStateCache cache = newCache(NOW);
        cache.init();
        cache.recordResult("h1", "uptime", DataPoint.of("1"));
        cache.persist();

        assertFalse(Files.exists(file));
        assertFalse(cache.hasInitialValue("h1"));
    }

    @Test
    void compareAndSetStatusOnlyFromExpected() {
        HostStateCache cache = newCache(NOW);
        assertTrue(cache.compareAndSetStatus("h1", List.of(HostStatus.UNINITIALIZED), HostStatus.INITIALIZING_LIVE));
        assertFalse(cache.compareAndSetStatus("h1", List.of(HostStatus.UNINITIALIZED), HostStatus.INITIALIZING_LIVE));
        assertEquals(HostStatus.INITIALIZING_LIVE, cache.getStatus("h1"));
        assertEquals(HostStatus.INITIALIZING_LIVE, cache.setStatus("h1", HostStatus.INITIALIZED));
    }

    private HostStateCache newCache(Instant now) {
        HostStateCache cache = new HostStateCache(properties);
        cache.setClock(Clock.fixed(now, ZoneOffset.UTC));
        return cache;
    }
}
