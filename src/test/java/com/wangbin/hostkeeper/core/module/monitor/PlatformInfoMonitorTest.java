package com.wangbin.hostkeeper.core.module.monitor;

import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlatformInfoMonitorTest {

    private static final String UBUNTU_OUTPUT = """
            Linux aarch64
            NAME="Ubuntu"
            VERSION_ID="22.04"
            ID=ubuntu
            ID_LIKE=debian
            subsystem=docker
            subsystem=systemctl
            subsystem=journalctl
            """;

    private PlatformInfoMonitor monitor;
    private ModuleContext context;

    @BeforeEach
    void setUp() {
        monitor = new PlatformInfoMonitor(Map.of());
        context = new ModuleContext("web-1", PlatformInfo.UNKNOWN, false, Map.of());
    }

    @Test
    void parsesUnameAndOsRelease() {
        PlatformInfo platform = PlatformInfoMonitor.parsePlatform(UBUNTU_OUTPUT);

        assertEquals(PlatformInfo.OperatingSystem.LINUX, platform.getOs());
        assertEquals(PlatformInfo.Flavor.UBUNTU, platform.getFlavor());
        assertEquals("22.04", platform.getVersion());
        assertEquals("aarch64", platform.getArchitecture());
        assertEquals(Set.of("docker", "systemd", "journald"), platform.getSubsystems());
    }

    @Test
    void emptyOutputIsUnknown() {
        assertFalse(PlatformInfoMonitor.parsePlatform("").isKnown());
        assertFalse(PlatformInfoMonitor.parsePlatform(null).isKnown());
    }

    @Test
    void unknownKernelFailsParsing() {
        assertThrows(IllegalArgumentException.class,
                () -> monitor.parseResult(context, CommandResponse.ok("Plan9 386\n")));
    }

    @Test
    void platformCanBeRestoredFromDataPoint() {
        DataPoint dataPoint = monitor.parseResult(context, CommandResponse.ok(UBUNTU_OUTPUT));

        PlatformInfo restored = PlatformInfoMonitor.fromDataPoint(dataPoint);

        assertEquals(PlatformInfoMonitor.parsePlatform(UBUNTU_OUTPUT), restored);
        assertEquals("UBUNTU 22.04", dataPoint.getValue());
    }

    @Test
    void errorDataPointRestoresUnknownPlatform() {
        assertSame(PlatformInfo.UNKNOWN, PlatformInfoMonitor.fromDataPoint(DataPoint.noData("timeout")));
    }

    @Test
    void commandProbesSubsystems() {
        String command = monitor.buildCommand(context, null);

        assertTrue(command.startsWith("uname -sm; cat /etc/os-release"));
        assertTrue(command.contains("systemctl"));
        assertTrue(command.contains("pvs"));
    }
}
