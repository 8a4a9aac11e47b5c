package com.wangbin.hostkeeper.core.module.monitor;

import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LvmPhysicalVolumeMonitorTest {

    private final LvmPhysicalVolumeMonitor monitor = new LvmPhysicalVolumeMonitor(Map.of());
    private final ModuleContext context = new ModuleContext("db-1", PlatformInfo.UNKNOWN, true, Map.of());

    @Test
    void parsesVolumesAndFlagsMissing() {
        String output = """
                  PV|Attr|PSize
                  /dev/sda2|a--|<99.00g
                  /dev/sdb|a-m|1.82t
                """;

        DataPoint result = monitor.parseResult(context, CommandResponse.ok(output));

        assertEquals(2, result.getMultivalue().size());
        DataPoint healthy = result.getMultivalue().get(0);
        assertEquals("/dev/sda2", healthy.getLabel());
        assertEquals("OK", healthy.getValue());
        assertEquals("size: <99.00g", healthy.getDescription());

        DataPoint missing = result.getMultivalue().get(1);
        assertEquals("Missing", missing.getValue());
        assertEquals(Criticality.CRITICAL, missing.getCriticality());
    }

    @Test
    void emptyOutputHasNoVolumes() {
        assertTrue(monitor.parseResult(context, CommandResponse.ok("")).getMultivalue().isEmpty());
    }

    @Test
    void malformedLineFails() {
        assertThrows(IllegalArgumentException.class,
                () -> monitor.parseResult(context, CommandResponse.ok("PV Attr\n/dev/sda2 a--\n")));
    }

    @Test
    void commandUsesSudoAndQuotesSeparator() {
        assertEquals("sudo pvs --separator '|' --options pv_name,pv_attr,pv_size --units H",
                monitor.buildCommand(context, null));
    }
}
