package com.wangbin.hostkeeper.core.module.monitor;

import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DockerComposeMonitorTest {

    private static final String CONTAINERS = """
            [
              {"Id": "a1", "Image": "nginx:1.25", "State": "running", "Status": "Up 2 hours",
               "Labels": {"com.docker.compose.config-hash": "h1",
                          "com.docker.compose.project": "shop",
                          "com.docker.compose.project.working_dir": "/srv/shop",
                          "com.docker.compose.service": "web"}},
              {"Id": "a2", "Image": "redis:7", "State": "exited", "Status": "Exited (1) 3 minutes ago",
               "Labels": {"com.docker.compose.config-hash": "h2",
                          "com.docker.compose.project": "shop",
                          "com.docker.compose.project.working_dir": "/srv/shop",
                          "com.docker.compose.service": "cache"}},
              {"Id": "b1", "Image": "busybox", "State": "running", "Status": "Up 1 day",
               "Labels": {}}
            ]
            """;

    private static final ModuleContext CONTEXT = new ModuleContext("web-1",
            PlatformInfo.builder().os(PlatformInfo.OperatingSystem.LINUX).subsystems(Set.of("docker")).build(),
            false, Map.of());

    @Test
    void groupsServicesByProject() {
        DockerComposeMonitor monitor = new DockerComposeMonitor(Map.of());

        DataPoint result = monitor.parseResult(CONTEXT, CommandResponse.ok(CONTAINERS));

        assertEquals(1, result.getMultivalue().size());
        DataPoint project = result.getMultivalue().get(0);
        assertEquals("shop", project.getLabel());
        assertEquals(Criticality.ERROR, project.getCriticality());
        assertEquals(List.of("/srv/shop/docker-compose.yml", "shop"), project.getCommandParams());

        List<DataPoint> services = project.getMultivalue();
        assertEquals(List.of("cache", "web"), services.stream().map(DataPoint::getLabel).toList());
        assertEquals(Criticality.ERROR, services.get(0).getCriticality());
        assertEquals(Criticality.NORMAL, services.get(1).getCriticality());
        assertEquals(List.of("/srv/shop/docker-compose.yml", "web"), services.get(1).getCommandParams());
    }

    @Test
    void fallsBackToMainDirectoryWithoutWorkingDirLabel() {
        DockerComposeMonitor monitor = new DockerComposeMonitor(
                Map.of("main_directory", "/opt/compose", "compose_file_name", "compose.yaml"));
        String json = """
                [{"Id": "c1", "State": "paused", "Status": "Paused",
                  "Labels": {"com.docker.compose.config-hash": "h",
                             "com.docker.compose.project": "legacy",
                             "com.docker.compose.service": "app"}}]
                """;

        DataPoint project = monitor.parseResult(CONTEXT, CommandResponse.ok(json)).getMultivalue().get(0);

        assertEquals("/opt/compose/legacy/compose.yaml", project.getCommandParams().get(0));
        assertEquals(Criticality.WARNING, project.getCriticality());
    }

    @Test
    void containersWithoutWorkingDirAreSkippedWhenNoMainDirectory() {
        DockerComposeMonitor monitor = new DockerComposeMonitor(Map.of());
        String json = """
                [{"Id": "c1", "State": "running",
                  "Labels": {"com.docker.compose.config-hash": "h",
                             "com.docker.compose.project": "legacy"}}]
                """;

        assertTrue(monitor.parseResult(CONTEXT, CommandResponse.ok(json)).getMultivalue().isEmpty());
    }

    @Test
    void containerStatesMapToCriticality() {
        assertEquals(Criticality.NORMAL, DockerComposeMonitor.stateToCriticality("running"));
        assertEquals(Criticality.WARNING, DockerComposeMonitor.stateToCriticality("restarting"));
        assertEquals(Criticality.CRITICAL, DockerComposeMonitor.stateToCriticality("dead"));
        assertEquals(Criticality.NO_DATA, DockerComposeMonitor.stateToCriticality(null));
    }

    @Test
    void onlyAppliesWithDocker() {
        DockerComposeMonitor monitor = new DockerComposeMonitor(Map.of());

        assertTrue(monitor.isApplicable(CONTEXT.platform()));
        assertFalse(monitor.isApplicable(PlatformInfo.builder().os(PlatformInfo.OperatingSystem.LINUX).build()));
    }
}
