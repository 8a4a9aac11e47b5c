package com.wangbin.hostkeeper.core.module.monitor;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.common.enums.DisplayStyle;
import com.wangbin.hostkeeper.common.utils.JsonUtil;
import com.wangbin.hostkeeper.common.utils.ShellCommand;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.module.MonitorModule;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.DisplayOptions;
import com.wangbin.hostkeeper.core.module.model.ModuleContext;
import com.wangbin.hostkeeper.core.module.model.ModuleSpec;
import com.wangbin.hostkeeper.core.module.model.PlatformInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * docker-compose 项目与服务，两级多值：项目 -> 服务
 */
@Slf4j
public class DockerComposeMonitor implements MonitorModule {

    public static final String ID = "docker-compose";

    private static final String LABEL_CONFIG_HASH = "com.docker.compose.config-hash";
    private static final String LABEL_PROJECT = "com.docker.compose.project";
    private static final String LABEL_WORKING_DIR = "com.docker.compose.project.working_dir";
    private static final String LABEL_SERVICE = "com.docker.compose.service";

    private final String composeFileName;
    /**
     * 旧版本 docker-compose 没有 working_dir 标签时使用的项目根目录
     */
    private final String mainDirectory;

    public DockerComposeMonitor(Map<String, String> settings) {
        this.composeFileName = settings.getOrDefault("compose_file_name", "docker-compose.yml");
        this.mainDirectory = settings.getOrDefault("main_directory", "");
    }

    @Override
    public ModuleSpec getSpec() {
        return ModuleSpec.of(ID, "0.0.1");
    }

    @Override
    public DisplayOptions getDisplayOptions() {
        return DisplayOptions.builder()
                .category("docker-compose")
                .displayText("Compose")
                .displayStyle(DisplayStyle.CRITICALITY_LEVEL)
                .useMultivalue(true)
                .build();
    }

    @Override
    public boolean isApplicable(PlatformInfo platform) {
        return platform.isLinux() && platform.hasSubsystem("docker");
    }

    @Override
    public String buildCommand(ModuleContext context, DataPoint prior) {
        return ShellCommand.of("curl", "-s", "--unix-socket", "/var/run/docker.sock",
                        "http://localhost/containers/json?all=true")
                .useSudo(context.useSudo())
                .toString();
    }

    @Override
    public DataPoint parseResult(ModuleContext context, CommandResponse response) {
        JSONArray containers = JsonUtil.parseArrayStrict(response.stdout());

        // 项目名 -> 服务数据点
        Map<String, List<DataPoint>> projects = new TreeMap<>();
        for (int i = 0; i < containers.size(); i++) {
            JSONObject container = containers.getJSONObject(i);
            JSONObject labels = container.getJSONObject("Labels");
            if (labels == null || !labels.containsKey(LABEL_CONFIG_HASH)) {
                continue;
            }
            String project = labels.getString(LABEL_PROJECT);
            if (project == null) {
                log.debug("容器 {} 缺少 {} 标签，跳过", container.getString("Id"), LABEL_PROJECT);
                continue;
            }
            String workingDir = labels.getString(LABEL_WORKING_DIR);
            if (workingDir == null) {
                if (mainDirectory.isEmpty()) {
                    log.warn("容器 {} 缺少 working_dir 标签且未配置 main_directory，跳过", container.getString("Id"));
                    continue;
                }
                workingDir = mainDirectory + "/" + project;
            }
            String service = labels.getString(LABEL_SERVICE);
            String composeFile = workingDir.endsWith("/") ? workingDir + composeFileName : workingDir + "/" + composeFileName;

            DataPoint servicePoint = DataPoint.builder()
                    .label(service != null ? service : container.getString("Id"))
                    .value(container.getString("Status") != null ? container.getString("Status") : "")
                    .criticality(stateToCriticality(container.getString("State")))
                    .description(container.getString("Image") != null ? container.getString("Image") : "")
                    .commandParam(composeFile)
                    .commandParam(service != null ? service : "")
                    .build();
            projects.computeIfAbsent(project, key -> new ArrayList<>()).add(servicePoint);
        }

        DataPoint.DataPointBuilder result = DataPoint.builder();
        for (Map.Entry<String, List<DataPoint>> entry : projects.entrySet()) {
            List<DataPoint> services = entry.getValue();
            services.sort(Comparator.comparing(DataPoint::getLabel));

            String composeFile = services.get(0).getCommandParams().get(0);
            DataPoint mostCritical = services.stream()
                    .max(Comparator.comparingInt(point -> point.getCriticality().getSeverity()))
                    .orElse(services.get(0));

            result.child(DataPoint.builder()
                    .label(entry.getKey())
                    .value(mostCritical.getValue())
                    .criticality(mostCritical.getCriticality())
                    .commandParam(composeFile)
                    .commandParam(entry.getKey())
                    .multivalue(services)
                    .build());
        }
        return result.build();
    }

    static Criticality stateToCriticality(String state) {
        if (state == null) {
            return Criticality.NO_DATA;
        }
        return switch (state) {
            case "running" -> Criticality.NORMAL;
            case "created", "paused", "restarting", "removing" -> Criticality.WARNING;
            case "exited" -> Criticality.ERROR;
            case "dead" -> Criticality.CRITICAL;
            default -> Criticality.NO_DATA;
        };
    }
}
