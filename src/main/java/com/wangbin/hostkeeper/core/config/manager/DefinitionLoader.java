package com.wangbin.hostkeeper.core.config.manager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.config.model.ConfigDefinitions;
import com.wangbin.hostkeeper.core.config.model.GroupDefinition;
import com.wangbin.hostkeeper.core.config.model.HostDefinition;
import com.wangbin.hostkeeper.core.config.model.TemplateDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模板/分组/主机定义加载器，读取 YAML 文件
 */
@Slf4j
@Component
public class DefinitionLoader {

    public static final String TEMPLATES_FILE = "templates.yml";
    public static final String GROUPS_FILE = "groups.yml";
    public static final String HOSTS_FILE = "hosts.yml";

    private static final String DEFAULTS_LOCATION = "defaults/";

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    static {
        yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        yamlMapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        yamlMapper.enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
    }

    private final KeeperProperties properties;

    public DefinitionLoader(KeeperProperties properties) {
        this.properties = properties;
    }

    /**
     * 从配置目录加载全部定义
     */
    public ConfigDefinitions load() {
        Path directory = Paths.get(properties.getConfig().getDirectory());
        if (properties.getConfig().isWriteDefaults()) {
            writeDefaultsIfMissing(directory);
        }
        log.info("开始加载主机定义: {}", directory.toAbsolutePath());

        String templates = readOptional(directory.resolve(TEMPLATES_FILE));
        String groups = readOptional(directory.resolve(GROUPS_FILE));
        String hosts = readOptional(directory.resolve(HOSTS_FILE));
        ConfigDefinitions definitions = parse(templates, groups, hosts);

        log.info("定义加载完成，模板: {}, 分组: {}, 主机: {}",
                definitions.getTemplates().size(), definitions.getGroups().size(), definitions.getHosts().size());
        return definitions;
    }

    /**
     * 解析 YAML 文本，空内容视为空定义
     */
    public ConfigDefinitions parse(String templatesYaml, String groupsYaml, String hostsYaml) {
        ConfigDefinitions definitions = new ConfigDefinitions();
        definitions.setTemplates(readSection(templatesYaml, "templates", TEMPLATES_FILE,
                new TypeReference<LinkedHashMap<String, TemplateDefinition>>() {}));
        definitions.setGroups(readSection(groupsYaml, "groups", GROUPS_FILE,
                new TypeReference<LinkedHashMap<String, GroupDefinition>>() {}));
        definitions.setHosts(readSection(hostsYaml, "hosts", HOSTS_FILE,
                new TypeReference<LinkedHashMap<String, HostDefinition>>() {}));

        // 空节点（如 "web-1:"）解析为 null，补成默认定义
        definitions.getTemplates().replaceAll((name, value) -> value != null ? value : new TemplateDefinition());
        definitions.getGroups().replaceAll((name, value) -> value != null ? value : new GroupDefinition());
        definitions.getHosts().replaceAll((name, value) -> value != null ? value : new HostDefinition());
        return definitions;
    }

    private <T> Map<String, T> readSection(String yaml, String rootKey, String fileName,
                                          TypeReference<LinkedHashMap<String, T>> type) {
        if (yaml == null || yaml.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            JsonNode root = yamlMapper.readTree(yaml);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return new LinkedHashMap<>();
            }
            JsonNode section = root.get(rootKey);
            if (section == null || section.isNull()) {
                return new LinkedHashMap<>();
            }
            if (!section.isObject()) {
                throw KeeperException.configException(String.format("%s 中的 %s 必须是映射", fileName, rootKey));
            }
            LinkedHashMap<String, T> result = yamlMapper.convertValue(section, type);
            return result != null ? result : new LinkedHashMap<>();
        } catch (KeeperException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw KeeperException.configException(
                    String.format("解析 %s 失败: %s", fileName, e.getMessage()), null, e);
        }
    }

    private String readOptional(Path file) {
        if (!Files.exists(file)) {
            log.debug("定义文件不存在，按空处理: {}", file);
            return null;
        }
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw KeeperException.configException("读取配置文件失败: " + file, null, e);
        }
    }

    /**
     * 首次运行时写入示例配置
     */
    private void writeDefaultsIfMissing(Path directory) {
        if (Files.exists(directory.resolve(HOSTS_FILE))) {
            return;
        }
        try {
            Files.createDirectories(directory);
            for (String name : new String[]{TEMPLATES_FILE, GROUPS_FILE, HOSTS_FILE}) {
                Path target = directory.resolve(name);
                if (Files.exists(target)) {
                    continue;
                }
                ClassPathResource resource = new ClassPathResource(DEFAULTS_LOCATION + name);
                if (!resource.exists()) {
                    continue;
                }
                try (InputStream in = resource.getInputStream()) {
                    Files.copy(in, target);
                }
                log.info("已写入默认配置文件: {}", target);
            }
        } catch (IOException e) {
            log.warn("写入默认配置失败: {}", directory, e);
        }
    }
}
