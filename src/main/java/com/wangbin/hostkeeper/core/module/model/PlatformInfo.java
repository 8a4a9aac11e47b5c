package com.wangbin.hostkeeper.core.module.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;
import java.util.Set;

/**
 * 主机平台信息，由 platform-info 监控在初始化时采集
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PlatformInfo {

    public static final PlatformInfo UNKNOWN = PlatformInfo.builder().build();

    @Builder.Default
    OperatingSystem os = OperatingSystem.UNKNOWN;
    @Builder.Default
    Flavor flavor = Flavor.UNKNOWN;
    @Builder.Default
    String version = "";
    @Builder.Default
    String architecture = "";
    /**
     * 可用子系统，如 docker、systemd、lvm
     */
    @Builder.Default
    Set<String> subsystems = Set.of();

    @JsonIgnore
    public boolean isKnown() {
        return os != OperatingSystem.UNKNOWN;
    }

    @JsonIgnore
    public boolean isLinux() {
        return os == OperatingSystem.LINUX;
    }

    public boolean hasSubsystem(String name) {
        return subsystems.contains(name);
    }

    /**
     * 发行版相同且版本不低于指定版本
     */
    public boolean isSameOrGreater(Flavor expectedFlavor, String minimumVersion) {
        return flavor == expectedFlavor && compareVersions(version, minimumVersion) >= 0;
    }

    /**
     * 按数字段比较版本号，非数字段视为0
     */
    public static int compareVersions(String left, String right) {
        String[] leftParts = left == null ? new String[0] : left.split("[.\\-]");
        String[] rightParts = right == null ? new String[0] : right.split("[.\\-]");
        int length = Math.max(leftParts.length, rightParts.length);
        for (int i = 0; i < length; i++) {
            int l = i < leftParts.length ? parseSegment(leftParts[i]) : 0;
            int r = i < rightParts.length ? parseSegment(rightParts[i]) : 0;
            if (l != r) {
                return Integer.compare(l, r);
            }
        }
        return 0;
    }

    private static int parseSegment(String segment) {
        String digits = segment.replaceAll("\\D.*$", "");
        if (digits.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public enum OperatingSystem {
        UNKNOWN,
        LINUX,
        FREEBSD,
        DARWIN;

        public static OperatingSystem fromUname(String kernelName) {
            if (kernelName == null) {
                return UNKNOWN;
            }
            return switch (kernelName.trim().toLowerCase(Locale.ROOT)) {
                case "linux" -> LINUX;
                case "freebsd" -> FREEBSD;
                case "darwin" -> DARWIN;
                default -> UNKNOWN;
            };
        }
    }

    public enum Flavor {
        UNKNOWN,
        DEBIAN,
        UBUNTU,
        CENTOS,
        REDHAT,
        FEDORA,
        ARCH,
        ALPINE,
        NIXOS;

        /**
         * 根据 /etc/os-release 的 ID 字段识别发行版
         */
        public static Flavor fromOsReleaseId(String id) {
            if (id == null) {
                return UNKNOWN;
            }
            return switch (id.trim().toLowerCase(Locale.ROOT)) {
                case "debian", "raspbian" -> DEBIAN;
                case "ubuntu" -> UBUNTU;
                case "centos" -> CENTOS;
                case "rhel", "rocky", "almalinux" -> REDHAT;
                case "fedora" -> FEDORA;
                case "arch" -> ARCH;
                case "alpine" -> ALPINE;
                case "nixos" -> NIXOS;
                default -> UNKNOWN;
            };
        }
    }
}
