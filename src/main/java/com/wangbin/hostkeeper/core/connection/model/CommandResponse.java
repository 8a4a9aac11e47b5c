package com.wangbin.hostkeeper.core.connection.model;

/**
 * 远程命令的原始响应
 *
 * @param stdout   标准输出
 * @param stderr   标准错误
 * @param exitCode 退出码
 */
public record CommandResponse(String stdout, String stderr, int exitCode) {

    public static CommandResponse ok(String stdout) {
        return new CommandResponse(stdout, "", 0);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * 错误描述，stderr 为空时退回 stdout
     */
    public String errorText() {
        if (stderr != null && !stderr.isBlank()) {
            return stderr.strip();
        }
        return stdout != null ? stdout.strip() : "";
    }
}
