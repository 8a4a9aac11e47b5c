package com.wangbin.hostkeeper.core.connection.adapter;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.connection.model.ConnectionConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * SSH 连接适配器
 *
 * 通过系统 OpenSSH 客户端执行命令，每个适配器持有一个 ControlMaster 复用连接，
 * 后续命令通过 ControlPath 复用同一条 SSH 通道。
 */
@Slf4j
public class SshConnectionAdapter extends AbstractConnectionAdapter {

    /**
     * OpenSSH 客户端自身出错（连接失败、认证失败）时的退出码
     */
    static final int SSH_ERROR_EXIT_CODE = 255;

    private static final ExecutorService STREAM_READER = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                    .setNameFormat("ssh-stream-%d")
                    .setDaemon(true)
                    .build());

    private final Path controlPath;

    public SshConnectionAdapter(ConnectionConfig config) {
        super(config);
        String directory = config.getControlDirectory() != null
                ? config.getControlDirectory()
                : System.getProperty("java.io.tmpdir");
        // unix socket 路径长度有限，使用短名称
        this.controlPath = Paths.get(directory, "hk-" + Integer.toHexString(connectionId.hashCode()));
    }

    @Override
    protected void doConnect() throws Exception {
        List<String> command = baseCommand();
        command.add(1, "-M");
        command.add(2, "-N");
        command.add(3, "-f");
        command.add("-o");
        command.add("ControlPersist=" + config.getControlPersist());
        command.add(config.getDestination());

        ProcessResult result = runDetached(command, config.getConnectTimeout());
        if (result.exitCode() != 0) {
            throw KeeperException.connectionException(
                    String.format("SSH连接失败(%d): %s", result.exitCode(), result.stderr().strip()),
                    config.getHostId());
        }
    }

    @Override
    protected void doDisconnect() throws Exception {
        List<String> command = baseCommand();
        command.add("-O");
        command.add("exit");
        command.add(config.getDestination());
        ProcessResult result = run(command, config.getConnectTimeout());
        if (result.exitCode() != 0) {
            log.debug("关闭SSH控制连接返回 {}: {}", result.exitCode(), result.stderr().strip());
        }
    }

    @Override
    protected CommandResponse doExecute(String remoteCommand, long timeoutMillis) throws Exception {
        List<String> command = baseCommand();
        command.add(config.getDestination());
        command.add("--");
        command.add(remoteCommand);

        ProcessResult result = run(command, timeoutMillis);
        if (result.exitCode() == SSH_ERROR_EXIT_CODE) {
            throw KeeperException.connectionException(
                    "SSH传输失败: " + result.stderr().strip(), config.getHostId());
        }
        return new CommandResponse(result.stdout(), result.stderr(), result.exitCode());
    }

    @Override
    protected boolean doHealthCheck() throws Exception {
        List<String> command = baseCommand();
        command.add("-O");
        command.add("check");
        command.add(config.getDestination());
        return run(command, config.getConnectTimeout()).exitCode() == 0;
    }

    private List<String> baseCommand() {
        List<String> command = new ArrayList<>();
        command.add(config.getSshBinary());
        command.add("-o");
        command.add("BatchMode=yes");
        command.add("-o");
        command.add("ControlPath=" + controlPath);
        command.add("-o");
        command.add("ConnectTimeout=" + Math.max(1, config.getConnectTimeout() / 1000));
        if (config.getPort() != null) {
            command.add("-p");
            command.add(String.valueOf(config.getPort()));
        }
        if (config.getPrivateKeyPath() != null && !config.getPrivateKeyPath().isBlank()) {
            command.add("-i");
            command.add(config.getPrivateKeyPath());
        }
        return command;
    }

    private ProcessResult run(List<String> command, long timeoutMillis) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = readAsync(process.getInputStream());
        CompletableFuture<String> stderr = readAsync(process.getErrorStream());

        if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw KeeperException.timeoutException(config.getHostId(), timeoutMillis);
        }
        return new ProcessResult(await(stdout), await(stderr), process.exitValue());
    }

    /**
     * 后台 master 进程会继承输出流，因此错误输出写入临时文件
     */
    private ProcessResult runDetached(List<String> command, long timeoutMillis)
            throws IOException, InterruptedException {
        Path errorFile = Files.createTempFile("hk-ssh-", ".err");
        try {
            Process process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(errorFile.toFile())
                    .start();
            process.getOutputStream().close();
            if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw KeeperException.timeoutException(config.getHostId(), timeoutMillis);
            }
            return new ProcessResult("", Files.readString(errorFile), process.exitValue());
        } finally {
            Files.deleteIfExists(errorFile);
        }
    }

    private CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.debug("读取SSH输出失败: {}", connectionId, e);
                return "";
            }
        }, STREAM_READER);
    }

    private String await(CompletableFuture<String> future) throws InterruptedException {
        try {
            return future.get(config.getConnectTimeout(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            future.cancel(true);
            return "";
        }
    }

    private record ProcessResult(String stdout, String stderr, int exitCode) {
    }
}
