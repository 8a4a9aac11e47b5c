package com.wangbin.hostkeeper.api.controller;

import com.wangbin.hostkeeper.api.dto.HostSummary;
import com.wangbin.hostkeeper.api.dto.InvokeRequest;
import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.common.web.result.ApiResult;
import com.wangbin.hostkeeper.core.cache.manager.HostStateCache;
import com.wangbin.hostkeeper.core.cache.model.HostState;
import com.wangbin.hostkeeper.core.config.manager.ConfigResolver;
import com.wangbin.hostkeeper.core.config.model.ConfigUpdateEvent;
import com.wangbin.hostkeeper.core.connection.manager.ConnectionManager;
import com.wangbin.hostkeeper.core.connection.model.ConnectionMetrics;
import com.wangbin.hostkeeper.core.dispatch.InvocationDispatcher;
import com.wangbin.hostkeeper.core.module.model.CommandData;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 主机管理控制器
 * 提供主机初始化、模块调用、确认与取消、分类刷新等接口
 */
@Slf4j
@RestController
@RequestMapping("/api/hosts")
public class HostController {

    private final InvocationDispatcher dispatcher;
    private final ConfigResolver configResolver;
    private final HostStateCache stateCache;
    private final ConnectionManager connectionManager;

    public HostController(InvocationDispatcher dispatcher,
                          ConfigResolver configResolver,
                          HostStateCache stateCache,
                          ConnectionManager connectionManager) {
        this.dispatcher = dispatcher;
        this.configResolver = configResolver;
        this.stateCache = stateCache;
        this.connectionManager = connectionManager;
    }

    @GetMapping
    public ApiResult<List<HostSummary>> listHosts() {
        List<HostSummary> hosts = configResolver.getHostIds().stream()
                .map(hostId -> HostSummary.from(hostId,
                        stateCache.get(hostId).orElse(null),
                        configResolver.resolve(hostId)))
                .toList();
        return ApiResult.success(hosts);
    }

    @GetMapping("/{hostId}")
    public ApiResult<HostState> getHost(@PathVariable String hostId) {
        HostState state = stateCache.get(hostId)
                .orElseThrow(() -> KeeperException.notFound("主机状态不存在: " + hostId, hostId, null));
        return ApiResult.success(state);
    }

    @GetMapping("/{hostId}/connections")
    public ApiResult<List<ConnectionMetrics>> getConnectionMetrics(@PathVariable String hostId) {
        return ApiResult.success(connectionManager.getMetrics(hostId));
    }

    @PostMapping("/{hostId}/initialize")
    public ApiResult<List<Long>> initializeHost(@PathVariable String hostId) {
        return ApiResult.success(dispatcher.initializeHost(hostId));
    }

    @PostMapping("/initialize")
    public ApiResult<Map<String, List<Long>>> forceInitializeHosts() {
        return ApiResult.success(dispatcher.forceInitializeHosts());
    }

    @PostMapping("/{hostId}/invoke")
    public ApiResult<Long> invoke(@PathVariable String hostId, @Valid @RequestBody InvokeRequest request) {
        long invocationId = dispatcher.invoke(hostId, request.getModuleId(), request.getParams());
        if (invocationId == InvocationDispatcher.NO_INVOCATION) {
            return ApiResult.success("需要补充输入参数", invocationId);
        }
        return ApiResult.success(invocationId);
    }

    @PostMapping("/{hostId}/execute-confirmed")
    public ApiResult<Long> executeConfirmed(@PathVariable String hostId,
                                            @Valid @RequestBody InvokeRequest request) {
        return ApiResult.success(dispatcher.executeConfirmed(hostId, request.getModuleId(), request.getParams()));
    }

    @PostMapping("/invocations/{invocationId}/confirm")
    public ApiResult<Boolean> confirm(@PathVariable long invocationId) {
        return ApiResult.success(dispatcher.confirmExecution(invocationId));
    }

    @DeleteMapping("/invocations/{invocationId}")
    public ApiResult<Boolean> cancel(@PathVariable long invocationId) {
        return ApiResult.success(dispatcher.cancel(invocationId));
    }

    @PostMapping("/{hostId}/categories/{category}/refresh")
    public ApiResult<List<Long>> refreshCategory(@PathVariable String hostId,
                                                 @PathVariable String category,
                                                 @RequestParam(defaultValue = "false") boolean cached) {
        List<Long> ids = cached
                ? dispatcher.cachedRefreshCategory(hostId, category)
                : dispatcher.refreshCategory(hostId, category);
        return ApiResult.success(ids);
    }

    @GetMapping("/{hostId}/commands")
    public ApiResult<List<CommandData>> getCommands(@PathVariable String hostId) {
        return ApiResult.success(dispatcher.getCommands(hostId));
    }

    @GetMapping("/{hostId}/commands/children")
    public ApiResult<List<CommandData>> getChildCommands(@PathVariable String hostId,
                                                         @RequestParam String category,
                                                         @RequestParam String parentId,
                                                         @RequestParam(defaultValue = "1") int level) {
        return ApiResult.success(dispatcher.getChildCommands(hostId, category, parentId, level));
    }

    @PostMapping("/reconfigure")
    public ApiResult<ConfigUpdateEvent> reconfigure() {
        ConfigUpdateEvent event = dispatcher.reconfigure();
        log.info("配置重新加载: {}", event.getSummary());
        return ApiResult.success(event);
    }

    @PostMapping("/stop")
    public ApiResult<Void> stop() {
        dispatcher.stop();
        return ApiResult.success();
    }
}
