package com.wangbin.hostkeeper.core.dispatch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.hostkeeper.common.enums.Criticality;
import com.wangbin.hostkeeper.common.enums.HostStatus;
import com.wangbin.hostkeeper.common.enums.UIAction;
import com.wangbin.hostkeeper.common.exception.ErrorKind;
import com.wangbin.hostkeeper.common.exception.KeeperException;
import com.wangbin.hostkeeper.core.cache.manager.CriticalityTracker;
import com.wangbin.hostkeeper.core.cache.manager.HostStateCache;
import com.wangbin.hostkeeper.core.cache.model.HostState;
import com.wangbin.hostkeeper.core.config.KeeperProperties;
import com.wangbin.hostkeeper.core.config.manager.ConfigResolver;
import com.wangbin.hostkeeper.core.config.model.ConfigUpdateEvent;
import com.wangbin.hostkeeper.core.config.model.EffectiveConfig;
import com.wangbin.hostkeeper.core.connection.manager.ConnectionManager;
import com.wangbin.hostkeeper.core.connection.manager.Session;
import com.wangbin.hostkeeper.core.connection.model.CommandResponse;
import com.wangbin.hostkeeper.core.event.EventBus;
import com.wangbin.hostkeeper.core.event.KeeperEvent;
import com.wangbin.hostkeeper.core.module.CommandModule;
import com.wangbin.hostkeeper.core.module.Module;
import com.wangbin.hostkeeper.core.module.ModuleRegistry;
import com.wangbin.hostkeeper.core.module.MonitorModule;
import com.wangbin.hostkeeper.core.module.model.CommandData;
import com.wangbin.hostkeeper.core.module.model.CommandResult;
import com.wangbin.hostkeeper.core.module.model.DataPoint;
import com.wangbin.hostkeeper.core.module.model.ModuleResult;
import com.wangbin.hostkeeper.core.module.monitor.PlatformInfoMonitor;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 调用调度器 - 监控刷新与命令执行的编排核心
 *
 * 执行顺序：占用主机槽位 → 获取会话（连接失败按退避重试） → 构建命令 → 执行（不重试） → 解析
 * → 写入状态缓存与严重程度汇总 → 发布带调用ID的结果事件 → 释放槽位。
 * 任何失败都会以错误结果完成调用，不会抛出调度器之外。
 */
@Slf4j
@Component
public class InvocationDispatcher {

    /**
     * 未产生调用（如需要用户输入）时返回的ID
     */
    public static final long NO_INVOCATION = 0;

    private static final List<HostStatus> INITIALIZABLE =
            List.of(HostStatus.UNINITIALIZED, HostStatus.INITIALIZED, HostStatus.UNREACHABLE);

    private final KeeperProperties.DispatcherConfig dispatcherConfig;
    private final ConfigResolver configResolver;
    private final ConnectionManager connectionManager;
    private final ModuleRegistry moduleRegistry;
    private final HostStateCache stateCache;
    private final CriticalityTracker criticalityTracker;
    private final EventBus eventBus;
    private final HostSlotScheduler scheduler;

    private final AtomicLong invocationIdGenerator = new AtomicLong(NO_INVOCATION);

    // 进行中的调用：invocationId -> Invocation
    private final Map<Long, Invocation> invocations = new ConcurrentHashMap<>();

    // 等待确认的命令：invocationId -> PendingConfirmation，超时未确认自动丢弃
    private final Cache<Long, PendingConfirmation> awaitingConfirmation;

    private volatile boolean stopped;

    public InvocationDispatcher(KeeperProperties properties,
                                ConfigResolver configResolver,
                                ConnectionManager connectionManager,
                                ModuleRegistry moduleRegistry,
                                HostStateCache stateCache,
                                CriticalityTracker criticalityTracker,
                                EventBus eventBus,
                                @Qualifier("invocationExecutor") ExecutorService invocationExecutor) {
        this.dispatcherConfig = properties.getDispatcher();
        this.configResolver = configResolver;
        this.connectionManager = connectionManager;
        this.moduleRegistry = moduleRegistry;
        this.stateCache = stateCache;
        this.criticalityTracker = criticalityTracker;
        this.eventBus = eventBus;
        this.scheduler = new HostSlotScheduler(dispatcherConfig.getMaxConcurrentPerHost(), invocationExecutor);
        this.awaitingConfirmation = Caffeine.newBuilder()
                .expireAfterWrite(Math.max(1, dispatcherConfig.getConfirmationTimeout()), TimeUnit.MILLISECONDS)
                .build();
    }

    @PostConstruct
    public void init() {
        log.info("调用调度器初始化开始...");
        for (String hostId : configResolver.getHostIds()) {
            configureHost(hostId);
        }
        log.info("调用调度器初始化完成，主机数: {}，单主机并发: {}",
                configResolver.getHostIds().size(), scheduler.getMaxConcurrentPerHost());
        if (dispatcherConfig.isInitializeOnStart()) {
            forceInitializeHosts();
        }
    }

    // =============== 初始化 ===============

    /**
     * 初始化主机
     *
     * 有可用缓存时先发布缓存数据并进入 INITIALIZED_FROM_CACHE，再做实时刷新；
     * 同一主机初始化进行中时重复调用不做任何事。
     *
     * @return 缓存数据的合成调用ID与实时刷新的调用ID
     */
    public List<Long> initializeHost(String hostId) {
        return initializeHost(hostId, true);
    }

    /**
     * 重新初始化全部主机，不使用缓存
     */
    public Map<String, List<Long>> forceInitializeHosts() {
        Map<String, List<Long>> result = new LinkedHashMap<>();
        for (String hostId : configResolver.getHostIds()) {
            result.put(hostId, initializeHost(hostId, false));
        }
        return result;
    }

    private List<Long> initializeHost(String hostId, boolean allowCache) {
        requireHost(hostId);
        if (stopped) {
            log.warn("调度器已停止，忽略初始化: {}", hostId);
            return List.of();
        }
        boolean fromCache = allowCache && stateCache.hasInitialValue(hostId);
        HostStatus target = fromCache ? HostStatus.INITIALIZED_FROM_CACHE : HostStatus.INITIALIZING_LIVE;

        HostStatus previous = stateCache.getStatus(hostId);
        if (!INITIALIZABLE.contains(previous)
                || !stateCache.compareAndSetStatus(hostId, List.of(previous), target)) {
            log.debug("主机 {} 正在初始化，忽略重复请求", hostId);
            return List.of();
        }
        eventBus.publish(new KeeperEvent.HostStatusChanged(hostId, previous, target));

        List<Long> ids = new ArrayList<>();
        if (fromCache) {
            ids.addAll(publishCachedData(hostId));
            eventBus.publish(new KeeperEvent.HostInitializedFromCache(hostId));
        }

        Initialization initialization = new Initialization(hostId);
        MonitorModule platformMonitor = (MonitorModule) moduleRegistry.getModule(hostId, PlatformInfoMonitor.ID);
        ids.add(submitMonitor(hostId, platformMonitor, () -> afterPlatformInfo(initialization)));
        log.info("主机初始化开始: {} ({})", hostId, target.getDescription());
        return ids;
    }

    private List<Long> publishCachedData(String hostId) {
        HostState state = stateCache.get(hostId).orElse(null);
        if (state == null) {
            return List.of();
        }
        List<Long> ids = new ArrayList<>();
        state.getMonitorData().forEach((monitorId, dataPoint) -> {
            long id = nextInvocationId();
            ids.add(id);
            recordCriticality(hostId, monitorId, dataPoint.getCriticality());
            eventBus.publish(new KeeperEvent.MonitoringDataReceived(hostId, monitorId, id, dataPoint));
        });
        eventBus.publish(new KeeperEvent.UpdateReceived(hostId));
        return ids;
    }

    private void afterPlatformInfo(Initialization initialization) {
        String hostId = initialization.hostId;
        if (!stopped && stateCache.getStatus(hostId) != HostStatus.UNREACHABLE) {
            for (MonitorModule monitor : moduleRegistry.applicableMonitors(hostId, null)) {
                if (PlatformInfoMonitor.ID.equals(monitor.getId())) {
                    continue;
                }
                initialization.pending.incrementAndGet();
                submitMonitor(hostId, monitor, initialization::completeOne);
            }
        }
        initialization.completeOne();
    }

    private void finishInitialization(Initialization initialization) {
        String hostId = initialization.hostId;
        HostStatus previous = stateCache.getStatus(hostId);
        if (stopped || !previous.isInitializing()) {
            return;
        }
        if (stateCache.compareAndSetStatus(hostId, List.of(previous), HostStatus.INITIALIZED)) {
            log.info("主机初始化完成: {}", hostId);
            eventBus.publish(new KeeperEvent.HostStatusChanged(hostId, previous, HostStatus.INITIALIZED));
            eventBus.publish(new KeeperEvent.HostInitialized(hostId));
        }
    }

    // =============== 调用 ===============

    /**
     * 调用模块，立即返回
     *
     * 需要确认的命令发布确认事件，等待 {@link #confirmExecution(long)}；
     * 缺少必要输入时发布输入事件并返回 {@link #NO_INVOCATION}。
     *
     * @throws KeeperException 主机或模块不存在时抛出 NOT_FOUND
     */
    public long invoke(String hostId, String moduleId, List<String> params) {
        return invoke(hostId, moduleId, params, false);
    }

    /**
     * 执行已确认的命令，跳过确认
     */
    public long executeConfirmed(String hostId, String commandId, List<String> params) {
        return invoke(hostId, commandId, params, true);
    }

    /**
     * 确认执行等待中的命令
     *
     * @return 是否存在该等待确认的调用
     */
    public boolean confirmExecution(long invocationId) {
        PendingConfirmation pending = awaitingConfirmation.asMap().remove(invocationId);
        if (pending == null) {
            return false;
        }
        submitCommand(invocationId, pending.hostId(), pending.command(), pending.params());
        return true;
    }

    private long invoke(String hostId, String moduleId, List<String> params, boolean confirmed) {
        requireHost(hostId);
        if (stopped) {
            log.warn("调度器已停止，忽略调用: {} {}", hostId, moduleId);
            return NO_INVOCATION;
        }
        List<String> arguments = params != null ? params : List.of();
        Module module = moduleRegistry.getModule(hostId, moduleId);
        if (!moduleRegistry.isApplicable(hostId, module)) {
            return reject(hostId, module, arguments, KeeperException.unsupportedPlatform(hostId, moduleId));
        }
        if (module instanceof MonitorModule monitor) {
            return submitMonitor(hostId, monitor, null);
        }

        CommandModule command = (CommandModule) module;
        if (moduleRegistry.requiresInput(command, arguments)) {
            eventBus.publish(new KeeperEvent.InputDialogOpened(
                    moduleRegistry.inputSpecsFor(hostId, command), hostId, moduleId, arguments));
            return NO_INVOCATION;
        }

        List<String> completed;
        try {
            completed = moduleRegistry.validateInput(hostId, command, arguments);
        } catch (KeeperException e) {
            return reject(hostId, command, arguments, e);
        }

        long invocationId = nextInvocationId();
        if (!confirmed && command.getDisplayOptions().requiresConfirmation()) {
            awaitingConfirmation.put(invocationId, new PendingConfirmation(hostId, command, completed));
            eventBus.publish(new KeeperEvent.ConfirmationDialogOpened(
                    hostId, moduleId, invocationId, command.getDisplayOptions().getConfirmationText()));
            return invocationId;
        }
        submitCommand(invocationId, hostId, command, completed);
        return invocationId;
    }

    /**
     * 刷新分类下的所有监控
     */
    public List<Long> refreshCategory(String hostId, String category) {
        requireHost(hostId);
        List<Long> ids = new ArrayList<>();
        if (stopped) {
            return ids;
        }
        for (MonitorModule monitor : moduleRegistry.applicableMonitors(hostId, category)) {
            ids.add(submitMonitor(hostId, monitor, null));
        }
        return ids;
    }

    /**
     * 刷新分类下的监控，有效期内的缓存数据直接发布
     */
    public List<Long> cachedRefreshCategory(String hostId, String category) {
        requireHost(hostId);
        List<Long> ids = new ArrayList<>();
        if (stopped) {
            return ids;
        }
        for (MonitorModule monitor : moduleRegistry.applicableMonitors(hostId, category)) {
            if (stateCache.isFresh(hostId, monitor.getId())) {
                long id = nextInvocationId();
                DataPoint cached = stateCache.getMonitorData(hostId, monitor.getId());
                eventBus.publish(new KeeperEvent.MonitoringDataReceived(hostId, monitor.getId(), id, cached));
                ids.add(id);
            } else {
                ids.add(submitMonitor(hostId, monitor, null));
            }
        }
        return ids;
    }

    /**
     * 取消调用
     *
     * 已开始的远程命令不会被终止，只丢弃其结果并释放槽位。
     *
     * @return 是否取消成功
     */
    public boolean cancel(long invocationId) {
        if (awaitingConfirmation.asMap().remove(invocationId) != null) {
            log.debug("已取消等待确认的调用: {}", invocationId);
            return true;
        }
        Invocation invocation = invocations.get(invocationId);
        if (invocation == null || !claim(invocation, InvocationState.CANCELLED)) {
            return false;
        }
        scheduler.cancel(invocation.getHostId(), invocationId);
        log.debug("已取消调用: {}", invocation);
        invocation.runCallback();
        return true;
    }

    // =============== 查询 ===============

    public List<CommandData> getCommands(String hostId) {
        requireHost(hostId);
        return moduleRegistry.getCommands(hostId);
    }

    public List<CommandData> getChildCommands(String hostId, String category, String parentId, int level) {
        requireHost(hostId);
        return moduleRegistry.getChildCommands(hostId, category, parentId, level);
    }

    public HostStatus getStatus(String hostId) {
        return stateCache.getStatus(hostId);
    }

    public Invocation getInvocation(long invocationId) {
        return invocations.get(invocationId);
    }

    public int getPendingCount() {
        awaitingConfirmation.cleanUp();
        return invocations.size() + (int) awaitingConfirmation.estimatedSize();
    }

    public boolean isStopped() {
        return stopped;
    }

    // =============== 配置与生命周期 ===============

    /**
     * 重新加载配置，变更通过 ConfigUpdateEvent 生效
     */
    public ConfigUpdateEvent reconfigure() {
        return configResolver.reloadAll("reconfigure");
    }

    @EventListener
    public void onConfigUpdate(ConfigUpdateEvent event) {
        if (!event.hasChanges()) {
            return;
        }
        for (String hostId : event.getRemovedHosts()) {
            awaitingConfirmation.asMap().values().removeIf(pending -> pending.hostId().equals(hostId));
            failQueued(hostId, "主机已从配置中移除");
            connectionManager.invalidate(hostId);
            moduleRegistry.remove(hostId);
            criticalityTracker.remove(hostId);
            stateCache.remove(hostId);
            log.info("主机已移除: {}", hostId);
        }
        for (String hostId : event.getChangedHosts()) {
            connectionManager.invalidate(hostId);
            configureHost(hostId);
        }
        for (String hostId : event.getAddedHosts()) {
            configureHost(hostId);
        }
    }

    /**
     * 停止调度：丢弃排队和等待确认的调用，运行中的调用结果不再投递
     */
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        awaitingConfirmation.invalidateAll();
        scheduler.drainAll();
        int cancelled = 0;
        for (Invocation invocation : new ArrayList<>(invocations.values())) {
            if (claim(invocation, InvocationState.CANCELLED)) {
                cancelled++;
            }
        }
        log.info("调用调度器已停止，取消调用数: {}", cancelled);
    }

    // =============== 执行 ===============

    private long submitMonitor(String hostId, MonitorModule monitor, Runnable callback) {
        long invocationId = nextInvocationId();
        Invocation invocation = new Invocation(invocationId, hostId, monitor.getId(),
                Invocation.Kind.MONITOR, List.of(), callback);
        invocations.put(invocationId, invocation);
        scheduler.submit(hostId, invocationId, () -> execute(invocation, monitor));
        return invocationId;
    }

    private void submitCommand(long invocationId, String hostId, CommandModule command, List<String> params) {
        Invocation invocation = new Invocation(invocationId, hostId, command.getId(),
                Invocation.Kind.COMMAND, params, null);
        invocations.put(invocationId, invocation);
        scheduler.submit(hostId, invocationId, () -> execute(invocation, command));
    }

    private void execute(Invocation invocation, Module module) {
        if (invocation.isDone()) {
            return;
        }
        String hostId = invocation.getHostId();
        try {
            String remoteCommand = module instanceof MonitorModule monitor
                    ? moduleRegistry.buildCommand(hostId, monitor, stateCache.getMonitorData(hostId, monitor.getId()))
                    : moduleRegistry.buildCommand(hostId, (CommandModule) module, invocation.getParams());
            CommandResponse response;
            try (Session session = acquireWithRetry(hostId)) {
                long timeout = session.getAdapter().getConfig().getCommandTimeout();
                response = connectionManager.execute(session, remoteCommand,
                        timeout > 0 ? timeout : dispatcherConfig.getCommandTimeout());
            }
            ModuleResult result = moduleRegistry.parseResult(hostId, module, response);
            deliver(invocation, module, result);
            restoreReachability(hostId);
        } catch (KeeperException e) {
            if (e.is(ErrorKind.CONNECTION)) {
                // 先标记不可达，初始化回调据此判断是否继续
                markUnreachable(hostId, e);
                fail(invocation, e.getMessage(), Criticality.ERROR, false);
            } else if (e.is(ErrorKind.PARSE)) {
                log.warn("解析失败: {} [{}] {}", invocation.getModuleId(), hostId, e.getMessage());
                fail(invocation, e.getMessage(), Criticality.NO_DATA, true);
            } else {
                log.warn("调用失败: {} [{}] {}", invocation.getModuleId(), hostId, e.getMessage());
                fail(invocation, e.getMessage(), Criticality.ERROR, true);
            }
        } catch (Exception e) {
            log.error("调用异常: {} [{}]", invocation.getModuleId(), hostId, e);
            fail(invocation, "内部错误: " + e.getMessage(), Criticality.ERROR, true);
        }
    }

    /**
     * 获取会话，连接失败时按指数退避重试
     *
     * 只重试会话获取，命令发出后不再重发。
     */
    private Session acquireWithRetry(String hostId) {
        int maxRetries = Math.max(0, dispatcherConfig.getMaxConnectionRetries());
        for (int attempt = 0; ; attempt++) {
            try {
                return connectionManager.acquireSession(hostId);
            } catch (KeeperException e) {
                if (!e.is(ErrorKind.CONNECTION) || attempt >= maxRetries || stopped) {
                    throw e;
                }
                long backoff = dispatcherConfig.getRetryBackoff() * (1L << attempt);
                log.warn("主机 {} 连接失败，{}ms 后重试({}/{}): {}", hostId, backoff, attempt + 1, maxRetries,
                        e.getMessage());
                sleep(hostId, backoff);
            }
        }
    }

    private void deliver(Invocation invocation, Module module, ModuleResult result) {
        if (!claim(invocation, InvocationState.COMPLETED)) {
            log.debug("调用已取消，丢弃结果: {}", invocation.getId());
            return;
        }
        String hostId = invocation.getHostId();
        String moduleId = invocation.getModuleId();
        if (!configResolver.hasHost(hostId)) {
            log.debug("主机已移除，丢弃结果: {} [{}]", moduleId, hostId);
            invocation.runCallback();
            return;
        }
        long now = System.currentTimeMillis();

        if (result instanceof DataPoint dataPoint) {
            DataPoint stamped = dataPoint.withTimestamp(now);
            stateCache.recordResult(hostId, moduleId, stamped);
            if (PlatformInfoMonitor.ID.equals(moduleId)) {
                stateCache.setPlatform(hostId, PlatformInfoMonitor.fromDataPoint(stamped));
            }
            recordCriticality(hostId, moduleId, stamped.getCriticality());
            eventBus.publish(new KeeperEvent.MonitoringDataReceived(hostId, moduleId, invocation.getId(), stamped));
        } else {
            UIAction action = module.getDisplayOptions().getAction();
            CommandResult commandResult = ((CommandResult) result).toBuilder()
                    .opensDetailsDialog(action == UIAction.DETAILS_DIALOG)
                    .build()
                    .correlate(invocation.getId(), moduleId, now);
            stateCache.recordResult(hostId, moduleId, commandResult);
            eventBus.publish(new KeeperEvent.CommandResultReceived(hostId, commandResult));
            if (action == UIAction.DETAILS_DIALOG) {
                eventBus.publish(new KeeperEvent.DetailsDialogOpened(hostId, invocation.getId()));
            } else if (action == UIAction.TEXT_VIEW || action == UIAction.LOG_VIEW) {
                eventBus.publish(new KeeperEvent.TextDialogOpened(hostId, invocation.getId()));
            }
            if (commandResult.isError()) {
                eventBus.publish(new KeeperEvent.ErrorReceived(
                        hostId, commandResult.getCriticality(), commandResult.getErrorText()));
            }
        }
        eventBus.publish(new KeeperEvent.UpdateReceived(hostId));
        invocation.runCallback();
    }

    /**
     * 以错误结果完成调用
     *
     * @param notify 是否单独发布 ErrorReceived，主机不可达时由主机级事件统一通知
     */
    private void fail(Invocation invocation, String message, Criticality criticality, boolean notify) {
        if (!claim(invocation, InvocationState.FAILED)) {
            return;
        }
        String hostId = invocation.getHostId();
        String moduleId = invocation.getModuleId();
        // 已移除主机的调用仍然完成，但不再写入状态
        boolean configured = configResolver.hasHost(hostId);
        long now = System.currentTimeMillis();

        if (invocation.isMonitor()) {
            DataPoint dataPoint = DataPoint.noData(message).withTimestamp(now);
            if (notify && configured) {
                stateCache.recordResult(hostId, moduleId, dataPoint);
            }
            if (configured) {
                recordCriticality(hostId, moduleId, Criticality.NO_DATA);
            }
            eventBus.publish(new KeeperEvent.MonitoringDataReceived(hostId, moduleId, invocation.getId(), dataPoint));
        } else {
            CommandResult result = CommandResult.error(message, criticality).correlate(invocation.getId(), moduleId, now);
            if (configured) {
                stateCache.recordResult(hostId, moduleId, result);
            }
            eventBus.publish(new KeeperEvent.CommandResultReceived(hostId, result));
            if (notify) {
                eventBus.publish(new KeeperEvent.ErrorReceived(hostId, criticality, message));
            }
        }
        eventBus.publish(new KeeperEvent.UpdateReceived(hostId));
        invocation.runCallback();
    }

    /**
     * 调用前即被拒绝的模块（输入非法、平台不支持），不会发送到主机
     */
    private long reject(String hostId, Module module, List<String> params, KeeperException cause) {
        long invocationId = nextInvocationId();
        log.info("调用被拒绝: {} [{}] {}", module.getId(), hostId, cause.getMessage());
        Invocation.Kind kind = module instanceof MonitorModule ? Invocation.Kind.MONITOR : Invocation.Kind.COMMAND;
        Invocation invocation = new Invocation(invocationId, hostId, module.getId(), kind, params, null);
        invocations.put(invocationId, invocation);
        // 未执行的监控不写入状态缓存
        fail(invocation, cause.getMessage(), Criticality.WARNING, kind == Invocation.Kind.COMMAND);
        return invocationId;
    }

    private void markUnreachable(String hostId, KeeperException cause) {
        if (!configResolver.hasHost(hostId)) {
            return;
        }
        HostStatus previous = stateCache.getStatus(hostId);
        if (previous == HostStatus.UNREACHABLE
                || !stateCache.compareAndSetStatus(hostId, List.of(previous), HostStatus.UNREACHABLE)) {
            return;
        }
        log.warn("主机不可达: {} ({})", hostId, cause.getMessage());
        eventBus.publish(new KeeperEvent.HostStatusChanged(hostId, previous, HostStatus.UNREACHABLE));
        eventBus.publish(new KeeperEvent.ErrorReceived(hostId, Criticality.ERROR,
                "主机不可达: " + hostId + " (" + cause.getMessage() + ")"));
        failQueued(hostId, "主机不可达: " + cause.getMessage());
    }

    private void restoreReachability(String hostId) {
        if (stateCache.getStatus(hostId) != HostStatus.UNREACHABLE) {
            return;
        }
        HostStatus target = stateCache.getPlatform(hostId).isKnown() ? HostStatus.INITIALIZED : HostStatus.UNINITIALIZED;
        if (stateCache.compareAndSetStatus(hostId, List.of(HostStatus.UNREACHABLE), target)) {
            log.info("主机恢复连接: {}", hostId);
            eventBus.publish(new KeeperEvent.HostStatusChanged(hostId, HostStatus.UNREACHABLE, target));
        }
    }

    private void failQueued(String hostId, String message) {
        List<Long> queued = scheduler.drainQueued(hostId);
        for (Long invocationId : queued) {
            Invocation invocation = invocations.get(invocationId);
            if (invocation != null) {
                fail(invocation, message, Criticality.ERROR, false);
            }
        }
        if (!queued.isEmpty()) {
            log.info("主机 {} 排队中的调用已结束: {}", hostId, queued.size());
        }
    }

    private boolean claim(Invocation invocation, InvocationState state) {
        if (!invocation.complete(state)) {
            return false;
        }
        invocations.remove(invocation.getId());
        return true;
    }

    private void recordCriticality(String hostId, String monitorId, Criticality criticality) {
        boolean ignore = isIgnoredFromSummary(hostId, monitorId);
        criticalityTracker.record(hostId, monitorId, criticality, ignore);
        stateCache.setCriticality(hostId, criticalityTracker.aggregate(hostId));
    }

    private boolean isIgnoredFromSummary(String hostId, String monitorId) {
        try {
            return moduleRegistry.getModule(hostId, monitorId).getDisplayOptions().isIgnoreFromSummary();
        } catch (KeeperException e) {
            // 缓存中有但已不再启用的监控
            return true;
        }
    }

    private void configureHost(String hostId) {
        try {
            EffectiveConfig config = configResolver.resolve(hostId);
            moduleRegistry.configure(config);
            stateCache.setHostFacts(hostId, config.getAddress(), config.getFqdn());
        } catch (KeeperException e) {
            log.error("主机配置失败: {} ({})", hostId, e.getMessage());
        }
    }

    private void requireHost(String hostId) {
        if (!configResolver.hasHost(hostId)) {
            throw KeeperException.notFound("主机不存在: " + hostId, hostId, null);
        }
        if (!moduleRegistry.isConfigured(hostId)) {
            configureHost(hostId);
        }
    }

    private long nextInvocationId() {
        return invocationIdGenerator.incrementAndGet();
    }

    private void sleep(String hostId, long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw KeeperException.connectionException("重试等待被中断", hostId, e);
        }
    }

    private record PendingConfirmation(String hostId, CommandModule command, List<String> params) {
    }

    /**
     * 单台主机的一次初始化，所有实时刷新完成后结束
     */
    private final class Initialization {

        private final String hostId;
        // platform-info 阶段占一个计数
        private final AtomicInteger pending = new AtomicInteger(1);

        Initialization(String hostId) {
            this.hostId = hostId;
        }

        void completeOne() {
            if (pending.decrementAndGet() == 0) {
                finishInitialization(this);
            }
        }
    }
}
