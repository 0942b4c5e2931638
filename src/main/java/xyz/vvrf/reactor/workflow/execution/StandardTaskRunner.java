package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.workflow.context.ContextHandle;
import xyz.vvrf.reactor.workflow.context.ContextStore;
import xyz.vvrf.reactor.workflow.core.*;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.registry.TaskExecutorRegistry;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * TaskRunner 的标准实现。
 * 从注册表获取执行器，为任务创建作用域上下文并构造输入，
 * 应用超时（考虑任务级覆盖），执行并处理结果/错误。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardTaskRunner implements TaskRunner {

    /**
     * 任务元数据中覆盖默认超时的键。值可以是 {@link Duration}、毫秒数或 ISO-8601 字符串。
     */
    public static final String METADATA_TIMEOUT = "timeout";

    private final TaskExecutorRegistry executorRegistry;
    private final ContextStore contextStore;
    private final TaskInputBuilder inputBuilder;
    private final Scheduler taskScheduler;
    private final List<WorkflowMonitorListener> monitorListeners;

    /**
     * @param executorRegistry 执行器注册表
     * @param contextStore     上下文存储
     * @param inputBuilder     输入构造器
     * @param taskScheduler    执行器调用所在的 Reactor Scheduler
     * @param monitorListeners 监控监听器列表
     */
    public StandardTaskRunner(TaskExecutorRegistry executorRegistry,
                              ContextStore contextStore,
                              TaskInputBuilder inputBuilder,
                              Scheduler taskScheduler,
                              List<WorkflowMonitorListener> monitorListeners) {
        this.executorRegistry = Objects.requireNonNull(executorRegistry, "TaskExecutorRegistry 不能为空");
        this.contextStore = Objects.requireNonNull(contextStore, "ContextStore 不能为空");
        this.inputBuilder = Objects.requireNonNull(inputBuilder, "TaskInputBuilder 不能为空");
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "任务执行调度器不能为空");
        this.monitorListeners = (monitorListeners != null) ? Collections.unmodifiableList(new ArrayList<>(monitorListeners)) : Collections.emptyList();
        log.info("初始化了 StandardTaskRunner。调度器: {}, 监听器数量: {}",
                taskScheduler.getClass().getSimpleName(), this.monitorListeners.size());
    }

    @Override
    public Mono<TaskOutcome> run(String requestId, Workflow workflow, Task task, Duration defaultTimeout) {
        final String workflowId = workflow.getId();
        final String taskId = task.getId();
        final String executorRef = task.getExecutorRef();

        return Mono.defer(() -> {
                    Optional<TaskExecutor> executor = executorRegistry.resolve(executorRef);
                    if (!executor.isPresent()) {
                        TaskError error = TaskError.executorNotFound(executorRef);
                        log.error("[RequestId: {}][Workflow: '{}'] 任务 '{}' 找不到执行器 '{}'",
                                requestId, workflowId, taskId, executorRef);
                        safeNotifyListeners(l -> l.onTaskFailure(requestId, workflowId, task, Duration.ZERO, error));
                        return Mono.just(TaskOutcome.failure(error));
                    }

                    ContextHandle context = contextStore.createContext(workflowId, taskId);
                    TaskRequest request = inputBuilder.buildRequest(requestId, workflow, task, context);
                    Duration timeout = determineEffectiveTimeout(task, defaultTimeout);

                    log.debug("[RequestId: {}][Workflow: '{}'] 执行任务 '{}' (执行器: {}, 超时: {})",
                            requestId, workflowId, taskId, executorRef, timeout != null ? timeout : "无");
                    return executeInternal(executor.get(), request, task, timeout, requestId, workflowId);
                })
                .onErrorResume(error -> { // 预执行阶段的错误，例如执行器工厂抛出异常
                    log.error("[RequestId: {}][Workflow: '{}'] 任务 '{}' 在预执行设置期间失败: {}",
                            requestId, workflowId, taskId, error.getMessage(), error);
                    TaskError taskError = TaskError.fromException(error);
                    safeNotifyListeners(l -> l.onTaskFailure(requestId, workflowId, task, Duration.ZERO, taskError));
                    return Mono.just(TaskOutcome.failure(taskError));
                });
    }

    private Mono<TaskOutcome> executeInternal(TaskExecutor executor,
                                              TaskRequest request,
                                              Task task,
                                              Duration timeout,
                                              String requestId,
                                              String workflowId) {
        final String taskId = task.getId();
        Instant startTime = Instant.now();
        safeNotifyListeners(l -> l.onTaskStart(requestId, workflowId, task));

        Mono<TaskOutcome> call = Mono.defer(() -> executor.execute(request))
                .subscribeOn(taskScheduler);
        if (timeout != null) {
            call = call.timeout(timeout);
        }

        return call
                .defaultIfEmpty(TaskOutcome.success())
                .onErrorResume(error -> {
                    if (error instanceof TimeoutException && timeout != null) {
                        log.warn("[RequestId: {}][Workflow: '{}'] 任务 '{}' 执行超时 ({})",
                                requestId, workflowId, taskId, timeout);
                        safeNotifyListeners(l -> l.onTaskTimeout(requestId, workflowId, task, timeout));
                        return Mono.just(TaskOutcome.failure(TaskError.timeout(timeout)));
                    }
                    log.warn("[RequestId: {}][Workflow: '{}'] 任务 '{}' 执行器抛出异常: {}",
                            requestId, workflowId, taskId, error.toString());
                    return Mono.just(TaskOutcome.failure(error));
                })
                .doOnNext(outcome -> {
                    Duration duration = Duration.between(startTime, Instant.now());
                    if (outcome.isSuccess()) {
                        log.debug("[RequestId: {}][Workflow: '{}'] 任务 '{}' 成功，耗时 {}ms",
                                requestId, workflowId, taskId, duration.toMillis());
                        safeNotifyListeners(l -> l.onTaskSuccess(requestId, workflowId, task, duration));
                    } else {
                        TaskError error = outcome.getError().orElseThrow(IllegalStateException::new);
                        log.debug("[RequestId: {}][Workflow: '{}'] 任务 '{}' 失败，耗时 {}ms: {}",
                                requestId, workflowId, taskId, duration.toMillis(), error);
                        safeNotifyListeners(l -> l.onTaskFailure(requestId, workflowId, task, duration, error));
                    }
                });
    }

    /**
     * 确定任务的有效超时时间。
     * 优先级：任务元数据 -> 调用方给出的默认值。非正数表示不设超时。
     */
    Duration determineEffectiveTimeout(Task task, Duration defaultTimeout) {
        Duration timeout = task.getMetadata(METADATA_TIMEOUT)
                .map(value -> parseTimeout(task, value, defaultTimeout))
                .orElse(defaultTimeout);
        return (timeout != null && !timeout.isZero() && !timeout.isNegative()) ? timeout : null;
    }

    private Duration parseTimeout(Task task, Object value, Duration defaultTimeout) {
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof Number) {
            return Duration.ofMillis(((Number) value).longValue());
        }
        try {
            return Duration.parse(String.valueOf(value));
        } catch (DateTimeParseException e) {
            log.warn("任务 '{}' 的超时配置 '{}' 无法解析，使用默认值 {}", task.getId(), value, defaultTimeout);
            return defaultTimeout;
        }
    }

    private void safeNotifyListeners(Consumer<WorkflowMonitorListener> notification) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (WorkflowMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("WorkflowMonitorListener {} 抛出异常: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
