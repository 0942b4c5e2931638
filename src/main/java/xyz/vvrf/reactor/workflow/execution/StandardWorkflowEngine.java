package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import xyz.vvrf.reactor.workflow.core.*;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.notify.StatusEvent;
import xyz.vvrf.reactor.workflow.notify.StatusEventType;
import xyz.vvrf.reactor.workflow.notify.StatusNotifier;
import xyz.vvrf.reactor.workflow.report.ExecutionReport;
import xyz.vvrf.reactor.workflow.resource.ResourceManager;
import xyz.vvrf.reactor.workflow.util.GraphUtils;
import xyz.vvrf.reactor.workflow.validation.DependencyValidator;
import xyz.vvrf.reactor.workflow.validation.ValidationResult;
import xyz.vvrf.reactor.workflow.validation.WorkflowValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * WorkflowEngine 的标准实现。
 * <p>
 * 每次 execute 调用创建一个 {@link WorkflowExecutionContext}，并以
 * {@code Mono.defer(step).repeat()} 驱动调度循环。每次迭代：
 * <ol>
 *     <li>检查取消与 FAIL_FAST；</li>
 *     <li>在工作流读锁内一次性取得就绪任务、是否全部完成、在途数量；</li>
 *     <li>没有就绪任务时：全部完成则 COMPLETED，无在途任务则判定死锁，否则等待进度信号；</li>
 *     <li>否则按就绪顺序派发，最多补满 {@code maxConcurrentTasks} 个在途任务。</li>
 * </ol>
 * 任务的状态迁移与对应通知在 {@link WorkflowExecutionContext#getTransitionLock()} 下串行执行。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardWorkflowEngine implements WorkflowEngine {

    private final DependencyValidator validator;
    private final TaskRunner taskRunner;
    private final ResourceManager resourceManager;
    private final List<WorkflowMonitorListener> monitorListeners;
    private final WorkflowEngineOptions options;
    private final Clock clock;
    // 正在执行的工作流 ID，保证同一工作流同时只有一次执行
    private final Set<String> activeWorkflows = ConcurrentHashMap.newKeySet();

    public StandardWorkflowEngine(DependencyValidator validator,
                                  TaskRunner taskRunner,
                                  ResourceManager resourceManager,
                                  List<WorkflowMonitorListener> monitorListeners,
                                  WorkflowEngineOptions options) {
        this.validator = Objects.requireNonNull(validator, "DependencyValidator cannot be null");
        this.taskRunner = Objects.requireNonNull(taskRunner, "TaskRunner cannot be null");
        this.resourceManager = Objects.requireNonNull(resourceManager, "ResourceManager cannot be null");
        this.monitorListeners = (monitorListeners != null) ? Collections.unmodifiableList(new ArrayList<>(monitorListeners)) : Collections.emptyList();
        this.options = Objects.requireNonNull(options, "WorkflowEngineOptions cannot be null");
        if (options.getMaxConcurrentTasks() <= 0) {
            throw new IllegalArgumentException("maxConcurrentTasks must be positive.");
        }
        Objects.requireNonNull(options.getPollInterval(), "pollInterval cannot be null");
        this.clock = Objects.requireNonNull(options.getClock(), "clock cannot be null");
        log.info("StandardWorkflowEngine initialized. Runner: {}, Validation: {}, Options: {}",
                taskRunner.getClass().getSimpleName(), validator.getMode(), options);
    }

    @Override
    public ValidationResult validateAndPrepare(Workflow workflow) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        WorkflowStatus status = workflow.getStatus();
        if (status != WorkflowStatus.PLANNING && status != WorkflowStatus.READY) {
            throw new IllegalStateException("Workflow '" + workflow.getId() + "' cannot be prepared in status " + status);
        }

        ValidationResult result = validator.validate(workflow);
        if (!result.isOk()) {
            workflow.failPlanning(result.describe(), result.getCyclePath().orElse(null), clock.instant());
            log.warn("Workflow '{}' rejected during planning: {}", workflow.getId(), result.describe());
            throw new WorkflowValidationException(workflow.getId(), result);
        }
        workflow.markReady();
        log.info("Workflow '{}' is READY. Tasks: {}, dependencies modified: {}",
                workflow.getId(), workflow.size(), result.isModified());
        if (log.isDebugEnabled()) {
            log.debug("Workflow '{}' graph:\n{}", workflow.getId(),
                    GraphUtils.toDot(GraphUtils.dependencyGraph(workflow), workflow.getId()));
        }
        return result;
    }

    @Override
    public Mono<ExecutionReport> execute(Workflow workflow, StatusNotifier notifier, CancellationToken cancellationToken) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");

        return Mono.defer(() -> {
            if (workflow.getStatus() == WorkflowStatus.PLANNING) {
                try {
                    validateAndPrepare(workflow);
                } catch (WorkflowValidationException e) {
                    safeNotify(notifier, event(StatusEventType.WORKFLOW_FAILED, workflow.getId(), null,
                            WorkflowStatus.FAILED.name(), e.getResult().describe()));
                    return Mono.just(snapshotReport(workflow));
                }
            }
            final String workflowId = workflow.getId();
            if (!activeWorkflows.add(workflowId)) {
                return Mono.error(new IllegalStateException("Workflow '" + workflowId + "' is already being executed"));
            }
            if (workflow.getStatus() != WorkflowStatus.READY) {
                activeWorkflows.remove(workflowId);
                return Mono.error(new IllegalStateException(
                        "Workflow '" + workflowId + "' cannot be executed in status " + workflow.getStatus()));
            }

            final WorkflowExecutionContext context = new WorkflowExecutionContext(workflow, notifier, cancellationToken);

            return Mono.usingWhen(
                            resourceManager.allocate(workflowId, resourceRequirements(workflow)).defaultIfEmpty(false),
                            allocated -> allocated ? runWorkflow(context) : failAllocation(context),
                            allocated -> release(workflowId),
                            (allocated, error) -> release(workflowId),
                            allocated -> release(workflowId))
                    .then(Mono.fromCallable(() -> snapshotReport(workflow)))
                    .doOnTerminate(() -> activeWorkflows.remove(workflowId))
                    .doOnCancel(() -> activeWorkflows.remove(workflowId));
        });
    }

    @Override
    public ExecutionReport snapshotReport(Workflow workflow) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        return ExecutionReport.of(workflow);
    }

    // --- 执行主流程 ---

    private Mono<Void> runWorkflow(WorkflowExecutionContext context) {
        final Workflow workflow = context.getWorkflow();
        final String requestId = context.getRequestId();

        return Mono.fromRunnable(() -> startWorkflow(context))
                .then(Mono.defer(() -> step(context))
                        .repeat()
                        .takeUntil(Boolean::booleanValue)
                        .then())
                .doOnError(e -> {
                    log.error("[RequestId: {}][Workflow: '{}'] Execution failed with unexpected error: {}",
                            requestId, workflow.getId(), e.getMessage(), e);
                    abort(context, "internal error: " + e.getMessage());
                })
                .doFinally(signal -> {
                    if (signal == SignalType.CANCEL) {
                        log.warn("[RequestId: {}][Workflow: '{}'] Subscription cancelled, aborting workflow.",
                                requestId, workflow.getId());
                        abort(context, CANCELLED_ERROR);
                    }
                });
    }

    private void startWorkflow(WorkflowExecutionContext context) {
        Workflow workflow = context.getWorkflow();
        withTransitionLock(context, () -> {
            workflow.markRunning(clock.instant());
            context.markStarted();
            notifyStatus(context, StatusEventType.WORKFLOW_STARTED, null, WorkflowStatus.RUNNING.name(), "workflow started");
        });
        safeNotifyListeners(l -> l.onWorkflowStart(context.getRequestId(), workflow));
        log.info("[RequestId: {}][Workflow: '{}'] Execution started with {} tasks (maxConcurrentTasks: {}, policy: {}).",
                context.getRequestId(), workflow.getId(), workflow.size(),
                options.getMaxConcurrentTasks(), options.getFailurePolicy());
    }

    /**
     * 调度循环的一次迭代。
     *
     * @return true 表示工作流已进入终态，循环结束
     */
    private Mono<Boolean> step(WorkflowExecutionContext context) {
        final Workflow workflow = context.getWorkflow();

        if (context.getCancellationToken().isCancellationRequested()) {
            cancelWorkflow(context);
            return Mono.just(true);
        }
        if (context.isFailFastActive()) {
            failFast(context);
            return Mono.just(true);
        }

        long observedVersion = context.currentProgressVersion();
        LoopState state = workflow.readLocked(() -> new LoopState(
                ReadinessSelector.executable(workflow),
                workflow.allTasksCompleted(),
                workflow.taskIdsInStatus(TaskStatus.RUNNING).size()));

        if (state.ready.isEmpty()) {
            if (state.allCompleted) {
                completeWorkflow(context);
                return Mono.just(true);
            }
            if (state.running == 0) {
                deadlock(context);
                return Mono.just(true);
            }
            log.trace("[RequestId: {}][Workflow: '{}'] No ready task, {} in flight. Waiting for progress.",
                    context.getRequestId(), workflow.getId(), state.running);
            return context.awaitProgress(observedVersion, options.getPollInterval()).thenReturn(false);
        }

        int slots = options.getMaxConcurrentTasks() - state.running;
        if (slots <= 0) {
            return context.awaitProgress(observedVersion, options.getPollInterval()).thenReturn(false);
        }
        state.ready.stream().limit(slots).forEach(task -> dispatch(context, task));
        return Mono.just(false);
    }

    private void dispatch(WorkflowExecutionContext context, Task task) {
        final Workflow workflow = context.getWorkflow();
        final String taskId = task.getId();

        withTransitionLock(context, () -> {
            workflow.startTask(taskId, causalStartTime(workflow, task));
            notifyStatus(context, StatusEventType.TASK_STARTED, taskId, TaskStatus.RUNNING.name(), "task started");
        });
        log.debug("[RequestId: {}][Workflow: '{}'] Dispatching task '{}' (executor: {}).",
                context.getRequestId(), workflow.getId(), taskId, task.getExecutorRef());

        // 先登记再订阅，同步完成的任务会在订阅返回前自行注销
        Disposable.Swap subscription = Disposables.swap();
        context.track(taskId, subscription);
        subscription.update(taskRunner.run(context.getRequestId(), workflow, task, options.getTaskTimeout())
                .subscribe(
                        outcome -> applyOutcome(context, task, outcome),
                        error -> applyOutcome(context, task, TaskOutcome.failure(error))));
    }

    /**
     * 任务开始时间不早于其所有依赖的完成时间。
     */
    private Instant causalStartTime(Workflow workflow, Task task) {
        Instant start = clock.instant();
        for (String dependencyId : task.getDependencies()) {
            Optional<Instant> completedAt = workflow.getTask(dependencyId).flatMap(Task::getCompletedAt);
            if (completedAt.isPresent() && completedAt.get().isAfter(start)) {
                start = completedAt.get();
            }
        }
        return start;
    }

    private void applyOutcome(WorkflowExecutionContext context, Task task, TaskOutcome outcome) {
        final Workflow workflow = context.getWorkflow();
        final String taskId = task.getId();

        withTransitionLock(context, () -> {
            Instant now = clock.instant();
            if (outcome.isSuccess()) {
                if (workflow.completeTask(taskId, outcome.getOutput().orElse(null), now)) {
                    log.debug("[RequestId: {}][Workflow: '{}'] Task '{}' COMPLETED.",
                            context.getRequestId(), workflow.getId(), taskId);
                    notifyStatus(context, StatusEventType.TASK_COMPLETED, taskId, TaskStatus.COMPLETED.name(), "task completed");
                }
            } else {
                TaskError error = outcome.getError().orElseThrow(IllegalStateException::new);
                if (workflow.failTask(taskId, error, now)) {
                    log.warn("[RequestId: {}][Workflow: '{}'] Task '{}' FAILED: {}",
                            context.getRequestId(), workflow.getId(), taskId, error);
                    notifyStatus(context, StatusEventType.TASK_FAILED, taskId, TaskStatus.FAILED.name(), error.getMessage());
                    if (options.getFailurePolicy() == FailurePolicy.FAIL_FAST) {
                        context.triggerFailFast(taskId);
                    }
                }
            }
        });
        context.untrack(taskId);
        context.signalProgress();
    }

    // --- 终止分支 ---

    private void completeWorkflow(WorkflowExecutionContext context) {
        Workflow workflow = context.getWorkflow();
        withTransitionLock(context, () -> {
            workflow.markCompleted(clock.instant());
            notifyStatus(context, StatusEventType.WORKFLOW_COMPLETED, null, WorkflowStatus.COMPLETED.name(), "workflow completed");
        });
        logCompletion(context, true, null);
    }

    private void deadlock(WorkflowExecutionContext context) {
        Workflow workflow = context.getWorkflow();
        List<String> blocked = workflow.taskIdsInStatus(TaskStatus.PENDING);
        List<String> failed = workflow.taskIdsInStatus(TaskStatus.FAILED);
        log.warn("[RequestId: {}][Workflow: '{}'] No progress possible. Blocked tasks: {}, failed tasks: {}",
                context.getRequestId(), workflow.getId(), blocked, failed);
        failWorkflow(context, DEADLOCK_ERROR, blocked);
    }

    private void cancelWorkflow(WorkflowExecutionContext context) {
        log.warn("[RequestId: {}][Workflow: '{}'] Cancellation requested.",
                context.getRequestId(), context.getWorkflow().getId());
        cancelInFlight(context, "workflow cancelled");
        failWorkflow(context, CANCELLED_ERROR, context.getWorkflow().taskIdsInStatus(TaskStatus.PENDING));
    }

    private void failFast(WorkflowExecutionContext context) {
        String failedTaskId = context.getFailFastTaskId().get();
        cancelInFlight(context, "cancelled after task '" + failedTaskId + "' failed");
        failWorkflow(context, "task '" + failedTaskId + "' failed", context.getWorkflow().taskIdsInStatus(TaskStatus.PENDING));
    }

    private Mono<Void> failAllocation(WorkflowExecutionContext context) {
        return Mono.fromRunnable(() -> {
            Workflow workflow = context.getWorkflow();
            log.warn("[RequestId: {}][Workflow: '{}'] Resource allocation denied.", context.getRequestId(), workflow.getId());
            withTransitionLock(context, () -> {
                workflow.markFailed(ALLOCATION_ERROR, clock.instant());
                notifyStatus(context, StatusEventType.WORKFLOW_FAILED, null, WorkflowStatus.FAILED.name(), ALLOCATION_ERROR);
            });
            logCompletion(context, false, ALLOCATION_ERROR);
        });
    }

    /**
     * 在意外错误或订阅取消后终止工作流；已处于终态时不做任何事。
     */
    private void abort(WorkflowExecutionContext context, String error) {
        if (!context.isStarted() || context.getWorkflow().getStatus().isTerminal()) {
            return;
        }
        cancelInFlight(context, error);
        failWorkflow(context, error, context.getWorkflow().taskIdsInStatus(TaskStatus.PENDING));
    }

    private void failWorkflow(WorkflowExecutionContext context, String error, List<String> blocked) {
        Workflow workflow = context.getWorkflow();
        withTransitionLock(context, () -> {
            if (!blocked.isEmpty()) {
                workflow.putMetadata(Workflow.METADATA_BLOCKED_TASKS, new ArrayList<>(blocked));
            }
            workflow.markFailed(error, clock.instant());
            notifyStatus(context, StatusEventType.WORKFLOW_FAILED, null, WorkflowStatus.FAILED.name(), error);
        });
        logCompletion(context, false, error);
    }

    private void cancelInFlight(WorkflowExecutionContext context, String reason) {
        Workflow workflow = context.getWorkflow();
        context.disposeInFlight();
        for (String taskId : workflow.taskIdsInStatus(TaskStatus.RUNNING)) {
            withTransitionLock(context, () -> {
                if (workflow.failTask(taskId, TaskError.cancelled(reason), clock.instant())) {
                    notifyStatus(context, StatusEventType.TASK_FAILED, taskId, TaskStatus.FAILED.name(), reason);
                }
            });
        }
    }

    // --- 辅助方法 ---

    private Mono<Void> release(String workflowId) {
        return resourceManager.release(workflowId)
                .onErrorResume(e -> {
                    log.error("Failed to release resources of workflow '{}': {}", workflowId, e.getMessage(), e);
                    return Mono.empty();
                });
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> resourceRequirements(Workflow workflow) {
        Object requirements = workflow.getMetadata(Workflow.METADATA_RESOURCE_REQUIREMENTS).orElse(null);
        if (requirements instanceof Map) {
            return Collections.unmodifiableMap((Map<String, Object>) requirements);
        }
        return Collections.emptyMap();
    }

    private void withTransitionLock(WorkflowExecutionContext context, Runnable transition) {
        context.getTransitionLock().lock();
        try {
            transition.run();
        } finally {
            context.getTransitionLock().unlock();
        }
    }

    private void notifyStatus(WorkflowExecutionContext context, StatusEventType type, String taskId, String status, String message) {
        safeNotify(context.getNotifier(), event(type, context.getWorkflow().getId(), taskId, status, message));
    }

    private StatusEvent event(StatusEventType type, String workflowId, String taskId, String status, String message) {
        return StatusEvent.builder()
                .type(type)
                .workflowId(workflowId)
                .taskId(taskId)
                .status(status)
                .message(message)
                .timestamp(clock.instant())
                .build();
    }

    private void safeNotify(StatusNotifier notifier, StatusEvent event) {
        if (notifier == null) {
            return;
        }
        try {
            notifier.onStatusChange(event);
        } catch (Exception e) {
            log.error("StatusNotifier threw on event {} of workflow '{}': {}", event.getType(), event.getWorkflowId(), e.getMessage(), e);
        }
    }

    private void safeNotifyListeners(Consumer<WorkflowMonitorListener> notification) {
        for (WorkflowMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("WorkflowMonitorListener {} threw: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private void logCompletion(WorkflowExecutionContext context, boolean success, String error) {
        Workflow workflow = context.getWorkflow();
        Duration duration = Duration.between(context.getExecutionStartTime(), Instant.now());
        if (success) {
            log.info("[RequestId: {}][Workflow: '{}'] Execution COMPLETED in {}ms. Order: {}",
                    context.getRequestId(), workflow.getId(), duration.toMillis(), workflow.getExecutionOrder());
        } else {
            log.warn("[RequestId: {}][Workflow: '{}'] Execution FAILED in {}ms: {}",
                    context.getRequestId(), workflow.getId(), duration.toMillis(), error);
        }
        safeNotifyListeners(l -> l.onWorkflowComplete(context.getRequestId(), workflow, duration, success, error));
    }

    private static final class LoopState {
        private final List<Task> ready;
        private final boolean allCompleted;
        private final int running;

        private LoopState(List<Task> ready, boolean allCompleted, int running) {
            this.ready = ready;
            this.allCompleted = allCompleted;
            this.running = running;
        }
    }
}
