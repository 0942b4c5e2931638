package xyz.vvrf.reactor.workflow.execution;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.notify.StatusNotifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 封装单次工作流执行的运行时状态。
 * 每次 {@link StandardWorkflowEngine#execute} 调用都会创建一个此类的实例。
 * <p>
 * 任务完成时通过 {@link #signalProgress()} 递增进度版本并唤醒等待中的调度循环，
 * 取代固定间隔的轮询。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Getter
public class WorkflowExecutionContext {

    private final String requestId;
    private final Workflow workflow;
    private final StatusNotifier notifier;
    private final CancellationToken cancellationToken;
    private final Instant executionStartTime;

    /** 串行化"状态迁移 + 通知"，保证通知顺序与状态顺序一致。 */
    private final ReentrantLock transitionLock = new ReentrantLock();

    private final Map<String, Disposable> inFlight = new ConcurrentHashMap<>();
    private final AtomicReference<String> failFastTaskId = new AtomicReference<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong progressVersion = new AtomicLong(0);
    private final Sinks.Many<Long> progressSink = Sinks.many().replay().latest();

    public WorkflowExecutionContext(Workflow workflow, StatusNotifier notifier, CancellationToken cancellationToken) {
        this.workflow = workflow;
        this.notifier = (notifier != null) ? notifier : StatusNotifier.noop();
        this.cancellationToken = (cancellationToken != null) ? cancellationToken : CancellationToken.none();
        this.executionStartTime = Instant.now();
        this.requestId = "wf-req-" + UUID.randomUUID().toString().substring(0, 8);
        emit(0L);
        this.cancellationToken.onCancel(this::signalProgress);

        log.info("[RequestId: {}][Workflow: '{}'] 创建 WorkflowExecutionContext (Tasks: {})",
                requestId, workflow.getId(), workflow.size());
    }

    public long currentProgressVersion() {
        return progressVersion.get();
    }

    /**
     * 递增进度版本并唤醒等待者。
     */
    public void signalProgress() {
        emit(progressVersion.incrementAndGet());
    }

    /**
     * 等待进度版本超过 {@code observedVersion}，最多等待 {@code pollInterval}。
     */
    public Mono<Void> awaitProgress(long observedVersion, Duration pollInterval) {
        Mono<Long> progressed = progressSink.asFlux()
                .filter(version -> version > observedVersion)
                .next();
        return Mono.firstWithSignal(progressed, Mono.delay(pollInterval)).then();
    }

    public void track(String taskId, Disposable subscription) {
        inFlight.put(taskId, subscription);
    }

    public void untrack(String taskId) {
        inFlight.remove(taskId);
    }

    /**
     * 取消所有在途的执行器调用。
     *
     * @return 被取消的任务 ID
     */
    public List<String> disposeInFlight() {
        List<String> disposed = new ArrayList<>();
        inFlight.forEach((taskId, subscription) -> {
            subscription.dispose();
            disposed.add(taskId);
        });
        inFlight.clear();
        return disposed;
    }

    /**
     * 尝试触发 FAIL_FAST 模式。
     *
     * @return 如果 FAIL_FAST 是首次被触发，则返回 true
     */
    public boolean triggerFailFast(String taskId) {
        if (failFastTaskId.compareAndSet(null, taskId)) {
            log.warn("[RequestId: {}][Workflow: '{}'] Activating FAIL_FAST due to failure of task '{}'.",
                    requestId, workflow.getId(), taskId);
            signalProgress();
            return true;
        }
        return false;
    }

    /**
     * 标记本次执行已把工作流置为 RUNNING。只有已启动的执行才能终止工作流。
     */
    public void markStarted() {
        started.set(true);
    }

    public boolean isStarted() {
        return started.get();
    }

    public boolean isFailFastActive() {
        return failFastTaskId.get() != null;
    }

    private void emit(long version) {
        Sinks.EmitResult result;
        synchronized (progressSink) {
            result = progressSink.tryEmitNext(version);
        }
        if (result.isFailure()) {
            log.debug("[RequestId: {}] 进度信号 {} 发送失败: {}", requestId, version, result);
        }
    }
}
