package xyz.vvrf.reactor.workflow.execution;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import xyz.vvrf.reactor.workflow.core.FailurePolicy;

import java.time.Clock;
import java.time.Duration;

/**
 * 调度引擎的运行参数。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class WorkflowEngineOptions {

    /**
     * 单个任务的默认超时；为 null、零或负数时不设超时。
     */
    @Builder.Default
    private final Duration taskTimeout = Duration.ofMinutes(5);

    /**
     * 同时在途的任务上限。1 表示逐个顺序执行。
     */
    @Builder.Default
    private final int maxConcurrentTasks = 1;

    /**
     * 等待在途任务时的兜底轮询间隔。正常情况下任务完成会立即唤醒调度循环。
     */
    @Builder.Default
    private final Duration pollInterval = Duration.ofMillis(100);

    @Builder.Default
    private final FailurePolicy failurePolicy = FailurePolicy.CONTINUE_ON_FAILURE;

    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    public static WorkflowEngineOptions defaults() {
        return WorkflowEngineOptions.builder().build();
    }
}
