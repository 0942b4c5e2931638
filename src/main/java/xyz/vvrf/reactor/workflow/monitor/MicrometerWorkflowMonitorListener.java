package xyz.vvrf.reactor.workflow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.TaskError;
import xyz.vvrf.reactor.workflow.core.TaskErrorType;
import xyz.vvrf.reactor.workflow.core.Workflow;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 将工作流执行事件记录为 Micrometer 指标。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerWorkflowMonitorListener implements WorkflowMonitorListener {

    private final MeterRegistry meterRegistry;

    // 指标名称
    public static final String METRIC_TASK_EXECUTION_TIME = "workflow.task.execution.time";
    public static final String METRIC_TASK_EXECUTION_TOTAL = "workflow.task.execution.total";
    public static final String METRIC_TASK_TIMEOUT_TOTAL = "workflow.task.timeout.total";
    public static final String METRIC_WORKFLOW_EXECUTION_TOTAL = "workflow.execution.total";
    public static final String METRIC_WORKFLOW_EXECUTION_TIME = "workflow.execution.time";

    // 标签键
    private static final String TAG_EXECUTOR = "executor";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";

    // 状态标签值
    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";
    private static final String STATUS_TIMEOUT = "TIMEOUT";

    public MicrometerWorkflowMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onWorkflowStart(String requestId, Workflow workflow) {
        // 只在终态时记录
    }

    @Override
    public void onWorkflowComplete(String requestId, Workflow workflow, Duration totalDuration, boolean success, String error) {
        Tags tags = Tags.of(Tag.of(TAG_STATUS, success ? STATUS_SUCCESS : STATUS_FAILURE));
        try {
            Counter.builder(METRIC_WORKFLOW_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("按状态统计的工作流执行总数")
                    .register(meterRegistry)
                    .increment();
            Timer.builder(METRIC_WORKFLOW_EXECUTION_TIME)
                    .tags(tags)
                    .description("工作流执行时间")
                    .register(meterRegistry)
                    .record(totalDuration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录工作流指标失败: {}", e.getMessage(), e);
        }
    }

    @Override
    public void onTaskStart(String requestId, String workflowId, Task task) {
        // 计数器/计时器在结束时记录
    }

    @Override
    public void onTaskSuccess(String requestId, String workflowId, Task task, Duration duration) {
        Tags tags = Tags.of(
                Tag.of(TAG_EXECUTOR, task.getExecutorRef()),
                Tag.of(TAG_STATUS, STATUS_SUCCESS)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onTaskFailure(String requestId, String workflowId, Task task, Duration duration, TaskError error) {
        String status = (error.getType() == TaskErrorType.TIMEOUT) ? STATUS_TIMEOUT : STATUS_FAILURE;
        Tags tags = Tags.of(
                Tag.of(TAG_EXECUTOR, task.getExecutorRef()),
                Tag.of(TAG_STATUS, status),
                Tag.of(TAG_ERROR, error.getType().name())
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onTaskTimeout(String requestId, String workflowId, Task task, Duration timeout) {
        Tags tags = Tags.of(Tag.of(TAG_EXECUTOR, task.getExecutorRef()));
        try {
            Counter.builder(METRIC_TASK_TIMEOUT_TOTAL).tags(tags).register(meterRegistry).increment();
        } catch (Exception e) {
            log.error("增加超时计数器失败: {}", e.getMessage(), e);
        }
        log.debug("Micrometer 监听器捕获到任务 {} 的超时事件", task.getId());
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_TASK_EXECUTION_TIME)
                    .tags(tags)
                    .description("工作流任务执行时间")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_TASK_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("按状态统计的工作流任务执行总数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
