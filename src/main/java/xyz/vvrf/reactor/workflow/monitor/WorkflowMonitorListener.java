package xyz.vvrf.reactor.workflow.monitor;

import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.TaskError;
import xyz.vvrf.reactor.workflow.core.Workflow;

import java.time.Duration;

/**
 * 引擎级的工作流执行监听器，用于日志、指标等横切关注点。
 * 与调用方按次传入的 {@link xyz.vvrf.reactor.workflow.notify.StatusNotifier} 不同，
 * 监听器在引擎创建时注册，对所有工作流生效。
 *
 * @author ruifeng.wen
 */
public interface WorkflowMonitorListener {

    /**
     * 工作流进入 RUNNING 时调用。
     *
     * @param requestId 请求 ID
     * @param workflow  工作流
     */
    void onWorkflowStart(String requestId, Workflow workflow);

    /**
     * 工作流进入终态时调用 (无论成功或失败)。
     *
     * @param requestId     请求 ID
     * @param workflow      工作流
     * @param totalDuration 从开始执行到终态的耗时
     * @param success       是否整体成功
     * @param error         失败原因；成功时为 null
     */
    void onWorkflowComplete(String requestId, Workflow workflow, Duration totalDuration, boolean success, String error);

    /**
     * 任务即将调用执行器时调用。
     */
    void onTaskStart(String requestId, String workflowId, Task task);

    /**
     * 任务成功时调用。
     *
     * @param duration 执行器调用耗时
     */
    void onTaskSuccess(String requestId, String workflowId, Task task, Duration duration);

    /**
     * 任务失败时调用，包括超时与找不到执行器。
     */
    void onTaskFailure(String requestId, String workflowId, Task task, Duration duration, TaskError error);

    /**
     * 任务执行超时时调用。
     * 这通常是 onTaskFailure 的一种特定情况，但为方便监控单独列出。
     *
     * @param timeout 配置的超时时长
     */
    void onTaskTimeout(String requestId, String workflowId, Task task, Duration timeout);
}
