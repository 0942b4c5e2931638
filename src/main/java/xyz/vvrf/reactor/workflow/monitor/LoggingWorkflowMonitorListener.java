package xyz.vvrf.reactor.workflow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.TaskError;
import xyz.vvrf.reactor.workflow.core.Workflow;

import java.time.Duration;

@Slf4j
public class LoggingWorkflowMonitorListener implements WorkflowMonitorListener {

    @Override
    public void onWorkflowStart(String requestId, Workflow workflow) {
        log.info("[MONITOR] 请求:[{}] 工作流:[{}] 开始。 标题:[{}], 任务数:[{}]",
                requestId, workflow.getId(), workflow.getTitle(), workflow.size());
    }

    @Override
    public void onWorkflowComplete(String requestId, Workflow workflow, Duration totalDuration, boolean success, String error) {
        if (success) {
            log.info("[MONITOR] 请求:[{}] 工作流:[{}] 完成。 耗时:[{}ms]",
                    requestId, workflow.getId(), totalDuration.toMillis());
        } else {
            log.warn("[MONITOR] 请求:[{}] 工作流:[{}] 失败。 耗时:[{}ms], 错误:[{}]",
                    requestId, workflow.getId(), totalDuration.toMillis(), error);
        }
    }

    @Override
    public void onTaskStart(String requestId, String workflowId, Task task) {
        log.info("[MONITOR] 请求:[{}] 工作流:[{}] 任务:[{}] 开始。 执行器:[{}]",
                requestId, workflowId, task.getId(), task.getExecutorRef());
    }

    @Override
    public void onTaskSuccess(String requestId, String workflowId, Task task, Duration duration) {
        log.info("[MONITOR] 请求:[{}] 工作流:[{}] 任务:[{}] 成功。 耗时:[{}ms]",
                requestId, workflowId, task.getId(), duration.toMillis());
    }

    @Override
    public void onTaskFailure(String requestId, String workflowId, Task task, Duration duration, TaskError error) {
        log.error("[MONITOR] 请求:[{}] 工作流:[{}] 任务:[{}] 失败。 耗时:[{}ms], 类型:[{}], 错误:[{}]",
                requestId, workflowId, task.getId(), duration.toMillis(), error.getType(), error.getMessage());
    }

    @Override
    public void onTaskTimeout(String requestId, String workflowId, Task task, Duration timeout) {
        log.warn("[MONITOR] 请求:[{}] 工作流:[{}] 任务:[{}] 超时。 配置:[{}ms], 执行器:[{}]",
                requestId, workflowId, task.getId(), timeout.toMillis(), task.getExecutorRef());
    }
}
