package xyz.vvrf.reactor.workflow.report;

import lombok.Builder;
import lombok.Value;
import xyz.vvrf.reactor.workflow.core.TaskError;
import xyz.vvrf.reactor.workflow.core.TaskStatus;

import java.time.Instant;
import java.util.List;

/**
 * 单个任务在报告中的只读投影。
 */
@Value
@Builder
public class TaskReport {
    String taskId;
    String title;
    String executorRef;
    TaskStatus status;
    List<String> dependencies;
    Object result;
    TaskError error;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
}
