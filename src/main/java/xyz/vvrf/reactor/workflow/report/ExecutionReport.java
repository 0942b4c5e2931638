package xyz.vvrf.reactor.workflow.report;

import lombok.Builder;
import lombok.Value;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.TaskStatus;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作流在某一时刻的只读投影，适合对外输出。
 * 通过 {@link #of(Workflow)} 在工作流读锁内构建，运行中随时可调用。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
public class ExecutionReport {
    String workflowId;
    String title;
    WorkflowStatus status;
    String query;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    /** 工作流失败原因，例如 "deadlocked"；未失败时为 null。 */
    String error;
    /** 按插入顺序排列的任务投影。 */
    Map<String, TaskReport> tasks;
    Map<String, Object> results;
    /** 任务实际开始执行的顺序。 */
    List<String> executionOrder;
    /** 工作流失败时仍处于 PENDING 的任务。 */
    List<String> blockedTasks;
    Map<String, Object> metadata;

    public static ExecutionReport of(Workflow workflow) {
        return workflow.readLocked(() -> {
            Map<String, TaskReport> tasks = new LinkedHashMap<>();
            List<String> pending = new ArrayList<>();
            for (Task task : workflow.tasksView()) {
                tasks.put(task.getId(), TaskReport.builder()
                        .taskId(task.getId())
                        .title(task.getTitle())
                        .executorRef(task.getExecutorRef())
                        .status(task.getStatus())
                        .dependencies(task.getDependencies())
                        .result(task.getResult().orElse(null))
                        .error(task.getError().orElse(null))
                        .createdAt(task.getCreatedAt())
                        .startedAt(task.getStartedAt().orElse(null))
                        .completedAt(task.getCompletedAt().orElse(null))
                        .build());
                if (task.getStatus() == TaskStatus.PENDING) {
                    pending.add(task.getId());
                }
            }
            WorkflowStatus status = workflow.getStatus();
            Map<String, Object> metadata = workflow.getMetadata();
            Object error = (status == WorkflowStatus.FAILED) ? metadata.get(Workflow.METADATA_ERROR) : null;
            return ExecutionReport.builder()
                    .workflowId(workflow.getId())
                    .title(workflow.getTitle())
                    .status(status)
                    .query(workflow.getQuery())
                    .createdAt(workflow.getCreatedAt())
                    .startedAt(workflow.getStartedAt().orElse(null))
                    .completedAt(workflow.getCompletedAt().orElse(null))
                    .error(error != null ? String.valueOf(error) : null)
                    .tasks(Collections.unmodifiableMap(tasks))
                    .results(workflow.getResults())
                    .executionOrder(workflow.getExecutionOrder())
                    .blockedTasks(status == WorkflowStatus.FAILED
                            ? Collections.unmodifiableList(pending) : Collections.emptyList())
                    .metadata(metadata)
                    .build();
        });
    }

    public boolean isSuccess() {
        return status == WorkflowStatus.COMPLETED;
    }
}
