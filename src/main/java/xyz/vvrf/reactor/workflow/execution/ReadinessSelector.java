package xyz.vvrf.reactor.workflow.execution;

import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.TaskStatus;
import xyz.vvrf.reactor.workflow.core.Workflow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 计算当前可执行的任务：状态为 PENDING 且所有依赖均已 COMPLETED。
 * 纯函数，不修改工作流；结果按工作流插入顺序排列。
 * 引用了不存在任务的依赖永远不被视为满足。
 *
 * @author ruifeng.wen
 */
public final class ReadinessSelector {

    private ReadinessSelector() {}

    public static List<Task> executable(Workflow workflow) {
        return workflow.readLocked(() -> {
            Map<String, TaskStatus> statuses = new HashMap<>();
            for (Task task : workflow.tasksView()) {
                statuses.put(task.getId(), task.getStatus());
            }
            List<Task> ready = new ArrayList<>();
            for (Task task : workflow.tasksView()) {
                if (task.getStatus() == TaskStatus.PENDING && dependenciesCompleted(task, statuses)) {
                    ready.add(task);
                }
            }
            return ready;
        });
    }

    public static boolean isExecutable(Workflow workflow, String taskId) {
        return executable(workflow).stream().anyMatch(t -> t.getId().equals(taskId));
    }

    private static boolean dependenciesCompleted(Task task, Map<String, TaskStatus> statuses) {
        for (String dependency : task.getDependencies()) {
            if (statuses.get(dependency) != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }
}
