package xyz.vvrf.reactor.workflow.planning;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.execution.StandardTaskRunner;
import xyz.vvrf.reactor.workflow.execution.TaskInputBuilder;
import xyz.vvrf.reactor.workflow.registry.TaskExecutorRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.*;

/**
 * 以编程方式构建处于 PLANNING 状态的 {@link Workflow}。
 * <p>
 * 依赖可以引用尚未添加的任务；引用了最终不存在的任务的依赖会原样保留，
 * 交由依赖校验器处理。如果提供了 {@link TaskExecutorRegistry}，添加任务时会检查执行器引用是否已注册。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class WorkflowBuilder {

    private final String title;
    private final TaskExecutorRegistry executorRegistry;
    private String id;
    private String description;
    private String query;
    private Clock clock = Clock.systemUTC();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Map<String, TaskSpec> tasks = new LinkedHashMap<>();

    public WorkflowBuilder(String title) {
        this(title, null);
    }

    public WorkflowBuilder(String title, TaskExecutorRegistry executorRegistry) {
        this.title = Objects.requireNonNull(title, "工作流标题不能为空");
        this.executorRegistry = executorRegistry;
    }

    public static WorkflowBuilder create(String title) {
        return new WorkflowBuilder(title);
    }

    public WorkflowBuilder id(String id) {
        this.id = id;
        return this;
    }

    public WorkflowBuilder description(String description) {
        this.description = description;
        return this;
    }

    public WorkflowBuilder query(String query) {
        this.query = query;
        return this;
    }

    public WorkflowBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
        return this;
    }

    public WorkflowBuilder metadata(String key, Object value) {
        metadata.put(Objects.requireNonNull(key, "元数据键不能为空"), value);
        return this;
    }

    /**
     * 合并到每个任务派生输入中的外部上下文。
     */
    public WorkflowBuilder externalContext(Map<String, ?> context) {
        metadata.put(Workflow.METADATA_EXTERNAL_CONTEXT, new LinkedHashMap<>(context));
        return this;
    }

    public WorkflowBuilder resourceRequirements(Map<String, ?> requirements) {
        metadata.put(Workflow.METADATA_RESOURCE_REQUIREMENTS, new LinkedHashMap<>(requirements));
        return this;
    }

    public WorkflowBuilder addTask(String taskId, String executorRef) {
        return addTask(taskId, taskId, "", executorRef);
    }

    public WorkflowBuilder addTask(String taskId, String taskTitle, String taskDescription, String executorRef) {
        Objects.requireNonNull(taskId, "任务 ID 不能为空");
        Objects.requireNonNull(executorRef, "执行器引用不能为空");
        if (tasks.containsKey(taskId)) {
            throw new IllegalArgumentException(String.format("任务 ID '%s' 在工作流 '%s' 中已存在。", taskId, title));
        }
        if (executorRegistry != null && !executorRegistry.isRegistered(executorRef)) {
            throw new IllegalArgumentException(String.format("执行器引用 '%s' 未注册。无法为工作流 '%s' 添加任务 '%s'。",
                    executorRef, title, taskId));
        }
        tasks.put(taskId, new TaskSpec(taskId, taskTitle, taskDescription, executorRef));
        log.debug("工作流 '{}': 添加了任务 '{}' (执行器: {})", title, taskId, executorRef);
        return this;
    }

    /**
     * 为任务追加依赖，保持调用顺序。
     */
    public WorkflowBuilder dependsOn(String taskId, String... dependencyIds) {
        TaskSpec spec = getTaskSpecOrThrow(taskId);
        spec.dependencies.addAll(Arrays.asList(dependencyIds));
        return this;
    }

    public WorkflowBuilder withTimeout(String taskId, Duration timeout) {
        return withMetadata(taskId, StandardTaskRunner.METADATA_TIMEOUT, timeout);
    }

    /**
     * 以字面量替换任务的派生输入。
     */
    public WorkflowBuilder withInput(String taskId, Object input) {
        return withMetadata(taskId, TaskInputBuilder.METADATA_INPUT, input);
    }

    public WorkflowBuilder withMetadata(String taskId, String key, Object value) {
        getTaskSpecOrThrow(taskId).metadata.put(Objects.requireNonNull(key, "元数据键不能为空"), value);
        return this;
    }

    public Workflow build() {
        Workflow workflow = Workflow.builder()
                .id(id)
                .title(title)
                .description(description)
                .query(query)
                .metadata(metadata)
                .createdAt(clock.instant())
                .build();
        for (TaskSpec spec : tasks.values()) {
            for (String dependency : spec.dependencies) {
                if (!tasks.containsKey(dependency)) {
                    log.warn("工作流 '{}': 任务 '{}' 依赖了不存在的任务 '{}'", title, spec.id, dependency);
                }
            }
            workflow.addTask(Task.builder()
                    .id(spec.id)
                    .title(spec.title)
                    .description(spec.description)
                    .executorRef(spec.executorRef)
                    .dependencies(spec.dependencies)
                    .metadata(spec.metadata)
                    .createdAt(clock.instant())
                    .build());
        }
        log.info("工作流 '{}' ({}) 构建完成，共 {} 个任务", title, workflow.getId(), tasks.size());
        return workflow;
    }

    private TaskSpec getTaskSpecOrThrow(String taskId) {
        TaskSpec spec = tasks.get(taskId);
        if (spec == null) {
            throw new IllegalArgumentException(String.format("任务 '%s' 尚未添加到工作流 '%s'。", taskId, title));
        }
        return spec;
    }

    private static final class TaskSpec {
        private final String id;
        private final String title;
        private final String description;
        private final String executorRef;
        private final List<String> dependencies = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private TaskSpec(String id, String title, String description, String executorRef) {
            this.id = id;
            this.title = title;
            this.description = description;
            this.executorRef = executorRef;
        }
    }
}
