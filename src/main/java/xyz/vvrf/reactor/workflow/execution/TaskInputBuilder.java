package xyz.vvrf.reactor.workflow.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.context.ContextHandle;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.TaskRequest;
import xyz.vvrf.reactor.workflow.core.Workflow;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 为任务构造执行器输入。
 * <p>
 * 默认输入由任务标题与描述开头，随后按依赖声明顺序附上每个上游任务的标题与结果，
 * 最后附上工作流元数据中的外部上下文（如有）。任务元数据中的 {@code input}
 * 会整体替换派生输入。非文本结果使用 Jackson 序列化为 JSON。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class TaskInputBuilder {

    /** 任务元数据中覆盖派生输入的键。 */
    public static final String METADATA_INPUT = "input";

    private final ObjectMapper objectMapper;

    public TaskInputBuilder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
    }

    public TaskRequest buildRequest(String requestId, Workflow workflow, Task task, ContextHandle context) {
        return TaskRequest.builder()
                .requestId(requestId)
                .workflowId(workflow.getId())
                .taskId(task.getId())
                .executorRef(task.getExecutorRef())
                .title(task.getTitle())
                .input(buildInput(workflow, task))
                .dependencyResults(dependencyResults(workflow, task))
                .metadata(task.getMetadata())
                .context(context)
                .build();
    }

    public String buildInput(Workflow workflow, Task task) {
        Object literal = task.getMetadata(METADATA_INPUT).orElse(null);
        if (literal != null) {
            return render(literal);
        }

        StringBuilder input = new StringBuilder();
        input.append("Task: ").append(task.getTitle());
        if (!task.getDescription().isEmpty()) {
            input.append('\n').append(task.getDescription());
        }

        if (!task.getDependencies().isEmpty()) {
            input.append("\n\nResults from dependencies:");
            for (String dependencyId : task.getDependencies()) {
                workflow.getTask(dependencyId).ifPresent(dependency -> input.append("\n\n[")
                        .append(dependency.getTitle()).append("] (").append(dependencyId).append("):\n")
                        .append(dependency.getResult().map(this::render).orElse("(no result)")));
            }
        }

        workflow.getMetadata(Workflow.METADATA_EXTERNAL_CONTEXT)
                .ifPresent(context -> input.append("\n\nExternal context:\n").append(render(context)));
        return input.toString();
    }

    /**
     * 上游结果，按依赖声明顺序，值可能为 null。
     */
    public Map<String, Object> dependencyResults(Workflow workflow, Task task) {
        Map<String, Object> results = new LinkedHashMap<>();
        for (String dependencyId : task.getDependencies()) {
            workflow.getTask(dependencyId)
                    .ifPresent(dependency -> results.put(dependencyId, dependency.getResult().orElse(null)));
        }
        return results;
    }

    private String render(Object value) {
        if (value instanceof CharSequence) {
            return value.toString();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("无法将 {} 序列化为 JSON，改用 toString(): {}", value.getClass().getName(), e.getMessage());
            return String.valueOf(value);
        }
    }
}
