package xyz.vvrf.reactor.workflow.planning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.Workflow;

import java.time.Clock;
import java.util.*;

/**
 * 将规划器输出的 JSON 计划解析为任务。
 * <pre>
 * {"tasks": [
 *   {"id": "可选", "title": "...", "description": "...", "executor": "...", "dependencies": [0, "other-id"], "metadata": {...}},
 *   ...
 * ]}
 * </pre>
 * 执行器引用也接受 {@code executorRef} 或 {@code agent_id} 字段。
 * 整数（或纯数字字符串）依赖被视为任务列表中从 0 开始的下标，在这里一次性解析为任务 ID；
 * 之后的数据模型中只存在稳定的任务 ID。无法解析的引用原样保留，由依赖校验器移除。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class WorkflowPlanParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WorkflowPlanParser(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
    }

    public WorkflowPlanParser(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    /**
     * 解析计划并把任务添加到 PLANNING 状态的工作流中。
     *
     * @return 添加的任务，按计划顺序
     * @throws WorkflowPlanException 如果 JSON 无效或缺少必需字段
     */
    public List<Task> populate(Workflow workflow, String planJson) {
        List<Task> tasks = parseTasks(planJson);
        for (Task task : tasks) {
            workflow.addTask(task);
        }
        log.info("工作流 '{}': 从计划中解析出 {} 个任务", workflow.getId(), tasks.size());
        return tasks;
    }

    public List<Task> parseTasks(String planJson) {
        JsonNode taskNodes = readTaskArray(planJson);

        // 第一遍：确定每个下标对应的任务 ID
        List<String> ids = new ArrayList<>(taskNodes.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < taskNodes.size(); i++) {
            JsonNode node = taskNodes.get(i);
            if (!node.isObject()) {
                throw new WorkflowPlanException("Plan task #" + i + " is not an object");
            }
            String id = node.hasNonNull("id") ? node.get("id").asText() : UUID.randomUUID().toString();
            if (!seen.add(id)) {
                throw new WorkflowPlanException("Plan contains duplicate task id '" + id + "'");
            }
            ids.add(id);
        }

        // 第二遍：构建任务并解析依赖
        List<Task> tasks = new ArrayList<>(taskNodes.size());
        for (int i = 0; i < taskNodes.size(); i++) {
            JsonNode node = taskNodes.get(i);
            String id = ids.get(i);
            tasks.add(Task.builder()
                    .id(id)
                    .title(requiredText(node, i, "title"))
                    .description(node.path("description").asText(""))
                    .executorRef(executorRef(node, i))
                    .dependencies(resolveDependencies(node.path("dependencies"), ids, seen, id))
                    .metadata(metadata(node.path("metadata"), i))
                    .createdAt(clock.instant())
                    .build());
        }
        return tasks;
    }

    private JsonNode readTaskArray(String planJson) {
        if (planJson == null || planJson.trim().isEmpty()) {
            throw new WorkflowPlanException("Plan is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(planJson);
        } catch (JsonProcessingException e) {
            throw new WorkflowPlanException("Invalid plan JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode tasks = root.isArray() ? root : root.path("tasks");
        if (!tasks.isArray()) {
            throw new WorkflowPlanException("Plan does not contain a 'tasks' array");
        }
        return tasks;
    }

    private static String requiredText(JsonNode node, int index, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().trim().isEmpty()) {
            throw new WorkflowPlanException("Plan task #" + index + " is missing '" + field + "'");
        }
        return value.asText();
    }

    private static String executorRef(JsonNode node, int index) {
        for (String field : new String[]{"executor", "executorRef", "agent_id"}) {
            if (node.hasNonNull(field) && !node.get(field).asText().trim().isEmpty()) {
                return node.get(field).asText();
            }
        }
        throw new WorkflowPlanException("Plan task #" + index + " is missing an executor reference");
    }

    private List<String> resolveDependencies(JsonNode dependencies, List<String> ids, Set<String> knownIds, String taskId) {
        if (dependencies.isMissingNode() || dependencies.isNull()) {
            return Collections.emptyList();
        }
        if (!dependencies.isArray()) {
            throw new WorkflowPlanException("Dependencies of task '" + taskId + "' must be an array");
        }
        List<String> resolved = new ArrayList<>(dependencies.size());
        for (JsonNode dependency : dependencies) {
            if (dependency.isIntegralNumber()) {
                resolved.add(dependency.canConvertToLong()
                        ? byIndex(dependency.asLong(), ids).orElse(dependency.asText())
                        : dependency.asText());
            } else if (dependency.isTextual()) {
                String value = dependency.asText();
                if (knownIds.contains(value)) {
                    resolved.add(value);
                } else if (value.matches("\\d+")) {
                    resolved.add(parseIndex(value).flatMap(index -> byIndex(index, ids)).orElse(value));
                } else {
                    resolved.add(value);
                }
            } else {
                log.warn("任务 '{}' 的依赖 {} 既不是下标也不是 ID，已忽略", taskId, dependency);
            }
        }
        return resolved;
    }

    private static Optional<Long> parseIndex(String value) {
        try {
            return Optional.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            // 超出 long 范围的数字串不可能是合法下标
            return Optional.empty();
        }
    }

    private static Optional<String> byIndex(long index, List<String> ids) {
        return (index >= 0 && index < ids.size()) ? Optional.of(ids.get((int) index)) : Optional.empty();
    }

    private Map<String, Object> metadata(JsonNode node, int index) {
        if (node.isMissingNode() || node.isNull()) {
            return Collections.emptyMap();
        }
        if (!node.isObject()) {
            throw new WorkflowPlanException("Metadata of plan task #" + index + " must be an object");
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }
}
