package xyz.vvrf.reactor.workflow.validation;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.util.GraphUtils;

import java.util.*;

/**
 * 校验并清理工作流的依赖图。
 * <p>
 * 依次执行：移除自依赖、去重、移除悬空引用、循环检测。每一步都是幂等的。
 * 宽松模式会把清理结果写回工作流；严格模式只报告问题。
 * 循环只会被报告，从不被自动打断。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class DependencyValidator {

    @Getter
    private final ValidationMode mode;

    public DependencyValidator(ValidationMode mode) {
        this.mode = Objects.requireNonNull(mode, "校验模式不能为空");
    }

    public DependencyValidator() {
        this(ValidationMode.LENIENT);
    }

    /**
     * 校验工作流依赖。本方法不修改工作流状态，只可能（宽松模式下）修改任务依赖列表。
     */
    public ValidationResult validate(Workflow workflow) {
        Objects.requireNonNull(workflow, "工作流不能为空");
        Map<String, List<String>> graph = GraphUtils.dependencyGraph(workflow);

        List<RemovedDependency> removed = new ArrayList<>();
        Map<String, List<String>> cleaned = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : graph.entrySet()) {
            cleaned.put(entry.getKey(), clean(entry.getKey(), entry.getValue(), graph.keySet(), removed));
        }

        boolean modified = false;
        if (!removed.isEmpty()) {
            if (mode == ValidationMode.STRICT) {
                log.warn("Workflow '{}': strict validation rejected {} degenerate dependencies: {}",
                        workflow.getId(), removed.size(), removed);
                return new ValidationResult(false, false, removed, GraphUtils.findCycle(cleaned).orElse(null));
            }
            for (Map.Entry<String, List<String>> entry : cleaned.entrySet()) {
                if (!entry.getValue().equals(graph.get(entry.getKey()))) {
                    workflow.replaceDependencies(entry.getKey(), entry.getValue());
                }
            }
            modified = true;
            log.info("Workflow '{}': removed {} degenerate dependencies: {}", workflow.getId(), removed.size(), removed);
        }

        Optional<List<String>> cycle = GraphUtils.findCycle(cleaned);
        if (cycle.isPresent()) {
            log.warn("Workflow '{}': dependency cycle detected: {}", workflow.getId(), cycle.get());
            return new ValidationResult(false, modified, removed, cycle.get());
        }
        if (log.isDebugEnabled()) {
            log.debug("Workflow '{}': validation passed. Topological order: {}",
                    workflow.getId(), GraphUtils.topologicalSort(cleaned, workflow.getId()));
        }
        return new ValidationResult(true, modified, removed, null);
    }

    private static List<String> clean(String taskId, List<String> dependencies, Set<String> knownIds,
                                      List<RemovedDependency> removed) {
        List<String> result = new ArrayList<>(dependencies.size());
        Set<String> seen = new HashSet<>();
        // 1. 自依赖
        for (String dependency : dependencies) {
            if (taskId.equals(dependency)) {
                removed.add(new RemovedDependency(taskId, dependency, RemovedDependency.Reason.SELF_REFERENCE));
            } else {
                result.add(dependency);
            }
        }
        // 2. 重复，保留首次出现
        List<String> unique = new ArrayList<>(result.size());
        for (String dependency : result) {
            if (seen.add(dependency)) {
                unique.add(dependency);
            } else {
                removed.add(new RemovedDependency(taskId, dependency, RemovedDependency.Reason.DUPLICATE));
            }
        }
        // 3. 悬空引用
        List<String> resolved = new ArrayList<>(unique.size());
        for (String dependency : unique) {
            if (knownIds.contains(dependency)) {
                resolved.add(dependency);
            } else {
                removed.add(new RemovedDependency(taskId, dependency, RemovedDependency.Reason.DANGLING));
            }
        }
        return resolved;
    }
}
