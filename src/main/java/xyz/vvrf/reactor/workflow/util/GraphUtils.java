package xyz.vvrf.reactor.workflow.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.Workflow;

import java.util.*;

/**
 * 工作流依赖图的循环检测、拓扑排序与 DOT 导出工具。
 * <p>
 * 图以 {@code 任务ID -> 依赖ID列表} 的形式表示，迭代顺序即 Map 的插入顺序，
 * 依赖按列表顺序访问，因此所有结果在相同输入下都是确定的。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 按插入顺序抽取工作流的依赖图。
     */
    public static Map<String, List<String>> dependencyGraph(Workflow workflow) {
        return workflow.readLocked(() -> {
            Map<String, List<String>> graph = new LinkedHashMap<>();
            for (Task task : workflow.tasksView()) {
                graph.put(task.getId(), task.getDependencies());
            }
            return graph;
        });
    }

    /**
     * 使用深度优先搜索查找第一个循环。
     * 按 Map 顺序依次以每个未处理节点为起点；如果 DFS 遇到仍在递归栈上的节点，
     * 返回从该节点沿递归路径回到它自身的有序 ID 列表，例如 {@code [A, B, A]}。
     *
     * @param graph 任务ID -> 依赖ID列表
     * @return 发现的循环路径；无循环时为空
     */
    public static Optional<List<String>> findCycle(Map<String, List<String>> graph) {
        Set<String> processed = new HashSet<>(); // 完全处理过的节点
        Deque<String> path = new ArrayDeque<>(); // 当前递归路径
        Set<String> onPath = new HashSet<>();

        for (String node : graph.keySet()) {
            if (!processed.contains(node)) {
                List<String> cycle = findCycleDfs(node, graph, processed, path, onPath);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    // DFS 辅助方法
    private static List<String> findCycleDfs(String node,
                                             Map<String, List<String>> graph,
                                             Set<String> processed,
                                             Deque<String> path,
                                             Set<String> onPath) {
        path.addLast(node);
        onPath.add(node);

        for (String dependency : graph.getOrDefault(node, Collections.emptyList())) {
            if (!graph.containsKey(dependency)) {
                continue; // 悬空引用不参与循环检测
            }
            if (onPath.contains(dependency)) {
                return cycleFrom(dependency, path);
            }
            if (!processed.contains(dependency)) {
                List<String> cycle = findCycleDfs(dependency, graph, processed, path, onPath);
                if (cycle != null) {
                    return cycle;
                }
            }
        }

        path.removeLast(); // 回溯
        onPath.remove(node);
        processed.add(node);
        return null;
    }

    private static List<String> cycleFrom(String start, Deque<String> path) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String node : path) {
            if (node.equals(start)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(node);
            }
        }
        cycle.add(start);
        return Collections.unmodifiableList(cycle);
    }

    /**
     * 检测循环，发现时抛出异常。
     *
     * @throws IllegalStateException 如果图包含循环
     */
    public static void detectCycles(Map<String, List<String>> graph, String graphName) {
        log.debug("Workflow '{}': Starting cycle detection...", graphName);
        findCycle(graph).ifPresent(cycle -> {
            throw new IllegalStateException(String.format("Workflow '%s': Cycle detected! Path: %s",
                    graphName, String.join(" -> ", cycle)));
        });
        log.debug("Workflow '{}': No cycles detected.", graphName);
    }

    /**
     * 使用 Kahn 算法计算拓扑排序。入度相同的节点按 Map 插入顺序输出。
     * 不在图中的依赖被忽略。
     *
     * @return 依赖在前的任务 ID 列表
     * @throws IllegalStateException 如果图包含循环
     */
    public static List<String> topologicalSort(Map<String, List<String>> graph, String graphName) {
        log.debug("Workflow '{}': Starting topological sort...", graphName);
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>(); // 依赖 -> 下游

        for (String node : graph.keySet()) {
            inDegree.put(node, 0);
        }
        for (Map.Entry<String, List<String>> entry : graph.entrySet()) {
            for (String dependency : new LinkedHashSet<>(entry.getValue())) {
                if (graph.containsKey(dependency)) {
                    inDegree.merge(entry.getKey(), 1, Integer::sum);
                    dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(entry.getKey());
                }
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((node, degree) -> {
            if (degree == 0) {
                queue.offer(node);
            }
        });

        List<String> sortedOrder = new ArrayList<>();
        while (!queue.isEmpty()) {
            String u = queue.poll();
            sortedOrder.add(u);
            for (String v : dependents.getOrDefault(u, Collections.emptyList())) {
                if (inDegree.merge(v, -1, Integer::sum) == 0) {
                    queue.offer(v);
                }
            }
        }

        if (sortedOrder.size() != graph.size()) {
            Set<String> remaining = new LinkedHashSet<>(graph.keySet());
            remaining.removeAll(sortedOrder);
            throw new IllegalStateException(String.format("Workflow '%s': Topological sort failed, graph contains a cycle. Unsorted tasks: %s",
                    graphName, remaining));
        }

        log.debug("Workflow '{}': Topological sort successful.", graphName);
        return Collections.unmodifiableList(sortedOrder);
    }

    /**
     * 生成依赖图的 DOT 描述，边由依赖指向下游任务。
     */
    public static String toDot(Map<String, List<String>> graph, String graphName) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"").append(escape(graphName)).append("\" {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=box, style=rounded];\n");
        for (String node : graph.keySet()) {
            dot.append("  \"").append(escape(node)).append("\";\n");
        }
        for (Map.Entry<String, List<String>> entry : graph.entrySet()) {
            for (String dependency : entry.getValue()) {
                dot.append("  \"").append(escape(dependency)).append("\" -> \"")
                        .append(escape(entry.getKey())).append("\";\n");
            }
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String escape(String value) {
        return value.replace("\"", "\\\"");
    }
}
