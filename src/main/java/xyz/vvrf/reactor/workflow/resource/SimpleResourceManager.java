package xyz.vvrf.reactor.workflow.resource;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 限制同时运行的工作流数量的资源管理器。
 * {@code maxConcurrentWorkflows <= 0} 表示不限制。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleResourceManager implements ResourceManager {

    @Getter
    private final int maxConcurrentWorkflows;
    private final Set<String> holders = new LinkedHashSet<>();

    public SimpleResourceManager(int maxConcurrentWorkflows) {
        this.maxConcurrentWorkflows = maxConcurrentWorkflows;
    }

    public static SimpleResourceManager unbounded() {
        return new SimpleResourceManager(0);
    }

    @Override
    public Mono<Boolean> allocate(String workflowId, Map<String, Object> requirements) {
        return Mono.fromCallable(() -> {
            synchronized (holders) {
                if (holders.contains(workflowId)) {
                    return true;
                }
                if (maxConcurrentWorkflows > 0 && holders.size() >= maxConcurrentWorkflows) {
                    log.warn("工作流 '{}' 资源分配被拒绝。当前占用: {}/{}", workflowId, holders.size(), maxConcurrentWorkflows);
                    return false;
                }
                holders.add(workflowId);
                log.debug("为工作流 '{}' 分配资源。需求: {}, 当前占用: {}", workflowId, requirements, holders.size());
                return true;
            }
        });
    }

    @Override
    public Mono<Void> release(String workflowId) {
        return Mono.fromRunnable(() -> {
            synchronized (holders) {
                if (holders.remove(workflowId)) {
                    log.debug("释放工作流 '{}' 的资源。当前占用: {}", workflowId, holders.size());
                }
            }
        });
    }

    public Set<String> getHolders() {
        synchronized (holders) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(holders));
        }
    }
}
