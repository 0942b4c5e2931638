package xyz.vvrf.reactor.workflow.context;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 基于 Caffeine 缓存的内存上下文存储。
 * 句柄在最后一次访问后 {@code ttl} 过期，总数不超过 {@code maximumSize}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class InMemoryContextStore implements ContextStore {

    private final Cache<String, ContextHandle> contexts;

    public InMemoryContextStore(Duration ttl, long maximumSize) {
        Objects.requireNonNull(ttl, "上下文 TTL 不能为空");
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize 必须大于 0");
        }
        this.contexts = Caffeine.newBuilder()
                .expireAfterAccess(ttl)
                .maximumSize(maximumSize)
                .build();
        log.info("InMemoryContextStore 已初始化。TTL: {}, 最大条目数: {}", ttl, maximumSize);
    }

    public InMemoryContextStore() {
        this(Duration.ofHours(1), 10_000);
    }

    @Override
    public ContextHandle createContext(String workflowId, String taskId) {
        Objects.requireNonNull(workflowId, "工作流 ID 不能为空");
        Objects.requireNonNull(taskId, "任务 ID 不能为空");
        return contexts.get(key(workflowId, taskId), k -> {
            log.debug("为工作流 '{}' 任务 '{}' 创建上下文", workflowId, taskId);
            return new MapContextHandle(workflowId, taskId);
        });
    }

    @Override
    public Optional<ContextHandle> findContext(String workflowId, String taskId) {
        return Optional.ofNullable(contexts.getIfPresent(key(workflowId, taskId)));
    }

    @Override
    public int evictWorkflow(String workflowId) {
        String prefix = workflowId + "/";
        List<String> keys = contexts.asMap().keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .collect(Collectors.toList());
        contexts.invalidateAll(keys);
        log.debug("已移除工作流 '{}' 的 {} 个上下文", workflowId, keys.size());
        return keys.size();
    }

    private static String key(String workflowId, String taskId) {
        return workflowId + "/" + taskId;
    }

    @Getter
    private static final class MapContextHandle implements ContextHandle {

        private final String workflowId;
        private final String taskId;
        @Getter(lombok.AccessLevel.NONE)
        private final Map<String, Object> values = new ConcurrentHashMap<>();

        private MapContextHandle(String workflowId, String taskId) {
            this.workflowId = workflowId;
            this.taskId = taskId;
        }

        @Override
        public Optional<Object> get(String key) {
            return Optional.ofNullable(values.get(key));
        }

        @Override
        public void put(String key, Object value) {
            Objects.requireNonNull(key, "键不能为空");
            if (value == null) {
                values.remove(key);
            } else {
                values.put(key, value);
            }
        }

        @Override
        public Map<String, Object> snapshot() {
            return Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }
}
