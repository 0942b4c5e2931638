package xyz.vvrf.reactor.workflow.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.execution.TaskExecutor;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * TaskExecutorRegistry 的简单内存实现。
 * 线程安全。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleTaskExecutorRegistry implements TaskExecutorRegistry {

    // 存储执行器工厂或实例包装成的工厂，保持注册顺序
    private final Map<String, Supplier<? extends TaskExecutor>> factoryMap = Collections.synchronizedMap(new LinkedHashMap<>());
    // 已创建的实例
    private final Map<String, TaskExecutor> instances = new ConcurrentHashMap<>();

    @Override
    public void register(String executorRef, Supplier<? extends TaskExecutor> factory) {
        Objects.requireNonNull(executorRef, "执行器引用不能为空");
        Objects.requireNonNull(factory, "执行器工厂不能为空");

        if (factoryMap.putIfAbsent(executorRef, factory) != null) {
            throw new IllegalArgumentException(String.format("执行器引用 '%s' 已存在。", executorRef));
        }
        log.info("已注册执行器 '{}' (使用工厂，首次解析时创建)", executorRef);
    }

    @Override
    public void register(String executorRef, TaskExecutor executor) {
        Objects.requireNonNull(executorRef, "执行器引用不能为空");
        Objects.requireNonNull(executor, "执行器实例不能为空");

        if (factoryMap.putIfAbsent(executorRef, () -> executor) != null) {
            throw new IllegalArgumentException(String.format("执行器引用 '%s' 已存在。", executorRef));
        }
        instances.put(executorRef, executor);
        log.info("已注册执行器 '{}' (使用实例, 实现: {})", executorRef, executor.getClass().getName());
    }

    @Override
    public Optional<TaskExecutor> resolve(String executorRef) {
        Objects.requireNonNull(executorRef, "执行器引用不能为空");
        Supplier<? extends TaskExecutor> factory = factoryMap.get(executorRef);
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(instances.computeIfAbsent(executorRef, ref -> {
            TaskExecutor created = factory.get();
            if (created == null) {
                throw new IllegalStateException(String.format("执行器 '%s' 的工厂返回了 null 实例。", ref));
            }
            log.debug("执行器 '{}' 已创建 (实现: {})", ref, created.getClass().getName());
            return created;
        }));
    }

    @Override
    public boolean isRegistered(String executorRef) {
        return factoryMap.containsKey(executorRef);
    }

    @Override
    public Set<String> getRegisteredRefs() {
        synchronized (factoryMap) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(factoryMap.keySet()));
        }
    }
}
