package xyz.vvrf.reactor.workflow.registry;

import xyz.vvrf.reactor.workflow.execution.TaskExecutor;

import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 按执行器引用 (executorRef) 解析 {@link TaskExecutor} 的注册表。
 * 注册表作为显式依赖注入到引擎中。
 *
 * @author ruifeng.wen
 */
public interface TaskExecutorRegistry {

    /**
     * 注册一个执行器工厂。工厂在第一次解析时调用一次，之后复用同一实例。
     *
     * @throws IllegalArgumentException 如果引用已被注册
     */
    void register(String executorRef, Supplier<? extends TaskExecutor> factory);

    /**
     * 注册一个现成的执行器实例。
     *
     * @throws IllegalArgumentException 如果引用已被注册
     */
    void register(String executorRef, TaskExecutor executor);

    /**
     * @return 执行器实例的 Optional，如果该引用未注册则为空
     */
    Optional<TaskExecutor> resolve(String executorRef);

    boolean isRegistered(String executorRef);

    Set<String> getRegisteredRefs();
}
