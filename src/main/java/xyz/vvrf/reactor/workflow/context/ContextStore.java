package xyz.vvrf.reactor.workflow.context;

import java.util.Optional;

/**
 * 为每个 (工作流, 任务) 提供作用域上下文的存储能力。
 *
 * @author ruifeng.wen
 */
public interface ContextStore {

    /**
     * 获取或创建指定任务的上下文句柄。对同一对 ID 重复调用返回同一个句柄。
     */
    ContextHandle createContext(String workflowId, String taskId);

    Optional<ContextHandle> findContext(String workflowId, String taskId);

    /**
     * 丢弃某个工作流下的全部上下文。
     *
     * @return 被移除的句柄数量
     */
    int evictWorkflow(String workflowId);
}
