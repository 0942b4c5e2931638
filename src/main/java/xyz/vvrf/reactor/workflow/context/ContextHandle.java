package xyz.vvrf.reactor.workflow.context;

import java.util.Map;
import java.util.Optional;

/**
 * 绑定到 (工作流, 任务) 的作用域状态句柄。
 * 调度器只负责创建并透传，读写语义由执行器自行决定。
 *
 * @author ruifeng.wen
 */
public interface ContextHandle {

    String getWorkflowId();

    String getTaskId();

    Optional<Object> get(String key);

    void put(String key, Object value);

    /**
     * @return 当前全部键值的只读快照
     */
    Map<String, Object> snapshot();
}
