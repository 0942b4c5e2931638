package xyz.vvrf.reactor.workflow.resource;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * 工作流执行前的资源分配钩子。
 * 引擎在执行前调用 {@link #allocate}，无论结果如何都会在结束后调用 {@link #release}。
 *
 * @author ruifeng.wen
 */
public interface ResourceManager {

    /**
     * @param requirements 来自工作流元数据 {@code resourceRequirements} 的需求描述，可能为空 Map
     * @return 是否分配成功；发出 false 时工作流直接失败，不执行任何任务
     */
    Mono<Boolean> allocate(String workflowId, Map<String, Object> requirements);

    /**
     * 释放分配给工作流的资源。必须是幂等的。
     */
    Mono<Void> release(String workflowId);
}
