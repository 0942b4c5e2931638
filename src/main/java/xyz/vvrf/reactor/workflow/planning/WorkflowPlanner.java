package xyz.vvrf.reactor.workflow.planning;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.context.ContextHandle;

/**
 * 把用户请求拆解为任务计划的外部能力（通常是一个规划模型）。
 * 发出的 JSON 格式见 {@link WorkflowPlanParser}。
 */
@FunctionalInterface
public interface WorkflowPlanner {

    Mono<String> plan(String query, ContextHandle context);
}
