package xyz.vvrf.reactor.workflow.core;

/**
 * 定义任务失败后调度循环的处理策略。
 */
public enum FailurePolicy {
    /**
     * 单个任务失败不会中止调度（默认）。
     * 独立分支继续执行；依赖失败任务的下游永远不会就绪，
     * 最终由死锁检测将工作流置为 FAILED。
     */
    CONTINUE_ON_FAILURE,

    /**
     * 第一个任务失败后立即停止派发新任务，取消所有在途任务，
     * 并将工作流置为 FAILED。
     */
    FAIL_FAST
}
