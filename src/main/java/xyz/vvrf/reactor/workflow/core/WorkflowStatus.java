package xyz.vvrf.reactor.workflow.core;

/**
 * 工作流整体状态。
 *
 * @author ruifeng.wen
 */
public enum WorkflowStatus {
    /** 任务与依赖仍在组装，尚未通过校验。 */
    PLANNING,
    /** 已通过依赖校验，尚未开始执行。 */
    READY,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
