package xyz.vvrf.reactor.workflow.core;

/**
 * 任务状态。
 * 合法的迁移只有 PENDING -> RUNNING -> {COMPLETED | FAILED}，终态不可再迁出。
 *
 * @author ruifeng.wen
 */
public enum TaskStatus {
    /** 等待依赖完成或等待调度。 */
    PENDING,
    /** 已派发给执行器，尚未返回。 */
    RUNNING,
    /** 执行成功，持有结果。 */
    COMPLETED,
    /** 执行失败（包括超时、取消），持有错误信息。 */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
