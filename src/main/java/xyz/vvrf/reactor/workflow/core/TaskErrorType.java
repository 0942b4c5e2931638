package xyz.vvrf.reactor.workflow.core;

/**
 * 任务失败的分类。
 */
public enum TaskErrorType {
    /** 执行器返回失败或抛出异常。 */
    EXECUTION_FAILED,
    /** 执行器在超时时间内没有返回。 */
    TIMEOUT,
    /** 注册表中找不到任务引用的执行器。 */
    EXECUTOR_NOT_FOUND,
    /** 工作流被取消或因 FAIL_FAST 中止时仍在途的任务。 */
    CANCELLED
}
