package xyz.vvrf.reactor.workflow.planning;

/**
 * 规划器输出无法解析为工作流时抛出。
 */
public class WorkflowPlanException extends RuntimeException {

    public WorkflowPlanException(String message) {
        super(message);
    }

    public WorkflowPlanException(String message, Throwable cause) {
        super(message, cause);
    }
}
