package xyz.vvrf.reactor.workflow.planning;

import lombok.Getter;

/**
 * {@link WorkflowPermissionChecker} 拒绝对某个工作流的操作时抛出。
 */
@Getter
public class WorkflowAccessDeniedException extends RuntimeException {

    private final WorkflowPermissionChecker.Operation operation;
    private final String workflowId;

    public WorkflowAccessDeniedException(WorkflowPermissionChecker.Operation operation, String workflowId) {
        super("Permission denied to " + operation.name().toLowerCase() + " workflow " + workflowId);
        this.operation = operation;
        this.workflowId = workflowId;
    }
}
