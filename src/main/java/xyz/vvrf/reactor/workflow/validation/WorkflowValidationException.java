package xyz.vvrf.reactor.workflow.validation;

import lombok.Getter;

/**
 * 工作流的依赖图存在循环或（严格模式下）存在退化依赖时抛出。
 * 工作流此时已被置为 FAILED，不会进入 RUNNING。
 */
@Getter
public class WorkflowValidationException extends RuntimeException {

    private final String workflowId;
    private final transient ValidationResult result;

    public WorkflowValidationException(String workflowId, ValidationResult result) {
        super("Workflow '" + workflowId + "' failed validation: " + result.describe());
        this.workflowId = workflowId;
        this.result = result;
    }
}
