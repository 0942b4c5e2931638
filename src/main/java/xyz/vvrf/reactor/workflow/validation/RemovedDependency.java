package xyz.vvrf.reactor.workflow.validation;

import lombok.Value;

/**
 * 校验过程中被移除（或在严格模式下被拒绝）的一条依赖边。
 */
@Value
public class RemovedDependency {

    public enum Reason {
        SELF_REFERENCE,
        DUPLICATE,
        DANGLING
    }

    String taskId;
    String dependencyId;
    Reason reason;

    @Override
    public String toString() {
        return taskId + " -> " + dependencyId + " (" + reason + ")";
    }
}
