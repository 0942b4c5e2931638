package xyz.vvrf.reactor.workflow.notify;

public enum StatusEventType {
    WORKFLOW_STARTED,
    WORKFLOW_COMPLETED,
    WORKFLOW_FAILED,
    TASK_STARTED,
    TASK_COMPLETED,
    TASK_FAILED;

    public boolean isTaskEvent() {
        return this == TASK_STARTED || this == TASK_COMPLETED || this == TASK_FAILED;
    }
}
