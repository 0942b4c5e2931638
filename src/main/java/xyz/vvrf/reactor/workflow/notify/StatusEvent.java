package xyz.vvrf.reactor.workflow.notify;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 一次工作流或任务状态变化。任务级事件带有 {@code taskId}，工作流级事件的 {@code taskId} 为 null。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
public class StatusEvent {
    StatusEventType type;
    String workflowId;
    String taskId;
    /** 变化后的状态名，例如 RUNNING、COMPLETED。 */
    String status;
    String message;
    Instant timestamp;
}
