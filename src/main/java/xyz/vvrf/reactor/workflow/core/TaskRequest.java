package xyz.vvrf.reactor.workflow.core;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import xyz.vvrf.reactor.workflow.context.ContextHandle;

import java.util.Map;

/**
 * 调度器交给 {@link xyz.vvrf.reactor.workflow.execution.TaskExecutor} 的单次调用参数。
 * <p>
 * {@code input} 是拼接好的文本输入；{@code dependencyResults} 以结构化形式
 * 携带每个上游任务的结果，按依赖声明顺序排列。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
public class TaskRequest {

    private final String requestId;
    private final String workflowId;
    private final String taskId;
    private final String executorRef;
    private final String title;
    private final String input;
    @Singular
    private final Map<String, Object> dependencyResults;
    @Singular("metadataEntry")
    private final Map<String, Object> metadata;
    private final ContextHandle context;
}
