package xyz.vvrf.reactor.workflow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.TaskOutcome;
import xyz.vvrf.reactor.workflow.core.Workflow;

import java.time.Duration;

/**
 * 负责执行单个任务的接口：解析执行器、构造输入、应用超时并把一切错误转换为失败结果。
 * 返回的 Mono 只会发出一个 {@link TaskOutcome}，不会发出错误信号。
 *
 * @author ruifeng.wen
 */
public interface TaskRunner {

    /**
     * @param defaultTimeout 任务元数据未指定超时时使用的超时；null、零或负数表示不设超时
     */
    Mono<TaskOutcome> run(String requestId, Workflow workflow, Task task, Duration defaultTimeout);
}
