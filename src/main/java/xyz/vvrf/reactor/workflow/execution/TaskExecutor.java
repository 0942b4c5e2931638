package xyz.vvrf.reactor.workflow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.TaskOutcome;
import xyz.vvrf.reactor.workflow.core.TaskRequest;

/**
 * 执行单个任务实际工作的外部能力（例如一次模型调用、一段脚本）。
 * <p>
 * 每次任务尝试只调用一次，调度器不做自动重试。实现可以发出
 * {@link TaskOutcome#failure(xyz.vvrf.reactor.workflow.core.TaskError)}，也可以直接发出错误信号，
 * 两者都会被记录为任务失败；空的 Mono 视为没有输出的成功。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface TaskExecutor {

    Mono<TaskOutcome> execute(TaskRequest request);
}
