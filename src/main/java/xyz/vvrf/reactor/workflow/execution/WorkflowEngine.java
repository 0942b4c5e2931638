package xyz.vvrf.reactor.workflow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.notify.StatusNotifier;
import xyz.vvrf.reactor.workflow.report.ExecutionReport;
import xyz.vvrf.reactor.workflow.validation.ValidationResult;
import xyz.vvrf.reactor.workflow.validation.WorkflowValidationException;

/**
 * 工作流调度引擎接口。
 *
 * @author ruifeng.wen
 */
public interface WorkflowEngine {

    /** 没有可执行任务、也没有在途任务时写入的工作流错误。 */
    String DEADLOCK_ERROR = "deadlocked";
    String CANCELLED_ERROR = "cancelled";
    String ALLOCATION_ERROR = "failed to allocate resources";

    /**
     * 校验依赖图并将工作流从 PLANNING 置为 READY。对 READY 的工作流再次调用是安全的。
     *
     * @return 校验结果（可能带有被移除的退化依赖）
     * @throws WorkflowValidationException 如果依赖图存在循环或被严格模式拒绝；此时工作流已被置为 FAILED
     * @throws IllegalStateException       如果工作流已经开始执行或已终止
     */
    ValidationResult validateAndPrepare(Workflow workflow);

    /**
     * 执行工作流直到终态，发出最终的执行报告。
     * PLANNING 状态的工作流会先被校验；校验失败时发出 FAILED 报告而不是错误。
     * 任务级失败都记录在报告中，只有内部不变量被破坏时才会发出错误信号。
     * 同一工作流已在执行时，再次调用会发出 {@link IllegalStateException}，不影响正在进行的执行。
     *
     * @param workflow          READY 或 PLANNING 状态的工作流
     * @param notifier          状态变化回调，可以为 null
     * @param cancellationToken 取消令牌，可以为 null
     */
    Mono<ExecutionReport> execute(Workflow workflow, StatusNotifier notifier, CancellationToken cancellationToken);

    default Mono<ExecutionReport> execute(Workflow workflow) {
        return execute(workflow, StatusNotifier.noop(), CancellationToken.none());
    }

    /**
     * 阻塞直到工作流进入终态。
     */
    default ExecutionReport run(Workflow workflow, StatusNotifier notifier) {
        return execute(workflow, notifier, CancellationToken.none()).block();
    }

    default ExecutionReport run(Workflow workflow) {
        return run(workflow, StatusNotifier.noop());
    }

    /**
     * 非阻塞地获取当前时刻的执行报告，可在执行期间从任意线程调用。
     */
    ExecutionReport snapshotReport(Workflow workflow);
}
