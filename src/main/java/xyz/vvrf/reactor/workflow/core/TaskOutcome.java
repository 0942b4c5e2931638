package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 执行器对单个任务的一次调用结果（不可变数据类）。
 * 成功时可携带输出，失败时必须携带 {@link TaskError}，两者互斥。
 *
 * @author ruifeng.wen
 */
public final class TaskOutcome {

    public enum OutcomeStatus {
        SUCCESS,
        FAILURE
    }

    @Getter private final OutcomeStatus status;
    private final Object output;
    private final TaskError error;

    private TaskOutcome(OutcomeStatus status, Object output, TaskError error) {
        this.status = Objects.requireNonNull(status, "结果状态不能为空");
        this.output = output;
        this.error = error;

        // 内部一致性校验
        if (status == OutcomeStatus.FAILURE && error == null) {
            throw new IllegalArgumentException("FAILURE 状态的结果必须包含错误信息。");
        }
        if (status == OutcomeStatus.SUCCESS && error != null) {
            throw new IllegalArgumentException("SUCCESS 状态的结果不能包含错误信息。");
        }
    }

    // --- 静态工厂方法 ---

    /**
     * @param output 任务输出 (可以为 null)
     */
    public static TaskOutcome success(Object output) {
        return new TaskOutcome(OutcomeStatus.SUCCESS, output, null);
    }

    public static TaskOutcome success() {
        return new TaskOutcome(OutcomeStatus.SUCCESS, null, null);
    }

    public static TaskOutcome failure(TaskError error) {
        Objects.requireNonNull(error, "错误对象不能为空");
        return new TaskOutcome(OutcomeStatus.FAILURE, null, error);
    }

    public static TaskOutcome failure(String message) {
        return failure(TaskError.executionFailed(message));
    }

    public static TaskOutcome failure(Throwable error) {
        return failure(TaskError.fromException(error));
    }

    // --- 实例方法 ---

    public Optional<Object> getOutput() {
        return Optional.ofNullable(output);
    }

    public Optional<TaskError> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() { return this.status == OutcomeStatus.SUCCESS; }
    public boolean isFailure() { return this.status == OutcomeStatus.FAILURE; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskOutcome that = (TaskOutcome) o;
        return status == that.status &&
                Objects.equals(output, that.output) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, output, error);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TaskOutcome{");
        sb.append("status=").append(status);
        getOutput().ifPresent(o -> sb.append(", output=").append(o.getClass().getSimpleName()));
        getError().ifPresent(e -> sb.append(", error=").append(e.getType()));
        sb.append('}');
        return sb.toString();
    }
}
