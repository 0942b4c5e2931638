package xyz.vvrf.reactor.workflow.core;

import lombok.Getter;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * 任务失败的结构化描述（不可变）。
 *
 * @author ruifeng.wen
 */
@Getter
public final class TaskError {

    private final TaskErrorType type;
    private final String message;
    /** 导致失败的异常类名，没有异常时为 null。 */
    private final String exceptionType;

    private TaskError(TaskErrorType type, String message, String exceptionType) {
        this.type = Objects.requireNonNull(type, "错误类型不能为空");
        this.message = (message != null) ? message : type.name();
        this.exceptionType = exceptionType;
    }

    public static TaskError of(TaskErrorType type, String message) {
        return new TaskError(type, message, null);
    }

    public static TaskError executionFailed(String message) {
        return new TaskError(TaskErrorType.EXECUTION_FAILED, message, null);
    }

    public static TaskError fromException(Throwable error) {
        Objects.requireNonNull(error, "异常不能为空");
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new TaskError(TaskErrorType.EXECUTION_FAILED, message, error.getClass().getName());
    }

    public static TaskError timeout(Duration timeout) {
        return new TaskError(TaskErrorType.TIMEOUT,
                "task did not complete within " + timeout.toMillis() + "ms",
                TimeoutException.class.getName());
    }

    public static TaskError executorNotFound(String executorRef) {
        return new TaskError(TaskErrorType.EXECUTOR_NOT_FOUND,
                "no executor registered for ref '" + executorRef + "'", null);
    }

    public static TaskError cancelled(String reason) {
        return new TaskError(TaskErrorType.CANCELLED, reason, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskError that = (TaskError) o;
        return type == that.type &&
                Objects.equals(message, that.message) &&
                Objects.equals(exceptionType, that.exceptionType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, message, exceptionType);
    }

    @Override
    public String toString() {
        return "TaskError{type=" + type + ", message='" + message + '\'' +
                (exceptionType != null ? ", exceptionType=" + exceptionType : "") + '}';
    }
}
