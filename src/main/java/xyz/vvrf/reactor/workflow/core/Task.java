package xyz.vvrf.reactor.workflow.core;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 工作流中的单个任务节点。
 * <p>
 * 标识、标题、描述与执行器引用在创建后不可变。状态、结果与时间戳只能经由所属
 * {@link Workflow} 修改，后者在写锁内调用本类的包级迁移方法，以保证状态单调：
 * PENDING -> RUNNING -> {COMPLETED | FAILED}。
 *
 * @author ruifeng.wen
 */
public final class Task {

    /** 任务元数据中存放错误消息的键。 */
    public static final String METADATA_ERROR = "error";

    @Getter private final String id;
    @Getter private final String title;
    @Getter private final String description;
    @Getter private final String executorRef;
    @Getter private final Instant createdAt;

    private final List<String> dependencies;
    private final Map<String, Object> metadata;

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile Object result;
    private volatile TaskError error;
    private volatile Instant startedAt;
    private volatile Instant completedAt;

    @Builder
    private Task(String id,
                 String title,
                 String description,
                 String executorRef,
                 List<String> dependencies,
                 Map<String, Object> metadata,
                 Instant createdAt) {
        this.id = (id != null && !id.trim().isEmpty()) ? id : UUID.randomUUID().toString();
        this.title = (title != null) ? title : this.id;
        this.description = (description != null) ? description : "";
        this.executorRef = Objects.requireNonNull(executorRef, "任务 '" + this.id + "' 的执行器引用不能为空");
        this.dependencies = (dependencies != null) ? new ArrayList<>(dependencies) : new ArrayList<>();
        this.metadata = Collections.synchronizedMap(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>());
        this.createdAt = (createdAt != null) ? createdAt : Instant.now();
    }

    /**
     * 依赖的任务 ID 列表，保持声明顺序。
     */
    public List<String> getDependencies() {
        synchronized (dependencies) {
            return Collections.unmodifiableList(new ArrayList<>(dependencies));
        }
    }

    public TaskStatus getStatus() {
        return status;
    }

    public Optional<Object> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<TaskError> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public Optional<Object> getMetadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    /**
     * 元数据的只读快照。
     */
    public Map<String, Object> getMetadata() {
        synchronized (metadata) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }
    }

    public void putMetadata(String key, Object value) {
        Objects.requireNonNull(key, "元数据键不能为空");
        metadata.put(key, value);
    }

    // --- 包级状态迁移，由 Workflow 在写锁内调用 ---

    void replaceDependencies(List<String> newDependencies) {
        if (status != TaskStatus.PENDING) {
            throw new IllegalStateException("任务 '" + id + "' 状态为 " + status + "，不能修改依赖");
        }
        synchronized (dependencies) {
            dependencies.clear();
            dependencies.addAll(newDependencies);
        }
    }

    void markRunning(Instant at) {
        if (status != TaskStatus.PENDING) {
            throw new IllegalStateException("任务 '" + id + "' 只能从 PENDING 进入 RUNNING，当前状态: " + status);
        }
        this.startedAt = latest(at, createdAt);
        this.status = TaskStatus.RUNNING;
    }

    void markCompleted(Object output, Instant at) {
        requireRunning(TaskStatus.COMPLETED);
        this.result = output;
        this.completedAt = latest(at, startedAt);
        this.status = TaskStatus.COMPLETED;
    }

    void markFailed(TaskError taskError, Instant at) {
        requireRunning(TaskStatus.FAILED);
        this.error = Objects.requireNonNull(taskError, "任务错误不能为空");
        this.completedAt = latest(at, startedAt);
        metadata.put(METADATA_ERROR, taskError.getMessage());
        this.status = TaskStatus.FAILED;
    }

    private void requireRunning(TaskStatus target) {
        if (status != TaskStatus.RUNNING) {
            throw new IllegalStateException("任务 '" + id + "' 只能从 RUNNING 进入 " + target + "，当前状态: " + status);
        }
    }

    private static Instant latest(Instant candidate, Instant floor) {
        if (candidate == null) {
            return floor;
        }
        return (floor != null && candidate.isBefore(floor)) ? floor : candidate;
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', title='" + title + "', executorRef='" + executorRef +
                "', status=" + status + ", dependencies=" + getDependencies() + '}';
    }
}
