package xyz.vvrf.reactor.workflow.core;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 一组相互依赖的任务及其整体状态。
 * <p>
 * 工作流独占其任务。所有状态迁移都在内部写锁下完成；进度查询
 * （{@link #readLocked(Supplier)}、各类快照 getter）持有读锁，
 * 因此可以在调度循环运行期间从其它线程安全地读取。
 * 任务按插入顺序保存，这一顺序决定了就绪任务的返回顺序。
 *
 * @author ruifeng.wen
 */
public final class Workflow {

    public static final String METADATA_ERROR = "error";
    public static final String METADATA_PLANNING_ERROR = "planningError";
    public static final String METADATA_CYCLE_PATH = "cyclePath";
    public static final String METADATA_BLOCKED_TASKS = "blockedTasks";
    public static final String METADATA_EXTERNAL_CONTEXT = "externalContext";
    public static final String METADATA_RESOURCE_REQUIREMENTS = "resourceRequirements";

    @Getter private final String id;
    @Getter private final String title;
    @Getter private final String description;
    @Getter private final String query;
    @Getter private final Instant createdAt;

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, Object> results = new LinkedHashMap<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final List<String> executionOrder = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile WorkflowStatus status = WorkflowStatus.PLANNING;
    private volatile Instant startedAt;
    private volatile Instant completedAt;

    @Builder
    private Workflow(String id, String title, String description, String query,
                     Map<String, Object> metadata, Instant createdAt) {
        this.id = (id != null && !id.trim().isEmpty()) ? id : UUID.randomUUID().toString();
        this.title = (title != null) ? title : "";
        this.description = (description != null) ? description : "";
        this.query = (query != null) ? query : "";
        this.createdAt = (createdAt != null) ? createdAt : Instant.now();
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
    }

    // --- 组装 ---

    /**
     * 添加一个任务。仅允许在 PLANNING 阶段调用。
     *
     * @throws IllegalArgumentException 如果任务 ID 已存在
     */
    public Workflow addTask(Task task) {
        Objects.requireNonNull(task, "任务不能为空");
        writeLocked(() -> {
            if (status != WorkflowStatus.PLANNING) {
                throw new IllegalStateException("工作流 '" + id + "' 状态为 " + status + "，不能再添加任务");
            }
            if (tasks.containsKey(task.getId())) {
                throw new IllegalArgumentException("工作流 '" + id + "' 中已存在任务 ID '" + task.getId() + "'");
            }
            tasks.put(task.getId(), task);
        });
        return this;
    }

    /**
     * 替换某个任务的依赖列表，由依赖校验器在 PLANNING/READY 阶段调用。
     */
    public void replaceDependencies(String taskId, List<String> dependencies) {
        writeLocked(() -> {
            if (status != WorkflowStatus.PLANNING && status != WorkflowStatus.READY) {
                throw new IllegalStateException("工作流 '" + id + "' 状态为 " + status + "，不能修改依赖");
            }
            requireTask(taskId).replaceDependencies(dependencies);
        });
    }

    // --- 查询 ---

    public WorkflowStatus getStatus() {
        return status;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public Optional<Task> getTask(String taskId) {
        return readLocked(() -> Optional.ofNullable(tasks.get(taskId)));
    }

    /**
     * 按插入顺序返回任务列表的快照。
     */
    public List<Task> getTasks() {
        return readLocked(() -> new ArrayList<>(tasks.values()));
    }

    public List<String> getTaskIds() {
        return readLocked(() -> new ArrayList<>(tasks.keySet()));
    }

    public int size() {
        return readLocked(tasks::size);
    }

    public Map<String, Object> getResults() {
        return readLocked(() -> Collections.unmodifiableMap(new LinkedHashMap<>(results)));
    }

    public Map<String, Object> getMetadata() {
        return readLocked(() -> Collections.unmodifiableMap(new LinkedHashMap<>(metadata)));
    }

    public Optional<Object> getMetadata(String key) {
        return readLocked(() -> Optional.ofNullable(metadata.get(key)));
    }

    public void putMetadata(String key, Object value) {
        Objects.requireNonNull(key, "元数据键不能为空");
        writeLocked(() -> metadata.put(key, value));
    }

    /**
     * 任务实际开始执行的顺序。
     */
    public List<String> getExecutionOrder() {
        return readLocked(() -> Collections.unmodifiableList(new ArrayList<>(executionOrder)));
    }

    public boolean allTasksCompleted() {
        return readLocked(() -> tasks.values().stream().allMatch(t -> t.getStatus() == TaskStatus.COMPLETED));
    }

    public List<String> taskIdsInStatus(TaskStatus taskStatus) {
        return readLocked(() -> tasks.values().stream()
                .filter(t -> t.getStatus() == taskStatus)
                .map(Task::getId)
                .collect(Collectors.toList()));
    }

    /**
     * 在读锁内执行投影，保证投影期间看到一致的工作流状态。
     */
    public <T> T readLocked(Supplier<T> projection) {
        lock.readLock().lock();
        try {
            return projection.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- 工作流级状态迁移 ---

    public void markReady() {
        writeLocked(() -> {
            if (status != WorkflowStatus.PLANNING && status != WorkflowStatus.READY) {
                throw new IllegalStateException("工作流 '" + id + "' 只能从 PLANNING 进入 READY，当前状态: " + status);
            }
            status = WorkflowStatus.READY;
        });
    }

    /**
     * 规划阶段失败（依赖校验不通过）。工作流永远不会进入 RUNNING。
     */
    public void failPlanning(String planningError, List<String> cyclePath, Instant at) {
        writeLocked(() -> {
            if (status != WorkflowStatus.PLANNING && status != WorkflowStatus.READY) {
                throw new IllegalStateException("工作流 '" + id + "' 状态为 " + status + "，不能标记规划失败");
            }
            metadata.put(METADATA_PLANNING_ERROR, planningError);
            metadata.put(METADATA_ERROR, planningError);
            if (cyclePath != null && !cyclePath.isEmpty()) {
                metadata.put(METADATA_CYCLE_PATH, new ArrayList<>(cyclePath));
            }
            completedAt = at;
            status = WorkflowStatus.FAILED;
        });
    }

    public void markRunning(Instant at) {
        writeLocked(() -> {
            if (status != WorkflowStatus.READY) {
                throw new IllegalStateException("工作流 '" + id + "' 只能从 READY 进入 RUNNING，当前状态: " + status);
            }
            startedAt = at;
            status = WorkflowStatus.RUNNING;
        });
    }

    public void markCompleted(Instant at) {
        writeLocked(() -> {
            if (status != WorkflowStatus.RUNNING) {
                throw new IllegalStateException("工作流 '" + id + "' 只能从 RUNNING 进入 COMPLETED，当前状态: " + status);
            }
            List<String> unfinished = tasks.values().stream()
                    .filter(t -> t.getStatus() != TaskStatus.COMPLETED)
                    .map(Task::getId)
                    .collect(Collectors.toList());
            if (!unfinished.isEmpty()) {
                throw new IllegalStateException("工作流 '" + id + "' 仍有未完成的任务: " + unfinished);
            }
            completedAt = notBefore(at, startedAt);
            status = WorkflowStatus.COMPLETED;
        });
    }

    /**
     * 将工作流置为 FAILED。已处于终态时抛出异常。
     */
    public void markFailed(String error, Instant at) {
        writeLocked(() -> {
            if (status.isTerminal()) {
                throw new IllegalStateException("工作流 '" + id + "' 已处于终态 " + status);
            }
            metadata.put(METADATA_ERROR, error);
            completedAt = notBefore(at, startedAt);
            status = WorkflowStatus.FAILED;
        });
    }

    // --- 任务级状态迁移 ---

    /**
     * 将任务置为 RUNNING 并记录开始顺序。
     */
    public Task startTask(String taskId, Instant at) {
        lock.writeLock().lock();
        try {
            requireStatus(WorkflowStatus.RUNNING, "启动任务");
            Task task = requireTask(taskId);
            task.markRunning(at);
            executionOrder.add(taskId);
            return task;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 记录任务成功。
     *
     * @return 如果任务此前已不处于 RUNNING（例如已被取消），返回 false 且不做任何修改
     */
    public boolean completeTask(String taskId, Object output, Instant at) {
        lock.writeLock().lock();
        try {
            Task task = requireTask(taskId);
            if (task.getStatus() != TaskStatus.RUNNING) {
                return false;
            }
            task.markCompleted(output, at);
            results.put(taskId, output);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 记录任务失败。
     *
     * @return 如果任务此前已不处于 RUNNING，返回 false 且不做任何修改
     */
    public boolean failTask(String taskId, TaskError error, Instant at) {
        lock.writeLock().lock();
        try {
            Task task = requireTask(taskId);
            if (task.getStatus() != TaskStatus.RUNNING) {
                return false;
            }
            task.markFailed(error, at);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Task requireTask(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("工作流 '" + id + "' 中不存在任务 '" + taskId + "'");
        }
        return task;
    }

    private void requireStatus(WorkflowStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException("工作流 '" + id + "' 状态为 " + status + "，无法" + action);
        }
    }

    private void writeLocked(Runnable mutation) {
        lock.writeLock().lock();
        try {
            mutation.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static Instant notBefore(Instant candidate, Instant floor) {
        return (floor != null && candidate.isBefore(floor)) ? floor : candidate;
    }

    /**
     * 只读地遍历任务，供纯函数组件在读锁内使用。
     */
    public Collection<Task> tasksView() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    @Override
    public String toString() {
        return "Workflow{id='" + id + "', title='" + title + "', status=" + status + ", tasks=" + size() + '}';
    }
}
