package xyz.vvrf.reactor.workflow.test.util;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.TaskOutcome;
import xyz.vvrf.reactor.workflow.core.TaskRequest;
import xyz.vvrf.reactor.workflow.execution.TaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 用于测试目的的可配置 TaskExecutor 实现。
 * 默认返回 "result:&lt;taskId&gt;"，并记录收到的每个请求。
 * 可以按任务 ID 配置失败、延迟或自定义行为。
 */
public class TestTaskExecutor implements TaskExecutor {

    private final Map<String, Function<TaskRequest, Mono<TaskOutcome>>> behaviours = new ConcurrentHashMap<>();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private final List<TaskRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();

    public static TestTaskExecutor echo() {
        return new TestTaskExecutor();
    }

    public TestTaskExecutor failing(String taskId, String message) {
        behaviours.put(taskId, request -> Mono.just(TaskOutcome.failure(message)));
        return this;
    }

    public TestTaskExecutor throwing(String taskId, RuntimeException error) {
        behaviours.put(taskId, request -> {
            throw error;
        });
        return this;
    }

    public TestTaskExecutor erroring(String taskId, Throwable error) {
        behaviours.put(taskId, request -> Mono.error(error));
        return this;
    }

    public TestTaskExecutor never(String taskId) {
        behaviours.put(taskId, request -> Mono.never());
        return this;
    }

    public TestTaskExecutor empty(String taskId) {
        behaviours.put(taskId, request -> Mono.empty());
        return this;
    }

    public TestTaskExecutor returning(String taskId, Object output) {
        behaviours.put(taskId, request -> Mono.just(TaskOutcome.success(output)));
        return this;
    }

    public TestTaskExecutor delayed(String taskId, Duration delay) {
        delays.put(taskId, delay);
        return this;
    }

    @Override
    public Mono<TaskOutcome> execute(TaskRequest request) {
        requests.add(request);
        Function<TaskRequest, Mono<TaskOutcome>> behaviour = behaviours.getOrDefault(request.getTaskId(),
                r -> Mono.just(TaskOutcome.success("result:" + r.getTaskId())));
        Mono<TaskOutcome> outcome = behaviour.apply(request);
        Duration delay = delays.get(request.getTaskId());
        if (delay != null) {
            outcome = Mono.delay(delay).then(outcome);
        }
        return Mono.defer(() -> {
                    int now = running.incrementAndGet();
                    maxRunning.accumulateAndGet(now, Math::max);
                    return Mono.just(now);
                })
                .then(outcome)
                .doFinally(signal -> running.decrementAndGet());
    }

    public List<TaskRequest> getRequests() {
        return Collections.unmodifiableList(new ArrayList<>(requests));
    }

    public List<String> getInvokedTaskIds() {
        List<String> ids = new ArrayList<>();
        for (TaskRequest request : requests) {
            ids.add(request.getTaskId());
        }
        return ids;
    }

    public TaskRequest requestFor(String taskId) {
        return requests.stream()
                .filter(r -> r.getTaskId().equals(taskId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("任务 '" + taskId + "' 未被调用"));
    }

    /**
     * 同时处于执行中的调用数的峰值。
     */
    public int getMaxConcurrency() {
        return maxRunning.get();
    }
}
