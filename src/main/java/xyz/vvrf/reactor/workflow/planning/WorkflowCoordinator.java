package xyz.vvrf.reactor.workflow.planning;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.context.ContextHandle;
import xyz.vvrf.reactor.workflow.context.ContextStore;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.execution.CancellationToken;
import xyz.vvrf.reactor.workflow.execution.WorkflowEngine;
import xyz.vvrf.reactor.workflow.notify.StatusNotifier;
import xyz.vvrf.reactor.workflow.report.ExecutionReport;
import xyz.vvrf.reactor.workflow.validation.WorkflowValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 工作流的门面：请求规划器生成计划、保存工作流、执行并查询报告。
 * <p>
 * 工作流保存在内存中（Caffeine，按最后访问时间过期）。规划失败不会以错误信号返回，
 * 而是得到一个 FAILED 状态、带有 {@code planningError} 元数据的工作流。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class WorkflowCoordinator {

    /** 规划器输出无法解析时，原始输出保存在工作流元数据中的键。 */
    public static final String METADATA_RAW_PLAN = "rawPlan";
    /** 为规划器创建上下文时使用的任务 ID。 */
    public static final String PLANNER_CONTEXT_ID = "planner";

    private static final int TITLE_QUERY_LENGTH = 50;

    private final WorkflowPlanner planner;
    private final WorkflowPlanParser planParser;
    private final WorkflowEngine engine;
    private final ContextStore contextStore;
    private final Clock clock;
    private final Cache<String, Workflow> workflows;
    private final WorkflowPermissionChecker permissionChecker;
    private final Map<String, CancellationToken> activeTokens = new ConcurrentHashMap<>();

    public WorkflowCoordinator(WorkflowPlanner planner,
                               WorkflowPlanParser planParser,
                               WorkflowEngine engine,
                               ContextStore contextStore,
                               WorkflowPermissionChecker permissionChecker,
                               Duration retention,
                               long maximumSize,
                               Clock clock) {
        this.planner = Objects.requireNonNull(planner, "WorkflowPlanner 不能为空");
        this.planParser = Objects.requireNonNull(planParser, "WorkflowPlanParser 不能为空");
        this.engine = Objects.requireNonNull(engine, "WorkflowEngine 不能为空");
        this.contextStore = Objects.requireNonNull(contextStore, "ContextStore 不能为空");
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
        this.permissionChecker = Objects.requireNonNull(permissionChecker, "WorkflowPermissionChecker 不能为空");
        this.workflows = Caffeine.newBuilder()
                .expireAfterAccess(Objects.requireNonNull(retention, "retention 不能为空"))
                .maximumSize(maximumSize)
                .build();
        log.info("WorkflowCoordinator 初始化完成 (保留时间: {}, 最大数量: {})", retention, maximumSize);
    }

    public WorkflowCoordinator(WorkflowPlanner planner,
                               WorkflowPlanParser planParser,
                               WorkflowEngine engine,
                               ContextStore contextStore) {
        this(planner, planParser, engine, contextStore, WorkflowPermissionChecker.allowAll(),
                Duration.ofHours(1), 10_000, Clock.systemUTC());
    }

    /**
     * 根据用户请求创建工作流。
     * 外部上下文以 "User Context" 段落附加到规划请求中，同时保存到工作流元数据里供任务输入使用。
     *
     * @return READY 状态的工作流；规划或校验失败时为 FAILED 状态的工作流
     */
    public Mono<Workflow> createWorkflow(String query, Map<String, ?> externalContext) {
        Objects.requireNonNull(query, "query 不能为空");
        Map<String, Object> context = (externalContext != null) ? new LinkedHashMap<>(externalContext) : Collections.emptyMap();

        Workflow.WorkflowBuilder builder = Workflow.builder()
                .title(titleFor(query))
                .query(query)
                .createdAt(clock.instant());
        if (!context.isEmpty()) {
            builder.metadata(Collections.singletonMap(Workflow.METADATA_EXTERNAL_CONTEXT, context));
        }
        Workflow workflow = builder.build();
        workflows.put(workflow.getId(), workflow);
        log.info("工作流 '{}' 已创建，开始规划: {}", workflow.getId(), workflow.getTitle());

        return Mono.defer(() -> {
                    ContextHandle plannerContext = contextStore.createContext(workflow.getId(), PLANNER_CONTEXT_ID);
                    context.forEach(plannerContext::put);
                    return planner.plan(plannerQuery(query, context), plannerContext);
                })
                .switchIfEmpty(Mono.error(() -> new WorkflowPlanException("Planner returned no plan")))
                .map(plan -> {
                    try {
                        planParser.populate(workflow, plan);
                    } catch (WorkflowPlanException e) {
                        workflow.putMetadata(METADATA_RAW_PLAN, plan);
                        throw e;
                    }
                    engine.validateAndPrepare(workflow);
                    return workflow;
                })
                .onErrorResume(WorkflowValidationException.class, e -> {
                    // validateAndPrepare 已经把工作流置为 FAILED
                    log.warn("工作流 '{}' 的依赖校验失败: {}", workflow.getId(), e.getMessage());
                    return Mono.just(workflow);
                })
                .onErrorResume(e -> {
                    log.error("工作流 '{}' 规划失败: {}", workflow.getId(), e.getMessage(), e);
                    if (!workflow.getStatus().isTerminal()) {
                        workflow.failPlanning(planningError(e), null, clock.instant());
                    }
                    return Mono.just(workflow);
                });
    }

    public Mono<Workflow> createWorkflow(String query) {
        return createWorkflow(query, Collections.emptyMap());
    }

    /**
     * 登记一个在外部构建好的工作流（例如通过 {@link WorkflowBuilder}）。
     *
     * @throws IllegalArgumentException 如果相同 ID 的工作流已存在
     */
    public Workflow register(Workflow workflow) {
        Objects.requireNonNull(workflow, "工作流不能为空");
        Workflow existing = workflows.asMap().putIfAbsent(workflow.getId(), workflow);
        if (existing != null && existing != workflow) {
            throw new IllegalArgumentException("工作流 ID '" + workflow.getId() + "' 已存在");
        }
        return workflow;
    }

    /**
     * @throws WorkflowAccessDeniedException 如果没有读取该工作流的权限
     */
    public Optional<Workflow> getWorkflow(String workflowId) {
        requirePermission(WorkflowPermissionChecker.Operation.READ, workflowId);
        return Optional.ofNullable(workflows.getIfPresent(workflowId));
    }

    /**
     * 有权列出的已保存工作流的摘要，按创建时间排序。
     */
    public List<WorkflowSummary> listWorkflows() {
        return workflows.asMap().values().stream()
                .filter(workflow -> permitted(WorkflowPermissionChecker.Operation.LIST, workflow.getId()))
                .sorted(Comparator.comparing(Workflow::getCreatedAt).thenComparing(Workflow::getId))
                .map(WorkflowSummary::of)
                .collect(Collectors.toList());
    }

    /**
     * 执行已保存的工作流。同一工作流同时只能有一次执行。
     * 没有执行权限时发出 {@link WorkflowAccessDeniedException}。
     */
    public Mono<ExecutionReport> executeWorkflow(String workflowId, StatusNotifier notifier) {
        return Mono.defer(() -> {
            if (!permitted(WorkflowPermissionChecker.Operation.EXECUTE, workflowId)) {
                return Mono.error(new WorkflowAccessDeniedException(WorkflowPermissionChecker.Operation.EXECUTE, workflowId));
            }
            Workflow workflow = workflows.getIfPresent(workflowId);
            if (workflow == null) {
                return Mono.error(new IllegalArgumentException("工作流 '" + workflowId + "' 不存在"));
            }
            CancellationToken token = CancellationToken.create();
            if (activeTokens.putIfAbsent(workflowId, token) != null) {
                return Mono.error(new IllegalStateException("工作流 '" + workflowId + "' 正在执行中"));
            }
            return engine.execute(workflow, notifier, token)
                    .doFinally(signal -> activeTokens.remove(workflowId, token));
        });
    }

    public Mono<ExecutionReport> executeWorkflow(String workflowId) {
        return executeWorkflow(workflowId, StatusNotifier.noop());
    }

    /**
     * @throws WorkflowAccessDeniedException 如果没有读取该工作流的权限
     */
    public Optional<ExecutionReport> getReport(String workflowId) {
        return getWorkflow(workflowId).map(engine::snapshotReport);
    }

    /**
     * 请求取消正在执行的工作流。
     *
     * @return 如果工作流正在执行且已发出取消请求则为 true
     */
    public boolean cancel(String workflowId) {
        CancellationToken token = activeTokens.get(workflowId);
        if (token == null) {
            return false;
        }
        log.info("请求取消工作流 '{}'", workflowId);
        token.cancel();
        return true;
    }

    /**
     * 移除工作流及其全部任务上下文；正在执行的工作流会先被取消。
     */
    public boolean remove(String workflowId) {
        cancel(workflowId);
        Workflow removed = workflows.asMap().remove(workflowId);
        int evicted = contextStore.evictWorkflow(workflowId);
        log.debug("工作流 '{}' 已移除，清理了 {} 个上下文", workflowId, evicted);
        return removed != null;
    }

    private boolean permitted(WorkflowPermissionChecker.Operation operation, String workflowId) {
        if (permissionChecker.checkPermission(operation, workflowId)) {
            return true;
        }
        log.warn("拒绝对工作流 '{}' 的 {} 操作", workflowId, operation);
        return false;
    }

    private void requirePermission(WorkflowPermissionChecker.Operation operation, String workflowId) {
        if (!permitted(operation, workflowId)) {
            throw new WorkflowAccessDeniedException(operation, workflowId);
        }
    }

    static String titleFor(String query) {
        String trimmed = query.trim();
        String head = trimmed.length() > TITLE_QUERY_LENGTH ? trimmed.substring(0, TITLE_QUERY_LENGTH) + "..." : trimmed;
        return "Workflow for: " + head;
    }

    static String plannerQuery(String query, Map<String, ?> externalContext) {
        if (externalContext.isEmpty()) {
            return query;
        }
        String contextLines = externalContext.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
        return query + "\n\nUser Context:\n" + contextLines;
    }

    private static String planningError(Throwable e) {
        String message = e.getMessage();
        return (message != null && !message.isEmpty()) ? message : e.getClass().getSimpleName();
    }

    /**
     * 工作流列表中的一行。
     */
    @Value
    @Builder
    public static class WorkflowSummary {
        String id;
        String title;
        WorkflowStatus status;
        int taskCount;
        Instant createdAt;

        static WorkflowSummary of(Workflow workflow) {
            return WorkflowSummary.builder()
                    .id(workflow.getId())
                    .title(workflow.getTitle())
                    .status(workflow.getStatus())
                    .taskCount(workflow.size())
                    .createdAt(workflow.getCreatedAt())
                    .build();
        }
    }
}
