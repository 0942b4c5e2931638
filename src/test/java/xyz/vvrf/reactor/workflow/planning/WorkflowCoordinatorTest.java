package xyz.vvrf.reactor.workflow.planning;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.workflow.context.InMemoryContextStore;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.execution.WorkflowEngine;
import xyz.vvrf.reactor.workflow.report.ExecutionReport;
import xyz.vvrf.reactor.workflow.test.util.TestEngines;
import xyz.vvrf.reactor.workflow.test.util.TestTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowCoordinatorTest {

    private static final String LINEAR_PLAN = "{\"tasks\": ["
            + "{\"id\": \"research\", \"title\": \"Research\", \"executor\": \"test\"},"
            + "{\"id\": \"write\", \"title\": \"Write\", \"executor\": \"test\", \"dependencies\": [0]}"
            + "]}";

    private final TestTaskExecutor executor = TestTaskExecutor.echo();
    private final InMemoryContextStore contextStore = new InMemoryContextStore();
    private final List<String> plannerQueries = new CopyOnWriteArrayList<>();

    private WorkflowCoordinator coordinator(WorkflowPlanner planner) {
        return coordinator(planner, TestEngines.engine(executor));
    }

    private WorkflowCoordinator coordinator(WorkflowPlanner planner, WorkflowEngine engine) {
        return coordinator(planner, engine, WorkflowPermissionChecker.allowAll());
    }

    private WorkflowCoordinator coordinator(WorkflowPlanner planner, WorkflowEngine engine,
                                            WorkflowPermissionChecker permissionChecker) {
        return new WorkflowCoordinator(planner, new WorkflowPlanParser(new ObjectMapper()), engine, contextStore,
                permissionChecker, Duration.ofHours(1), 100, Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private WorkflowPlanner returning(String plan) {
        return (query, context) -> {
            plannerQueries.add(query);
            return Mono.just(plan);
        };
    }

    @Test
    void createsReadyWorkflowFromPlan() {
        WorkflowCoordinator coordinator = coordinator(returning(LINEAR_PLAN));

        Workflow workflow = coordinator.createWorkflow("Write an article about reactive streams").block();

        assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.READY);
        assertThat(workflow.getTitle()).isEqualTo("Workflow for: Write an article about reactive streams");
        assertThat(workflow.getTaskIds()).containsExactly("research", "write");
        assertThat(workflow.getTask("write").get().getDependencies()).containsExactly("research");
        assertThat(coordinator.getWorkflow(workflow.getId())).containsSame(workflow);
    }

    @Test
    void appendsExternalContextToPlannerQuery() {
        WorkflowCoordinator coordinator = coordinator(returning(LINEAR_PLAN));
        Map<String, Object> context = Collections.singletonMap("region", "EU");

        Workflow workflow = coordinator.createWorkflow("find suppliers", context).block();

        assertThat(plannerQueries).containsExactly("find suppliers\n\nUser Context:\nregion: EU");
        assertThat(workflow.getMetadata(Workflow.METADATA_EXTERNAL_CONTEXT)).contains(context);
        assertThat(contextStore.findContext(workflow.getId(), WorkflowCoordinator.PLANNER_CONTEXT_ID))
                .hasValueSatisfying(handle -> assertThat(handle.get("region")).contains("EU"));
    }

    @Test
    void longQueriesAreTruncatedInTitle() {
        String query = "x".repeat(80);
        assertThat(WorkflowCoordinator.titleFor(query)).isEqualTo("Workflow for: " + "x".repeat(50) + "...");
        assertThat(WorkflowCoordinator.plannerQuery("q", Collections.emptyMap())).isEqualTo("q");
    }

    @Test
    void cyclicPlanYieldsFailedWorkflow() {
        String plan = "[{\"id\": \"a\", \"title\": \"A\", \"executor\": \"test\", \"dependencies\": [\"b\"]},"
                + "{\"id\": \"b\", \"title\": \"B\", \"executor\": \"test\", \"dependencies\": [\"a\"]}]";
        WorkflowCoordinator coordinator = coordinator(returning(plan));

        Workflow workflow = coordinator.createWorkflow("loop").block();

        assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(workflow.getMetadata(Workflow.METADATA_CYCLE_PATH)).isPresent();
        assertThat(workflow.getMetadata(Workflow.METADATA_PLANNING_ERROR))
                .hasValueSatisfying(error -> assertThat(error.toString()).contains("cycle"));
    }

    @Test
    void unparseablePlanKeepsRawOutput() {
        WorkflowCoordinator coordinator = coordinator(returning("I could not plan this"));

        Workflow workflow = coordinator.createWorkflow("something").block();

        assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(workflow.getMetadata(WorkflowCoordinator.METADATA_RAW_PLAN)).contains("I could not plan this");
        assertThat(workflow.getMetadata(Workflow.METADATA_PLANNING_ERROR))
                .hasValueSatisfying(error -> assertThat(error.toString()).startsWith("Invalid plan JSON"));
    }

    @Test
    void plannerErrorsAndEmptyPlansYieldFailedWorkflow() {
        Workflow failed = coordinator((query, context) -> Mono.error(new IllegalStateException("model unavailable")))
                .createWorkflow("q").block();
        Workflow empty = coordinator((query, context) -> Mono.empty()).createWorkflow("q").block();

        assertThat(failed.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(failed.getMetadata(Workflow.METADATA_PLANNING_ERROR)).contains("model unavailable");
        assertThat(empty.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(empty.getMetadata(Workflow.METADATA_PLANNING_ERROR)).contains("Planner returned no plan");
    }

    @Test
    void executesStoredWorkflowAndReports() {
        WorkflowCoordinator coordinator = coordinator(returning(LINEAR_PLAN));
        Workflow workflow = coordinator.createWorkflow("article", Collections.singletonMap("tone", "formal")).block();

        StepVerifier.create(coordinator.executeWorkflow(workflow.getId()))
                .assertNext(report -> {
                    assertThat(report.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
                    assertThat(report.getExecutionOrder()).containsExactly("research", "write");
                })
                .verifyComplete();

        assertThat(executor.requestFor("write").getInput())
                .contains("result:research")
                .contains("\"tone\":\"formal\"");
        assertThat(coordinator.getReport(workflow.getId()))
                .map(ExecutionReport::getResults)
                .hasValueSatisfying(results -> assertThat(results).containsKeys("research", "write"));
    }

    @Test
    void unknownWorkflowCannotBeExecuted() {
        WorkflowCoordinator coordinator = coordinator(returning(LINEAR_PLAN));

        StepVerifier.create(coordinator.executeWorkflow("missing"))
                .expectError(IllegalArgumentException.class)
                .verify();
        assertThat(coordinator.getReport("missing")).isEmpty();
        assertThat(coordinator.cancel("missing")).isFalse();
    }

    @Test
    void cancelStopsRunningWorkflowAndRejectsConcurrentExecution() {
        executor.never("write");
        WorkflowCoordinator coordinator = coordinator(returning(LINEAR_PLAN));
        String id = coordinator.createWorkflow("article").block().getId();

        StepVerifier.create(coordinator.executeWorkflow(id))
                .then(() -> StepVerifier.create(coordinator.executeWorkflow(id))
                        .expectError(IllegalStateException.class)
                        .verify())
                .then(() -> assertThat(coordinator.cancel(id)).isTrue())
                .assertNext(report -> assertThat(report.getStatus()).isEqualTo(WorkflowStatus.FAILED))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void registerAndListWorkflows() {
        WorkflowCoordinator coordinator = coordinator(returning(LINEAR_PLAN));
        Workflow manual = WorkflowBuilder.create("manual")
                .id("manual-1")
                .clock(Clock.fixed(Instant.parse("2023-06-01T00:00:00Z"), ZoneOffset.UTC))
                .addTask("only", TestEngines.EXECUTOR_REF)
                .build();
        coordinator.register(manual);
        Workflow planned = coordinator.createWorkflow("article").block();

        assertThat(coordinator.listWorkflows())
                .extracting(WorkflowCoordinator.WorkflowSummary::getId)
                .containsExactly("manual-1", planned.getId());
        assertThat(coordinator.listWorkflows().get(1).getTaskCount()).isEqualTo(2);
        assertThat(coordinator.register(manual)).isSameAs(manual);
        assertThatThrownBy(() -> coordinator.register(WorkflowBuilder.create("other").id("manual-1").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeEvictsTaskContexts() {
        WorkflowCoordinator coordinator = coordinator(returning(LINEAR_PLAN));
        Workflow workflow = coordinator.createWorkflow("article").block();
        assertThat(contextStore.findContext(workflow.getId(), WorkflowCoordinator.PLANNER_CONTEXT_ID)).isPresent();

        assertThat(coordinator.remove(workflow.getId())).isTrue();

        assertThat(coordinator.getWorkflow(workflow.getId())).isEmpty();
        assertThat(contextStore.findContext(workflow.getId(), WorkflowCoordinator.PLANNER_CONTEXT_ID)).isEmpty();
        assertThat(coordinator.remove(workflow.getId())).isFalse();
    }

    @Test
    void permissionCheckerGuardsReadListAndExecute() {
        Set<String> denied = ConcurrentHashMap.newKeySet();
        WorkflowPermissionChecker checker = (operation, workflowId) -> !denied.contains(operation + ":" + workflowId);
        WorkflowCoordinator coordinator = coordinator(returning(LINEAR_PLAN), TestEngines.engine(executor), checker);
        Workflow visible = coordinator.createWorkflow("visible").block();
        Workflow hidden = coordinator.createWorkflow("hidden").block();
        denied.add("LIST:" + hidden.getId());
        denied.add("READ:" + hidden.getId());
        denied.add("EXECUTE:" + hidden.getId());

        assertThat(coordinator.listWorkflows())
                .extracting(WorkflowCoordinator.WorkflowSummary::getId)
                .containsExactly(visible.getId());
        assertThat(coordinator.getWorkflow(visible.getId())).containsSame(visible);
        assertThatThrownBy(() -> coordinator.getWorkflow(hidden.getId()))
                .isInstanceOf(WorkflowAccessDeniedException.class)
                .hasMessage("Permission denied to read workflow " + hidden.getId());
        assertThatThrownBy(() -> coordinator.getReport(hidden.getId()))
                .isInstanceOf(WorkflowAccessDeniedException.class);
        StepVerifier.create(coordinator.executeWorkflow(hidden.getId()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(WorkflowAccessDeniedException.class);
                    assertThat(((WorkflowAccessDeniedException) error).getOperation())
                            .isEqualTo(WorkflowPermissionChecker.Operation.EXECUTE);
                })
                .verify();

        assertThat(hidden.getStatus()).isEqualTo(WorkflowStatus.READY);
        assertThat(executor.getInvokedTaskIds()).isEmpty();
    }

    @Test
    void deniedUnknownWorkflowFailsWithAccessDeniedBeforeLookup() {
        WorkflowCoordinator coordinator = coordinator(returning(LINEAR_PLAN), TestEngines.engine(executor),
                (operation, workflowId) -> false);

        StepVerifier.create(coordinator.executeWorkflow("missing"))
                .expectError(WorkflowAccessDeniedException.class)
                .verify();
        assertThat(coordinator.listWorkflows()).isEmpty();
    }
}
