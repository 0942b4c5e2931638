package xyz.vvrf.reactor.workflow.execution;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.context.InMemoryContextStore;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.TaskRequest;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.planning.WorkflowBuilder;
import xyz.vvrf.reactor.workflow.report.ReportJsonWriter;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class TaskInputBuilderTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private TaskInputBuilder inputBuilder;

    @BeforeEach
    void setUp() {
        inputBuilder = new TaskInputBuilder(ReportJsonWriter.defaultObjectMapper());
    }

    private static Workflow completed(Workflow workflow, String taskId, Object result) {
        workflow.startTask(taskId, T0);
        workflow.completeTask(taskId, result, T0);
        return workflow;
    }

    private static Workflow running(WorkflowBuilder builder) {
        Workflow workflow = builder.build();
        workflow.markReady();
        workflow.markRunning(T0);
        return workflow;
    }

    @Test
    void rootTaskInputIsTitleAndDescription() {
        Workflow workflow = running(WorkflowBuilder.create("input")
                .addTask("research", "Research", "Find three sources", "llm"));

        String input = inputBuilder.buildInput(workflow, workflow.getTask("research").get());

        assertThat(input).isEqualTo("Task: Research\nFind three sources");
    }

    @Test
    void dependencyResultsAreAppendedInDeclarationOrder() {
        Workflow workflow = running(WorkflowBuilder.create("input")
                .addTask("a", "Alpha", "", "llm")
                .addTask("b", "Beta", "", "llm")
                .addTask("c", "Gamma", "", "llm")
                .dependsOn("c", "b", "a"));
        completed(workflow, "a", "first");
        Map<String, Object> structured = new LinkedHashMap<>();
        structured.put("score", 7);
        completed(workflow, "b", structured);

        String input = inputBuilder.buildInput(workflow, workflow.getTask("c").get());

        assertThat(input).isEqualTo("Task: Gamma"
                + "\n\nResults from dependencies:"
                + "\n\n[Beta] (b):\n{\"score\":7}"
                + "\n\n[Alpha] (a):\nfirst");
    }

    @Test
    void missingResultIsMarked() {
        Workflow workflow = running(WorkflowBuilder.create("input")
                .addTask("a", "llm")
                .addTask("b", "llm")
                .dependsOn("b", "a"));
        completed(workflow, "a", null);

        assertThat(inputBuilder.buildInput(workflow, workflow.getTask("b").get()))
                .endsWith("[a] (a):\n(no result)");
    }

    @Test
    void externalContextIsAppended() {
        Workflow workflow = running(WorkflowBuilder.create("input")
                .externalContext(Collections.singletonMap("tenant", "acme"))
                .addTask("a", "llm"));

        assertThat(inputBuilder.buildInput(workflow, workflow.getTask("a").get()))
                .isEqualTo("Task: a\n\nExternal context:\n{\"tenant\":\"acme\"}");
    }

    @Test
    void literalInputReplacesDerivedInput() {
        Workflow workflow = running(WorkflowBuilder.create("input")
                .addTask("a", "llm")
                .withInput("a", Arrays.asList(1, 2, 3)));

        assertThat(inputBuilder.buildInput(workflow, workflow.getTask("a").get())).isEqualTo("[1,2,3]");
    }

    @Test
    void requestCarriesStructuredDependencyResultsAndContext() {
        Workflow workflow = running(WorkflowBuilder.create("input")
                .addTask("a", "llm")
                .addTask("b", "llm")
                .dependsOn("b", "a")
                .withMetadata("b", "priority", "high"));
        completed(workflow, "a", "done");
        Task b = workflow.getTask("b").get();
        InMemoryContextStore contexts = new InMemoryContextStore();

        TaskRequest request = inputBuilder.buildRequest("wf-req-1", workflow, b, contexts.createContext(workflow.getId(), "b"));

        assertThat(request.getRequestId()).isEqualTo("wf-req-1");
        assertThat(request.getWorkflowId()).isEqualTo(workflow.getId());
        assertThat(request.getTaskId()).isEqualTo("b");
        assertThat(request.getExecutorRef()).isEqualTo("llm");
        assertThat(request.getDependencyResults()).containsExactly(entry("a", "done"));
        assertThat(request.getMetadata()).containsEntry("priority", "high");
        assertThat(request.getContext().getTaskId()).isEqualTo("b");
    }
}
