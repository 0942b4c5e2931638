package xyz.vvrf.reactor.workflow.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.core.TaskError;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.planning.WorkflowBuilder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ReportJsonWriterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Workflow deadlocked() {
        Workflow workflow = WorkflowBuilder.create("report")
                .id("wf-1")
                .query("summarise the news")
                .clock(Clock.fixed(T0, ZoneOffset.UTC))
                .addTask("a", "llm")
                .addTask("b", "llm")
                .dependsOn("b", "a")
                .build();
        workflow.markReady();
        workflow.markRunning(T0);
        workflow.startTask("a", T0.plusSeconds(1));
        workflow.failTask("a", TaskError.executionFailed("boom"), T0.plusSeconds(2));
        workflow.markFailed("deadlocked", T0.plusSeconds(3));
        return workflow;
    }

    @Test
    void reportProjectsWorkflowState() {
        ExecutionReport report = ExecutionReport.of(deadlocked());

        assertThat(report.getStatus()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(report.getError()).isEqualTo("deadlocked");
        assertThat(report.getQuery()).isEqualTo("summarise the news");
        assertThat(report.getBlockedTasks()).containsExactly("b");
        assertThat(report.getTasks()).containsOnlyKeys("a", "b");
        assertThat(report.getTasks().get("a").getExecutorRef()).isEqualTo("llm");
        assertThat(report.getExecutionOrder()).containsExactly("a");
    }

    @Test
    void runningWorkflowHasNoErrorOrBlockedTasks() {
        Workflow workflow = WorkflowBuilder.create("report").addTask("a", "llm").build();
        workflow.markReady();
        workflow.markRunning(T0);

        ExecutionReport report = ExecutionReport.of(workflow);

        assertThat(report.getError()).isNull();
        assertThat(report.getBlockedTasks()).isEmpty();
        assertThat(report.getCompletedAt()).isNull();
    }

    @Test
    void serializesTimestampsAsIsoStrings() throws Exception {
        String json = new ReportJsonWriter().toJson(ExecutionReport.of(deadlocked()));

        JsonNode root = new ObjectMapper().readTree(json);
        assertThat(root.get("workflowId").asText()).isEqualTo("wf-1");
        assertThat(root.get("status").asText()).isEqualTo("FAILED");
        assertThat(root.get("startedAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(root.get("completedAt").asText()).isEqualTo("2024-01-01T00:00:03Z");
        assertThat(root.at("/tasks/a/error/type").asText()).isEqualTo("EXECUTION_FAILED");
        assertThat(root.at("/tasks/a/error/message").asText()).isEqualTo("boom");
        assertThat(root.at("/tasks/b/status").asText()).isEqualTo("PENDING");
        assertThat(root.get("blockedTasks").get(0).asText()).isEqualTo("b");
        assertThat(root.get("success").asBoolean()).isFalse();
    }

    @Test
    void prettyJsonIsMultiline() {
        String json = new ReportJsonWriter().toPrettyJson(ExecutionReport.of(deadlocked()));
        assertThat(json).contains("\n").contains("\"workflowId\" : \"wf-1\"");
    }
}
