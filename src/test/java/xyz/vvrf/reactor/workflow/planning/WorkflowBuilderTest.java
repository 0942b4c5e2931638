package xyz.vvrf.reactor.workflow.planning;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.TaskOutcome;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.core.WorkflowStatus;
import xyz.vvrf.reactor.workflow.execution.StandardTaskRunner;
import xyz.vvrf.reactor.workflow.execution.TaskInputBuilder;
import xyz.vvrf.reactor.workflow.registry.SimpleTaskExecutorRegistry;

import java.time.Duration;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowBuilderTest {

    @Test
    void buildsPlanningWorkflowInInsertionOrder() {
        Workflow workflow = WorkflowBuilder.create("pipeline")
                .id("wf")
                .query("do things")
                .externalContext(Collections.singletonMap("user", "alice"))
                .addTask("load", "Load", "load the data", "io")
                .addTask("report", "io")
                .dependsOn("report", "load", "missing")
                .withTimeout("load", Duration.ofSeconds(3))
                .withInput("report", "literal")
                .build();

        assertThat(workflow.getStatus()).isEqualTo(WorkflowStatus.PLANNING);
        assertThat(workflow.getTaskIds()).containsExactly("load", "report");
        Task load = workflow.getTask("load").get();
        assertThat(load.getDescription()).isEqualTo("load the data");
        assertThat(load.getMetadata(StandardTaskRunner.METADATA_TIMEOUT)).contains(Duration.ofSeconds(3));
        Task report = workflow.getTask("report").get();
        assertThat(report.getTitle()).isEqualTo("report");
        assertThat(report.getDependencies()).containsExactly("load", "missing");
        assertThat(report.getMetadata(TaskInputBuilder.METADATA_INPUT)).contains("literal");
        assertThat(workflow.getMetadata(Workflow.METADATA_EXTERNAL_CONTEXT))
                .contains(Collections.singletonMap("user", "alice"));
    }

    @Test
    void rejectsDuplicateAndUnknownTasks() {
        WorkflowBuilder builder = WorkflowBuilder.create("dup").addTask("a", "x");

        assertThatThrownBy(() -> builder.addTask("a", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.dependsOn("b", "a")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void checksExecutorRefsAgainstRegistry() {
        SimpleTaskExecutorRegistry registry = new SimpleTaskExecutorRegistry();
        registry.register("known", request -> Mono.just(TaskOutcome.success()));
        WorkflowBuilder builder = new WorkflowBuilder("checked", registry);

        builder.addTask("a", "known");

        assertThatThrownBy(() -> builder.addTask("b", "unknown"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown");
    }
}
