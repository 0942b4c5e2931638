package xyz.vvrf.reactor.workflow.monitor;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.TaskError;
import xyz.vvrf.reactor.workflow.core.Workflow;
import xyz.vvrf.reactor.workflow.planning.WorkflowBuilder;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerWorkflowMonitorListenerTest {

    private SimpleMeterRegistry registry;
    private MicrometerWorkflowMonitorListener listener;
    private Workflow workflow;
    private Task task;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        listener = new MicrometerWorkflowMonitorListener(registry);
        workflow = WorkflowBuilder.create("metrics").addTask("a", "llm").build();
        task = workflow.getTask("a").get();
    }

    @Test
    void recordsTaskSuccess() {
        listener.onTaskSuccess("req", workflow.getId(), task, Duration.ofMillis(40));
        listener.onTaskSuccess("req", workflow.getId(), task, Duration.ofMillis(60));

        assertThat(registry.get(MicrometerWorkflowMonitorListener.METRIC_TASK_EXECUTION_TOTAL)
                .tag("executor", "llm").tag("status", "SUCCESS").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(MicrometerWorkflowMonitorListener.METRIC_TASK_EXECUTION_TIME)
                .tag("executor", "llm").timer().count()).isEqualTo(2);
    }

    @Test
    void timeoutsAreTaggedSeparatelyFromFailures() {
        listener.onTaskFailure("req", workflow.getId(), task, Duration.ofMillis(10), TaskError.executionFailed("boom"));
        listener.onTaskFailure("req", workflow.getId(), task, Duration.ofSeconds(1), TaskError.timeout(Duration.ofSeconds(1)));
        listener.onTaskTimeout("req", workflow.getId(), task, Duration.ofSeconds(1));

        assertThat(registry.get(MicrometerWorkflowMonitorListener.METRIC_TASK_EXECUTION_TOTAL)
                .tag("status", "FAILURE").tag("error", "EXECUTION_FAILED").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerWorkflowMonitorListener.METRIC_TASK_EXECUTION_TOTAL)
                .tag("status", "TIMEOUT").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerWorkflowMonitorListener.METRIC_TASK_TIMEOUT_TOTAL)
                .tag("executor", "llm").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recordsWorkflowOutcome() {
        listener.onWorkflowStart("req", workflow);
        listener.onWorkflowComplete("req", workflow, Duration.ofMillis(120), true, null);
        listener.onWorkflowComplete("req", workflow, Duration.ofMillis(80), false, "deadlocked");

        assertThat(registry.get(MicrometerWorkflowMonitorListener.METRIC_WORKFLOW_EXECUTION_TOTAL)
                .tag("status", "SUCCESS").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerWorkflowMonitorListener.METRIC_WORKFLOW_EXECUTION_TOTAL)
                .tag("status", "FAILURE").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerWorkflowMonitorListener.METRIC_WORKFLOW_EXECUTION_TIME)
                .timers()).hasSize(2);
    }
}
