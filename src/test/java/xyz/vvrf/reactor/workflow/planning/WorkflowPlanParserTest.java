package xyz.vvrf.reactor.workflow.planning;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.core.Task;
import xyz.vvrf.reactor.workflow.core.Workflow;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class WorkflowPlanParserTest {

    private final WorkflowPlanParser parser = new WorkflowPlanParser(new ObjectMapper());

    @Test
    void resolvesIndexDependenciesToIds() {
        String plan = "{\"tasks\": ["
                + "{\"id\": \"fetch\", \"title\": \"Fetch\", \"executor\": \"http\"},"
                + "{\"id\": \"parse\", \"title\": \"Parse\", \"executor\": \"llm\", \"dependencies\": [0]},"
                + "{\"id\": \"report\", \"title\": \"Report\", \"executor\": \"llm\", \"dependencies\": [\"1\", \"fetch\"]}"
                + "]}";

        List<Task> tasks = parser.parseTasks(plan);

        assertThat(tasks).extracting(Task::getId).containsExactly("fetch", "parse", "report");
        assertThat(tasks.get(1).getDependencies()).containsExactly("fetch");
        assertThat(tasks.get(2).getDependencies()).containsExactly("parse", "fetch");
    }

    @Test
    void numericIdTakesPrecedenceOverIndex() {
        String plan = "[{\"id\": \"1\", \"title\": \"One\", \"executor\": \"x\"},"
                + "{\"id\": \"b\", \"title\": \"B\", \"executor\": \"x\", \"dependencies\": [\"1\"]}]";

        List<Task> tasks = parser.parseTasks(plan);

        assertThat(tasks.get(1).getDependencies()).containsExactly("1");
    }

    @Test
    void unresolvableReferencesAreKeptVerbatim() {
        String plan = "[{\"id\": \"a\", \"title\": \"A\", \"executor\": \"x\", \"dependencies\": [7, \"ghost\", true]}]";

        List<Task> tasks = parser.parseTasks(plan);

        assertThat(tasks.get(0).getDependencies()).containsExactly("7", "ghost");
    }

    @Test
    void indexesBeyondLongRangeAreKeptVerbatim() {
        String plan = "[{\"id\": \"a\", \"title\": \"A\", \"executor\": \"x\"},"
                + "{\"id\": \"b\", \"title\": \"B\", \"executor\": \"x\","
                + " \"dependencies\": [\"99999999999999999999\", 18446744073709551616]}]";

        List<Task> tasks = parser.parseTasks(plan);

        assertThat(tasks.get(1).getDependencies())
                .containsExactly("99999999999999999999", "18446744073709551616");
    }

    @Test
    void acceptsAlternativeExecutorFieldsAndGeneratesIds() {
        String plan = "[{\"title\": \"A\", \"agent_id\": \"search\", \"description\": \"look it up\"},"
                + "{\"title\": \"B\", \"executorRef\": \"llm\", \"metadata\": {\"timeout\": \"PT5S\"}}]";

        List<Task> tasks = parser.parseTasks(plan);

        assertThat(tasks.get(0).getId()).isNotBlank();
        assertThat(tasks.get(0).getExecutorRef()).isEqualTo("search");
        assertThat(tasks.get(0).getDescription()).isEqualTo("look it up");
        assertThat(tasks.get(1).getExecutorRef()).isEqualTo("llm");
        assertThat(tasks.get(1).getMetadata()).containsExactly(entry("timeout", "PT5S"));
        assertThat(tasks.get(0).getId()).isNotEqualTo(tasks.get(1).getId());
    }

    @Test
    void populateAddsTasksToWorkflow() {
        Workflow workflow = Workflow.builder().title("plan").build();

        parser.populate(workflow, "{\"tasks\": [{\"id\": \"a\", \"title\": \"A\", \"executor\": \"x\"}]}");

        assertThat(workflow.getTaskIds()).containsExactly("a");
    }

    @Test
    void rejectsMalformedPlans() {
        assertThatThrownBy(() -> parser.parseTasks("  "))
                .isInstanceOf(WorkflowPlanException.class).hasMessage("Plan is empty");
        assertThatThrownBy(() -> parser.parseTasks("{not json"))
                .isInstanceOf(WorkflowPlanException.class).hasMessageStartingWith("Invalid plan JSON");
        assertThatThrownBy(() -> parser.parseTasks("{\"steps\": []}"))
                .isInstanceOf(WorkflowPlanException.class).hasMessageContaining("'tasks' array");
        assertThatThrownBy(() -> parser.parseTasks("[{\"id\": \"a\", \"executor\": \"x\"}]"))
                .isInstanceOf(WorkflowPlanException.class).hasMessageContaining("missing 'title'");
        assertThatThrownBy(() -> parser.parseTasks("[{\"id\": \"a\", \"title\": \"A\"}]"))
                .isInstanceOf(WorkflowPlanException.class).hasMessageContaining("executor reference");
        assertThatThrownBy(() -> parser.parseTasks(
                "[{\"id\": \"a\", \"title\": \"A\", \"executor\": \"x\", \"dependencies\": \"b\"}]"))
                .isInstanceOf(WorkflowPlanException.class).hasMessageContaining("must be an array");
    }

    @Test
    void rejectsDuplicateIds() {
        String plan = "[{\"id\": \"a\", \"title\": \"A\", \"executor\": \"x\"},"
                + "{\"id\": \"a\", \"title\": \"A2\", \"executor\": \"x\"}]";

        assertThatThrownBy(() -> parser.parseTasks(plan))
                .isInstanceOf(WorkflowPlanException.class)
                .hasMessage("Plan contains duplicate task id 'a'");
    }
}
