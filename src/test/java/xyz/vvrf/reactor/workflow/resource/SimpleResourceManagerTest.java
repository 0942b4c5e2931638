package xyz.vvrf.reactor.workflow.resource;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class SimpleResourceManagerTest {

    @Test
    void capsConcurrentWorkflows() {
        SimpleResourceManager manager = new SimpleResourceManager(2);

        StepVerifier.create(manager.allocate("a", Collections.emptyMap())).expectNext(true).verifyComplete();
        StepVerifier.create(manager.allocate("b", Collections.emptyMap())).expectNext(true).verifyComplete();
        StepVerifier.create(manager.allocate("c", Collections.emptyMap())).expectNext(false).verifyComplete();

        StepVerifier.create(manager.release("a")).verifyComplete();
        StepVerifier.create(manager.allocate("c", Collections.emptyMap())).expectNext(true).verifyComplete();
        assertThat(manager.getHolders()).containsExactly("b", "c");
    }

    @Test
    void allocationIsIdempotentPerWorkflow() {
        SimpleResourceManager manager = new SimpleResourceManager(1);

        StepVerifier.create(manager.allocate("a", Collections.emptyMap())).expectNext(true).verifyComplete();
        StepVerifier.create(manager.allocate("a", Collections.emptyMap())).expectNext(true).verifyComplete();
        assertThat(manager.getHolders()).containsExactly("a");
    }

    @Test
    void unboundedNeverDenies() {
        SimpleResourceManager manager = SimpleResourceManager.unbounded();
        for (int i = 0; i < 50; i++) {
            StepVerifier.create(manager.allocate("wf-" + i, Collections.emptyMap())).expectNext(true).verifyComplete();
        }
        StepVerifier.create(manager.release("unknown")).verifyComplete();
        assertThat(manager.getHolders()).hasSize(50);
    }
}
