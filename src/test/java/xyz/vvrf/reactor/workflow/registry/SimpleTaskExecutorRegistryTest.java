package xyz.vvrf.reactor.workflow.registry;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.TaskOutcome;
import xyz.vvrf.reactor.workflow.execution.TaskExecutor;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleTaskExecutorRegistryTest {

    private final SimpleTaskExecutorRegistry registry = new SimpleTaskExecutorRegistry();

    @Test
    void resolvesRegisteredInstance() {
        TaskExecutor executor = request -> Mono.just(TaskOutcome.success());
        registry.register("llm", executor);

        assertThat(registry.resolve("llm")).containsSame(executor);
        assertThat(registry.isRegistered("llm")).isTrue();
        assertThat(registry.resolve("other")).isEmpty();
    }

    @Test
    void factoryIsInvokedLazilyAndOnce() {
        AtomicInteger created = new AtomicInteger();
        registry.register("lazy", () -> {
            created.incrementAndGet();
            return request -> Mono.empty();
        });

        assertThat(created).hasValue(0);
        TaskExecutor first = registry.resolve("lazy").get();
        TaskExecutor second = registry.resolve("lazy").get();

        assertThat(created).hasValue(1);
        assertThat(second).isSameAs(first);
    }

    @Test
    void rejectsDuplicateRefs() {
        registry.register("llm", request -> Mono.empty());

        assertThatThrownBy(() -> registry.register("llm", () -> request -> Mono.empty()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("llm");
    }

    @Test
    void factoryReturningNullIsAnError() {
        registry.register("null", () -> null);

        assertThatThrownBy(() -> registry.resolve("null")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void listsRefsInRegistrationOrder() {
        registry.register("b", request -> Mono.empty());
        registry.register("a", () -> request -> Mono.empty());

        assertThat(registry.getRegisteredRefs()).containsExactly("b", "a");
    }
}
