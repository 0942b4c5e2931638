package xyz.vvrf.reactor.workflow.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.workflow.core.FailurePolicy;
import xyz.vvrf.reactor.workflow.validation.ValidationMode;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 工作流框架的配置属性，绑定 'workflow' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "workflow")
@Validated
public class WorkflowFrameworkProperties {

    @Valid
    private final Task task = new Task();
    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final Validation validation = new Validation();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Context context = new Context();
    @Valid
    private final Resources resources = new Resources();
    @Valid
    private final Coordinator coordinator = new Coordinator();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Task {
        /**
         * 任务的默认执行超时时间。零表示不设超时。
         */
        private Duration defaultTimeout = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Engine {
        /**
         * 同时在途的任务上限。默认 1，即逐个顺序执行。
         */
        @Min(1)
        private int maxConcurrentTasks = 1;

        /**
         * 等待在途任务时的兜底轮询间隔。
         */
        @NotNull
        private Duration pollInterval = Duration.ofMillis(100);

        @NotNull
        private FailurePolicy failurePolicy = FailurePolicy.CONTINUE_ON_FAILURE;
    }

    @Getter
    @Setter
    public static class Validation {
        /**
         * LENIENT 移除退化依赖后继续；STRICT 直接拒绝。
         */
        @NotNull
        private ValidationMode mode = ValidationMode.LENIENT;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 调度器类型。
         */
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器名称前缀。
         */
        private String namePrefix = "workflow-task";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Context {
        /**
         * 任务上下文在最后一次访问后的保留时间。
         */
        @NotNull
        private Duration ttl = Duration.ofHours(1);

        @Min(1)
        private long maximumSize = 10_000;
    }

    @Getter
    @Setter
    public static class Resources {
        /**
         * 同时运行的工作流上限，0 表示不限制。
         */
        @Min(0)
        private int maxConcurrentWorkflows = 0;
    }

    @Getter
    @Setter
    public static class Coordinator {
        /**
         * 工作流在协调器中最后一次访问后的保留时间。
         */
        @NotNull
        private Duration retention = Duration.ofHours(1);

        @Min(1)
        private long maximumSize = 10_000;
    }

    @Getter
    @Setter
    public static class Monitor {
        private final Logging logging = new Logging();

        @Getter
        @Setter
        public static class Logging {
            private boolean enabled = true;
        }
    }

    @Override
    public String toString() {
        return "WorkflowFrameworkProperties{" +
                "task={defaultTimeout=" + task.defaultTimeout +
                "}, engine={maxConcurrentTasks=" + engine.maxConcurrentTasks +
                ", pollInterval=" + engine.pollInterval +
                ", failurePolicy=" + engine.failurePolicy +
                "}, validation={mode=" + validation.mode +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                ", boundedElastic={threadCap=" + scheduler.boundedElastic.threadCap +
                ", queuedTaskCap=" + scheduler.boundedElastic.queuedTaskCap +
                ", ttlSeconds=" + scheduler.boundedElastic.ttlSeconds +
                "}, parallel={parallelism=" + scheduler.parallel.parallelism +
                "}, customBeanName='" + scheduler.customBeanName + '\'' +
                "}, context={ttl=" + context.ttl +
                ", maximumSize=" + context.maximumSize +
                "}, resources={maxConcurrentWorkflows=" + resources.maxConcurrentWorkflows +
                "}, coordinator={retention=" + coordinator.retention +
                ", maximumSize=" + coordinator.maximumSize +
                "}, monitor={logging=" + monitor.logging.enabled +
                "}}";
    }
}
