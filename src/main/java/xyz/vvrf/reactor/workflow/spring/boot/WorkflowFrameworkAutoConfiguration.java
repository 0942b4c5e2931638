package xyz.vvrf.reactor.workflow.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.workflow.context.ContextStore;
import xyz.vvrf.reactor.workflow.context.InMemoryContextStore;
import xyz.vvrf.reactor.workflow.execution.StandardTaskRunner;
import xyz.vvrf.reactor.workflow.execution.StandardWorkflowEngine;
import xyz.vvrf.reactor.workflow.execution.TaskInputBuilder;
import xyz.vvrf.reactor.workflow.execution.TaskRunner;
import xyz.vvrf.reactor.workflow.execution.WorkflowEngine;
import xyz.vvrf.reactor.workflow.execution.WorkflowEngineOptions;
import xyz.vvrf.reactor.workflow.monitor.LoggingWorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.monitor.MicrometerWorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.planning.WorkflowCoordinator;
import xyz.vvrf.reactor.workflow.planning.WorkflowPermissionChecker;
import xyz.vvrf.reactor.workflow.planning.WorkflowPlanParser;
import xyz.vvrf.reactor.workflow.planning.WorkflowPlanner;
import xyz.vvrf.reactor.workflow.registry.SpringScanningTaskExecutorRegistry;
import xyz.vvrf.reactor.workflow.registry.TaskExecutorRegistry;
import xyz.vvrf.reactor.workflow.report.ReportJsonWriter;
import xyz.vvrf.reactor.workflow.resource.ResourceManager;
import xyz.vvrf.reactor.workflow.resource.SimpleResourceManager;
import xyz.vvrf.reactor.workflow.validation.DependencyValidator;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link WorkflowFrameworkProperties}。
 * 2. 提供任务执行所用的 {@link Scheduler} Bean ("workflowTaskScheduler")，可由属性配置。
 * 3. 提供执行器注册表、上下文存储、资源管理器、依赖校验器与调度引擎。
 * 4. 收集所有的 {@link WorkflowMonitorListener} Bean 交给任务执行器与引擎。
 * 5. 如果应用提供了 {@link WorkflowPlanner}，额外提供 {@link WorkflowCoordinator}。
 * <p>
 * 每个 Bean 都是 {@code @ConditionalOnMissingBean}，应用可以自行覆盖。
 * 执行器实现类使用 {@link xyz.vvrf.reactor.workflow.registry.WorkflowTaskExecutor} 注解即可被自动注册。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(WorkflowFrameworkProperties.class)
@AutoConfigureAfter(name = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@Slf4j
public class WorkflowFrameworkAutoConfiguration {

    public static final String TASK_SCHEDULER_BEAN_NAME = "workflowTaskScheduler";

    private final ApplicationContext applicationContext;

    public WorkflowFrameworkAutoConfiguration(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
        log.info("工作流框架自动配置 (WorkflowFrameworkAutoConfiguration) 已加载。");
    }

    /**
     * 提供执行器调用所在的 Reactor Scheduler。
     * 调度器类型和参数可由 {@link WorkflowFrameworkProperties.SchedulerProps} 配置。
     */
    @Bean(name = TASK_SCHEDULER_BEAN_NAME)
    @ConditionalOnMissingBean(name = TASK_SCHEDULER_BEAN_NAME)
    public Scheduler workflowTaskScheduler(WorkflowFrameworkProperties properties) {
        WorkflowFrameworkProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case BOUNDED_ELASTIC:
                return boundedElastic(schedulerProps, namePrefix);
            case PARALLEL:
                int parallelism = schedulerProps.getParallel().getParallelism();
                log.info("正在创建 '{}' (Parallel): prefix={}, parallelism={}", TASK_SCHEDULER_BEAN_NAME, namePrefix, parallelism);
                return Schedulers.newParallel(namePrefix, parallelism, true);
            case SINGLE:
                log.info("正在创建 '{}' (Single): prefix={}", TASK_SCHEDULER_BEAN_NAME, namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case CUSTOM:
                String customBeanName = schedulerProps.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'workflow.scheduler.type=CUSTOM' 但 'workflow.scheduler.custom-bean-name' 未配置。回退到默认 BoundedElastic。");
                    return boundedElastic(schedulerProps, namePrefix + "-fallback");
                }
                log.info("正在从 Spring 上下文获取自定义 Scheduler Bean，名称: {}", customBeanName);
                try {
                    return applicationContext.getBean(customBeanName, Scheduler.class);
                } catch (Exception e) {
                    log.error("获取自定义 Scheduler Bean '{}' 失败。回退到默认 BoundedElastic。", customBeanName, e);
                    return boundedElastic(schedulerProps, namePrefix + "-fallback-custom-failed");
                }
            default:
                log.warn("未知的 'workflow.scheduler.type': {}. 回退到默认 BoundedElastic。", schedulerProps.getType());
                return boundedElastic(schedulerProps, namePrefix + "-default");
        }
    }

    private static Scheduler boundedElastic(WorkflowFrameworkProperties.SchedulerProps schedulerProps, String name) {
        WorkflowFrameworkProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
        log.info("正在创建 '{}' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                TASK_SCHEDULER_BEAN_NAME, name, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
        return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(), name, beProps.getTtlSeconds(), true);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "workflow.monitor.logging", name = "enabled", havingValue = "true", matchIfMissing = true)
    public LoggingWorkflowMonitorListener loggingWorkflowMonitorListener() {
        return new LoggingWorkflowMonitorListener();
    }

    @Bean
    @ConditionalOnMissingBean(TaskExecutorRegistry.class)
    public SpringScanningTaskExecutorRegistry taskExecutorRegistry() {
        return new SpringScanningTaskExecutorRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextStore workflowContextStore(WorkflowFrameworkProperties properties) {
        WorkflowFrameworkProperties.Context context = properties.getContext();
        return new InMemoryContextStore(context.getTtl(), context.getMaximumSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceManager workflowResourceManager(WorkflowFrameworkProperties properties) {
        return new SimpleResourceManager(properties.getResources().getMaxConcurrentWorkflows());
    }

    @Bean
    @ConditionalOnMissingBean
    public DependencyValidator workflowDependencyValidator(WorkflowFrameworkProperties properties) {
        return new DependencyValidator(properties.getValidation().getMode());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskInputBuilder workflowTaskInputBuilder(ObjectProvider<ObjectMapper> objectMapper) {
        return new TaskInputBuilder(objectMapper.getIfAvailable(ReportJsonWriter::defaultObjectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public ReportJsonWriter workflowReportJsonWriter(ObjectProvider<ObjectMapper> objectMapper) {
        return new ReportJsonWriter(objectMapper.getIfAvailable(ReportJsonWriter::defaultObjectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowPlanParser workflowPlanParser(ObjectProvider<ObjectMapper> objectMapper) {
        return new WorkflowPlanParser(objectMapper.getIfAvailable(ReportJsonWriter::defaultObjectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRunner workflowTaskRunner(TaskExecutorRegistry executorRegistry,
                                         ContextStore contextStore,
                                         TaskInputBuilder inputBuilder,
                                         @Qualifier(TASK_SCHEDULER_BEAN_NAME) Scheduler taskScheduler,
                                         ObjectProvider<WorkflowMonitorListener> listenersProvider) {
        return new StandardTaskRunner(executorRegistry, contextStore, inputBuilder, taskScheduler,
                collectListeners(listenersProvider));
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEngine workflowEngine(DependencyValidator validator,
                                         TaskRunner taskRunner,
                                         ResourceManager resourceManager,
                                         WorkflowFrameworkProperties properties,
                                         ObjectProvider<WorkflowMonitorListener> listenersProvider) {
        log.info("正在创建 WorkflowEngine Bean，配置: {}", properties);
        WorkflowEngineOptions options = WorkflowEngineOptions.builder()
                .taskTimeout(properties.getTask().getDefaultTimeout())
                .maxConcurrentTasks(properties.getEngine().getMaxConcurrentTasks())
                .pollInterval(properties.getEngine().getPollInterval())
                .failurePolicy(properties.getEngine().getFailurePolicy())
                .clock(Clock.systemUTC())
                .build();
        return new StandardWorkflowEngine(validator, taskRunner, resourceManager, collectListeners(listenersProvider), options);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowPermissionChecker workflowPermissionChecker() {
        log.info("未定义 WorkflowPermissionChecker Bean，所有工作流操作均被允许。");
        return WorkflowPermissionChecker.allowAll();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(WorkflowPlanner.class)
    public WorkflowCoordinator workflowCoordinator(WorkflowPlanner planner,
                                                   WorkflowPlanParser planParser,
                                                   WorkflowEngine engine,
                                                   ContextStore contextStore,
                                                   WorkflowPermissionChecker permissionChecker,
                                                   WorkflowFrameworkProperties properties) {
        WorkflowFrameworkProperties.Coordinator coordinator = properties.getCoordinator();
        return new WorkflowCoordinator(planner, planParser, engine, contextStore, permissionChecker,
                coordinator.getRetention(), coordinator.getMaximumSize(), Clock.systemUTC());
    }

    /**
     * 收集在应用上下文中定义的所有 WorkflowMonitorListener Bean，按 {@code @Order} 排序。
     */
    private static List<WorkflowMonitorListener> collectListeners(ObjectProvider<WorkflowMonitorListener> listenersProvider) {
        List<WorkflowMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 WorkflowMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 WorkflowMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    /**
     * 存在 {@link MeterRegistry} 时记录任务与工作流的执行指标。
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MeterRegistry.class)
        public MicrometerWorkflowMonitorListener micrometerWorkflowMonitorListener(MeterRegistry meterRegistry) {
            return new MicrometerWorkflowMonitorListener(meterRegistry);
        }
    }
}
