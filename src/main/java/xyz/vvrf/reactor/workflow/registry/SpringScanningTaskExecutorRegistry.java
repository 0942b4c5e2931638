package xyz.vvrf.reactor.workflow.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.reactor.workflow.execution.TaskExecutor;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 一个 {@link TaskExecutorRegistry} 实现，它会自动发现并注册
 * 使用 {@link WorkflowTaskExecutor} 注解的 Spring Bean。
 * 原型作用域的 Bean 每次解析都会从容器获取新实例。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SpringScanningTaskExecutorRegistry implements TaskExecutorRegistry, ApplicationContextAware, InitializingBean {

    private ApplicationContext applicationContext;
    private final SimpleTaskExecutorRegistry delegateRegistry = new SimpleTaskExecutorRegistry();
    // 原型 Bean 不经过委托注册表的实例缓存
    private final Map<String, String> prototypeBeans = new ConcurrentHashMap<>();

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() {
        if (applicationContext == null) {
            throw new BeanCreationException("SpringScanningTaskExecutorRegistry 中 ApplicationContext 未设置");
        }
        log.info("开始扫描 @WorkflowTaskExecutor Bean...");
        scanAndRegisterExecutors();
    }

    private void scanAndRegisterExecutors() {
        String[] beanNames = applicationContext.getBeanNamesForAnnotation(WorkflowTaskExecutor.class);
        int registeredCount = 0;

        for (String beanName : beanNames) {
            WorkflowTaskExecutor annotation = applicationContext.findAnnotationOnBean(beanName, WorkflowTaskExecutor.class);
            if (annotation == null) {
                log.warn("在 Bean '{}' 上找不到 @WorkflowTaskExecutor 注解，尽管 getBeanNamesForAnnotation 返回了它。", beanName);
                continue;
            }
            Class<?> beanType = applicationContext.getType(beanName);
            if (beanType == null || !TaskExecutor.class.isAssignableFrom(beanType)) {
                log.error("Bean '{}' 使用了 @WorkflowTaskExecutor 注解，但未实现 TaskExecutor 接口。跳过注册。", beanName);
                continue;
            }

            String executorRef = determineExecutorRef(annotation, beanName);
            try {
                if (BeanDefinition.SCOPE_PROTOTYPE.equals(annotation.scope())) {
                    log.debug("注册原型执行器: ref='{}', Bean名='{}'", executorRef, beanName);
                    Supplier<TaskExecutor> factory = () -> applicationContext.getBean(beanName, TaskExecutor.class);
                    delegateRegistry.register(executorRef, factory);
                    prototypeBeans.put(executorRef, beanName);
                } else {
                    log.debug("注册单例执行器: ref='{}', Bean名='{}'", executorRef, beanName);
                    delegateRegistry.register(executorRef, applicationContext.getBean(beanName, TaskExecutor.class));
                }
                registeredCount++;
            } catch (IllegalArgumentException e) {
                // 记录注册错误（例如重复引用），但继续扫描
                log.error("注册执行器 Bean '{}' (ref: '{}') 失败: {}", beanName, executorRef, e.getMessage());
            }
        }
        log.info("扫描完成。共注册了 {} 个执行器。", registeredCount);
    }

    private String determineExecutorRef(WorkflowTaskExecutor annotation, String beanName) {
        String ref = annotation.ref();
        if (ref.isEmpty()) {
            ref = annotation.value();
        }
        if (ref.isEmpty()) {
            log.warn("Bean '{}' 的 @WorkflowTaskExecutor 注解中未提供 'ref' 或 'value'。将使用 Bean 名称作为执行器引用。", beanName);
            return beanName;
        }
        return ref;
    }

    @Override
    public void register(String executorRef, Supplier<? extends TaskExecutor> factory) {
        log.warn("尝试在 SpringScanningTaskExecutorRegistry 上手动注册引用 '{}'。推荐使用自动扫描。", executorRef);
        delegateRegistry.register(executorRef, factory);
    }

    @Override
    public void register(String executorRef, TaskExecutor executor) {
        log.warn("尝试在 SpringScanningTaskExecutorRegistry 上手动注册引用 '{}'。推荐使用自动扫描。", executorRef);
        delegateRegistry.register(executorRef, executor);
    }

    @Override
    public Optional<TaskExecutor> resolve(String executorRef) {
        String prototypeBean = prototypeBeans.get(executorRef);
        if (prototypeBean != null) {
            return Optional.of(applicationContext.getBean(prototypeBean, TaskExecutor.class));
        }
        return delegateRegistry.resolve(executorRef);
    }

    @Override
    public boolean isRegistered(String executorRef) {
        return delegateRegistry.isRegistered(executorRef);
    }

    @Override
    public Set<String> getRegisteredRefs() {
        return delegateRegistry.getRegisteredRefs();
    }
}
