package xyz.vvrf.reactor.workflow.registry;

import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * 标记一个类为可被发现的任务执行器实现。
 * 会被 {@link SpringScanningTaskExecutorRegistry} 以 {@link #ref()} 为引用自动注册。
 * <p>
 * 包含 {@link Component} 以便 Spring 在组件扫描期间自动检测这些类。
 *
 * @author ruifeng.wen
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface WorkflowTaskExecutor {

    /**
     * 执行器引用，同时也是 {@link #ref()} 的别名。
     */
    @AliasFor("ref")
    String value() default "";

    /**
     * 执行器引用，同时也是 {@link #value()} 的别名。为空时使用 Bean 名称。
     */
    @AliasFor("value")
    String ref() default "";

    /**
     * 此执行器的 Spring bean 定义的作用域。
     */
    String scope() default BeanDefinition.SCOPE_SINGLETON;
}
