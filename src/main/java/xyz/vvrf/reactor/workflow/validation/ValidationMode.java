package xyz.vvrf.reactor.workflow.validation;

/**
 * 依赖校验模式。两种模式下循环都是致命错误，不会被自动修复。
 */
public enum ValidationMode {
    /**
     * 宽松模式（默认）：移除自依赖、重复依赖与悬空引用，并在结果中标记 modified。
     */
    LENIENT,
    /**
     * 严格模式：存在任何退化依赖边即拒绝工作流，不修改依赖。
     */
    STRICT
}
