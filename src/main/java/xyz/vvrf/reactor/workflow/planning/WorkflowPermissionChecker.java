package xyz.vvrf.reactor.workflow.planning;

/**
 * {@link WorkflowCoordinator} 访问已保存工作流前的权限检查，多租户部署时按调用方实现。
 * <p>
 * 只检查工作流 ID，不关心工作流内容。默认实现放行所有操作。
 */
@FunctionalInterface
public interface WorkflowPermissionChecker {

    boolean checkPermission(Operation operation, String workflowId);

    static WorkflowPermissionChecker allowAll() {
        return (operation, workflowId) -> true;
    }

    /**
     * 受检查的操作。
     */
    enum Operation {
        /** 读取单个工作流或其报告 */
        READ,
        /** 出现在工作流列表中 */
        LIST,
        /** 执行工作流 */
        EXECUTE
    }
}
