package xyz.vvrf.reactor.workflow.notify;

/**
 * 调用方提供的状态变化回调。
 * 实现不应抛出异常；即使抛出，调度器也只会记录日志，不会中断调度循环。
 */
@FunctionalInterface
public interface StatusNotifier {

    void onStatusChange(StatusEvent event);

    static StatusNotifier noop() {
        return event -> { };
    }
}
