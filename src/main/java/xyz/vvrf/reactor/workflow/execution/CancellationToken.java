package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 工作流级取消令牌。调度循环在每次迭代开始时检查它。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * 一个独立的新令牌，调用方不持有引用时永远不会被取消。
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * 请求取消。重复调用无副作用。
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable callback : callbacks) {
                try {
                    callback.run();
                } catch (Exception e) {
                    log.error("执行取消回调时出错", e);
                }
            }
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * 注册取消回调；如果已经取消，立即执行。
     */
    void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }
}
