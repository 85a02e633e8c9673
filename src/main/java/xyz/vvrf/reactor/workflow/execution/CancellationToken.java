package xyz.vvrf.reactor.workflow.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 运行的取消信号。
 * 取消后调度器不再分派新的波次，已在执行的节点继续完成或超时，随后运行进入补偿。
 * 子令牌在父令牌取消时同样视为已取消，但取消子令牌不会影响父令牌。
 */
public final class CancellationToken {

    /** Reactor Context 中存放当前运行取消令牌的键。*/
    public static final String CONTEXT_KEY = CancellationToken.class.getName();

    private final CancellationToken parent;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    /**
     * @return 如果本次调用使令牌从未取消变为已取消，返回 true。
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    @Override
    public String toString() {
        return "CancellationToken[cancelled=" + isCancelled() + "]";
    }
}
