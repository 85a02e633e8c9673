package xyz.vvrf.reactor.workflow.core;

/**
 * 一次工作流运行的状态机。
 * <pre>
 * PENDING -> RUNNING -> {COMPLETED, FAILED}
 * FAILED -> COMPENSATING -> COMPENSATED
 * </pre>
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    COMPENSATING,
    COMPENSATED;

    /**
     * @return 是否为终态（运行不会再发生任何迁移）。
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == COMPENSATED;
    }
}
