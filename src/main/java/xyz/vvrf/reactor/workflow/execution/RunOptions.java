package xyz.vvrf.reactor.workflow.execution;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 单次运行的选项。未设置（null）的字段回退到引擎默认值，
 * 见 {@link #mergedWith(RunOptions)}。嵌套运行继承根运行的选项。
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class RunOptions {

    /** Reactor Context 中存放当前运行生效选项的键。*/
    public static final String CONTEXT_KEY = RunOptions.class.getName();

    private static final RunOptions EMPTY = RunOptions.builder().build();

    /** 同一波次内同时执行的节点数上限，0 表示不限。*/
    private final Integer concurrencyLimit;

    /** 调用栈的最大深度，顶层运行深度为 1。*/
    private final Integer maxNestingDepth;

    /** 同一个图在调用栈中允许重复出现的次数，0 表示不允许任何自递归。*/
    private final Integer maxSameGraphRepeats;

    private final CancellationToken cancellationToken;

    public static RunOptions defaults() {
        return EMPTY;
    }

    /**
     * 用 fallback 中的值填充本选项中未设置的字段。
     */
    public RunOptions mergedWith(RunOptions fallback) {
        if (fallback == null) {
            return this;
        }
        return RunOptions.builder()
                .concurrencyLimit(concurrencyLimit != null ? concurrencyLimit : fallback.concurrencyLimit)
                .maxNestingDepth(maxNestingDepth != null ? maxNestingDepth : fallback.maxNestingDepth)
                .maxSameGraphRepeats(maxSameGraphRepeats != null ? maxSameGraphRepeats : fallback.maxSameGraphRepeats)
                .cancellationToken(cancellationToken != null ? cancellationToken : fallback.cancellationToken)
                .build();
    }

    int effectiveConcurrency() {
        return (concurrencyLimit == null || concurrencyLimit <= 0) ? Integer.MAX_VALUE : concurrencyLimit;
    }
}
