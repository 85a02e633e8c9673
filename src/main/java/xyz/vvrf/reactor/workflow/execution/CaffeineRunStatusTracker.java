package xyz.vvrf.reactor.workflow.execution;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 基于 Caffeine 缓存的 {@link RunStatusTracker}。
 * 未结束的运行一直保留；运行到达终态后再保留 retention 时长。
 * 超出 maximumSize 时按 Caffeine 的淘汰策略移除。
 */
@Slf4j
public class CaffeineRunStatusTracker implements RunStatusTracker {

    private final Cache<String, ExecutionContext> runs;

    public CaffeineRunStatusTracker(Duration retention, long maximumSize) {
        Objects.requireNonNull(retention, "保留时长不能为空");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("保留时长必须为正数: " + retention);
        }
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize 必须为正数: " + maximumSize);
        }
        this.runs = Caffeine.newBuilder()
                .expireAfter(new RetentionExpiry(retention.toNanos()))
                .maximumSize(maximumSize)
                .build();
        log.info("CaffeineRunStatusTracker initialized. Retention: {}, Maximum size: {}", retention, maximumSize);
    }

    public CaffeineRunStatusTracker() {
        this(Duration.ofMinutes(10), 10_000);
    }

    @Override
    public void track(ExecutionContext context) {
        runs.put(context.getRunId(), context);
        log.trace("[RunId: {}][Graph: '{}'] Tracking run status.", context.getRunId(), context.getGraphName());
    }

    @Override
    public void markFinished(ExecutionContext context) {
        // 重新写入以按终态计算过期时间
        runs.put(context.getRunId(), context);
        log.trace("[RunId: {}][Graph: '{}'] Run finished with status {}, retention window started.",
                context.getRunId(), context.getGraphName(), context.getStatus());
    }

    @Override
    public Optional<ExecutionContext> find(String runId) {
        if (runId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(runs.getIfPresent(runId));
    }

    @Override
    public long size() {
        return runs.estimatedSize();
    }

    private static final class RetentionExpiry implements Expiry<String, ExecutionContext> {
        private final long retentionNanos;

        private RetentionExpiry(long retentionNanos) {
            this.retentionNanos = retentionNanos;
        }

        @Override
        public long expireAfterCreate(String runId, ExecutionContext context, long currentTime) {
            return lifetimeOf(context);
        }

        @Override
        public long expireAfterUpdate(String runId, ExecutionContext context, long currentTime, long currentDuration) {
            return lifetimeOf(context);
        }

        @Override
        public long expireAfterRead(String runId, ExecutionContext context, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long lifetimeOf(ExecutionContext context) {
            return context.getStatus().isTerminal() ? retentionNanos : Long.MAX_VALUE;
        }
    }
}
