package xyz.vvrf.reactor.workflow.core;

import java.time.Duration;
import java.util.Objects;

/**
 * 节点的弹性策略（不可变）：最大尝试次数、基础退避时长、单次尝试超时。
 * 退避时长按 {@code base * 2^(attempt-1)} 计算，不带抖动，便于测试复现。
 */
public final class ResiliencePolicy {

    /** 退避倍数的最大指数，避免 Duration 溢出。*/
    private static final int MAX_BACKOFF_EXPONENT = 30;

    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Duration timeout;

    private ResiliencePolicy(int maxAttempts, Duration baseBackoff, Duration timeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 必须 >= 1，实际为 " + maxAttempts);
        }
        this.baseBackoff = Objects.requireNonNull(baseBackoff, "基础退避时长不能为空");
        this.timeout = Objects.requireNonNull(timeout, "超时时长不能为空");
        if (baseBackoff.isNegative()) {
            throw new IllegalArgumentException("基础退避时长不能为负数: " + baseBackoff);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("超时时长必须为正数: " + timeout);
        }
        this.maxAttempts = maxAttempts;
    }

    public static ResiliencePolicy of(int maxAttempts, Duration baseBackoff, Duration timeout) {
        return new ResiliencePolicy(maxAttempts, baseBackoff, timeout);
    }

    /** 单次尝试、不重试。*/
    public static ResiliencePolicy noRetry(Duration timeout) {
        return new ResiliencePolicy(1, Duration.ZERO, timeout);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseBackoff() {
        return baseBackoff;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * 第 {@code failedAttempt} 次尝试失败后、下一次尝试前的等待时长。
     *
     * @param failedAttempt 刚刚失败的尝试序号，从 1 开始
     */
    public Duration backoffFor(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("尝试序号从 1 开始，实际为 " + failedAttempt);
        }
        int exponent = Math.min(failedAttempt - 1, MAX_BACKOFF_EXPONENT);
        return baseBackoff.multipliedBy(1L << exponent);
    }

    public ResiliencePolicy withMaxAttempts(int maxAttempts) {
        return new ResiliencePolicy(maxAttempts, baseBackoff, timeout);
    }

    public ResiliencePolicy withTimeout(Duration timeout) {
        return new ResiliencePolicy(maxAttempts, baseBackoff, timeout);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResiliencePolicy that = (ResiliencePolicy) o;
        return maxAttempts == that.maxAttempts &&
                baseBackoff.equals(that.baseBackoff) &&
                timeout.equals(that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAttempts, baseBackoff, timeout);
    }

    @Override
    public String toString() {
        return String.format("ResiliencePolicy[maxAttempts=%d, baseBackoff=%s, timeout=%s]",
                maxAttempts, baseBackoff, timeout);
    }
}
