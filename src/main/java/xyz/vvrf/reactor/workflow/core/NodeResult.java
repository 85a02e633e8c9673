package xyz.vvrf.reactor.workflow.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 代表单个节点在一次运行中的最终结果（不可变数据类）。
 * 包含状态、可选输出、可能的错误、起止时间戳、尝试次数以及完成序号。
 * 完成序号在同一次运行内单调递增，补偿协调器据此按完成的逆序回滚。
 */
public final class NodeResult {

    private final NodeStatus status;
    private final Object output;
    private final Throwable error;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final int attempts;
    private final long sequence;

    private NodeResult(NodeStatus status, Object output, Throwable error,
                       Instant startedAt, Instant finishedAt, int attempts, long sequence) {
        this.status = Objects.requireNonNull(status, "节点状态不能为空");
        this.startedAt = Objects.requireNonNull(startedAt, "开始时间不能为空");
        this.finishedAt = Objects.requireNonNull(finishedAt, "结束时间不能为空");
        this.output = output;
        this.error = error;
        this.attempts = attempts;
        this.sequence = sequence;

        if (status == NodeStatus.FAILED && error == null) {
            throw new IllegalArgumentException("FAILED 状态的结果必须包含一个非空的错误信息。");
        }
        if (status != NodeStatus.FAILED && error != null) {
            throw new IllegalArgumentException("非 FAILED 状态的结果不能包含错误信息。");
        }
        if (status == NodeStatus.SKIPPED && output != null) {
            throw new IllegalArgumentException("SKIPPED 状态的结果不能包含输出。");
        }
    }

    // --- 静态工厂方法 ---

    public static NodeResult completed(Object output, Instant startedAt, Instant finishedAt, int attempts, long sequence) {
        return new NodeResult(NodeStatus.COMPLETED, output, null, startedAt, finishedAt, attempts, sequence);
    }

    public static NodeResult failed(Throwable error, Instant startedAt, Instant finishedAt, int attempts, long sequence) {
        Objects.requireNonNull(error, "错误对象不能为空");
        return new NodeResult(NodeStatus.FAILED, null, error, startedAt, finishedAt, attempts, sequence);
    }

    public static NodeResult skipped(Instant at, long sequence) {
        return new NodeResult(NodeStatus.SKIPPED, null, null, at, at, 0, sequence);
    }

    // --- 实例方法 ---

    public NodeStatus getStatus() {
        return status;
    }

    /**
     * 获取节点输出。节点以 {@code Mono.empty()} 完成时输出为空。
     */
    public Optional<Object> getOutput() {
        return Optional.ofNullable(output);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * @return 实际发生的执行尝试次数（跳过的节点为 0）。
     */
    public int getAttempts() {
        return attempts;
    }

    public long getSequence() {
        return sequence;
    }

    public boolean isCompleted() { return status == NodeStatus.COMPLETED; }
    public boolean isFailed() { return status == NodeStatus.FAILED; }
    public boolean isSkipped() { return status == NodeStatus.SKIPPED; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeResult that = (NodeResult) o;
        return attempts == that.attempts &&
                sequence == that.sequence &&
                status == that.status &&
                Objects.equals(output, that.output) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, output, error, attempts, sequence);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NodeResult{");
        sb.append("status=").append(status);
        sb.append(", attempts=").append(attempts);
        sb.append(", seq=").append(sequence);
        getOutput().ifPresent(o -> sb.append(", output=").append(o.getClass().getSimpleName()));
        getError().ifPresent(e -> sb.append(", error=").append(e.getClass().getSimpleName()));
        sb.append('}');
        return sb.toString();
    }
}
