package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;
import xyz.vvrf.reactor.workflow.core.InputValidator;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.ResiliencePolicy;
import xyz.vvrf.reactor.workflow.core.ResolvedInput;
import xyz.vvrf.reactor.workflow.core.ResultView;
import xyz.vvrf.reactor.workflow.core.ValidationResult;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.exception.NodeFailedException;
import xyz.vvrf.reactor.workflow.exception.WorkflowException;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 弹性包装器 - 负责以超时、重试和指数退避执行单个节点。
 * <p>
 * 每次尝试都与策略中的超时竞争；超时会取消本次尝试并计为一次失败。
 * 失败且仍有剩余尝试时，等待 {@code base * 2^(attempt-1)} 后重新订阅执行器。
 * 尝试耗尽后以 {@link NodeFailedException} 记录为 FAILED 结果。
 */
@Slf4j
public class ResilientNodeInvoker {

    private final ResiliencePolicy defaultPolicy;
    private final Scheduler nodeExecutionScheduler;
    private final Scheduler timerScheduler;
    private final MonitorNotifier notifier;

    public ResilientNodeInvoker(ResiliencePolicy defaultPolicy,
                                Scheduler nodeExecutionScheduler,
                                Scheduler timerScheduler,
                                List<WorkflowMonitorListener> monitorListeners) {
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "默认弹性策略不能为空");
        this.nodeExecutionScheduler = Objects.requireNonNull(nodeExecutionScheduler, "节点执行调度器不能为空");
        this.timerScheduler = Objects.requireNonNull(timerScheduler, "计时调度器不能为空");
        this.notifier = new MonitorNotifier(Objects.requireNonNull(monitorListeners, "Monitor listeners list cannot be null"));
        log.info("ResilientNodeInvoker initialized. Default policy: {}, Scheduler: {}, Listeners: {}",
                defaultPolicy, nodeExecutionScheduler.getClass().getSimpleName(), notifier.size());
    }

    public ResilientNodeInvoker(ResiliencePolicy defaultPolicy) {
        this(defaultPolicy, Schedulers.boundedElastic(), Schedulers.parallel(), Collections.<WorkflowMonitorListener>emptyList());
    }

    /**
     * 确定节点实际生效的弹性策略：节点自身的策略，否则为默认策略。
     */
    public ResiliencePolicy effectivePolicy(WorkflowNode node) {
        return node.getPolicy().orElse(defaultPolicy);
    }

    public ResiliencePolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    /**
     * 执行节点直到成功或尝试耗尽。
     *
     * @return 发出节点最终结果（COMPLETED 或 FAILED）的 Mono，它本身从不以错误终止
     */
    public Mono<NodeResult> invoke(ExecutionContext context, WorkflowNode node, ResolvedInput input, ResultView view) {
        final String runId = context.getRunId();
        final String graphName = context.getGraphName();
        final String nodeId = node.getId();
        final ResiliencePolicy policy = effectivePolicy(node);

        return Mono.defer(() -> {
            Instant startTime = Instant.now();
            AtomicInteger attempts = new AtomicInteger(0);

            log.debug("[RunId: {}][Graph: '{}'] Node '{}' invoking with {}", runId, graphName, nodeId, policy);

            return Mono.defer(() -> attemptOnce(context, node, input, view, policy, attempts.incrementAndGet()))
                    .retryWhen(retrySpec(context, nodeId, policy, attempts))
                    .map(output -> {
                        NodeResult result = NodeResult.completed(output.orElse(null), startTime, Instant.now(),
                                attempts.get(), context.nextSequence());
                        log.debug("[RunId: {}][Graph: '{}'] Node '{}' executed successfully after {} attempt(s). Result: {}",
                                runId, graphName, nodeId, result.getAttempts(), result);
                        notifier.safeNotify(l -> l.onNodeSuccess(runId, graphName, nodeId, result.getDuration(), result));
                        return result;
                    })
                    .onErrorResume(error -> {
                        int attempted = attempts.get();
                        NodeResult result = NodeResult.failed(new NodeFailedException(nodeId, error, attempted),
                                startTime, Instant.now(), attempted, context.nextSequence());
                        log.error("[RunId: {}][Graph: '{}'] Node '{}' execution ultimately failed after {} attempt(s): {}",
                                runId, graphName, nodeId, attempted, error.toString());
                        notifier.safeNotify(l -> l.onNodeFailure(runId, graphName, nodeId, result.getDuration(), error, attempted));
                        return Mono.just(result);
                    });
        });
    }

    /**
     * 单次尝试：在节点调度器上订阅执行器，施加超时并校验输出。
     * 输出包装为 Optional，以 {@code Mono.empty()} 完成的节点得到空输出。
     */
    private Mono<Optional<Object>> attemptOnce(ExecutionContext context, WorkflowNode node, ResolvedInput input,
                                               ResultView view, ResiliencePolicy policy, int attempt) {
        final String runId = context.getRunId();
        final String graphName = context.getGraphName();
        final String nodeId = node.getId();

        log.trace("[RunId: {}][Graph: '{}'] Node '{}' attempt {}/{} starting",
                runId, graphName, nodeId, attempt, policy.getMaxAttempts());
        notifier.safeNotify(l -> l.onNodeStart(runId, graphName, nodeId, attempt));

        return Mono.<Object>defer(() -> node.getExecutor().execute(input, view))
                .subscribeOn(nodeExecutionScheduler)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .timeout(policy.getTimeout(), timerScheduler)
                .flatMap(output -> validateOutput(node, output))
                .doOnError(error -> {
                    if (error instanceof TimeoutException) {
                        log.warn("[RunId: {}][Graph: '{}'] Node '{}' attempt {} timed out after {}.",
                                runId, graphName, nodeId, attempt, policy.getTimeout());
                        notifier.safeNotify(l -> l.onNodeTimeout(runId, graphName, nodeId, policy.getTimeout(), attempt));
                    } else {
                        log.warn("[RunId: {}][Graph: '{}'] Node '{}' attempt {} failed: {}",
                                runId, graphName, nodeId, attempt, error.toString());
                    }
                });
    }

    private Mono<Optional<Object>> validateOutput(WorkflowNode node, Optional<Object> output) {
        Optional<InputValidator> validator = node.getOutputValidator();
        if (!validator.isPresent()) {
            return Mono.just(output);
        }
        ValidationResult validation = validator.get().validate(output.orElse(null));
        if (validation.isValid()) {
            return Mono.just(output);
        }
        return Mono.error(new IllegalStateException(String.format("Output of node '%s' rejected: %s",
                node.getId(), validation.getError().orElse("invalid output"))));
    }

    /**
     * 确定性的重试规格：不可重试的错误和耗尽的尝试直接传播，
     * 否则按策略等待固定的退避时长。运行已取消时不再发起新的尝试。
     */
    private Retry retrySpec(ExecutionContext context, String nodeId, ResiliencePolicy policy, AtomicInteger attempts) {
        final String runId = context.getRunId();
        final String graphName = context.getGraphName();

        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable error = signal.failure();
            int failedAttempt = attempts.get();

            if (!isRetryable(error)) {
                log.debug("[RunId: {}][Graph: '{}'] Node '{}' error is not retryable: {}",
                        runId, graphName, nodeId, error.toString());
                return Mono.<Long>error(error);
            }
            if (failedAttempt >= policy.getMaxAttempts()) {
                return Mono.<Long>error(error);
            }
            if (context.getCancellationToken().isCancelled()) {
                log.debug("[RunId: {}][Graph: '{}'] Node '{}' not retried, run was cancelled.", runId, graphName, nodeId);
                return Mono.<Long>error(error);
            }

            Duration backoff = policy.backoffFor(failedAttempt);
            log.warn("[RunId: {}][Graph: '{}'] Node '{}' attempt {}/{} failed, retrying in {}",
                    runId, graphName, nodeId, failedAttempt, policy.getMaxAttempts(), backoff);
            notifier.safeNotify(l -> l.onNodeRetry(runId, graphName, nodeId, failedAttempt, backoff, error));
            return Mono.delay(backoff, timerScheduler);
        }));
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof WorkflowException) {
            return ((WorkflowException) error).isRetryable();
        }
        return true;
    }
}
