package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.workflow.core.CompensationAction;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.RunStatus;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.exception.CompensationException;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Saga 补偿协调器。
 * <p>
 * 对失败的运行恰好执行一次：按完成的严格逆序访问所有 COMPLETED 节点，
 * 对注册了 {@link CompensationAction} 的节点用其记录的输出调用一次补偿。
 * 单个补偿失败只记录为 {@link CompensationException}，其余节点继续补偿；补偿不重试。
 * 运行状态依次经过 FAILED -> COMPENSATING -> COMPENSATED。
 */
@Slf4j
public class CompensationCoordinator {

    private final Duration compensationTimeout;
    private final Scheduler timerScheduler;
    private final MonitorNotifier notifier;

    public CompensationCoordinator(Duration compensationTimeout,
                                   Scheduler timerScheduler,
                                   List<WorkflowMonitorListener> monitorListeners) {
        this.compensationTimeout = Objects.requireNonNull(compensationTimeout, "补偿超时时长不能为空");
        this.timerScheduler = Objects.requireNonNull(timerScheduler, "计时调度器不能为空");
        this.notifier = new MonitorNotifier(monitorListeners);
        if (compensationTimeout.isNegative() || compensationTimeout.isZero()) {
            throw new IllegalArgumentException("补偿超时时长必须为正数: " + compensationTimeout);
        }
    }

    public CompensationCoordinator(Duration compensationTimeout) {
        this(compensationTimeout, Schedulers.parallel(), Collections.<WorkflowMonitorListener>emptyList());
    }

    /**
     * 补偿一个已失败的运行。
     *
     * @param context       处于 FAILED 状态的运行上下文
     * @param originalError 导致运行失败的错误
     * @return 补偿报告；同一运行第二次调用时以 {@link IllegalStateException} 终止
     */
    public Mono<CompensationReport> compensate(ExecutionContext context, Throwable originalError) {
        final String runId = context.getRunId();
        final String graphName = context.getGraphName();

        return Mono.defer(() -> {
            if (!context.tryTriggerCompensation()) {
                return Mono.error(new IllegalStateException(
                        String.format("Compensation for run '%s' has already been triggered", runId)));
            }
            if (!context.transition(RunStatus.FAILED, RunStatus.COMPENSATING)) {
                return Mono.error(new IllegalStateException(
                        String.format("Run '%s' must be FAILED before compensation, but was %s", runId, context.getStatus())));
            }

            List<String> completedInReverse = context.getCompletedNodeIdsInReverseOrder();
            log.info("[RunId: {}][Graph: '{}'] Starting compensation over {} completed node(s) in reverse order: {}",
                    runId, graphName, completedInReverse.size(), completedInReverse);

            // 严格串行：上一个补偿结束后才开始下一个
            return Flux.fromIterable(completedInReverse)
                    .concatMap(nodeId -> compensateNode(context, nodeId))
                    .collectList()
                    .map(outcomes -> buildReport(originalError, completedInReverse, outcomes))
                    .doOnNext(report -> {
                        context.transition(RunStatus.COMPENSATING, RunStatus.COMPENSATED);
                        if (report.isClean()) {
                            log.info("[RunId: {}][Graph: '{}'] Compensation finished. Compensated: {}",
                                    runId, graphName, report.getCompensatedNodeIds());
                        } else {
                            log.warn("[RunId: {}][Graph: '{}'] Compensation finished with {} failure(s). Compensated: {}, failed: {}",
                                    runId, graphName, report.getErrors().size(), report.getCompensatedNodeIds(), report.getFailedNodeIds());
                        }
                        notifier.safeNotify(l -> l.onCompensation(runId, graphName, report));
                    });
        });
    }

    private Mono<Outcome> compensateNode(ExecutionContext context, String nodeId) {
        final String runId = context.getRunId();
        final String graphName = context.getGraphName();

        Optional<CompensationAction> action = context.getGraph().getNode(nodeId)
                .flatMap(WorkflowNode::getCompensation);
        if (!action.isPresent()) {
            log.trace("[RunId: {}][Graph: '{}'] Node '{}' has no compensation action.", runId, graphName, nodeId);
            return Mono.just(Outcome.none(nodeId));
        }

        NodeResult result = context.getResults().get(nodeId);
        Object recordedOutput = result.getOutput().orElse(null);
        log.debug("[RunId: {}][Graph: '{}'] Compensating node '{}'", runId, graphName, nodeId);

        return Mono.defer(() -> action.get().compensate(recordedOutput))
                .timeout(compensationTimeout, timerScheduler)
                .then(Mono.fromCallable(() -> Outcome.compensated(nodeId)))
                .onErrorResume(error -> {
                    log.warn("[RunId: {}][Graph: '{}'] Compensation of node '{}' failed: {}",
                            runId, graphName, nodeId, error.toString());
                    return Mono.just(Outcome.failed(nodeId, new CompensationException(nodeId, error)));
                });
    }

    private CompensationReport buildReport(Throwable originalError, List<String> visited, List<Outcome> outcomes) {
        List<String> compensated = new ArrayList<>();
        List<CompensationException> errors = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.error != null) {
                errors.add(outcome.error);
            } else if (outcome.compensated) {
                compensated.add(outcome.nodeId);
            }
        }
        return new CompensationReport(originalError, visited, compensated, errors);
    }

    private static final class Outcome {
        private final String nodeId;
        private final boolean compensated;
        private final CompensationException error;

        private Outcome(String nodeId, boolean compensated, CompensationException error) {
            this.nodeId = nodeId;
            this.compensated = compensated;
            this.error = error;
        }

        static Outcome none(String nodeId) {
            return new Outcome(nodeId, false, null);
        }

        static Outcome compensated(String nodeId) {
            return new Outcome(nodeId, true, null);
        }

        static Outcome failed(String nodeId, CompensationException error) {
            return new Outcome(nodeId, false, error);
        }
    }
}
