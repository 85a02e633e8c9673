package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;
import xyz.vvrf.reactor.workflow.core.CallFrame;
import xyz.vvrf.reactor.workflow.core.CallStack;
import xyz.vvrf.reactor.workflow.core.InputValidator;
import xyz.vvrf.reactor.workflow.core.NodeExecutor;
import xyz.vvrf.reactor.workflow.core.ResolvedInput;
import xyz.vvrf.reactor.workflow.core.ValidationResult;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;
import xyz.vvrf.reactor.workflow.exception.GraphNotFoundException;
import xyz.vvrf.reactor.workflow.exception.InputValidationException;
import xyz.vvrf.reactor.workflow.exception.MaxNestingDepthExceededException;
import xyz.vvrf.reactor.workflow.exception.NestedWorkflowCycleException;
import xyz.vvrf.reactor.workflow.exception.RunFailedException;
import xyz.vvrf.reactor.workflow.registry.WorkflowRegistry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * 工作流编排器 - 提交运行、处理嵌套调用并提供状态查询与取消。
 * <p>
 * 每次调用 {@link #run} 都会检查 Reactor Context 中的调用栈：
 * 从某个节点内部发起的调用即为嵌套运行，先做深度检查与同图重复检查，
 * 两者都通过后才解析图、校验输入并创建子运行的上下文。
 * 子运行继承根运行的选项与取消信号。
 * <p>
 * 运行与订阅者解绑：订阅被取消（例如调用它的父节点超时）时只会触发该运行的取消令牌，
 * 运行本身继续推进到终态并执行自己的补偿。
 */
@Slf4j
public class WorkflowOrchestrator {

    /** 引擎内置默认值：不限并发、最大嵌套深度 8、不允许同图重复。*/
    public static final RunOptions BUILT_IN_DEFAULTS = RunOptions.builder()
            .concurrencyLimit(0)
            .maxNestingDepth(8)
            .maxSameGraphRepeats(0)
            .build();

    private final WorkflowRegistry registry;
    private final WaveScheduler waveScheduler;
    private final RunStatusTracker statusTracker;
    private final RunOptions defaultOptions;

    public WorkflowOrchestrator(WorkflowRegistry registry,
                                WaveScheduler waveScheduler,
                                RunStatusTracker statusTracker,
                                RunOptions defaultOptions) {
        this.registry = Objects.requireNonNull(registry, "WorkflowRegistry 不能为空");
        this.waveScheduler = Objects.requireNonNull(waveScheduler, "WaveScheduler 不能为空");
        this.statusTracker = Objects.requireNonNull(statusTracker, "RunStatusTracker 不能为空");
        this.defaultOptions = (defaultOptions != null ? defaultOptions : RunOptions.defaults())
                .mergedWith(BUILT_IN_DEFAULTS);
        if (this.defaultOptions.getMaxNestingDepth() < 1) {
            throw new IllegalArgumentException("maxNestingDepth 必须 >= 1，实际为 " + this.defaultOptions.getMaxNestingDepth());
        }
        if (this.defaultOptions.getMaxSameGraphRepeats() < 0) {
            throw new IllegalArgumentException("maxSameGraphRepeats 不能为负数: " + this.defaultOptions.getMaxSameGraphRepeats());
        }
        log.info("WorkflowOrchestrator initialized. Default options: {}", this.defaultOptions);
    }

    public WorkflowOrchestrator(WorkflowRegistry registry, WaveScheduler waveScheduler) {
        this(registry, waveScheduler, new CaffeineRunStatusTracker(), BUILT_IN_DEFAULTS);
    }

    /**
     * 以默认选项运行。
     *
     * @see #run(String, Map, RunOptions)
     */
    public Mono<RunResult> run(String graphName, Map<String, Object> runInput) {
        return run(graphName, runInput, null);
    }

    /**
     * 运行指定的图。
     * <p>
     * 订阅时才会开始运行。错误信号：
     * <ul>
     *     <li>{@link MaxNestingDepthExceededException} / {@link NestedWorkflowCycleException}：嵌套调用被拒绝，未创建子运行；</li>
     *     <li>{@link GraphNotFoundException}：图未注册；</li>
     *     <li>{@link InputValidationException}：输入校验失败，没有节点被执行；</li>
     *     <li>{@link RunFailedException}：运行失败且补偿已结束，携带 {@link RunFailure}。</li>
     * </ul>
     *
     * @param graphName 已注册的图名称
     * @param runInput  运行输入，可为 null
     * @param options   运行选项，可为 null；未设置的字段取继承值或引擎默认值
     */
    public Mono<RunResult> run(String graphName, Map<String, Object> runInput, RunOptions options) {
        Objects.requireNonNull(graphName, "图名称不能为空");

        return Mono.deferContextual(contextView -> {
            CallStack parentStack = contextView.getOrDefault(CallStack.CONTEXT_KEY, CallStack.empty());
            RunOptions inherited = contextView.getOrDefault(RunOptions.CONTEXT_KEY, defaultOptions);
            CancellationToken parentToken = contextView.getOrDefault(CancellationToken.CONTEXT_KEY, null);

            RunOptions effective = (options != null ? options : RunOptions.defaults())
                    .mergedWith(inherited)
                    .mergedWith(defaultOptions);

            // 1. 深度检查
            int currentDepth = parentStack.depth();
            if (currentDepth >= effective.getMaxNestingDepth()) {
                log.error("Rejecting invocation of graph '{}': nesting depth {} would exceed maximum {}. Stack: {}",
                        graphName, currentDepth + 1, effective.getMaxNestingDepth(), parentStack);
                return Mono.error(new MaxNestingDepthExceededException(graphName, currentDepth, effective.getMaxNestingDepth()));
            }

            // 2. 同图重复检查
            if (parentStack.occurrencesOf(graphName) > effective.getMaxSameGraphRepeats()) {
                log.error("Rejecting invocation of graph '{}': already on call stack {} (allowed repeats: {})",
                        graphName, parentStack, effective.getMaxSameGraphRepeats());
                return Mono.error(new NestedWorkflowCycleException(graphName, parentStack.toString(),
                        effective.getMaxSameGraphRepeats()));
            }

            Optional<WorkflowGraph> found = registry.find(graphName);
            if (!found.isPresent()) {
                log.error("Graph '{}' is not registered. Registered graphs: {}", graphName, registry.getGraphNames());
                return Mono.error(new GraphNotFoundException(graphName));
            }
            WorkflowGraph graph = found.get();

            Map<String, Object> input = runInput != null ? runInput : Collections.<String, Object>emptyMap();
            Map<String, String> violations = validateInput(graph, input);
            if (!violations.isEmpty()) {
                log.warn("Run input for graph '{}' rejected: {}", graphName, violations);
                return Mono.error(new InputValidationException(graphName, violations));
            }

            // 3. 压栈并创建子运行
            String runId = generateRunId();
            CallStack stack = parentStack.push(new CallFrame(graphName, runId));
            CancellationToken token = resolveToken(parentToken, effective);
            ExecutionContext context = new ExecutionContext(runId, graph, input, stack, effective, token);
            statusTracker.track(context);

            Mono<RunResult> execution = waveScheduler.execute(context)
                    .doFinally(signal -> statusTracker.markFinished(context))
                    .contextWrite(ctx -> ctx
                            .put(CallStack.CONTEXT_KEY, stack)
                            .put(RunOptions.CONTEXT_KEY, effective)
                            .put(CancellationToken.CONTEXT_KEY, token));
            return detachFromSubscriber(context, execution);
        });
    }

    /**
     * 在独立的订阅上驱动运行。订阅者取消时触发运行的取消令牌而不是中断运行，
     * 被放弃的运行稍后以 RunCancelledException 进入补偿，其结果只记录日志。
     */
    private Mono<RunResult> detachFromSubscriber(ExecutionContext context, Mono<RunResult> execution) {
        final String runId = context.getRunId();
        final String graphName = context.getGraphName();

        return Mono.create(sink -> {
            AtomicBoolean abandoned = new AtomicBoolean(false);
            sink.onCancel(() -> {
                abandoned.set(true);
                if (context.getCancellationToken().cancel()) {
                    log.warn("[RunId: {}][Graph: '{}'] Subscriber cancelled while run is {}. Cancelling run.",
                            runId, graphName, context.getStatus());
                }
            });
            execution.subscribe(
                    result -> {
                        if (abandoned.get()) {
                            log.info("[RunId: {}][Graph: '{}'] Abandoned run finished with status {}.",
                                    runId, graphName, context.getStatus());
                        } else {
                            sink.success(result);
                        }
                    },
                    error -> {
                        if (abandoned.get()) {
                            log.info("[RunId: {}][Graph: '{}'] Abandoned run finished with status {}: {}",
                                    runId, graphName, context.getStatus(), error.toString());
                        } else {
                            sink.error(error);
                        }
                    },
                    sink::success,
                    Context.of(sink.contextView()));
        });
    }

    /**
     * 阻塞地运行指定的图，等待其到达终态。
     * 不能在非阻塞线程（例如 parallel 调度器）上调用。
     *
     * @throws RunFailedException 运行失败，补偿已完成
     */
    public RunResult submitRun(String graphName, Map<String, Object> runInput, RunOptions options) {
        try {
            return run(graphName, runInput, options).block();
        } catch (RuntimeException e) {
            Throwable unwrapped = Exceptions.unwrap(e);
            if (unwrapped instanceof RuntimeException) {
                throw (RuntimeException) unwrapped;
            }
            throw e;
        }
    }

    public RunResult submitRun(String graphName, Map<String, Object> runInput) {
        return submitRun(graphName, runInput, null);
    }

    /**
     * 请求取消一个运行。已在执行的节点继续完成或超时，之后运行进入补偿。
     * 取消会传递到该运行发起的所有嵌套运行。
     *
     * @return 找到该运行且本次调用触发了取消时返回 true
     */
    public boolean cancel(String runId) {
        Optional<ExecutionContext> context = statusTracker.find(runId);
        if (!context.isPresent()) {
            log.warn("[RunId: {}] Cannot cancel: run is unknown or no longer tracked.", runId);
            return false;
        }
        boolean cancelled = context.get().getCancellationToken().cancel();
        if (cancelled) {
            log.info("[RunId: {}][Graph: '{}'] Cancellation requested (status: {}).",
                    runId, context.get().getGraphName(), context.get().getStatus());
        }
        return cancelled;
    }

    public Optional<RunStatusSnapshot> getRunStatus(String runId) {
        return statusTracker.getStatus(runId);
    }

    /**
     * 创建一个调用指定子图的节点执行器，子图的运行输入即父运行的运行输入。
     */
    public NodeExecutor subWorkflow(String graphName) {
        return new SubWorkflowExecutor(this, graphName, SubWorkflowExecutor.PASS_RUN_INPUT, false);
    }

    /**
     * 创建一个调用指定子图的节点执行器。
     *
     * @param inputMapper 从父节点的已解析输入构造子运行输入
     */
    public NodeExecutor subWorkflow(String graphName, Function<ResolvedInput, Map<String, Object>> inputMapper) {
        return new SubWorkflowExecutor(this, graphName, inputMapper, false);
    }

    public WorkflowRegistry getRegistry() {
        return registry;
    }

    public RunOptions getDefaultOptions() {
        return defaultOptions;
    }

    private Map<String, String> validateInput(WorkflowGraph graph, Map<String, Object> input) {
        Map<String, String> violations = new LinkedHashMap<>();
        for (Map.Entry<String, InputValidator> entry : graph.getInputValidators().entrySet()) {
            String inputName = entry.getKey();
            try {
                ValidationResult result = entry.getValue().validate(input.get(inputName));
                if (!result.isValid()) {
                    violations.put(inputName, result.getError().orElse("invalid"));
                }
            } catch (RuntimeException e) {
                log.warn("Validator for input '{}' of graph '{}' threw exception: {}",
                        inputName, graph.getName(), e.toString());
                violations.put(inputName, "validator failed: " + e.getMessage());
            }
        }
        return violations;
    }

    private CancellationToken resolveToken(CancellationToken parentToken, RunOptions effective) {
        if (parentToken != null) {
            return parentToken.child();
        }
        if (effective.getCancellationToken() != null) {
            return effective.getCancellationToken().child();
        }
        return CancellationToken.create();
    }

    private String generateRunId() {
        return "wf-run-" + UUID.randomUUID();
    }
}
