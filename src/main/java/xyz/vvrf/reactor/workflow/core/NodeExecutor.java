package xyz.vvrf.reactor.workflow.core;

import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Function;

/**
 * 节点执行器 - 节点内不透明的业务逻辑。
 * 引擎只关心它声明的输入输出，不关心它调用了哪个外部 agent / worker。
 * <p>
 * 同一节点在一次运行中最多被调用 {@link ResiliencePolicy#getMaxAttempts()} 次，
 * 每次调用都会重新订阅返回的 Mono。如果需要幂等，由实现自行保证。
 */
@FunctionalInterface
public interface NodeExecutor {

    /**
     * 执行节点逻辑。
     *
     * @param input   由运行输入和直接依赖的输出组装而成的输入
     * @param results 本波次调度时已完成节点结果的只读视图
     * @return 发出节点输出的 Mono；{@code Mono.empty()} 表示输出为空；以错误终止表示本次尝试失败
     */
    Mono<?> execute(ResolvedInput input, ResultView results);

    /**
     * 将同步函数包装为执行器。函数在订阅时（即在节点调度器上）执行。
     */
    static NodeExecutor fromFunction(Function<ResolvedInput, ?> function) {
        Objects.requireNonNull(function, "函数不能为空");
        return (input, results) -> Mono.fromCallable(() -> function.apply(input));
    }
}
