package xyz.vvrf.reactor.workflow.core;

import xyz.vvrf.reactor.workflow.exception.OutputUnavailableException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * 运行输出的派生规则（不可变）。
 * <ul>
 *     <li>{@link #fromNode(String)}：取某个节点的最终输出；</li>
 *     <li>{@link #fromInput(String)}：直接取运行输入（空图也能产出输出）；</li>
 *     <li>{@link #combine(BiFunction)}：基于最终结果视图和运行输入自定义组合。</li>
 * </ul>
 * 节点未完成（例如被条件跳过）时，若规则带默认值则使用默认值，否则派生失败。
 */
public final class OutputBinding {

    public enum Kind {
        NODE, INPUT, COMBINER
    }

    private final Kind kind;
    private final String source;
    private final boolean hasDefault;
    private final Object defaultValue;
    private final BiFunction<ResultView, Map<String, Object>, ?> combiner;

    private OutputBinding(Kind kind, String source, boolean hasDefault, Object defaultValue,
                          BiFunction<ResultView, Map<String, Object>, ?> combiner) {
        this.kind = kind;
        this.source = source;
        this.hasDefault = hasDefault;
        this.defaultValue = defaultValue;
        this.combiner = combiner;
    }

    public static OutputBinding fromNode(String nodeId) {
        return new OutputBinding(Kind.NODE, Objects.requireNonNull(nodeId, "节点 ID 不能为空"), false, null, null);
    }

    public static OutputBinding fromNode(String nodeId, Object defaultValue) {
        return new OutputBinding(Kind.NODE, Objects.requireNonNull(nodeId, "节点 ID 不能为空"), true, defaultValue, null);
    }

    public static OutputBinding fromInput(String inputName) {
        return new OutputBinding(Kind.INPUT, Objects.requireNonNull(inputName, "输入名称不能为空"), false, null, null);
    }

    public static OutputBinding fromInput(String inputName, Object defaultValue) {
        return new OutputBinding(Kind.INPUT, Objects.requireNonNull(inputName, "输入名称不能为空"), true, defaultValue, null);
    }

    public static OutputBinding combine(BiFunction<ResultView, Map<String, Object>, ?> combiner) {
        return new OutputBinding(Kind.COMBINER, null, false, null, Objects.requireNonNull(combiner, "组合函数不能为空"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return NODE 规则引用的节点 ID；其他规则为空。
     */
    public Optional<String> getSourceNodeId() {
        return kind == Kind.NODE ? Optional.of(source) : Optional.empty();
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    /**
     * 派生一个运行输出值。
     *
     * @param outputName 输出名称（用于错误信息）
     * @param results    运行结束时的结果视图
     * @param runInput   运行输入
     * @return 输出值，可能为 null
     * @throws OutputUnavailableException 源节点未完成且无默认值，或组合函数失败
     */
    public Object derive(String outputName, ResultView results, Map<String, Object> runInput) {
        switch (kind) {
            case NODE:
                if (results.isCompleted(source)) {
                    return results.getOutput(source).orElse(null);
                }
                if (hasDefault) {
                    return defaultValue;
                }
                throw new OutputUnavailableException(outputName,
                        String.format("source node '%s' did not complete", source));
            case INPUT:
                if (runInput.containsKey(source)) {
                    return runInput.get(source);
                }
                if (hasDefault) {
                    return defaultValue;
                }
                throw new OutputUnavailableException(outputName,
                        String.format("run input '%s' is absent", source));
            case COMBINER:
                try {
                    return combiner.apply(results, runInput);
                } catch (RuntimeException e) {
                    throw new OutputUnavailableException(outputName, "combiner failed: " + e.getMessage(), e);
                }
            default:
                throw new IllegalStateException("Unknown output binding kind: " + kind);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case NODE:
                return "fromNode(" + source + (hasDefault ? ", default" : "") + ")";
            case INPUT:
                return "fromInput(" + source + (hasDefault ? ", default" : "") + ")";
            default:
                return "combine(..)";
        }
    }
}
