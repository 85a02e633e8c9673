package xyz.vvrf.reactor.workflow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * 已完成节点结果的只读视图。
 * 每个波次在调度时创建一次快照，同一波次内并发执行的兄弟节点彼此不可见。
 * 只包含状态为 {@link NodeStatus#COMPLETED} 的节点。
 */
public final class ResultView {

    private static final ResultView EMPTY = new ResultView(Collections.<String, NodeResult>emptyMap());

    private final Map<String, NodeResult> completed;

    private ResultView(Map<String, NodeResult> completed) {
        this.completed = completed;
    }

    /**
     * 从结果 Map 创建快照，过滤掉非 COMPLETED 的结果。
     */
    public static ResultView snapshotOf(Map<String, NodeResult> results) {
        Map<String, NodeResult> copy = new LinkedHashMap<>();
        results.forEach((nodeId, result) -> {
            if (result.isCompleted()) {
                copy.put(nodeId, result);
            }
        });
        return copy.isEmpty() ? EMPTY : new ResultView(Collections.unmodifiableMap(copy));
    }

    public static ResultView empty() {
        return EMPTY;
    }

    public boolean isCompleted(String nodeId) {
        return completed.containsKey(nodeId);
    }

    public Set<String> getCompletedNodeIds() {
        return completed.keySet();
    }

    public Optional<NodeResult> getResult(String nodeId) {
        return Optional.ofNullable(completed.get(nodeId));
    }

    public Optional<Object> getOutput(String nodeId) {
        NodeResult result = completed.get(nodeId);
        return result == null ? Optional.empty() : result.getOutput();
    }

    /**
     * 获取指定节点的类型化输出。
     *
     * @throws NoSuchElementException 节点未完成或没有输出
     * @throws ClassCastException     输出类型不匹配
     */
    public <T> T getOutput(String nodeId, Class<T> type) {
        return getOutput(nodeId)
                .map(type::cast)
                .orElseThrow(() -> new NoSuchElementException(
                        String.format("节点 '%s' 没有可用的输出", nodeId)));
    }

    public int size() {
        return completed.size();
    }

    @Override
    public String toString() {
        return "ResultView" + completed.keySet();
    }
}
