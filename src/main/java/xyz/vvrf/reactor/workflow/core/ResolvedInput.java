package xyz.vvrf.reactor.workflow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * 节点的已解析输入：运行级输入 + 所有直接依赖的输出（按依赖节点 id 寻址）。
 * 它是调度时刻执行上下文的确定性纯函数，创建后不可变。
 */
public final class ResolvedInput {

    private final String runId;
    private final String nodeId;
    private final Map<String, Object> runInput;
    private final Map<String, Object> dependencyOutputs;

    public ResolvedInput(String runId, String nodeId, Map<String, Object> runInput, Map<String, Object> dependencyOutputs) {
        this.runId = Objects.requireNonNull(runId, "运行 ID 不能为空");
        this.nodeId = Objects.requireNonNull(nodeId, "节点 ID 不能为空");
        this.runInput = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(runInput, "运行输入不能为空")));
        // 依赖输出可能为 null（节点以 Mono.empty() 完成），LinkedHashMap 允许 null 值
        this.dependencyOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(dependencyOutputs, "依赖输出不能为空")));
    }

    public String getRunId() {
        return runId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public Map<String, Object> getRunInput() {
        return runInput;
    }

    public Optional<Object> getRunInput(String name) {
        return Optional.ofNullable(runInput.get(name));
    }

    public <T> T getRunInput(String name, Class<T> type) {
        return getRunInput(name)
                .map(type::cast)
                .orElseThrow(() -> new NoSuchElementException(
                        String.format("运行输入 '%s' 不存在 (节点: %s)", name, nodeId)));
    }

    public Map<String, Object> getDependencyOutputs() {
        return dependencyOutputs;
    }

    public Optional<Object> getDependencyOutput(String dependencyId) {
        return Optional.ofNullable(dependencyOutputs.get(dependencyId));
    }

    public <T> T getDependencyOutput(String dependencyId, Class<T> type) {
        return getDependencyOutput(dependencyId)
                .map(type::cast)
                .orElseThrow(() -> new NoSuchElementException(
                        String.format("依赖 '%s' 没有可用的输出 (节点: %s)", dependencyId, nodeId)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedInput that = (ResolvedInput) o;
        return runId.equals(that.runId) &&
                nodeId.equals(that.nodeId) &&
                runInput.equals(that.runInput) &&
                dependencyOutputs.equals(that.dependencyOutputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, nodeId, runInput, dependencyOutputs);
    }

    @Override
    public String toString() {
        return String.format("ResolvedInput[node=%s, runInput=%s, dependencies=%s]",
                nodeId, runInput.keySet(), dependencyOutputs.keySet());
    }
}
