package xyz.vvrf.reactor.workflow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 工作流图定义（不可变）。
 * 包含唯一名称、按插入顺序排列的节点、声明的运行输入及其校验器、声明的输出及其派生规则。
 * 节点插入顺序即同一波次内的调度顺序。
 * <p>
 * 结构合法性（依赖存在、无环、输出引用存在）由
 * {@link xyz.vvrf.reactor.workflow.registry.WorkflowRegistry#register(WorkflowGraph)} 在注册时校验。
 */
public final class WorkflowGraph {

    private final String name;
    private final Map<String, WorkflowNode> nodes;
    private final Map<String, InputValidator> inputValidators;
    private final Map<String, OutputBinding> outputBindings;
    private final Map<String, List<String>> dependents;

    public WorkflowGraph(String name,
                         Map<String, WorkflowNode> nodes,
                         Map<String, InputValidator> inputValidators,
                         Map<String, OutputBinding> outputBindings) {
        this.name = Objects.requireNonNull(name, "图名称不能为空");
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(nodes, "节点 Map 不能为空")));
        this.inputValidators = (inputValidators != null)
                ? Collections.unmodifiableMap(new LinkedHashMap<>(inputValidators))
                : Collections.<String, InputValidator>emptyMap();
        this.outputBindings = (outputBindings != null)
                ? Collections.unmodifiableMap(new LinkedHashMap<>(outputBindings))
                : Collections.<String, OutputBinding>emptyMap();
        this.dependents = buildDependents(this.nodes);
    }

    // 下游列表按节点插入顺序排列，悬空依赖被忽略（注册时会拒绝）
    private static Map<String, List<String>> buildDependents(Map<String, WorkflowNode> nodes) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String nodeId : nodes.keySet()) {
            result.put(nodeId, new ArrayList<>());
        }
        for (WorkflowNode node : nodes.values()) {
            for (String dependency : node.getDependencies()) {
                List<String> list = result.get(dependency);
                if (list != null) {
                    list.add(node.getId());
                }
            }
        }
        result.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return Collections.unmodifiableMap(result);
    }

    public String getName() {
        return name;
    }

    public Map<String, WorkflowNode> getNodes() {
        return nodes;
    }

    public Optional<WorkflowNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Set<String> getNodeIds() {
        return nodes.keySet();
    }

    /**
     * @return 直接依赖指定节点的下游节点 id，按插入顺序。
     */
    public List<String> getDependents(String nodeId) {
        return dependents.getOrDefault(nodeId, Collections.<String>emptyList());
    }

    public Map<String, InputValidator> getInputValidators() {
        return inputValidators;
    }

    public Map<String, OutputBinding> getOutputBindings() {
        return outputBindings;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("WorkflowGraph[name=%s, nodes=%s, inputs=%s, outputs=%s]",
                name, nodes.keySet(), inputValidators.keySet(), outputBindings.keySet());
    }
}
