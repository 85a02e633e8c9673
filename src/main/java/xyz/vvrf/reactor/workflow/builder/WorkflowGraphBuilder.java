package xyz.vvrf.reactor.workflow.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.CompensationAction;
import xyz.vvrf.reactor.workflow.core.InputValidator;
import xyz.vvrf.reactor.workflow.core.NodeCondition;
import xyz.vvrf.reactor.workflow.core.NodeExecutor;
import xyz.vvrf.reactor.workflow.core.OutputBinding;
import xyz.vvrf.reactor.workflow.core.ResiliencePolicy;
import xyz.vvrf.reactor.workflow.core.ValidationResult;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.exception.GraphInvalidException;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 用于以编程方式构建不可变的 {@link WorkflowGraph}。
 * 节点按 addNode 的调用顺序保存，该顺序也是同一波次内的调度顺序。
 * 允许节点级配置（依赖、弹性策略、补偿、条件、输出校验）。
 * <p>
 * build() 只拒绝重复的节点 ID；依赖是否存在、是否有环由注册表在注册时校验，
 * 这样非法的图永远无法被提交运行。
 */
@Slf4j
public class WorkflowGraphBuilder {

    private String graphName;
    private final Map<String, NodeSpec> nodeSpecs = new LinkedHashMap<>();
    private final Map<String, InputValidator> inputValidators = new LinkedHashMap<>();
    private final Map<String, OutputBinding> outputBindings = new LinkedHashMap<>();
    private String duplicateNodeId;

    public WorkflowGraphBuilder(String graphName) {
        this.graphName = Objects.requireNonNull(graphName, "图名称不能为空");
        log.debug("为工作流图 '{}' 创建 WorkflowGraphBuilder", graphName);
    }

    public static WorkflowGraphBuilder named(String graphName) {
        return new WorkflowGraphBuilder(graphName);
    }

    public WorkflowGraphBuilder name(String name) {
        this.graphName = Objects.requireNonNull(name, "图名称不能为空");
        return this;
    }

    /**
     * 添加节点。重复的节点 ID 会在 build() 时以 {@link GraphInvalidException} 拒绝。
     */
    public WorkflowGraphBuilder addNode(String nodeId, NodeExecutor executor, String... dependencies) {
        Objects.requireNonNull(nodeId, "节点 ID 不能为空");
        Objects.requireNonNull(executor, "节点 '" + nodeId + "' 的执行器不能为空");

        if (nodeSpecs.containsKey(nodeId)) {
            log.warn("Graph '{}': duplicate node id '{}' declared.", graphName, nodeId);
            if (duplicateNodeId == null) {
                duplicateNodeId = nodeId;
            }
            return this;
        }
        NodeSpec spec = new NodeSpec(executor);
        spec.dependencies.addAll(Arrays.asList(dependencies));
        nodeSpecs.put(nodeId, spec);
        log.debug("Graph '{}': 添加了节点 '{}' (依赖: {})", graphName, nodeId, spec.dependencies);
        return this;
    }

    public WorkflowGraphBuilder dependsOn(String nodeId, String... dependencies) {
        NodeSpec spec = getNodeSpecOrThrow(nodeId);
        spec.dependencies.addAll(Arrays.asList(dependencies));
        log.debug("Graph '{}': 节点 '{}' 的依赖更新为 {}", graphName, nodeId, spec.dependencies);
        return this;
    }

    public WorkflowGraphBuilder withPolicy(String nodeId, ResiliencePolicy policy) {
        getNodeSpecOrThrow(nodeId).policy = policy;
        log.debug("Graph '{}': 为节点 '{}' 配置了弹性策略 {}", graphName, nodeId, policy);
        return this;
    }

    public WorkflowGraphBuilder withRetry(String nodeId, int maxAttempts, Duration baseBackoff, Duration timeout) {
        return withPolicy(nodeId, ResiliencePolicy.of(maxAttempts, baseBackoff, timeout));
    }

    public WorkflowGraphBuilder withCompensation(String nodeId, CompensationAction compensation) {
        getNodeSpecOrThrow(nodeId).compensation = compensation;
        return this;
    }

    public WorkflowGraphBuilder withCondition(String nodeId, NodeCondition condition) {
        getNodeSpecOrThrow(nodeId).condition = condition;
        return this;
    }

    public WorkflowGraphBuilder withOutputValidator(String nodeId, InputValidator validator) {
        getNodeSpecOrThrow(nodeId).outputValidator = validator;
        return this;
    }

    /**
     * 声明一个运行输入及其校验器。
     */
    public WorkflowGraphBuilder input(String inputName, InputValidator validator) {
        Objects.requireNonNull(inputName, "输入名称不能为空");
        inputValidators.put(inputName, validator != null ? validator : value -> ValidationResult.ok());
        return this;
    }

    /**
     * 声明一个不做校验的运行输入。
     */
    public WorkflowGraphBuilder input(String inputName) {
        return input(inputName, null);
    }

    public WorkflowGraphBuilder output(String outputName, OutputBinding binding) {
        Objects.requireNonNull(outputName, "输出名称不能为空");
        Objects.requireNonNull(binding, "输出 '" + outputName + "' 的派生规则不能为空");
        outputBindings.put(outputName, binding);
        return this;
    }

    /**
     * 声明输出取自同名节点的最终输出。
     */
    public WorkflowGraphBuilder outputFromNode(String outputName, String nodeId) {
        return output(outputName, OutputBinding.fromNode(nodeId));
    }

    public WorkflowGraph build() {
        if (duplicateNodeId != null) {
            log.error("Graph '{}' 构建失败: 重复的节点 ID '{}'", graphName, duplicateNodeId);
            throw new GraphInvalidException(graphName, String.format("duplicate node id '%s'", duplicateNodeId));
        }

        Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
        for (Map.Entry<String, NodeSpec> entry : nodeSpecs.entrySet()) {
            NodeSpec spec = entry.getValue();
            nodes.put(entry.getKey(), new WorkflowNode(entry.getKey(), spec.executor, spec.dependencies,
                    spec.policy, spec.compensation, spec.condition, spec.outputValidator));
        }

        WorkflowGraph graph = new WorkflowGraph(graphName, nodes, inputValidators, outputBindings);
        log.info("Graph '{}' 构建完成。{} 个节点, 输入: {}, 输出: {}",
                graphName, nodes.size(), inputValidators.keySet(), outputBindings.keySet());
        return graph;
    }

    private NodeSpec getNodeSpecOrThrow(String nodeId) {
        NodeSpec spec = nodeSpecs.get(nodeId);
        if (spec == null) {
            throw new IllegalStateException(String.format("节点 '%s' 尚未通过 addNode() 定义。无法配置。", nodeId));
        }
        return spec;
    }

    private static final class NodeSpec {
        private final NodeExecutor executor;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private ResiliencePolicy policy;
        private CompensationAction compensation;
        private NodeCondition condition;
        private InputValidator outputValidator;

        private NodeSpec(NodeExecutor executor) {
            this.executor = executor;
        }
    }
}
