package xyz.vvrf.reactor.workflow.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 工作流图中的一个节点（不可变数据类）。
 * 由 {@link xyz.vvrf.reactor.workflow.builder.WorkflowGraphBuilder} 创建。
 * 依赖集合保持声明顺序，依赖 id 是否存在由注册表在注册时校验。
 */
public final class WorkflowNode {

    private final String id;
    private final NodeExecutor executor;
    private final Set<String> dependencies;
    private final ResiliencePolicy policy;
    private final CompensationAction compensation;
    private final NodeCondition condition;
    private final InputValidator outputValidator;

    public WorkflowNode(String id,
                        NodeExecutor executor,
                        Set<String> dependencies,
                        ResiliencePolicy policy,
                        CompensationAction compensation,
                        NodeCondition condition,
                        InputValidator outputValidator) {
        this.id = Objects.requireNonNull(id, "节点 ID 不能为空");
        this.executor = Objects.requireNonNull(executor, "节点 '" + id + "' 的执行器不能为空");
        this.dependencies = (dependencies != null)
                ? Collections.unmodifiableSet(new LinkedHashSet<>(dependencies))
                : Collections.<String>emptySet();
        this.policy = policy;
        this.compensation = compensation;
        this.condition = condition;
        this.outputValidator = outputValidator;
    }

    public String getId() {
        return id;
    }

    public NodeExecutor getExecutor() {
        return executor;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    /**
     * @return 节点自身的弹性策略；为空时使用引擎的默认策略。
     */
    public Optional<ResiliencePolicy> getPolicy() {
        return Optional.ofNullable(policy);
    }

    public Optional<CompensationAction> getCompensation() {
        return Optional.ofNullable(compensation);
    }

    public Optional<NodeCondition> getCondition() {
        return Optional.ofNullable(condition);
    }

    public Optional<InputValidator> getOutputValidator() {
        return Optional.ofNullable(outputValidator);
    }

    @Override
    public String toString() {
        return String.format("WorkflowNode[id=%s, deps=%s, policy=%s, compensation=%s, conditional=%s]",
                id, dependencies, policy != null ? policy : "default",
                compensation != null, condition != null);
    }
}
