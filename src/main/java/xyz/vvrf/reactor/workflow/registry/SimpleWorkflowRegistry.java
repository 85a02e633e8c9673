package xyz.vvrf.reactor.workflow.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;
import xyz.vvrf.reactor.workflow.exception.GraphInvalidException;
import xyz.vvrf.reactor.workflow.util.GraphUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WorkflowRegistry 的简单内存实现。
 * 线程安全。
 */
@Slf4j
public class SimpleWorkflowRegistry implements WorkflowRegistry {

    private final Map<String, WorkflowGraph> graphs = new ConcurrentHashMap<>();

    @Override
    public void register(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "工作流图不能为空");
        validate(graph);

        if (graphs.putIfAbsent(graph.getName(), graph) != null) {
            throw new GraphInvalidException(graph.getName(), "a graph with the same name is already registered");
        }
        logRegistration(graph, "Registered");
    }

    @Override
    public Optional<WorkflowGraph> replace(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "工作流图不能为空");
        validate(graph);

        WorkflowGraph previous = graphs.put(graph.getName(), graph);
        logRegistration(graph, previous != null ? "Replaced" : "Registered");
        return Optional.ofNullable(previous);
    }

    @Override
    public Optional<WorkflowGraph> unregister(String graphName) {
        Objects.requireNonNull(graphName, "图名称不能为空");
        WorkflowGraph removed = graphs.remove(graphName);
        if (removed != null) {
            log.info("Graph '{}' unregistered.", graphName);
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public Optional<WorkflowGraph> find(String graphName) {
        Objects.requireNonNull(graphName, "图名称不能为空");
        return Optional.ofNullable(graphs.get(graphName));
    }

    @Override
    public Set<String> getGraphNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(graphs.keySet()));
    }

    private void validate(WorkflowGraph graph) {
        try {
            GraphUtils.validate(graph);
        } catch (GraphInvalidException e) {
            log.error("Graph '{}' 注册期间验证失败: {}", graph.getName(), e.getMessage());
            throw e;
        }
    }

    private void logRegistration(WorkflowGraph graph, String action) {
        log.info("{} graph '{}'. {} nodes, wave plan: {}", action, graph.getName(), graph.size(), GraphUtils.computeWaves(graph));
        if (log.isDebugEnabled()) {
            log.debug("Graph '{}' DOT 图形描述:\n--- DOT BEGIN ---\n{}--- DOT END ---", graph.getName(), GraphUtils.toDot(graph));
        }
    }
}
