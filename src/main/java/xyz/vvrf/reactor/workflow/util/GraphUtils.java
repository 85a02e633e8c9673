package xyz.vvrf.reactor.workflow.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.OutputBinding;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;
import xyz.vvrf.reactor.workflow.core.WorkflowNode;
import xyz.vvrf.reactor.workflow.exception.GraphInvalidException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 提供工作流图结构校验、循环检测、拓扑排序与波次计算的工具方法。
 * 所有遍历都按节点插入顺序进行，保证结果确定、可复现。
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 完整校验：结构完整性 + 无环。
     *
     * @throws GraphInvalidException 如果校验失败
     */
    public static void validate(WorkflowGraph graph) {
        validateGraphStructure(graph);
        detectCycles(graph);
    }

    /**
     * 校验依赖引用和输出引用都指向图中存在的节点，且节点不依赖自身。
     *
     * @throws GraphInvalidException 如果存在悬空引用或自依赖
     */
    public static void validateGraphStructure(WorkflowGraph graph) {
        String graphName = graph.getName();
        log.debug("Graph '{}': Starting graph structure validation...", graphName);

        Set<String> nodeIds = graph.getNodeIds();
        for (WorkflowNode node : graph.getNodes().values()) {
            for (String dependency : node.getDependencies()) {
                if (dependency.equals(node.getId())) {
                    throw new GraphInvalidException(graphName,
                            String.format("node '%s' depends on itself", node.getId()));
                }
                if (!nodeIds.contains(dependency)) {
                    throw new GraphInvalidException(graphName,
                            String.format("node '%s' depends on non-existent node '%s'", node.getId(), dependency));
                }
            }
        }

        for (Map.Entry<String, OutputBinding> entry : graph.getOutputBindings().entrySet()) {
            entry.getValue().getSourceNodeId().ifPresent(source -> {
                if (!nodeIds.contains(source)) {
                    throw new GraphInvalidException(graphName,
                            String.format("output '%s' references non-existent node '%s'", entry.getKey(), source));
                }
            });
        }

        log.debug("Graph '{}': Graph structure validation passed.", graphName);
    }

    /**
     * 使用深度优先搜索 (DFS) 检测依赖关系中的环。
     *
     * @throws GraphInvalidException 如果检测到环，错误信息包含环上的节点路径
     */
    public static void detectCycles(WorkflowGraph graph) {
        log.debug("Graph '{}': Starting cycle detection...", graph.getName());
        Set<String> visited = new HashSet<>();
        // 当前递归路径，保持顺序以便报告环路
        LinkedHashSet<String> visiting = new LinkedHashSet<>();

        for (String nodeId : graph.getNodeIds()) {
            if (!visited.contains(nodeId)) {
                detectCycleDFS(graph, nodeId, visited, visiting);
            }
        }
        log.debug("Graph '{}': No cycles detected.", graph.getName());
    }

    // 沿 "节点 -> 下游" 方向遍历
    private static void detectCycleDFS(WorkflowGraph graph, String nodeId, Set<String> visited, LinkedHashSet<String> visiting) {
        visited.add(nodeId);
        visiting.add(nodeId);

        for (String dependent : graph.getDependents(nodeId)) {
            if (visiting.contains(dependent)) {
                List<String> path = new ArrayList<>();
                boolean inCycle = false;
                for (String onPath : visiting) {
                    if (onPath.equals(dependent)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        path.add(onPath);
                    }
                }
                path.add(dependent);
                throw new GraphInvalidException(graph.getName(),
                        "cycle detected: " + String.join(" -> ", path));
            }
            if (!visited.contains(dependent)) {
                detectCycleDFS(graph, dependent, visited, visiting);
            }
        }

        visiting.remove(nodeId);
    }

    /**
     * 计算每个节点的入度（未满足的依赖数量），按节点插入顺序。
     */
    public static Map<String, Integer> computeInDegrees(WorkflowGraph graph) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (WorkflowNode node : graph.getNodes().values()) {
            inDegree.put(node.getId(), node.getDependencies().size());
        }
        return inDegree;
    }

    /**
     * 使用 Kahn 算法计算拓扑排序。同时就绪的节点按插入顺序排列。
     *
     * @throws GraphInvalidException 如果图包含环
     */
    public static List<String> topologicalSort(WorkflowGraph graph) {
        List<String> sorted = new ArrayList<>(graph.size());
        for (List<String> wave : computeWaves(graph)) {
            sorted.addAll(wave);
        }
        return Collections.unmodifiableList(sorted);
    }

    /**
     * 计算静态波次计划：每个波次包含依赖全部位于之前波次中的节点。
     * 波次内部按节点插入顺序排列。这也是调度器在全部节点成功时的实际分派顺序。
     *
     * @throws GraphInvalidException 如果图包含环
     */
    public static List<List<String>> computeWaves(WorkflowGraph graph) {
        Map<String, Integer> inDegree = computeInDegrees(graph);
        List<List<String>> waves = new ArrayList<>();

        List<String> ready = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        int placed = 0;
        while (!ready.isEmpty()) {
            waves.add(Collections.unmodifiableList(new ArrayList<>(ready)));
            placed += ready.size();
            Set<String> next = new HashSet<>();
            for (String nodeId : ready) {
                for (String dependent : graph.getDependents(nodeId)) {
                    int remaining = inDegree.merge(dependent, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(dependent);
                    }
                }
            }
            ready = orderByInsertion(graph, next);
        }

        if (placed != graph.size()) {
            Set<String> remaining = new LinkedHashSet<>(graph.getNodeIds());
            for (List<String> wave : waves) {
                remaining.removeAll(wave);
            }
            throw new GraphInvalidException(graph.getName(),
                    "topological sort failed, graph contains a cycle among " + remaining);
        }
        return Collections.unmodifiableList(waves);
    }

    /**
     * 按节点在图中的插入顺序排列给定的节点集合。
     */
    public static List<String> orderByInsertion(WorkflowGraph graph, Set<String> nodeIds) {
        List<String> ordered = new ArrayList<>(nodeIds.size());
        if (nodeIds.isEmpty()) {
            return ordered;
        }
        for (String nodeId : graph.getNodeIds()) {
            if (nodeIds.contains(nodeId)) {
                ordered.add(nodeId);
            }
        }
        return ordered;
    }

    /**
     * 生成图的 Graphviz DOT 描述，用于日志和调试。
     */
    public static String toDot(WorkflowGraph graph) {
        StringBuilder dot = new StringBuilder();
        String safeName = escapeDotString(graph.getName());

        dot.append(String.format("digraph \"%s\" {%n", safeName));
        dot.append("  rankdir=LR;\n");
        dot.append(String.format("  label=\"%s\";%n", safeName));
        dot.append("  node [shape=box, style=rounded];\n");

        for (WorkflowNode node : graph.getNodes().values()) {
            String id = escapeDotString(node.getId());
            List<String> attributes = new ArrayList<>();
            attributes.add(String.format("label=\"%s\"", id));
            if (node.getCompensation().isPresent()) {
                attributes.add("peripheries=2");
            }
            if (node.getCondition().isPresent()) {
                attributes.add("style=\"rounded,dashed\"");
            }
            dot.append(String.format("  \"%s\" [%s];%n", id, String.join(", ", attributes)));
        }

        for (WorkflowNode node : graph.getNodes().values()) {
            for (String dependency : node.getDependencies()) {
                dot.append(String.format("  \"%s\" -> \"%s\";%n",
                        escapeDotString(dependency), escapeDotString(node.getId())));
            }
        }

        dot.append("}\n");
        return dot.toString();
    }

    private static String escapeDotString(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
