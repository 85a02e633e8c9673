package xyz.vvrf.reactor.workflow.registry;

import xyz.vvrf.reactor.workflow.core.WorkflowGraph;
import xyz.vvrf.reactor.workflow.exception.GraphInvalidException;
import xyz.vvrf.reactor.workflow.exception.GraphNotFoundException;

import java.util.Optional;
import java.util.Set;

/**
 * 工作流图注册表接口。
 * 负责管理图名称到不可变 {@link WorkflowGraph} 的映射，注册时完成结构校验。
 */
public interface WorkflowRegistry {

    /**
     * 校验并注册一个图。校验失败时不会留下任何部分注册。
     *
     * @param graph 要注册的图 (不能为空)
     * @throws GraphInvalidException 如果图存在环、悬空引用，或同名图已注册
     */
    void register(WorkflowGraph graph);

    /**
     * 校验并替换同名图。正在使用旧图的运行不受影响，旧图实例本身不会被修改。
     *
     * @param graph 新的图定义 (不能为空)
     * @return 被替换的旧图，如果之前没有注册则为空
     * @throws GraphInvalidException 如果新图校验失败（此时旧图保持不变）
     */
    Optional<WorkflowGraph> replace(WorkflowGraph graph);

    /**
     * @return 被移除的图，如果不存在则为空
     */
    Optional<WorkflowGraph> unregister(String graphName);

    /**
     * @throws GraphNotFoundException 如果图不存在
     */
    default WorkflowGraph resolve(String graphName) {
        return find(graphName).orElseThrow(() -> new GraphNotFoundException(graphName));
    }

    Optional<WorkflowGraph> find(String graphName);

    /**
     * @return 已注册图名称的不可变快照
     */
    Set<String> getGraphNames();
}
