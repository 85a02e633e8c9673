package xyz.vvrf.reactor.workflow.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 一个 {@link WorkflowRegistry} 实现，它会在所有单例 Bean 创建完成后扫描 ApplicationContext，
 * 自动注册所有类型为 {@link WorkflowGraph} 的 Spring Bean。
 * 图 Bean 因此可以依赖编排器（例如子工作流节点）。
 * 运行期仍可通过 register/replace 追加图。
 */
@Slf4j
public class SpringScanningWorkflowRegistry implements WorkflowRegistry, ApplicationContextAware, SmartInitializingSingleton {

    private ApplicationContext applicationContext;
    // 内部使用 SimpleWorkflowRegistry 来存储和校验
    private final SimpleWorkflowRegistry delegateRegistry = new SimpleWorkflowRegistry();

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterSingletonsInstantiated() {
        if (applicationContext == null) {
            throw new BeanCreationException("SpringScanningWorkflowRegistry 中 ApplicationContext 未设置");
        }
        Map<String, WorkflowGraph> graphBeans = applicationContext.getBeansOfType(WorkflowGraph.class);
        log.info("开始注册 Spring 上下文中的 WorkflowGraph Bean，共 {} 个...", graphBeans.size());

        for (Map.Entry<String, WorkflowGraph> entry : graphBeans.entrySet()) {
            try {
                delegateRegistry.register(entry.getValue());
            } catch (RuntimeException e) {
                throw new BeanCreationException(entry.getKey(),
                        "注册 WorkflowGraph Bean '" + entry.getKey() + "' 失败: " + e.getMessage(), e);
            }
        }
        log.info("WorkflowGraph Bean 注册完成: {}", delegateRegistry.getGraphNames());
    }

    @Override
    public void register(WorkflowGraph graph) {
        delegateRegistry.register(graph);
    }

    @Override
    public Optional<WorkflowGraph> replace(WorkflowGraph graph) {
        return delegateRegistry.replace(graph);
    }

    @Override
    public Optional<WorkflowGraph> unregister(String graphName) {
        return delegateRegistry.unregister(graphName);
    }

    @Override
    public Optional<WorkflowGraph> find(String graphName) {
        return delegateRegistry.find(graphName);
    }

    @Override
    public Set<String> getGraphNames() {
        return delegateRegistry.getGraphNames();
    }
}
