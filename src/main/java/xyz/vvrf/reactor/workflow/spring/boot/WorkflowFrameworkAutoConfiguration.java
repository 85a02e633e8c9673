package xyz.vvrf.reactor.workflow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.workflow.core.ResiliencePolicy;
import xyz.vvrf.reactor.workflow.execution.CaffeineRunStatusTracker;
import xyz.vvrf.reactor.workflow.execution.CompensationCoordinator;
import xyz.vvrf.reactor.workflow.execution.ResilientNodeInvoker;
import xyz.vvrf.reactor.workflow.execution.RunOptions;
import xyz.vvrf.reactor.workflow.execution.RunStatusTracker;
import xyz.vvrf.reactor.workflow.execution.WaveScheduler;
import xyz.vvrf.reactor.workflow.execution.WorkflowOrchestrator;
import xyz.vvrf.reactor.workflow.monitor.LoggingWorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.monitor.MicrometerWorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.registry.SpringScanningWorkflowRegistry;
import xyz.vvrf.reactor.workflow.registry.WorkflowRegistry;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link WorkflowFrameworkProperties}。
 * 2. 提供可由属性配置的节点执行 {@link Scheduler} Bean ("workflowNodeExecutionScheduler") 和计时调度器。
 * 3. 提供引擎默认的 {@link ResiliencePolicy}。
 * 4. 组装 {@link ResilientNodeInvoker}、{@link CompensationCoordinator}、{@link WaveScheduler}
 * 和 {@link WorkflowOrchestrator}，并把所有 {@link WorkflowMonitorListener} Bean 传给它们。
 * 5. 提供自动注册所有 {@link xyz.vvrf.reactor.workflow.core.WorkflowGraph} Bean 的注册表。
 * <p>
 * **用户职责:** 把图定义为 WorkflowGraph Bean（或在运行期注册），然后注入 WorkflowOrchestrator 提交运行。
 */
@Configuration
@AutoConfigureAfter(name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(WorkflowFrameworkProperties.class)
@Slf4j
public class WorkflowFrameworkAutoConfiguration {

    public static final String NODE_SCHEDULER_BEAN_NAME = "workflowNodeExecutionScheduler";
    public static final String TIMER_SCHEDULER_BEAN_NAME = "workflowTimerScheduler";

    private final ApplicationContext applicationContext;

    public WorkflowFrameworkAutoConfiguration(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
        log.info("Reactor Workflow 框架自动配置 (WorkflowFrameworkAutoConfiguration) 已加载。");
    }

    /**
     * 提供一个默认的 Reactor Scheduler Bean 用于节点执行。
     * 调度器类型和参数可由 {@link WorkflowFrameworkProperties.SchedulerProps} 配置。
     */
    @Bean(name = NODE_SCHEDULER_BEAN_NAME)
    @ConditionalOnMissingBean(name = NODE_SCHEDULER_BEAN_NAME)
    public Scheduler workflowNodeExecutionScheduler(WorkflowFrameworkProperties properties) {
        WorkflowFrameworkProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case BOUNDED_ELASTIC:
                return newBoundedElastic(schedulerProps, namePrefix);
            case PARALLEL:
                WorkflowFrameworkProperties.ParallelProps pProps = schedulerProps.getParallel();
                log.info("正在创建 '{}' (Parallel): prefix={}, parallelism={}",
                        NODE_SCHEDULER_BEAN_NAME, namePrefix, pProps.getParallelism());
                return Schedulers.newParallel(namePrefix, pProps.getParallelism(), true);
            case SINGLE:
                log.info("正在创建 '{}' (Single): prefix={}", NODE_SCHEDULER_BEAN_NAME, namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case CUSTOM:
                String customBeanName = schedulerProps.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'workflow.scheduler.type=CUSTOM' 但 'workflow.scheduler.custom-bean-name' 未配置。回退到默认 BoundedElastic。");
                    return newBoundedElastic(schedulerProps, namePrefix + "-fallback");
                }
                log.info("正在从 Spring 上下文获取自定义节点执行 Scheduler Bean，名称: {}", customBeanName);
                try {
                    return applicationContext.getBean(customBeanName, Scheduler.class);
                } catch (Exception e) {
                    log.error("获取自定义 Scheduler Bean '{}' 失败。回退到默认 BoundedElastic。", customBeanName, e);
                    return newBoundedElastic(schedulerProps, namePrefix + "-fallback-custom-failed");
                }
            default:
                log.warn("未知的 'workflow.scheduler.type': {}. 回退到默认 BoundedElastic。", schedulerProps.getType());
                return newBoundedElastic(schedulerProps, namePrefix + "-default");
        }
    }

    private Scheduler newBoundedElastic(WorkflowFrameworkProperties.SchedulerProps schedulerProps, String name) {
        WorkflowFrameworkProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
        log.info("正在创建 '{}' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                NODE_SCHEDULER_BEAN_NAME, name, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
        return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(), name,
                beProps.getTtlSeconds(), true);
    }

    /**
     * 用于超时和退避等待的计时调度器，默认使用 Reactor 共享的 parallel 调度器。
     */
    @Bean(name = TIMER_SCHEDULER_BEAN_NAME)
    @ConditionalOnMissingBean(name = TIMER_SCHEDULER_BEAN_NAME)
    public Scheduler workflowTimerScheduler() {
        return Schedulers.parallel();
    }

    /**
     * 未声明弹性策略的节点使用的默认策略，由 {@link WorkflowFrameworkProperties.Node} 配置。
     */
    @Bean
    @ConditionalOnMissingBean(ResiliencePolicy.class)
    public ResiliencePolicy workflowDefaultResiliencePolicy(WorkflowFrameworkProperties properties) {
        WorkflowFrameworkProperties.Node node = properties.getNode();
        ResiliencePolicy policy = ResiliencePolicy.of(node.getDefaultMaxAttempts(), node.getDefaultBackoff(), node.getDefaultTimeout());
        log.info("正在创建默认节点弹性策略: {}", policy);
        return policy;
    }

    @Bean
    @ConditionalOnMissingBean(LoggingWorkflowMonitorListener.class)
    public LoggingWorkflowMonitorListener loggingWorkflowMonitorListener() {
        return new LoggingWorkflowMonitorListener();
    }

    @Bean
    @ConditionalOnMissingBean(ResilientNodeInvoker.class)
    public ResilientNodeInvoker resilientNodeInvoker(ResiliencePolicy defaultPolicy,
                                                     @Qualifier(NODE_SCHEDULER_BEAN_NAME) Scheduler nodeScheduler,
                                                     @Qualifier(TIMER_SCHEDULER_BEAN_NAME) Scheduler timerScheduler,
                                                     ObjectProvider<WorkflowMonitorListener> listenersProvider) {
        return new ResilientNodeInvoker(defaultPolicy, nodeScheduler, timerScheduler, collectListeners(listenersProvider));
    }

    @Bean
    @ConditionalOnMissingBean(CompensationCoordinator.class)
    public CompensationCoordinator compensationCoordinator(WorkflowFrameworkProperties properties,
                                                           @Qualifier(TIMER_SCHEDULER_BEAN_NAME) Scheduler timerScheduler,
                                                           ObjectProvider<WorkflowMonitorListener> listenersProvider) {
        return new CompensationCoordinator(properties.getEngine().getCompensationTimeout(), timerScheduler,
                collectListeners(listenersProvider));
    }

    @Bean
    @ConditionalOnMissingBean(WaveScheduler.class)
    public WaveScheduler waveScheduler(ResilientNodeInvoker nodeInvoker,
                                       CompensationCoordinator compensationCoordinator,
                                       ObjectProvider<WorkflowMonitorListener> listenersProvider) {
        return new WaveScheduler(nodeInvoker, compensationCoordinator, collectListeners(listenersProvider));
    }

    /**
     * 自动注册上下文中所有 WorkflowGraph Bean 的注册表。
     */
    @Bean
    @ConditionalOnMissingBean(WorkflowRegistry.class)
    public SpringScanningWorkflowRegistry workflowRegistry() {
        log.info("正在创建 SpringScanningWorkflowRegistry Bean...");
        return new SpringScanningWorkflowRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(RunStatusTracker.class)
    public RunStatusTracker runStatusTracker(WorkflowFrameworkProperties properties) {
        WorkflowFrameworkProperties.Tracker tracker = properties.getTracker();
        return new CaffeineRunStatusTracker(tracker.getRetention(), tracker.getMaximumSize());
    }

    @Bean
    @ConditionalOnMissingBean(WorkflowOrchestrator.class)
    public WorkflowOrchestrator workflowOrchestrator(WorkflowRegistry registry,
                                                     WaveScheduler waveScheduler,
                                                     RunStatusTracker runStatusTracker,
                                                     WorkflowFrameworkProperties properties) {
        WorkflowFrameworkProperties.Engine engine = properties.getEngine();
        RunOptions defaults = RunOptions.builder()
                .concurrencyLimit(engine.getConcurrencyLimit())
                .maxNestingDepth(engine.getMaxNestingDepth())
                .maxSameGraphRepeats(engine.getMaxSameGraphRepeats())
                .build();
        log.info("正在创建 WorkflowOrchestrator Bean，配置: {}", properties);
        return new WorkflowOrchestrator(registry, waveScheduler, runStatusTracker, defaults);
    }

    private List<WorkflowMonitorListener> collectListeners(ObjectProvider<WorkflowMonitorListener> listenersProvider) {
        List<WorkflowMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 WorkflowMonitorListener Bean。");
        } else {
            log.debug("收集到 {} 个 WorkflowMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    /**
     * 存在 MeterRegistry Bean 时记录 Micrometer 指标。
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerListenerConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerWorkflowMonitorListener.class)
        public MicrometerWorkflowMonitorListener micrometerWorkflowMonitorListener(MeterRegistry meterRegistry) {
            log.info("检测到 MeterRegistry，正在创建 MicrometerWorkflowMonitorListener Bean。");
            return new MicrometerWorkflowMonitorListener(meterRegistry);
        }
    }
}
