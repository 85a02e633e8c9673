package xyz.vvrf.reactor.workflow.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 工作流框架的配置属性类。
 * 绑定 'workflow' 前缀下的属性。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "workflow")
@Validated
public class WorkflowFrameworkProperties {

    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final Node node = new Node();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Tracker tracker = new Tracker();

    @Getter
    @Setter
    public static class Engine {
        /**
         * 调用栈的最大深度，顶层运行深度为 1。
         */
        @Min(1)
        private int maxNestingDepth = 8;

        /**
         * 同一个图在调用栈中允许重复出现的次数。0 表示禁止任何自递归。
         */
        @Min(0)
        private int maxSameGraphRepeats = 0;

        /**
         * 同一波次内同时执行的节点数上限。0 表示不限。
         */
        @Min(0)
        private int concurrencyLimit = 0;

        /**
         * 单个补偿动作的超时时间。
         */
        @NotNull
        private Duration compensationTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Node {
        /**
         * 未声明弹性策略的节点的单次尝试超时时间。
         */
        @NotNull
        private Duration defaultTimeout = Duration.ofSeconds(30);

        /**
         * 未声明弹性策略的节点的最大尝试次数 (1 表示不重试)。
         */
        @Min(1)
        private int defaultMaxAttempts = 1;

        /**
         * 未声明弹性策略的节点的基础退避时长，第 n 次失败后等待 base * 2^(n-1)。
         */
        @NotNull
        private Duration defaultBackoff = Duration.ofMillis(100);
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 节点执行调度器类型。
         */
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器名称前缀。
         */
        private String namePrefix = "workflow-exec";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Tracker {
        /**
         * 运行状态在跟踪器中的保留时长。
         */
        @NotNull
        private Duration retention = Duration.ofMinutes(10);

        /**
         * 跟踪器最多保留的运行数。
         */
        @Min(1)
        private long maximumSize = 10_000;
    }

    @Override
    public String toString() {
        return "WorkflowFrameworkProperties{" +
                "engine={maxNestingDepth=" + engine.maxNestingDepth +
                ", maxSameGraphRepeats=" + engine.maxSameGraphRepeats +
                ", concurrencyLimit=" + engine.concurrencyLimit +
                ", compensationTimeout=" + engine.compensationTimeout +
                "}, node={defaultTimeout=" + node.defaultTimeout +
                ", defaultMaxAttempts=" + node.defaultMaxAttempts +
                ", defaultBackoff=" + node.defaultBackoff +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                ", customBeanName='" + scheduler.customBeanName + '\'' +
                "}, tracker={retention=" + tracker.retention +
                ", maximumSize=" + tracker.maximumSize +
                "}}";
    }
}
