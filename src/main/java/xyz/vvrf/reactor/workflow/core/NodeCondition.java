package xyz.vvrf.reactor.workflow.core;

/**
 * 由调用方注入的节点执行条件。引擎本身不提供表达式语言。
 * 返回 false 时节点被标记为 SKIPPED，其下游也随之跳过。
 */
@FunctionalInterface
public interface NodeCondition {

    boolean shouldExecute(ResolvedInput input, ResultView results);
}
