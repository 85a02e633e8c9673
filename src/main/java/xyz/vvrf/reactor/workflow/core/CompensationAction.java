package xyz.vvrf.reactor.workflow.core;

import reactor.core.publisher.Mono;

/**
 * 补偿动作：给定节点记录下的输出，尝试撤销节点产生的副作用。
 * 补偿只执行一次，失败会被记录但不会中断其他节点的补偿。
 */
@FunctionalInterface
public interface CompensationAction {

    /**
     * @param recordedOutput 节点成功时记录的输出（可能为 null）
     * @return 补偿完成信号；以错误终止表示补偿失败
     */
    Mono<Void> compensate(Object recordedOutput);
}
