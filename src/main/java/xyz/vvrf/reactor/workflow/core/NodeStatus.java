package xyz.vvrf.reactor.workflow.core;

/**
 * 单个节点在一次运行中的终态。
 * 未被调度的节点（上游失败或运行被取消）没有任何结果记录。
 */
public enum NodeStatus {
    /** 节点成功执行，结果中包含输出（可能为 null）。*/
    COMPLETED,
    /** 节点在重试耗尽后失败，结果中包含最后一次错误。*/
    FAILED,
    /** 节点被跳过：条件谓词为 false，或某个依赖被跳过。*/
    SKIPPED
}
