package xyz.vvrf.reactor.workflow.execution;

import xyz.vvrf.reactor.workflow.exception.CompensationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一次补偿过程的报告（不可变）。
 * visitedNodeIds 为按完成逆序访问到的所有已完成节点，
 * compensatedNodeIds 为其中补偿动作成功执行的节点，errors 为补偿动作失败的节点。
 */
public final class CompensationReport {

    private final Throwable originalError;
    private final List<String> visitedNodeIds;
    private final List<String> compensatedNodeIds;
    private final List<CompensationException> errors;

    public CompensationReport(Throwable originalError,
                              List<String> visitedNodeIds,
                              List<String> compensatedNodeIds,
                              List<CompensationException> errors) {
        this.originalError = Objects.requireNonNull(originalError, "原始错误不能为空");
        this.visitedNodeIds = Collections.unmodifiableList(new ArrayList<>(visitedNodeIds));
        this.compensatedNodeIds = Collections.unmodifiableList(new ArrayList<>(compensatedNodeIds));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public Throwable getOriginalError() {
        return originalError;
    }

    public List<String> getVisitedNodeIds() {
        return visitedNodeIds;
    }

    public List<String> getCompensatedNodeIds() {
        return compensatedNodeIds;
    }

    public List<CompensationException> getErrors() {
        return errors;
    }

    public List<String> getFailedNodeIds() {
        List<String> failed = new ArrayList<>(errors.size());
        for (CompensationException error : errors) {
            failed.add(error.getNodeId());
        }
        return failed;
    }

    /**
     * @return 所有补偿动作均成功时为 true。
     */
    public boolean isClean() {
        return errors.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("CompensationReport[visited=%s, compensated=%s, failed=%s]",
                visitedNodeIds, compensatedNodeIds, getFailedNodeIds());
    }
}
