package xyz.vvrf.reactor.workflow.execution;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import xyz.vvrf.reactor.workflow.core.RunStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 运行状态在某一时刻的只读快照。
 */
@Getter
@ToString
public final class RunStatusSnapshot {

    private final String runId;
    private final String graphName;
    private final RunStatus status;
    private final Set<String> completedNodeIds;
    private final Duration elapsed;
    private final int depth;
    @Getter(AccessLevel.NONE)
    private final String parentRunId;

    private RunStatusSnapshot(String runId, String graphName, RunStatus status, Set<String> completedNodeIds,
                              Duration elapsed, int depth, String parentRunId) {
        this.runId = runId;
        this.graphName = graphName;
        this.status = status;
        this.completedNodeIds = Collections.unmodifiableSet(completedNodeIds);
        this.elapsed = elapsed;
        this.depth = depth;
        this.parentRunId = parentRunId;
    }

    public static RunStatusSnapshot of(ExecutionContext context) {
        Set<String> completed = new LinkedHashSet<>(context.snapshotView().getCompletedNodeIds());
        int depth = context.getDepth();
        String parentRunId = depth > 1
                ? context.getCallStack().getFrames().get(depth - 2).getRunId()
                : null;
        return new RunStatusSnapshot(context.getRunId(), context.getGraphName(), context.getStatus(),
                completed, context.getElapsed(), depth, parentRunId);
    }

    /**
     * @return 嵌套运行的父运行 ID；顶层运行为空。
     */
    public Optional<String> getParentRunId() {
        return Optional.ofNullable(parentRunId);
    }
}
