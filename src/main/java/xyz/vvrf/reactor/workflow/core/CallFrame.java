package xyz.vvrf.reactor.workflow.core;

import java.util.Objects;

/**
 * 调用栈帧：图名称 + 运行 ID。
 */
public final class CallFrame {

    private final String graphName;
    private final String runId;

    public CallFrame(String graphName, String runId) {
        this.graphName = Objects.requireNonNull(graphName, "图名称不能为空");
        this.runId = Objects.requireNonNull(runId, "运行 ID 不能为空");
    }

    public String getGraphName() {
        return graphName;
    }

    public String getRunId() {
        return runId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallFrame that = (CallFrame) o;
        return graphName.equals(that.graphName) && runId.equals(that.runId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(graphName, runId);
    }

    @Override
    public String toString() {
        return graphName + "#" + runId;
    }
}
