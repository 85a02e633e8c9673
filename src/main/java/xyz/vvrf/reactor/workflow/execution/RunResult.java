package xyz.vvrf.reactor.workflow.execution;

import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.RunStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * 成功运行的结果（不可变）：派生的输出、全部节点结果和实际执行的波次。
 */
public final class RunResult {

    private final String runId;
    private final String graphName;
    private final RunStatus status;
    private final Map<String, Object> outputs;
    private final Map<String, NodeResult> nodeResults;
    private final List<List<String>> waves;
    private final Instant startedAt;
    private final Instant finishedAt;

    public RunResult(String runId, String graphName, Map<String, Object> outputs,
                     Map<String, NodeResult> nodeResults, List<List<String>> waves,
                     Instant startedAt, Instant finishedAt) {
        this.runId = Objects.requireNonNull(runId, "运行 ID 不能为空");
        this.graphName = Objects.requireNonNull(graphName, "图名称不能为空");
        this.status = RunStatus.COMPLETED;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.nodeResults = Collections.unmodifiableMap(new LinkedHashMap<>(nodeResults));
        this.waves = Collections.unmodifiableList(waves);
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public String getRunId() {
        return runId;
    }

    public String getGraphName() {
        return graphName;
    }

    public RunStatus getStatus() {
        return status;
    }

    /**
     * @return 输出名称 -> 输出值，按图中声明顺序；值可能为 null。
     */
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public <T> T getOutput(String outputName, Class<T> type) {
        if (!outputs.containsKey(outputName)) {
            throw new NoSuchElementException(String.format("运行 '%s' 没有名为 '%s' 的输出", runId, outputName));
        }
        return type.cast(outputs.get(outputName));
    }

    /**
     * @return 节点 ID -> 结果，按完成顺序。
     */
    public Map<String, NodeResult> getNodeResults() {
        return nodeResults;
    }

    public List<List<String>> getWaves() {
        return waves;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return String.format("RunResult[runId=%s, graph=%s, outputs=%s, nodes=%d]",
                runId, graphName, outputs.keySet(), nodeResults.size());
    }
}
