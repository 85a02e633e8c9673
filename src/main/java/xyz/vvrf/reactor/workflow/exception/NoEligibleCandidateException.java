package xyz.vvrf.reactor.workflow.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 路由节点的所有候选得分都低于阈值（或没有候选）。
 */
public class NoEligibleCandidateException extends WorkflowException {

    private final String nodeId;
    private final Map<String, Double> scores;

    public NoEligibleCandidateException(String nodeId, Map<String, Double> scores, double threshold) {
        super(String.format("Node '%s': no candidate scored at or above %s (scores: %s)", nodeId, threshold, scores));
        this.nodeId = nodeId;
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public String getNodeId() {
        return nodeId;
    }

    public Map<String, Double> getScores() {
        return scores;
    }
}
