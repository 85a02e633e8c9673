package xyz.vvrf.reactor.workflow.pattern;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.workflow.core.NodeExecutor;
import xyz.vvrf.reactor.workflow.core.ResolvedInput;
import xyz.vvrf.reactor.workflow.core.ResultView;
import xyz.vvrf.reactor.workflow.exception.NoEligibleCandidateException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 委派/竞标式节点：对每个候选执行器打分，执行得分最高的一个。
 * <p>
 * 得分相同的候选取先注册的那个；最高分低于阈值时本次尝试以
 * {@link NoEligibleCandidateException} 失败。打分在每次尝试时重新进行。
 */
@Slf4j
public class RoutingNodeExecutor implements NodeExecutor {

    /**
     * 候选打分函数。
     */
    @FunctionalInterface
    public interface CandidateScorer {
        double score(String candidateName, ResolvedInput input);
    }

    private final Map<String, NodeExecutor> candidates;
    private final CandidateScorer scorer;
    private final double threshold;

    private RoutingNodeExecutor(Map<String, NodeExecutor> candidates, CandidateScorer scorer, double threshold) {
        this.candidates = Collections.unmodifiableMap(new LinkedHashMap<>(candidates));
        this.scorer = scorer;
        this.threshold = threshold;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Mono<?> execute(ResolvedInput input, ResultView results) {
        Map<String, Double> scores = new LinkedHashMap<>();
        String selected = null;
        double best = Double.NEGATIVE_INFINITY;

        for (String name : candidates.keySet()) {
            double score = scorer.score(name, input);
            scores.put(name, score);
            // 严格大于：同分时保留先注册的候选
            if (score > best) {
                best = score;
                selected = name;
            }
        }

        if (selected == null || best < threshold) {
            log.warn("[RunId: {}] Node '{}': no eligible candidate. Scores: {}, threshold: {}",
                    input.getRunId(), input.getNodeId(), scores, threshold);
            return Mono.error(new NoEligibleCandidateException(input.getNodeId(), scores, threshold));
        }

        log.debug("[RunId: {}] Node '{}': routed to candidate '{}' (score {}). Scores: {}",
                input.getRunId(), input.getNodeId(), selected, best, scores);
        return candidates.get(selected).execute(input, results);
    }

    public Map<String, NodeExecutor> getCandidates() {
        return candidates;
    }

    public double getThreshold() {
        return threshold;
    }

    public static final class Builder {
        private final Map<String, NodeExecutor> candidates = new LinkedHashMap<>();
        private CandidateScorer scorer;
        private double threshold = Double.NEGATIVE_INFINITY;

        private Builder() {
        }

        public Builder candidate(String name, NodeExecutor executor) {
            Objects.requireNonNull(name, "候选名称不能为空");
            Objects.requireNonNull(executor, "候选 '" + name + "' 的执行器不能为空");
            if (candidates.putIfAbsent(name, executor) != null) {
                throw new IllegalArgumentException("重复的候选名称: " + name);
            }
            return this;
        }

        public Builder scorer(CandidateScorer scorer) {
            this.scorer = Objects.requireNonNull(scorer, "打分函数不能为空");
            return this;
        }

        /**
         * 最低可接受得分（含）。默认不设下限。
         */
        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public RoutingNodeExecutor build() {
            if (scorer == null) {
                throw new IllegalStateException("RoutingNodeExecutor 需要一个打分函数");
            }
            return new RoutingNodeExecutor(candidates, scorer, threshold);
        }
    }
}
