package xyz.vvrf.reactor.workflow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.core.NodeResult;
import xyz.vvrf.reactor.workflow.core.RunStatus;
import xyz.vvrf.reactor.workflow.exception.CompensationException;
import xyz.vvrf.reactor.workflow.execution.CompensationReport;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.reactor.workflow.monitor.MicrometerWorkflowMonitorListener.*;

class MicrometerWorkflowMonitorListenerTest {

    private SimpleMeterRegistry registry;
    private MicrometerWorkflowMonitorListener listener;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        listener = new MicrometerWorkflowMonitorListener(registry);
    }

    @Test
    void onNodeSuccess_shouldRecordTimerAndCounterWithSuccessStatus() {
        Instant now = Instant.now();
        listener.onNodeSuccess("run-1", "orders", "charge", Duration.ofMillis(40),
                NodeResult.completed("ok", now, now, 1, 1));

        Timer timer = registry.find(METRIC_NODE_EXECUTION_TIME)
                .tags(TAG_GRAPH_NAME, "orders", TAG_NODE_ID, "charge", TAG_STATUS, "SUCCESS")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(40.0);
        assertThat(registry.find(METRIC_NODE_EXECUTION_TOTAL).tags(TAG_STATUS, "SUCCESS").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void onNodeFailure_shouldTagTimeoutsSeparately() {
        listener.onNodeFailure("run-1", "orders", "ship", Duration.ofMillis(5), new TimeoutException(), 2);
        listener.onNodeFailure("run-1", "orders", "ship", Duration.ofMillis(5), new IllegalStateException(), 1);

        Counter timeouts = registry.find(METRIC_NODE_EXECUTION_TOTAL)
                .tags(TAG_STATUS, "TIMEOUT", TAG_ERROR, "TimeoutException").counter();
        Counter failures = registry.find(METRIC_NODE_EXECUTION_TOTAL)
                .tags(TAG_STATUS, "FAILURE", TAG_ERROR, "IllegalStateException").counter();
        assertThat(timeouts).isNotNull();
        assertThat(timeouts.count()).isEqualTo(1.0);
        assertThat(failures).isNotNull();
        assertThat(failures.count()).isEqualTo(1.0);
    }

    @Test
    void retryTimeoutAndSkip_shouldIncrementCounters() {
        listener.onNodeRetry("run-1", "orders", "charge", 1, Duration.ofMillis(100), new IllegalStateException());
        listener.onNodeRetry("run-1", "orders", "charge", 2, Duration.ofMillis(200), new IllegalStateException());
        listener.onNodeTimeout("run-1", "orders", "charge", Duration.ofSeconds(1), 1);
        listener.onNodeSkipped("run-1", "orders", "optional");

        assertThat(registry.find(METRIC_NODE_RETRY_TOTAL).tags(TAG_NODE_ID, "charge").counter().count()).isEqualTo(2.0);
        assertThat(registry.find(METRIC_NODE_TIMEOUT_TOTAL).counter().count()).isEqualTo(1.0);
        assertThat(registry.find(METRIC_NODE_EXECUTION_TOTAL).tags(TAG_STATUS, "SKIPPED").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void onRunCompleteAndCompensation_shouldRecordFinalStatusAndOutcome() {
        listener.onRunComplete("run-1", "orders", Duration.ofMillis(120), RunStatus.COMPENSATED,
                Collections.<String, NodeResult>emptyMap(), new IllegalStateException());
        CompensationReport partial = new CompensationReport(new IllegalStateException("boom"),
                Arrays.asList("B", "A"), Collections.singletonList("A"),
                Collections.singletonList(new CompensationException("B", new IllegalStateException("undo"))));
        listener.onCompensation("run-1", "orders", partial);

        assertThat(registry.find(METRIC_RUN_EXECUTION_TIME).tags(TAG_STATUS, "COMPENSATED").timer().count())
                .isEqualTo(1);
        assertThat(registry.find(METRIC_RUN_COMPENSATION_TOTAL).tags(TAG_OUTCOME, "PARTIAL").counter().count())
                .isEqualTo(1.0);
    }
}
