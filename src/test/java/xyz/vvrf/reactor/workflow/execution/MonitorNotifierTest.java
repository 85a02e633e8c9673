package xyz.vvrf.reactor.workflow.execution;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.reactor.workflow.test.util.RecordingMonitorListener;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class MonitorNotifierTest {

    @Test
    void safeNotify_shouldKeepNotifyingAfterListenerThrows() {
        WorkflowMonitorListener broken = new WorkflowMonitorListener() {
            @Override
            public void onNodeSkipped(String runId, String graphName, String nodeId) {
                throw new IllegalStateException("listener bug");
            }
        };
        RecordingMonitorListener recording = new RecordingMonitorListener();
        MonitorNotifier notifier = new MonitorNotifier(Arrays.asList(broken, recording));

        notifier.safeNotify(l -> l.onNodeSkipped("run-1", "g", "A"));

        assertThat(recording.getEvents()).containsExactly("nodeSkipped:g:A");
        assertThat(notifier.size()).isEqualTo(2);
    }
}
