package xyz.vvrf.reactor.workflow.execution;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.monitor.WorkflowMonitorListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * 依次通知所有监听器，单个监听器抛出的异常只记录日志。
 */
@Slf4j
final class MonitorNotifier {

    private final List<WorkflowMonitorListener> listeners;

    MonitorNotifier(List<WorkflowMonitorListener> listeners) {
        this.listeners = listeners != null
                ? Collections.unmodifiableList(new ArrayList<>(listeners))
                : Collections.<WorkflowMonitorListener>emptyList();
    }

    void safeNotify(Consumer<WorkflowMonitorListener> notification) {
        if (listeners.isEmpty()) {
            return;
        }
        for (WorkflowMonitorListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("Workflow Monitor Listener {} threw exception: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    int size() {
        return listeners.size();
    }
}
