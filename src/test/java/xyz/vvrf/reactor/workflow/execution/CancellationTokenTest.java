package xyz.vvrf.reactor.workflow.execution;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void cancel_shouldOnlyReportFirstCancellation() {
        CancellationToken token = CancellationToken.create();

        assertThat(token.cancel()).isTrue();
        assertThat(token.cancel()).isFalse();
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void child_shouldObserveParentButNotTheOtherWayAround() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();
        CancellationToken sibling = parent.child();

        child.cancel();
        assertThat(child.isCancelled()).isTrue();
        assertThat(parent.isCancelled()).isFalse();
        assertThat(sibling.isCancelled()).isFalse();

        parent.cancel();
        assertThat(sibling.isCancelled()).isTrue();
    }
}
