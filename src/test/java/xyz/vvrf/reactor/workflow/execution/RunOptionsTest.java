package xyz.vvrf.reactor.workflow.execution;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RunOptionsTest {

    @Test
    void mergedWith_shouldFillOnlyUnsetFields() {
        CancellationToken token = CancellationToken.create();
        RunOptions explicit = RunOptions.builder().maxNestingDepth(3).build();
        RunOptions fallback = RunOptions.builder()
                .concurrencyLimit(2)
                .maxNestingDepth(8)
                .maxSameGraphRepeats(1)
                .cancellationToken(token)
                .build();

        RunOptions merged = explicit.mergedWith(fallback);

        assertThat(merged.getMaxNestingDepth()).isEqualTo(3);
        assertThat(merged.getConcurrencyLimit()).isEqualTo(2);
        assertThat(merged.getMaxSameGraphRepeats()).isEqualTo(1);
        assertThat(merged.getCancellationToken()).isSameAs(token);
        assertThat(explicit.mergedWith(null)).isSameAs(explicit);
    }

    @Test
    void effectiveConcurrency_shouldTreatZeroAndUnsetAsUnbounded() {
        assertThat(RunOptions.defaults().effectiveConcurrency()).isEqualTo(Integer.MAX_VALUE);
        assertThat(RunOptions.builder().concurrencyLimit(0).build().effectiveConcurrency()).isEqualTo(Integer.MAX_VALUE);
        assertThat(RunOptions.builder().concurrencyLimit(3).build().effectiveConcurrency()).isEqualTo(3);
    }

    @Test
    void builtInDefaults_shouldForbidSelfRecursion() {
        RunOptions defaults = WorkflowOrchestrator.BUILT_IN_DEFAULTS;

        assertThat(defaults.getMaxNestingDepth()).isEqualTo(8);
        assertThat(defaults.getMaxSameGraphRepeats()).isZero();
        assertThat(defaults.getConcurrencyLimit()).isZero();
    }
}
