package com.shipyard.orchestrator.config;

import com.shipyard.orchestrator.model.FailureType;
import com.shipyard.orchestrator.model.PipelineState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecoveryPropertiesTest {

    @Test
    void escalationTarget_crashFailsByDefault() {
        assertThat(new RecoveryProperties().escalationTarget(FailureType.CRASH)).isEqualTo(PipelineState.FAILED);
    }

    @ParameterizedTest
    @EnumSource(value = FailureType.class, names = "CRASH", mode = EnumSource.Mode.EXCLUDE)
    void escalationTarget_everythingElsePausesByDefault(FailureType type) {
        assertThat(new RecoveryProperties().escalationTarget(type)).isEqualTo(PipelineState.PAUSED);
    }

    @Test
    void escalationTarget_followsConfiguredMapping() {
        RecoveryProperties props = new RecoveryProperties();
        props.getSeverity().put(FailureType.LOOP, PipelineState.FAILED);
        props.getSeverity().put(FailureType.CRASH, PipelineState.PAUSED);

        assertThat(props.escalationTarget(FailureType.LOOP)).isEqualTo(PipelineState.FAILED);
        assertThat(props.escalationTarget(FailureType.CRASH)).isEqualTo(PipelineState.PAUSED);
    }

    @Test
    void escalationTarget_workingStateRejected() {
        RecoveryProperties props = new RecoveryProperties();
        props.getSeverity().put(FailureType.TIMEOUT, PipelineState.QA);

        assertThatThrownBy(() -> props.escalationTarget(FailureType.TIMEOUT))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must be PAUSED or FAILED");
    }
}
