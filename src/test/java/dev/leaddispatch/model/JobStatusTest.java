package dev.leaddispatch.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStatusTest {

    @Test
    void shouldAllowForwardTransitionsOnly() {
        assertThat(JobStatus.DISPATCHED.canTransitionTo(JobStatus.COMPLETE)).isTrue();
        assertThat(JobStatus.DISPATCHED.canTransitionTo(JobStatus.CANCELLED)).isTrue();
        assertThat(JobStatus.COMPLETE.canTransitionTo(JobStatus.PAID)).isTrue();

        assertThat(JobStatus.DISPATCHED.canTransitionTo(JobStatus.PAID)).isFalse();
        assertThat(JobStatus.COMPLETE.canTransitionTo(JobStatus.CANCELLED)).isFalse();
        assertThat(JobStatus.PAID.canTransitionTo(JobStatus.COMPLETE)).isFalse();
        assertThat(JobStatus.CANCELLED.canTransitionTo(JobStatus.DISPATCHED)).isFalse();
    }

    @Test
    void shouldParseUserText() {
        assertThat(JobStatus.fromText(" complete ")).isEqualTo(JobStatus.COMPLETE);
        assertThat(JobStatus.fromText("Dispatched")).isEqualTo(JobStatus.DISPATCHED);
        assertThatThrownBy(() -> JobStatus.fromText("done"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
