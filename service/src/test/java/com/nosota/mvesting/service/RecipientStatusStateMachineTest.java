package com.nosota.mvesting.service;

import com.nosota.mvesting.api.model.RecipientStatus;
import com.nosota.mvesting.error.StateConflictException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecipientStatusStateMachineTest {

    private final RecipientStatusStateMachine stateMachine = new RecipientStatusStateMachine();

    @Test
    void allowsPauseUnpauseAndTermination() {
        assertThat(stateMachine.isTransitionAllowed(RecipientStatus.UNPAUSED, RecipientStatus.PAUSED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(RecipientStatus.PAUSED, RecipientStatus.UNPAUSED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(RecipientStatus.UNPAUSED, RecipientStatus.TERMINATED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(RecipientStatus.PAUSED, RecipientStatus.TERMINATED)).isTrue();
    }

    @Test
    void rejectsRepeatedStatus() {
        assertThat(stateMachine.isTransitionAllowed(RecipientStatus.PAUSED, RecipientStatus.PAUSED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(RecipientStatus.UNPAUSED, RecipientStatus.UNPAUSED)).isFalse();
    }

    @Test
    void terminatedIsFinal() {
        for (RecipientStatus target : RecipientStatus.values()) {
            assertThat(stateMachine.isTransitionAllowed(RecipientStatus.TERMINATED, target)).isFalse();
        }
        assertThat(stateMachine.isFinalState(RecipientStatus.TERMINATED)).isTrue();
        assertThat(stateMachine.isFinalState(RecipientStatus.PAUSED)).isFalse();
    }

    @Test
    void validateTransitionNamesTheRecipient() {
        assertThatCode(() -> stateMachine.validateTransition("0xabc", RecipientStatus.UNPAUSED, RecipientStatus.PAUSED))
                .doesNotThrowAnyException();

        assertThatThrownBy(() -> stateMachine.validateTransition("0xabc", RecipientStatus.TERMINATED, RecipientStatus.UNPAUSED))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("0xabc")
                .hasMessageContaining("TERMINATED");
    }
}
