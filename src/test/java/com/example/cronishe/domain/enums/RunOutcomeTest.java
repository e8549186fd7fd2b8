package com.example.cronishe.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RunOutcome Tests")
class RunOutcomeTest {

    @Nested
    @DisplayName("fromExitCode Tests")
    class FromExitCodeTests {

        @Test
        @DisplayName("Exit status zero is a success")
        void zeroIsSuccess() {
            assertThat(RunOutcome.fromExitCode(0)).isEqualTo(RunOutcome.SUCCESS);
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 2, 127, 137, -1})
        @DisplayName("Any other exit status is a failure")
        void nonZeroIsFail(int exitCode) {
            assertThat(RunOutcome.fromExitCode(exitCode)).isEqualTo(RunOutcome.FAIL);
        }
    }

    @Test
    @DisplayName("Codes are the lowercase outcome names")
    void codesAreLowercase() {
        assertThat(RunOutcome.values())
                .extracting(RunOutcome::getCode)
                .containsExactly("running", "success", "fail", "aborted");
    }

    @Test
    @DisplayName("Webhook stage follows the outcome")
    void webhookStageForOutcome() {
        assertThat(WebhookStage.forOutcome(RunOutcome.SUCCESS)).isEqualTo(WebhookStage.SUCCESS);
        assertThat(WebhookStage.forOutcome(RunOutcome.FAIL)).isEqualTo(WebhookStage.FAIL);
    }
}
