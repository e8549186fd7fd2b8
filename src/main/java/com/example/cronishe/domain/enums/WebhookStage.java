package com.example.cronishe.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle transitions that can trigger a job webhook.
 */
@Getter
@RequiredArgsConstructor
public enum WebhookStage {

    START("on_start"),
    SUCCESS("on_success"),
    FAIL("on_fail");

    private final String code;

    public static WebhookStage forOutcome(RunOutcome outcome) {
        return outcome == RunOutcome.SUCCESS ? SUCCESS : FAIL;
    }
}
