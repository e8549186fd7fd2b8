package com.example.cronishe.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of a single job run.
 * A run is created as {@link #RUNNING} and ends in exactly one terminal state.
 */
@Getter
@RequiredArgsConstructor
public enum RunOutcome {

    /**
     * Process spawned (or about to be) and not yet finished.
     */
    RUNNING("running"),

    /**
     * Process exited with status zero.
     */
    SUCCESS("success"),

    /**
     * Non-zero exit, spawn error, or run left open by a previous scheduler process.
     */
    FAIL("fail"),

    /**
     * Stopped by an operator.
     */
    ABORTED("aborted");

    private final String code;

    public static RunOutcome fromExitCode(int exitCode) {
        return exitCode == 0 ? SUCCESS : FAIL;
    }
}
