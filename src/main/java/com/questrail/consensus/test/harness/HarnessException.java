package com.questrail.consensus.test.harness;

import java.util.Objects;

/**
 * Setup or transport failure inside the harness. Always fatal to the
 * current test; the stage names the step that failed.
 */
public class HarnessException extends RuntimeException
{
    private final HarnessStage stage;

    public HarnessException(HarnessStage stage, String message) {
        super("[" + Objects.requireNonNull(stage, "stage") + "] " + message);
        this.stage = stage;
    }

    public HarnessException(HarnessStage stage, String message, Throwable cause) {
        super("[" + Objects.requireNonNull(stage, "stage") + "] " + message, cause);
        this.stage = stage;
    }

    public HarnessStage stage() {
        return stage;
    }
}
