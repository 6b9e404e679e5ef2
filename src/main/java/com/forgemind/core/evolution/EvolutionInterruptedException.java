package com.forgemind.core.evolution;

import com.forgemind.core.error.ForgemindException;
import com.forgemind.core.model.RunStatus;

/**
 * Unwinds an evolution run on cancellation or timeout. The engine converts it into a
 * partial result with the given status.
 */
public class EvolutionInterruptedException extends ForgemindException {

    private final RunStatus status;

    public EvolutionInterruptedException(RunStatus status, String message) {
        super(message);
        this.status = status;
    }

    public RunStatus getStatus() {
        return status;
    }
}
