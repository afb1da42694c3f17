package com.driftfix.exception;

public class RollbackException extends DriftFixException {
    public RollbackException(String modelId) {
        super("ROLLBACK_UNAVAILABLE",
              "Model '" + modelId + "' has no previous rule set to restore.");
    }
}
