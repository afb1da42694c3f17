package com.driftfix.exception;

public class RuleSetStoreException extends DriftFixException {
    public RuleSetStoreException(String message, Throwable cause) {
        super("RULESET_STORE_ERROR", message, cause);
    }
}
