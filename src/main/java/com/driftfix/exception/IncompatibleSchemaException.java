package com.driftfix.exception;

public class IncompatibleSchemaException extends DriftFixException {
    public IncompatibleSchemaException(String message) {
        super("INCOMPATIBLE_SCHEMA", message);
    }
}
