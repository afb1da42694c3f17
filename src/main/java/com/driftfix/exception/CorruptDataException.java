package com.driftfix.exception;

public class CorruptDataException extends DriftFixException {
    public CorruptDataException(String message) {
        super("CORRUPT_DATA", message);
    }
}
