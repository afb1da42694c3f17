package com.driftfix.exception;

public class InsufficientDataException extends DriftFixException {
    public InsufficientDataException(String label, int samples, int required) {
        super("INSUFFICIENT_DATA",
              label + " has " + samples + " samples, at least " + required + " are required.");
    }
}
