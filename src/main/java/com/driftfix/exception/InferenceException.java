package com.driftfix.exception;

public class InferenceException extends DriftFixException {
    public InferenceException(String message) {
        super("INFERENCE_ERROR", message);
    }
    public InferenceException(String message, Throwable cause) {
        super("INFERENCE_ERROR", message, cause);
    }
}
