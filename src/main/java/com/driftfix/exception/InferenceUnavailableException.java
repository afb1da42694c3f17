package com.driftfix.exception;

public class InferenceUnavailableException extends DriftFixException {
    public InferenceUnavailableException(Throwable cause) {
        super("INFERENCE_UNAVAILABLE",
              "The model inference service is currently unavailable. Please try again later.",
              cause);
    }
}
