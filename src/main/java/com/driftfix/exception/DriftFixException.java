package com.driftfix.exception;

import lombok.Getter;

@Getter
public abstract class DriftFixException extends RuntimeException {
    private final String errorCode;
    protected DriftFixException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected DriftFixException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
