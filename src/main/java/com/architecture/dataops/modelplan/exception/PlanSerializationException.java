package com.architecture.dataops.modelplan.exception;

public class PlanSerializationException extends RuntimeException {

    public PlanSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
