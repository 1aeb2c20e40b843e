package com.taxidispatch.dispatch.exception;

/**
 * Raised for requests the dispatch core refuses, such as invalid lifecycle transitions.
 * Mapped to HTTP 400 with {@link #getCode()} by the controller.
 */
public class DispatchException extends RuntimeException {

    public static final String INVALID_STATE = "INVALID_STATE";

    private final String code;

    public DispatchException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
