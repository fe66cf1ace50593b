package com.circuit.common.exception;

/**
 * 系统基础异常，所有业务异常的父类。
 */
public class CircuitException extends RuntimeException {

    private final String errorCode;

    public CircuitException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CircuitException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
