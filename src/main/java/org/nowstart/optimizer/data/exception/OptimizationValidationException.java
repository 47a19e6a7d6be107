package org.nowstart.optimizer.data.exception;

public class OptimizationValidationException extends OptimizationException {

    public static final String CODE = "validation_error";

    public OptimizationValidationException(String message) {
        super(CODE, message);
    }

}
