package org.nowstart.optimizer.data.exception;

import lombok.Getter;

@Getter
public class OptimizationException extends RuntimeException {

    private final String code;

    public OptimizationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public OptimizationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

}
