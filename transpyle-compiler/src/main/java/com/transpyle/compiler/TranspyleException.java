package com.transpyle.compiler;

/**
 * Transpyle 异常基类
 */
public class TranspyleException extends RuntimeException {

    public TranspyleException(String message) {
        super(message);
    }

    public TranspyleException(String message, Throwable cause) {
        super(message, cause);
    }
}
