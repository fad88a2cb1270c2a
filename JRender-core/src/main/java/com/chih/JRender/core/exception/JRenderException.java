package com.chih.JRender.core.exception;

/**
 * JRender 框架根异常
 */
public class JRenderException extends RuntimeException {
    public JRenderException(String message) {
        super(message);
    }

    public JRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
