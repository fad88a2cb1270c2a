package com.chih.JRender.core.exception;

/**
 * 子模板循环引用 (A -> B -> A)
 */
public class TemplateRecursionException extends JRenderException {
    public TemplateRecursionException(String message) {
        super(message);
    }
}
