package com.chih.JRender.core.exception;

public class TemplateRenderException extends JRenderException {
    public TemplateRenderException(String key, Throwable cause) {
        super("Failed to render template: " + key, cause);
    }
}
