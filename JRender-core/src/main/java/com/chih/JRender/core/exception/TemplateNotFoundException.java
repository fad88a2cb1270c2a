package com.chih.JRender.core.exception;

public class TemplateNotFoundException extends JRenderException {
    public TemplateNotFoundException(String key) {
        super("Template not found for key: " + key);
    }
}
