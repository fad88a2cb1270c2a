package com.chih.JRender.core.exception;

public class RuleSetParseException extends JRenderException {
    public RuleSetParseException(String fileName, Throwable cause) {
        super("Failed to parse tag helper rule file: " + fileName, cause);
    }

    public RuleSetParseException(String fileName, String reason) {
        super("Failed to parse tag helper rule file: " + fileName + " (" + reason + ")");
    }
}
