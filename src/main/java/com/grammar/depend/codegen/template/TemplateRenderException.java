package com.grammar.depend.codegen.template;

/**
 * Raised when a template cannot be loaded or rendered.
 */
public class TemplateRenderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TemplateRenderException(String message) {
        super(message);
    }

    public TemplateRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
