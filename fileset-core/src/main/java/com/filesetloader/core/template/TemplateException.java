package com.filesetloader.core.template;

/**
 * Raised when a template cannot be parsed or rendered.
 *
 * <p>
 * Carries the offending template text so callers can report it without
 * re-running the render.
 * </p>
 *
 * @since 1.0.0
 */
public class TemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String template;

    public TemplateException(String message, String template) {
        super(message);
        this.template = template;
    }

    public TemplateException(String message, String template, Throwable cause) {
        super(message, cause);
        this.template = template;
    }

    /**
     * @return the template source that failed, never {@code null}
     */
    public String getTemplate() {
        return template != null ? template : "";
    }
}
