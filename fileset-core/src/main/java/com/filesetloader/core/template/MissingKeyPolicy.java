package com.filesetloader.core.template;

/**
 * What the renderer does when a field reference names a key that is not
 * present in the data map.
 *
 * @since 1.0.0
 */
public enum MissingKeyPolicy {

    /** Fail the render with a {@link TemplateException}. */
    STRICT,

    /** Render the missing value as an empty string; it is falsy in conditions. */
    LENIENT
}
