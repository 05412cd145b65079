package com.filesetloader.core;

import java.util.Objects;

/**
 * Failure while loading a fileset.
 *
 * <p>
 * Every failure carries a {@link Kind} and a message naming the variable,
 * file or template involved, so it can be diagnosed without re-running the
 * load. Nothing is retried and no partial result is returned.
 * </p>
 *
 * @since 1.0.0
 */
public class FilesetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Category of a fileset failure. */
    public enum Kind {
        /** The module directory does not exist. */
        MISSING_MODULE,
        /** The manifest file could not be read. */
        MANIFEST_READ,
        /** The manifest is not well-formed or has keys of the wrong type. */
        MANIFEST_UNPACK,
        /** A variable declaration lacks {@code name} or {@code default}. */
        MISSING_VARIABLE_FIELD,
        /** A template could not be parsed or evaluated. */
        TEMPLATE,
        /** The local host name could not be determined. */
        HOST_RESOLUTION,
        /** A file referenced by the manifest could not be read. */
        FILE_READ,
        /** A materialized document is not valid YAML / JSON. */
        CONFIG_PARSE,
        /** An override document could not be merged. */
        OVERRIDE_MERGE
    }

    private final Kind kind;

    public FilesetException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public FilesetException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public Kind getKind() {
        return kind;
    }
}
