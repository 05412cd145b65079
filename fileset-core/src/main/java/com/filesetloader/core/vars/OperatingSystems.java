package com.filesetloader.core.vars;

import java.util.Locale;

/**
 * Maps the JVM's {@code os.name} onto the short identifiers used as keys of
 * a variable's {@code os} map ({@code linux}, {@code darwin},
 * {@code windows}, ...).
 *
 * @since 1.0.0
 */
public final class OperatingSystems {

    private OperatingSystems() {
        // utility class: not instantiable
    }

    /**
     * @return identifier of the operating system this JVM runs on
     */
    public static String current() {
        return normalize(System.getProperty("os.name", ""));
    }

    /**
     * @param osName a value of the {@code os.name} system property
     * @return the matching identifier, or the lower-cased name without
     *         spaces when the system is not a known one
     */
    public static String normalize(String osName) {
        String n = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (n.startsWith("windows")) {
            return "windows";
        }
        if (n.startsWith("mac") || n.startsWith("darwin")) {
            return "darwin";
        }
        if (n.startsWith("sunos") || n.startsWith("solaris")) {
            return "solaris";
        }
        for (String known : new String[] { "linux", "freebsd", "openbsd", "netbsd", "aix" }) {
            if (n.startsWith(known)) {
                return known;
            }
        }
        return n.replace(" ", "");
    }
}
