package com.filesetloader.core.fileset;

import java.io.File;
import java.util.Objects;

/**
 * Derives ingest pipeline IDs from module, fileset and pipeline file path.
 *
 * <p>
 * {@code format("nginx", "access", "ingest/default.json")} yields
 * {@code nginx-access-default}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineIds {

    private PipelineIds() {
        // utility class: not instantiable
    }

    /**
     * @param module  module name
     * @param fileset fileset name
     * @param path    expanded pipeline path, relative to the fileset
     * @return {@code <module>-<fileset>-<file name without extension>}
     */
    public static String format(String module, String fileset, String path) {
        Objects.requireNonNull(path, "Pipeline path must not be null");
        return module + "-" + fileset + "-" + removeExt(baseName(path));
    }

    /**
     * Strip the extension of the last path element.
     *
     * <p>
     * Everything from the last dot of the file name is removed; a name
     * without a dot is returned unchanged, and {@code .hidden} becomes the
     * empty string.
     * </p>
     *
     * @param path a file name or path
     * @return {@code path} without the extension of its last element
     */
    public static String removeExt(String path) {
        for (int i = path.length() - 1; i >= 0 && !isSeparator(path.charAt(i)); i--) {
            if (path.charAt(i) == '.') {
                return path.substring(0, i);
            }
        }
        return path;
    }

    /**
     * Last element of {@code path}, ignoring trailing separators. An empty
     * path gives {@code "."}; a path of only separators gives {@code "/"}.
     */
    static String baseName(String path) {
        if (path.isEmpty()) {
            return ".";
        }
        int end = path.length();
        while (end > 0 && isSeparator(path.charAt(end - 1))) {
            end--;
        }
        if (end == 0) {
            return "/";
        }
        int start = end;
        while (start > 0 && !isSeparator(path.charAt(start - 1))) {
            start--;
        }
        return path.substring(start, end);
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == File.separatorChar;
    }
}
