package com.filesetloader.core.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits template source into literal text and <code>{{ ... }}</code>
 * action segments.
 *
 * <p>
 * Handles the <code>{{- </code> and <code> -}}</code> trim markers by
 * stripping the whitespace of the neighbouring text, and drops comment
 * actions. String literals inside an action may contain the closing
 * delimiter.
 * </p>
 */
final class TemplateScanner {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    private final String source;

    TemplateScanner(String source) {
        this.source = source;
    }

    /**
     * One piece of scanned source: literal text, or the trimmed inside of an
     * action.
     */
    static final class Segment {
        final boolean action;
        final String text;
        final int line;

        Segment(boolean action, String text, int line) {
            this.action = action;
            this.text = text;
            this.line = line;
        }

        @Override
        public String toString() {
            return action ? "{{" + text + "}}" : text;
        }
    }

    List<Segment> scan() {
        List<Segment> segments = new ArrayList<>();
        int pos = 0;
        boolean trimNextText = false;

        while (pos < source.length()) {
            int open = source.indexOf(OPEN, pos);
            if (open < 0) {
                addText(segments, source.substring(pos), trimNextText, false, lineAt(pos));
                break;
            }

            int innerStart = open + OPEN.length();
            boolean trimLeft = hasTrimMarker(innerStart);
            if (trimLeft) {
                innerStart += 2;
            }
            addText(segments, source.substring(pos, open), trimNextText, trimLeft, lineAt(pos));

            int close = findClose(innerStart, lineAt(open));
            boolean trimRight = close - 2 >= innerStart
                    && source.charAt(close - 1) == '-'
                    && isSpace(source.charAt(close - 2));
            int innerEnd = trimRight ? close - 1 : close;
            String inner = source.substring(innerStart, innerEnd).trim();

            if (!isComment(inner, lineAt(open))) {
                segments.add(new Segment(true, inner, lineAt(open)));
            }

            pos = close + CLOSE.length();
            trimNextText = trimRight;
        }
        return segments;
    }

    private void addText(List<Segment> segments, String text, boolean trimLeading, boolean trimTrailing,
            int line) {
        String t = text;
        if (trimLeading) {
            int i = 0;
            while (i < t.length() && isSpace(t.charAt(i))) {
                i++;
            }
            t = t.substring(i);
        }
        if (trimTrailing) {
            int j = t.length();
            while (j > 0 && isSpace(t.charAt(j - 1))) {
                j--;
            }
            t = t.substring(0, j);
        }
        if (!t.isEmpty()) {
            segments.add(new Segment(false, t, line));
        }
    }

    private boolean hasTrimMarker(int index) {
        return index + 1 < source.length()
                && source.charAt(index) == '-'
                && isSpace(source.charAt(index + 1));
    }

    private int findClose(int from, int line) {
        int i = from;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"') {
                i = skipQuoted(i, line);
            } else if (c == '`') {
                int end = source.indexOf('`', i + 1);
                if (end < 0) {
                    throw error("unterminated raw quoted string", line);
                }
                i = end + 1;
            } else if (source.startsWith("/*", i)) {
                int end = source.indexOf("*/", i + 2);
                if (end < 0) {
                    throw error("unclosed comment", line);
                }
                i = end + 2;
            } else if (source.startsWith(CLOSE, i)) {
                return i;
            } else {
                i++;
            }
        }
        throw error("unclosed action", line);
    }

    private int skipQuoted(int quote, int line) {
        int i = quote + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '"') {
                return i + 1;
            } else if (c == '\n') {
                break;
            } else {
                i++;
            }
        }
        throw error("unterminated quoted string", line);
    }

    private boolean isComment(String inner, int line) {
        if (!inner.startsWith("/*")) {
            return false;
        }
        if (!inner.endsWith("*/") || inner.length() < 4) {
            throw error("comment ends before closing delimiter", line);
        }
        return true;
    }

    private int lineAt(int index) {
        int line = 1;
        for (int i = 0; i < index && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private TemplateException error(String message, int line) {
        return new TemplateException("template:" + line + ": " + message, source);
    }

    static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }
}
