package com.filesetloader.core.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Tokenizes the inside of a single action.
 */
final class ActionLexer {

    enum Kind {
        FIELD, VARIABLE, STRING, NUMBER, BOOL, NIL, KEYWORD, IDENT, DECLARE, ASSIGN, COMMA, PIPE, PAREN
    }

    private static final Set<String> KEYWORDS = Set.of(
            "if", "else", "end", "range", "with", "define", "template", "block", "break", "continue");

    static final class Token {
        final Kind kind;
        final String text;
        final Object value;
        final List<String> path;

        Token(Kind kind, String text, Object value, List<String> path) {
            this.kind = kind;
            this.text = text;
            this.value = value;
            this.path = path;
        }

        boolean is(Kind k, String t) {
            return kind == k && text.equals(t);
        }

        @Override
        public String toString() {
            return text;
        }
    }

    private final String input;
    private final String template;
    private final int line;
    private int pos;

    ActionLexer(String input, String template, int line) {
        this.input = input;
        this.template = template;
        this.line = line;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (TemplateScanner.isSpace(c)) {
                pos++;
            } else if (c == '.') {
                tokens.add(field());
            } else if (c == '$') {
                tokens.add(variable());
            } else if (c == '"') {
                tokens.add(quoted());
            } else if (c == '`') {
                tokens.add(rawQuoted());
            } else if (isDigit(c) || ((c == '-' || c == '+') && pos + 1 < input.length()
                    && isDigit(input.charAt(pos + 1)))) {
                tokens.add(number());
            } else if (isIdentStart(c)) {
                tokens.add(word());
            } else if (c == ':' && pos + 1 < input.length() && input.charAt(pos + 1) == '=') {
                pos += 2;
                tokens.add(new Token(Kind.DECLARE, ":=", null, List.of()));
            } else if (c == '=') {
                pos++;
                tokens.add(new Token(Kind.ASSIGN, "=", null, List.of()));
            } else if (c == ',') {
                pos++;
                tokens.add(new Token(Kind.COMMA, ",", null, List.of()));
            } else if (c == '|') {
                pos++;
                tokens.add(new Token(Kind.PIPE, "|", null, List.of()));
            } else if (c == '(' || c == ')') {
                pos++;
                tokens.add(new Token(Kind.PAREN, String.valueOf(c), null, List.of()));
            } else {
                throw new TemplateException(
                        "template:" + line + ": unexpected \"" + c + "\" in command", template);
            }
        }
        return tokens;
    }

    private Token field() {
        int start = pos;
        List<String> path = chain();
        return new Token(Kind.FIELD, input.substring(start, pos), null, path);
    }

    private Token variable() {
        int start = pos;
        pos++;
        while (pos < input.length() && isIdentPart(input.charAt(pos))) {
            pos++;
        }
        String name = input.substring(start, pos);
        List<String> path = pos < input.length() && input.charAt(pos) == '.' ? chain() : List.of();
        return new Token(Kind.VARIABLE, input.substring(start, pos), name, path);
    }

    /** Reads {@code .a.b.c}; a lone {@code .} yields an empty path. */
    private List<String> chain() {
        List<String> path = new ArrayList<>();
        while (pos < input.length() && input.charAt(pos) == '.') {
            pos++;
            int start = pos;
            while (pos < input.length() && isIdentPart(input.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                if (path.isEmpty() && (pos >= input.length() || !isIdentPart(input.charAt(pos)))) {
                    break;
                }
                throw new TemplateException("template:" + line + ": bad field syntax in \"" + input + "\"",
                        template);
            }
            path.add(input.substring(start, pos));
        }
        return Collections.unmodifiableList(path);
    }

    private Token quoted() {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new Token(Kind.STRING, input.substring(start, pos), sb.toString(), List.of());
            }
            if (c == '\\' && pos + 1 < input.length()) {
                char next = input.charAt(pos + 1);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\' -> sb.append('\\');
                    case '"' -> sb.append('"');
                    default -> throw new TemplateException(
                            "template:" + line + ": unknown escape sequence \\" + next, template);
                }
                pos += 2;
            } else {
                sb.append(c);
                pos++;
            }
        }
        throw new TemplateException("template:" + line + ": unterminated quoted string", template);
    }

    private Token rawQuoted() {
        int start = pos;
        int end = input.indexOf('`', pos + 1);
        if (end < 0) {
            throw new TemplateException("template:" + line + ": unterminated raw quoted string", template);
        }
        pos = end + 1;
        return new Token(Kind.STRING, input.substring(start, pos), input.substring(start + 1, end), List.of());
    }

    private Token number() {
        int start = pos;
        pos++;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (isDigit(c) || c == '.' || c == '_' || c == 'e' || c == 'E'
                    || ((c == '-' || c == '+') && (input.charAt(pos - 1) == 'e' || input.charAt(pos - 1) == 'E'))) {
                pos++;
            } else {
                break;
            }
        }
        String text = input.substring(start, pos);
        String digits = text.replace("_", "");
        try {
            if (digits.contains(".") || digits.contains("e") || digits.contains("E")) {
                return new Token(Kind.NUMBER, text, Double.parseDouble(digits), List.of());
            }
            return new Token(Kind.NUMBER, text, Long.parseLong(digits), List.of());
        } catch (NumberFormatException e) {
            throw new TemplateException("template:" + line + ": bad number syntax: \"" + text + "\"", template, e);
        }
    }

    private Token word() {
        int start = pos;
        while (pos < input.length() && isIdentPart(input.charAt(pos))) {
            pos++;
        }
        String text = input.substring(start, pos);
        if (KEYWORDS.contains(text)) {
            return new Token(Kind.KEYWORD, text, null, List.of());
        }
        return switch (text) {
            case "true" -> new Token(Kind.BOOL, text, Boolean.TRUE, List.of());
            case "false" -> new Token(Kind.BOOL, text, Boolean.FALSE, List.of());
            case "nil" -> new Token(Kind.NIL, text, null, List.of());
            default -> new Token(Kind.IDENT, text, null, List.of());
        };
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
