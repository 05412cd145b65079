package com.filesetloader.core.template;

import com.filesetloader.core.template.ActionLexer.Kind;
import com.filesetloader.core.template.ActionLexer.Token;
import com.filesetloader.core.template.TemplateScanner.Segment;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the node tree of a template from its scanned segments.
 *
 * <p>
 * Supported actions: operands ({@code .a.b}, {@code $x.a}, literals),
 * variable declarations, {@code if} / {@code else if} / {@code else},
 * {@code range} with optional {@code else}, and {@code end}. Function calls
 * and pipelines are rejected at parse time.
 * </p>
 */
final class TemplateParser {

    private final String source;
    private final List<Segment> segments;
    private int pos;

    TemplateParser(String source) {
        this.source = source;
        this.segments = new TemplateScanner(source).scan();
    }

    /** A parsed list plus the {@code else}/{@code end} action that closed it, if any. */
    private static final class Block {
        final Node.Sequence body;
        final Segment closer;
        final List<Token> closerTokens;

        Block(Node.Sequence body, Segment closer, List<Token> closerTokens) {
            this.body = body;
            this.closer = closer;
            this.closerTokens = closerTokens;
        }

        boolean closedBy(String keyword) {
            return closer != null && closerTokens.get(0).is(Kind.KEYWORD, keyword);
        }
    }

    Node.Sequence parse() {
        Block block = parseBlock(1);
        if (block.closer != null) {
            throw error(block.closer.line, "unexpected {{" + block.closerTokens.get(0).text + "}}");
        }
        return block.body;
    }

    private Block parseBlock(int line) {
        List<Node> nodes = new ArrayList<>();
        while (pos < segments.size()) {
            Segment segment = segments.get(pos++);
            if (!segment.action) {
                nodes.add(new Node.Text(segment.line, segment.text));
                continue;
            }

            List<Token> tokens = new ActionLexer(segment.text, source, segment.line).tokenize();
            if (tokens.isEmpty()) {
                throw error(segment.line, "missing value for command");
            }

            Token first = tokens.get(0);
            if (first.kind == Kind.KEYWORD) {
                switch (first.text) {
                    case "end", "else" -> {
                        return new Block(new Node.Sequence(line, nodes), segment, tokens);
                    }
                    case "if" -> nodes.add(parseIf(segment, tokens.subList(1, tokens.size())));
                    case "range" -> nodes.add(parseRange(segment, tokens.subList(1, tokens.size())));
                    default -> throw error(segment.line, "{{" + first.text + "}} is not supported");
                }
            } else if (first.kind == Kind.VARIABLE && tokens.size() > 1 && tokens.get(1).kind == Kind.DECLARE) {
                if (!first.path.isEmpty()) {
                    throw error(segment.line, "unexpected \":=\" after " + first.text);
                }
                nodes.add(new Node.Declare(segment.line, first.text,
                        operand(segment, tokens.subList(2, tokens.size()), "declaration")));
            } else {
                nodes.add(new Node.Action(segment.line, operand(segment, tokens, "command")));
            }
        }
        return new Block(new Node.Sequence(line, nodes), null, null);
    }

    private Node.If parseIf(Segment segment, List<Token> conditionTokens) {
        Expr condition = operand(segment, conditionTokens, "if");
        Block then = parseBlock(segment.line);
        requireClosed(then, segment, "if");

        Node.Sequence otherwise = null;
        if (then.closedBy("else")) {
            List<Token> rest = then.closerTokens.subList(1, then.closerTokens.size());
            if (!rest.isEmpty() && rest.get(0).is(Kind.KEYWORD, "if")) {
                // else-if shares the closing end of the outer if
                Node.If chained = parseIf(then.closer, rest.subList(1, rest.size()));
                otherwise = new Node.Sequence(then.closer.line, List.of(chained));
            } else {
                if (!rest.isEmpty()) {
                    throw error(then.closer.line, "unexpected " + rest.get(0) + " in else");
                }
                Block elseBlock = parseBlock(then.closer.line);
                requireEnd(elseBlock, segment, "if");
                otherwise = elseBlock.body;
            }
        } else {
            requireBareEnd(then);
        }
        return new Node.If(segment.line, condition, then.body, otherwise);
    }

    private Node.Range parseRange(Segment segment, List<Token> tokens) {
        String keyVar = null;
        String valueVar = null;
        List<Token> rest = tokens;

        int declare = indexOf(tokens, Kind.DECLARE);
        if (declare >= 0) {
            List<Token> vars = tokens.subList(0, declare);
            if (vars.size() == 1 && isPlainVariable(vars.get(0))) {
                valueVar = vars.get(0).text;
            } else if (vars.size() == 3 && isPlainVariable(vars.get(0)) && vars.get(1).kind == Kind.COMMA
                    && isPlainVariable(vars.get(2))) {
                keyVar = vars.get(0).text;
                valueVar = vars.get(2).text;
            } else {
                throw error(segment.line, "range can only initialize variables: " + segment.text);
            }
            rest = tokens.subList(declare + 1, tokens.size());
        }

        Expr expr = operand(segment, rest, "range");
        Block body = parseBlock(segment.line);
        requireClosed(body, segment, "range");

        Node.Sequence otherwise = null;
        if (body.closedBy("else")) {
            if (body.closerTokens.size() > 1) {
                throw error(body.closer.line, "unexpected " + body.closerTokens.get(1) + " in else");
            }
            Block elseBlock = parseBlock(body.closer.line);
            requireEnd(elseBlock, segment, "range");
            otherwise = elseBlock.body;
        } else {
            requireBareEnd(body);
        }
        return new Node.Range(segment.line, keyVar, valueVar, expr, body.body, otherwise);
    }

    private Expr operand(Segment segment, List<Token> tokens, String context) {
        if (tokens.isEmpty()) {
            throw error(segment.line, "missing value for " + context);
        }
        Token token = tokens.get(0);
        if (token.kind == Kind.IDENT) {
            throw error(segment.line, "function \"" + token.text + "\" not defined");
        }
        if (tokens.size() > 1) {
            Token extra = tokens.get(1);
            if (extra.kind == Kind.PIPE) {
                throw error(segment.line, "pipelines are not supported: " + segment.text);
            }
            throw error(segment.line, "unexpected " + extra + " in " + context);
        }
        return switch (token.kind) {
            case FIELD -> new Expr.Field(segment.line, token.text, token.path);
            case VARIABLE -> new Expr.Variable(segment.line, token.text, (String) token.value, token.path);
            case STRING, NUMBER, BOOL, NIL -> new Expr.Literal(segment.line, token.text, token.value);
            default -> throw error(segment.line, "unexpected " + token + " in " + context);
        };
    }

    private void requireClosed(Block block, Segment opener, String keyword) {
        if (block.closer == null) {
            throw error(opener.line, "unexpected EOF: {{" + keyword + "}} has no matching {{end}}");
        }
    }

    private void requireEnd(Block block, Segment opener, String keyword) {
        requireClosed(block, opener, keyword);
        if (!block.closedBy("end")) {
            throw error(block.closer.line, "expected end; found {{" + block.closer.text + "}}");
        }
        requireBareEnd(block);
    }

    private void requireBareEnd(Block block) {
        if (block.closerTokens.size() > 1) {
            throw error(block.closer.line, "unexpected " + block.closerTokens.get(1) + " in end");
        }
    }

    private static boolean isPlainVariable(Token token) {
        return token.kind == Kind.VARIABLE && token.path.isEmpty() && !"$".equals(token.text);
    }

    private static int indexOf(List<Token> tokens, Kind kind) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).kind == kind) {
                return i;
            }
        }
        return -1;
    }

    private TemplateException error(int line, String message) {
        return new TemplateException("template:" + line + ": " + message, source);
    }
}
