package com.filesetloader.core.template;

import java.util.List;

/**
 * An operand inside an action: a field chain on dot, a variable with an
 * optional field chain, or a literal.
 */
abstract class Expr {

    final int line;
    final String text;

    Expr(int line, String text) {
        this.line = line;
        this.text = text;
    }

    abstract Object evaluate(RenderState state, Object dot);

    static final class Field extends Expr {
        private final List<String> path;

        Field(int line, String text, List<String> path) {
            super(line, text);
            this.path = path;
        }

        @Override
        Object evaluate(RenderState state, Object dot) {
            return state.walk(dot, path, text, line);
        }
    }

    static final class Variable extends Expr {
        private final String name;
        private final List<String> path;

        Variable(int line, String text, String name, List<String> path) {
            super(line, text);
            this.name = name;
            this.path = path;
        }

        @Override
        Object evaluate(RenderState state, Object dot) {
            return state.walk(state.variable(name, line), path, text, line);
        }
    }

    static final class Literal extends Expr {
        private final Object value;

        Literal(int line, String text, Object value) {
            super(line, text);
            this.value = value;
        }

        @Override
        Object evaluate(RenderState state, Object dot) {
            return value;
        }
    }
}
