package com.filesetloader.core.template;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Parse-tree element of a template.
 */
abstract class Node {

    final int line;

    Node(int line) {
        this.line = line;
    }

    abstract void render(RenderState state, Object dot);

    static final class Sequence extends Node {
        private final List<Node> nodes;

        Sequence(int line, List<Node> nodes) {
            super(line);
            this.nodes = List.copyOf(nodes);
        }

        @Override
        void render(RenderState state, Object dot) {
            for (Node node : nodes) {
                node.render(state, dot);
            }
        }
    }

    static final class Text extends Node {
        private final String text;

        Text(int line, String text) {
            super(line);
            this.text = text;
        }

        @Override
        void render(RenderState state, Object dot) {
            state.write(text);
        }
    }

    /** {@code {{ operand }}}: prints the operand. */
    static final class Action extends Node {
        private final Expr expr;

        Action(int line, Expr expr) {
            super(line);
            this.expr = expr;
        }

        @Override
        void render(RenderState state, Object dot) {
            state.write(Values.format(expr.evaluate(state, dot)));
        }
    }

    /** {@code {{ $x := operand }}}: binds a variable in the current scope, prints nothing. */
    static final class Declare extends Node {
        private final String name;
        private final Expr expr;

        Declare(int line, String name, Expr expr) {
            super(line);
            this.name = name;
            this.expr = expr;
        }

        @Override
        void render(RenderState state, Object dot) {
            state.push(name, expr.evaluate(state, dot));
        }
    }

    static final class If extends Node {
        private final Expr condition;
        private final Sequence then;
        private final Sequence otherwise;

        If(int line, Expr condition, Sequence then, Sequence otherwise) {
            super(line);
            this.condition = condition;
            this.then = then;
            this.otherwise = otherwise;
        }

        @Override
        void render(RenderState state, Object dot) {
            Sequence branch = Values.isTrue(condition.evaluate(state, dot)) ? then : otherwise;
            if (branch != null) {
                int mark = state.mark();
                branch.render(state, dot);
                state.reset(mark);
            }
        }
    }

    /**
     * {@code {{ range [$k[, $v] :=] operand }}}. Lists iterate in order, maps
     * in sorted key order; dot is the element inside the body.
     */
    static final class Range extends Node {
        private final String keyVar;
        private final String valueVar;
        private final Expr expr;
        private final Sequence body;
        private final Sequence otherwise;

        Range(int line, String keyVar, String valueVar, Expr expr, Sequence body, Sequence otherwise) {
            super(line);
            this.keyVar = keyVar;
            this.valueVar = valueVar;
            this.expr = expr;
            this.body = body;
            this.otherwise = otherwise;
        }

        @Override
        void render(RenderState state, Object dot) {
            Object value = expr.evaluate(state, dot);
            List<Object> keys = new ArrayList<>();
            List<Object> elements = new ArrayList<>();

            if (value instanceof Collection<?> c) {
                int i = 0;
                for (Object element : c) {
                    keys.add((long) i++);
                    elements.add(element);
                }
            } else if (value instanceof Map<?, ?> m) {
                for (Object key : Values.sortedKeys(m)) {
                    keys.add(key);
                    elements.add(m.get(key));
                }
            } else if (value != null && value != Values.MISSING) {
                throw state.error(line, "range can't iterate over " + Values.format(value));
            }

            if (elements.isEmpty()) {
                if (otherwise != null) {
                    int mark = state.mark();
                    otherwise.render(state, dot);
                    state.reset(mark);
                }
                return;
            }

            for (int i = 0; i < elements.size(); i++) {
                int mark = state.mark();
                if (keyVar != null) {
                    state.push(keyVar, keys.get(i));
                }
                if (valueVar != null) {
                    state.push(valueVar, elements.get(i));
                }
                body.render(state, elements.get(i));
                state.reset(mark);
            }
        }
    }
}
