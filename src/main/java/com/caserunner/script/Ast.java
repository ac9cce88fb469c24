package com.caserunner.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Syntax tree of a script. Each node evaluates itself against the bindings.
 */
final class Ast {

    private Ast() {}

    interface Expression {
        Object evaluate(ScriptBindings bindings);
    }

    interface Statement {
        /** @return the value of an expression statement, otherwise {@code null} */
        Object execute(ScriptBindings bindings);
    }

    // ── Statements ────────────────────────────────────────────────────────────

    static final class Block implements Statement {
        final List<Statement> statements;

        Block(List<Statement> statements) {
            this.statements = statements;
        }

        @Override
        public Object execute(ScriptBindings bindings) {
            Object last = null;
            for (Statement s : statements) {
                last = s.execute(bindings);
            }
            return last;
        }
    }

    static final class Assign implements Statement {
        final String name;
        final Expression value;

        Assign(String name, Expression value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public Object execute(ScriptBindings bindings) {
            bindings.set(name, value.evaluate(bindings));
            return null;
        }
    }

    static final class ExpressionStatement implements Statement {
        final Expression expression;

        ExpressionStatement(Expression expression) {
            this.expression = expression;
        }

        @Override
        public Object execute(ScriptBindings bindings) {
            return expression.evaluate(bindings);
        }
    }

    static final class If implements Statement {
        final Expression condition;
        final Statement then;
        final Statement otherwise;  // may be null

        If(Expression condition, Statement then, Statement otherwise) {
            this.condition = condition;
            this.then = then;
            this.otherwise = otherwise;
        }

        @Override
        public Object execute(ScriptBindings bindings) {
            if (ScriptValues.isTruthy(condition.evaluate(bindings))) {
                then.execute(bindings);
            } else if (otherwise != null) {
                otherwise.execute(bindings);
            }
            return null;
        }
    }

    // ── Expressions ───────────────────────────────────────────────────────────

    static final class Literal implements Expression {
        final Object value;

        Literal(Object value) {
            this.value = value;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            return value;
        }
    }

    static final class Name implements Expression {
        final String name;
        final int line;
        final int column;

        Name(String name, int line, int column) {
            this.name = name;
            this.line = line;
            this.column = column;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            if (!bindings.contains(name)) {
                throw new ScriptException("name '" + name + "' is not defined", line, column);
            }
            return bindings.get(name);
        }
    }

    static final class ListLiteral implements Expression {
        final List<Expression> items;

        ListLiteral(List<Expression> items) {
            this.items = items;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            List<Object> values = new ArrayList<>(items.size());
            for (Expression item : items) {
                values.add(item.evaluate(bindings));
            }
            return values;
        }
    }

    static final class Not implements Expression {
        final Expression operand;

        Not(Expression operand) {
            this.operand = operand;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            return !ScriptValues.isTruthy(operand.evaluate(bindings));
        }
    }

    static final class Negate implements Expression {
        final Expression operand;
        final int line;
        final int column;

        Negate(Expression operand, int line, int column) {
            this.operand = operand;
            this.line = line;
            this.column = column;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            Object value = operand.evaluate(bindings);
            if (value instanceof Number n) {
                return ScriptValues.isIntegral(n) ? (Object) (-n.longValue()) : (Object) (-n.doubleValue());
            }
            throw new ScriptException("cannot negate " + ScriptValues.typeName(value), line, column);
        }
    }

    /** {@code and} / {@code or}, short-circuiting and yielding the deciding operand. */
    static final class Logical implements Expression {
        final boolean isAnd;
        final Expression left;
        final Expression right;

        Logical(boolean isAnd, Expression left, Expression right) {
            this.isAnd = isAnd;
            this.left = left;
            this.right = right;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            Object l = left.evaluate(bindings);
            boolean truthy = ScriptValues.isTruthy(l);
            if (isAnd ? !truthy : truthy) {
                return l;
            }
            return right.evaluate(bindings);
        }
    }

    static final class Binary implements Expression {
        final String op;
        final Expression left;
        final Expression right;
        final int line;
        final int column;

        Binary(String op, Expression left, Expression right, int line, int column) {
            this.op = op;
            this.left = left;
            this.right = right;
            this.line = line;
            this.column = column;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            Object l = left.evaluate(bindings);
            Object r = right.evaluate(bindings);
            try {
                switch (op) {
                    case "==":     return ScriptValues.areEqual(l, r);
                    case "!=":     return !ScriptValues.areEqual(l, r);
                    case "<":      return ScriptValues.compare(l, r) < 0;
                    case "<=":     return ScriptValues.compare(l, r) <= 0;
                    case ">":      return ScriptValues.compare(l, r) > 0;
                    case ">=":     return ScriptValues.compare(l, r) >= 0;
                    case "in":     return ScriptValues.contains(r, l);
                    case "not in": return !ScriptValues.contains(r, l);
                    case "+":      return add(l, r);
                    default:       return arithmetic(l, r);
                }
            } catch (ScriptException e) {
                if (e.getLine() > 0) throw e;
                throw new ScriptException(e.getMessage(), line, column);
            }
        }

        private Object add(Object l, Object r) {
            if (l instanceof String || r instanceof String) {
                return ScriptValues.toText(l) + ScriptValues.toText(r);
            }
            if (l instanceof List<?> a && r instanceof List<?> b) {
                List<Object> joined = new ArrayList<>(a);
                joined.addAll(b);
                return joined;
            }
            return arithmetic(l, r);
        }

        private Object arithmetic(Object l, Object r) {
            if (!(l instanceof Number a) || !(r instanceof Number b)) {
                throw new ScriptException("unsupported operand types for " + op + ": " +
                    ScriptValues.typeName(l) + " and " + ScriptValues.typeName(r));
            }
            boolean integral = ScriptValues.isIntegral(a) && ScriptValues.isIntegral(b);
            switch (op) {
                case "+":
                    return integral ? (Object) (a.longValue() + b.longValue()) : (Object) (a.doubleValue() + b.doubleValue());
                case "-":
                    return integral ? (Object) (a.longValue() - b.longValue()) : (Object) (a.doubleValue() - b.doubleValue());
                case "*":
                    return integral ? (Object) (a.longValue() * b.longValue()) : (Object) (a.doubleValue() * b.doubleValue());
                case "/":
                    if (b.doubleValue() == 0.0) throw new ScriptException("division by zero");
                    return a.doubleValue() / b.doubleValue();
                case "%":
                    if (b.doubleValue() == 0.0) throw new ScriptException("modulo by zero");
                    return integral ? (Object) Math.floorMod(a.longValue(), b.longValue())
                                    : (Object) (a.doubleValue() % b.doubleValue());
                default:
                    throw new ScriptException("unknown operator " + op);
            }
        }
    }

    static final class Index implements Expression {
        final Expression target;
        final Expression index;
        final int line;
        final int column;

        Index(Expression target, Expression index, int line, int column) {
            this.target = target;
            this.index = index;
            this.line = line;
            this.column = column;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            Object t = target.evaluate(bindings);
            Object i = index.evaluate(bindings);
            if (t instanceof Map<?, ?> m) {
                return m.get(i);
            }
            if (!(i instanceof Number n) || !ScriptValues.isIntegral(n)) {
                throw new ScriptException("index must be an integer, got " + ScriptValues.typeName(i), line, column);
            }
            if (t instanceof List<?> list) {
                return list.get(position(n.longValue(), list.size()));
            }
            if (t instanceof String s) {
                return String.valueOf(s.charAt(position(n.longValue(), s.length())));
            }
            throw new ScriptException(ScriptValues.typeName(t) + " cannot be indexed", line, column);
        }

        private int position(long i, int size) {
            long p = i < 0 ? size + i : i;
            if (p < 0 || p >= size) {
                throw new ScriptException("index " + i + " out of range for size " + size, line, column);
            }
            return (int) p;
        }
    }

    static final class Call implements Expression {
        final Expression callee;
        final List<Expression> positional;
        final Map<String, Expression> keyword;
        final int line;
        final int column;

        Call(Expression callee, List<Expression> positional, Map<String, Expression> keyword, int line, int column) {
            this.callee = callee;
            this.positional = positional;
            this.keyword = keyword;
            this.line = line;
            this.column = column;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            Object fn = callee.evaluate(bindings);
            if (!(fn instanceof ScriptFunction function)) {
                throw new ScriptException(ScriptValues.typeName(fn) + " is not callable", line, column);
            }
            List<Object> args = new ArrayList<>(positional.size());
            for (Expression e : positional) {
                args.add(e.evaluate(bindings));
            }
            Map<String, Object> kwargs = new LinkedHashMap<>();
            for (Map.Entry<String, Expression> e : keyword.entrySet()) {
                kwargs.put(e.getKey(), e.getValue().evaluate(bindings));
            }
            return function.call(Collections.unmodifiableList(args), Collections.unmodifiableMap(kwargs));
        }
    }
}
