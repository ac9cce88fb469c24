package com.caserunner.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser from {@link Token}s to an {@link Ast.Block}.
 *
 * Precedence, lowest first: or, and, not, comparison, additive,
 * multiplicative, unary minus, postfix (call and index), primary.
 *
 * Nesting of parentheses, lists, calls, blocks and prefix operators is capped
 * at {@value #MAX_NESTING} levels.
 */
final class Parser {

    static final int MAX_NESTING = 200;

    private final List<Token> tokens;
    private int pos = 0;
    private int depth = 0;

    Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    Ast.Block parseProgram() {
        List<Ast.Statement> statements = parseStatements(false);
        expect(Token.Type.EOF, null);
        return new Ast.Block(statements);
    }

    // ── Statements ────────────────────────────────────────────────────────────

    private List<Ast.Statement> parseStatements(boolean insideBlock) {
        List<Ast.Statement> statements = new ArrayList<>();
        while (true) {
            skipSeparators();
            Token t = peek();
            if (t.type == Token.Type.EOF || (insideBlock && t.isOperator("}"))) {
                return statements;
            }
            statements.add(parseStatement());
            Token after = peek();
            if (!isSeparator(after) && after.type != Token.Type.EOF
                    && !(insideBlock && after.isOperator("}"))) {
                throw error("expected end of statement but found " + after, after);
            }
        }
    }

    private Ast.Statement parseStatement() {
        Token t = peek();
        if (t.isName("if")) {
            return parseIf();
        }
        if (t.type == Token.Type.NAME && peekAt(1).isOperator("=") && !isKeyword(t.text)) {
            advance();
            advance();
            return new Ast.Assign(t.text, parseExpression());
        }
        return new Ast.ExpressionStatement(parseExpression());
    }

    private Ast.Statement parseIf() {
        advance();  // if
        Ast.Expression condition = parseExpression();
        Ast.Statement then = parseBlock();
        Ast.Statement otherwise = null;
        int mark = pos;
        skipNewlines();
        if (peek().isName("else")) {
            advance();
            otherwise = peek().isName("if") ? parseIf() : parseBlock();
        } else {
            pos = mark;
        }
        return new Ast.If(condition, then, otherwise);
    }

    private Ast.Block parseBlock() {
        skipNewlines();
        Token open = expect(Token.Type.OPERATOR, "{");
        enter(open);
        List<Ast.Statement> body = parseStatements(true);
        expect(Token.Type.OPERATOR, "}");
        depth--;
        return new Ast.Block(body);
    }

    // ── Expressions ───────────────────────────────────────────────────────────

    Ast.Expression parseExpression() {
        enter(peek());
        Ast.Expression expr = parseOr();
        depth--;
        return expr;
    }

    private Ast.Expression parseOr() {
        Ast.Expression left = parseAnd();
        while (peek().isName("or") || peek().isOperator("||")) {
            advance();
            left = new Ast.Logical(false, left, parseAnd());
        }
        return left;
    }

    private Ast.Expression parseAnd() {
        Ast.Expression left = parseNot();
        while (peek().isName("and") || peek().isOperator("&&")) {
            advance();
            left = new Ast.Logical(true, left, parseNot());
        }
        return left;
    }

    private Ast.Expression parseNot() {
        if (peek().isName("not") || peek().isOperator("!")) {
            enter(advance());
            Ast.Expression operand = parseNot();
            depth--;
            return new Ast.Not(operand);
        }
        return parseComparison();
    }

    private Ast.Expression parseComparison() {
        Ast.Expression left = parseAdditive();
        while (true) {
            Token t = peek();
            String op;
            if (t.type == Token.Type.OPERATOR && isComparison(t.text)) {
                op = t.text;
                advance();
            } else if (t.isName("in")) {
                op = "in";
                advance();
            } else if (t.isName("not") && peekAt(1).isName("in")) {
                op = "not in";
                advance();
                advance();
            } else {
                return left;
            }
            left = new Ast.Binary(op, left, parseAdditive(), t.line, t.column);
        }
    }

    private Ast.Expression parseAdditive() {
        Ast.Expression left = parseMultiplicative();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            Token op = advance();
            left = new Ast.Binary(op.text, left, parseMultiplicative(), op.line, op.column);
        }
        return left;
    }

    private Ast.Expression parseMultiplicative() {
        Ast.Expression left = parseUnary();
        while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("%")) {
            Token op = advance();
            left = new Ast.Binary(op.text, left, parseUnary(), op.line, op.column);
        }
        return left;
    }

    private Ast.Expression parseUnary() {
        if (peek().isOperator("-")) {
            Token op = advance();
            enter(op);
            Ast.Expression operand = parseUnary();
            depth--;
            return new Ast.Negate(operand, op.line, op.column);
        }
        return parsePostfix();
    }

    private Ast.Expression parsePostfix() {
        Ast.Expression expr = parsePrimary();
        while (true) {
            Token t = peek();
            if (t.isOperator("(")) {
                advance();
                expr = parseCallArguments(expr, t);
            } else if (t.isOperator("[")) {
                advance();
                Ast.Expression index = parseExpression();
                expect(Token.Type.OPERATOR, "]");
                expr = new Ast.Index(expr, index, t.line, t.column);
            } else {
                return expr;
            }
        }
    }

    private Ast.Expression parseCallArguments(Ast.Expression callee, Token open) {
        List<Ast.Expression> positional = new ArrayList<>();
        Map<String, Ast.Expression> keyword = new LinkedHashMap<>();
        if (!peek().isOperator(")")) {
            do {
                Token t = peek();
                if (t.type == Token.Type.NAME && peekAt(1).isOperator("=")) {
                    advance();
                    advance();
                    if (keyword.put(t.text, parseExpression()) != null) {
                        throw error("keyword argument '" + t.text + "' repeated", t);
                    }
                } else {
                    if (!keyword.isEmpty()) {
                        throw error("positional argument follows keyword argument", t);
                    }
                    positional.add(parseExpression());
                }
            } while (acceptOperator(","));
        }
        expect(Token.Type.OPERATOR, ")");
        return new Ast.Call(callee, positional, keyword, open.line, open.column);
    }

    private Ast.Expression parsePrimary() {
        Token t = advance();
        switch (t.type) {
            case NUMBER:
                return new Ast.Literal(t.text.contains(".") ? (Object) Double.valueOf(t.text) : parseLong(t));
            case STRING:
                return new Ast.Literal(t.text);
            case NAME:
                switch (t.text) {
                    case "true":
                    case "True":
                        return new Ast.Literal(Boolean.TRUE);
                    case "false":
                    case "False":
                        return new Ast.Literal(Boolean.FALSE);
                    case "null":
                    case "None":
                        return new Ast.Literal(null);
                    default:
                        if (isKeyword(t.text)) {
                            throw error("unexpected " + t, t);
                        }
                        return new Ast.Name(t.text, t.line, t.column);
                }
            case OPERATOR:
                if (t.text.equals("(")) {
                    Ast.Expression inner = parseExpression();
                    expect(Token.Type.OPERATOR, ")");
                    return inner;
                }
                if (t.text.equals("[")) {
                    List<Ast.Expression> items = new ArrayList<>();
                    if (!peek().isOperator("]")) {
                        do {
                            if (peek().isOperator("]")) break;  // trailing comma
                            items.add(parseExpression());
                        } while (acceptOperator(","));
                    }
                    expect(Token.Type.OPERATOR, "]");
                    return new Ast.ListLiteral(items);
                }
                throw error("unexpected " + t, t);
            default:
                throw error("unexpected " + t, t);
        }
    }

    // ── Token helpers ─────────────────────────────────────────────────────────

    private Long parseLong(Token t) {
        try {
            return Long.valueOf(t.text);
        } catch (NumberFormatException e) {
            throw error("integer out of range: " + t.text, t);
        }
    }

    private void enter(Token at) {
        if (++depth > MAX_NESTING) {
            throw error("script nested more than " + MAX_NESTING + " levels deep", at);
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        int i = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (t.type != Token.Type.EOF) pos++;
        return t;
    }

    private boolean acceptOperator(String op) {
        if (peek().isOperator(op)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(Token.Type type, String text) {
        Token t = peek();
        if (t.type != type || (text != null && !t.text.equals(text))) {
            String wanted = text != null ? "'" + text + "'" : type == Token.Type.EOF ? "end of script" : type.name();
            throw error("expected " + wanted + " but found " + t, t);
        }
        return advance();
    }

    private void skipSeparators() {
        while (isSeparator(peek())) advance();
    }

    private void skipNewlines() {
        while (peek().type == Token.Type.NEWLINE) advance();
    }

    private static boolean isSeparator(Token t) {
        return t.type == Token.Type.NEWLINE || t.isOperator(";");
    }

    private static boolean isComparison(String op) {
        return op.equals("==") || op.equals("!=") || op.equals("<")
            || op.equals("<=") || op.equals(">") || op.equals(">=");
    }

    private static boolean isKeyword(String name) {
        switch (name) {
            case "if":
            case "else":
            case "and":
            case "or":
            case "not":
            case "in":
                return true;
            default:
                return false;
        }
    }

    private static ScriptException error(String message, Token at) {
        return new ScriptException(message, at.line, at.column);
    }
}
