package com.caserunner.script;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits script source into {@link Token}s.
 *
 * Newlines are significant as statement separators except inside parentheses
 * and brackets. {@code #} starts a comment that runs to the end of the line.
 */
final class Lexer {

    private static final String[] TWO_CHAR_OPERATORS = { "==", "!=", "<=", ">=", "&&", "||" };
    private static final String   ONE_CHAR_OPERATORS = "()[]{},=<>+-*/%!;";

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;
    private int nesting = 0;  // open ( and [

    Lexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipBlanksAndComments();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.EOF, "", line, column));
                return tokens;
            }
            char c = source.charAt(pos);
            int startLine = line;
            int startColumn = column;

            if (c == '\n') {
                advance();
                if (nesting == 0) {
                    tokens.add(new Token(Token.Type.NEWLINE, "\n", startLine, startColumn));
                }
            } else if (Character.isDigit(c)) {
                tokens.add(new Token(Token.Type.NUMBER, readNumber(), startLine, startColumn));
            } else if (c == '"' || c == '\'') {
                tokens.add(new Token(Token.Type.STRING, readString(c), startLine, startColumn));
            } else if (Character.isLetter(c) || c == '_') {
                tokens.add(new Token(Token.Type.NAME, readName(), startLine, startColumn));
            } else {
                tokens.add(new Token(Token.Type.OPERATOR, readOperator(), startLine, startColumn));
            }
        }
    }

    // ── Scanners ──────────────────────────────────────────────────────────────

    private void skipBlanksAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '\\' && pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
                advance();  // line continuation
                advance();
            } else if (c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n') advance();
            } else {
                return;
            }
        }
    }

    private String readNumber() {
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) advance();
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            advance();
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) advance();
        }
        return source.substring(start, pos);
    }

    private String readName() {
        int start = pos;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            advance();
        }
        return source.substring(start, pos);
    }

    private String readString(char quote) {
        int startLine = line;
        int startColumn = column;
        advance();
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= source.length() || source.charAt(pos) == '\n') {
                throw new ScriptException("unterminated string", startLine, startColumn);
            }
            char c = source.charAt(pos);
            advance();
            if (c == quote) {
                return sb.toString();
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (pos >= source.length()) {
                throw new ScriptException("unterminated string", startLine, startColumn);
            }
            char escaped = source.charAt(pos);
            advance();
            switch (escaped) {
                case 'n':  sb.append('\n'); break;
                case 't':  sb.append('\t'); break;
                case 'r':  sb.append('\r'); break;
                case '\\': sb.append('\\'); break;
                case '\'': sb.append('\''); break;
                case '"':  sb.append('"');  break;
                default:   sb.append('\\').append(escaped);
            }
        }
    }

    private String readOperator() {
        for (String op : TWO_CHAR_OPERATORS) {
            if (source.startsWith(op, pos)) {
                advance();
                advance();
                return op;
            }
        }
        char c = source.charAt(pos);
        if (ONE_CHAR_OPERATORS.indexOf(c) < 0) {
            throw new ScriptException("unexpected character '" + c + "'", line, column);
        }
        if (c == '(' || c == '[') nesting++;
        if ((c == ')' || c == ']') && nesting > 0) nesting--;
        advance();
        return String.valueOf(c);
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
