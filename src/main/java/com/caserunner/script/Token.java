package com.caserunner.script;

/**
 * A lexical token with its 1-based source position.
 */
final class Token {

    enum Type {
        NUMBER,
        STRING,
        NAME,
        OPERATOR,
        NEWLINE,
        EOF
    }

    final Type   type;
    final String text;
    final int    line;
    final int    column;

    Token(Type type, String text, int line, int column) {
        this.type   = type;
        this.text   = text;
        this.line   = line;
        this.column = column;
    }

    boolean is(Type t, String s) {
        return type == t && text.equals(s);
    }

    boolean isOperator(String s) {
        return is(Type.OPERATOR, s);
    }

    boolean isName(String s) {
        return is(Type.NAME, s);
    }

    @Override
    public String toString() {
        return type == Type.EOF ? "end of script" : type == Type.NEWLINE ? "end of line" : "'" + text + "'";
    }
}
