package com.caserunner.script;

/**
 * A script could not be parsed or failed while running.
 *
 * Line and column are 1-based and 0 when unknown.
 */
public class ScriptException extends RuntimeException {

    private final int line;
    private final int column;

    public ScriptException(String message) {
        this(message, 0, 0);
    }

    public ScriptException(String message, int line, int column) {
        super(line > 0 ? message + " (line " + line + ", column " + column + ")" : message);
        this.line = line;
        this.column = column;
    }

    public int getLine()   { return line; }
    public int getColumn() { return column; }
}
