package com.caserunner.script;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the small imperative language used by the {@code code} directive.
 *
 * A script sees nothing but its {@link ScriptBindings}: every name it reads
 * or calls must be bound there, and every assignment is written back there.
 * There is no access to the host runtime.
 *
 * <pre>
 *   out = call_may_fail("ls", args=["-l"])
 *   if (out[0] != 0) {
 *       fail("listing failed with {}", out[0])
 *   }
 * </pre>
 */
public class ScriptEngine {

    private static final Logger log = LoggerFactory.getLogger(ScriptEngine.class);

    /**
     * Parses and runs {@code source}.
     *
     * @return the value of the last top-level expression statement, or {@code null}
     * @throws ScriptException on a syntax error or a runtime fault in the script,
     *         including evaluation that exhausts the thread's stack
     */
    public Object execute(String source, ScriptBindings bindings) {
        Ast.Block program = parse(source);
        log.debug("ScriptEngine: running {} statement(s)", program.statements.size());
        try {
            return program.execute(bindings);
        } catch (StackOverflowError e) {
            log.warn("ScriptEngine: script ran out of stack");
            throw new ScriptException("script too deeply nested to evaluate");
        }
    }

    /** Checks {@code source} for syntax errors without running it. */
    public void validate(String source) {
        parse(source);
    }

    private Ast.Block parse(String source) {
        if (source == null) {
            throw new ScriptException("no script given");
        }
        try {
            return new Parser(new Lexer(source).tokenize()).parseProgram();
        } catch (StackOverflowError e) {
            log.warn("ScriptEngine: script ran out of stack while parsing");
            throw new ScriptException("script too deeply nested to parse");
        }
    }
}
