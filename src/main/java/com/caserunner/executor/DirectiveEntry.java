package com.caserunner.executor;

/**
 * One row of the {@link DirectiveTable}.
 *
 * Either a plain value exposed as a symbol (case number, label) or a handler
 * with an optional {@link ArgumentAdapter}. Handlers without an adapter are
 * callable only from embedded code.
 *
 * Immutable; use the static factories.
 */
public class DirectiveEntry {

    private final String           name;
    private final Object           value;    // only for value entries
    private final DirectiveHandler handler;  // null for value entries
    private final ArgumentAdapter  adapter;  // null = code-only

    private DirectiveEntry(String name, Object value, DirectiveHandler handler, ArgumentAdapter adapter) {
        this.name    = name;
        this.value   = value;
        this.handler = handler;
        this.adapter = adapter;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static DirectiveEntry value(String name, Object value) {
        return new DirectiveEntry(name, value, null, null);
    }

    public static DirectiveEntry handler(String name, DirectiveHandler handler, ArgumentAdapter adapter) {
        if (handler == null) {
            throw new IllegalArgumentException("Directive '" + name + "' needs a handler");
        }
        return new DirectiveEntry(name, null, handler, adapter);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String           getName()    { return name; }
    public Object           getValue()   { return value; }
    public DirectiveHandler getHandler() { return handler; }
    public ArgumentAdapter  getAdapter() { return adapter; }

    public boolean isValue()       { return handler == null; }

    /** {@code true} when the directive may appear as a stage entry. */
    public boolean isDeclarative() { return adapter != null; }

    @Override
    public String toString() {
        if (isValue()) return String.format("DirectiveEntry{%s=%s}", name, value);
        return String.format("DirectiveEntry{%s -> %s%s}",
            name, handler.getClass().getSimpleName(), isDeclarative() ? "" : ", code-only");
    }
}
