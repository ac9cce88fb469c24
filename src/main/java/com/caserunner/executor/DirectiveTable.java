package com.caserunner.executor;

import com.caserunner.core.TestCase;
import com.caserunner.script.ScriptFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps directive names to their {@link DirectiveEntry} for one case.
 *
 * Populated at case construction with the built-ins and any discovered
 * extensions, then consulted for every stage entry and every call made from
 * embedded code.
 *
 * <h3>Stage entries</h3>
 * A stage entry is a map with exactly one key, the directive name, whose value
 * is the declared argument block:
 * <pre>
 *   { "call": { "target": "list_buckets", "args": [ { "literal": "us" } ] } }
 * </pre>
 * It is resolved and adapted before any handler runs, so a malformed entry
 * has no side effects.
 */
public class DirectiveTable {

    private static final Logger log = LoggerFactory.getLogger(DirectiveTable.class);

    private final TestCase owner;
    private final Map<String, DirectiveEntry> entries = new LinkedHashMap<>();

    public DirectiveTable(TestCase owner) {
        this.owner = owner;
    }

    // ── Registration ──────────────────────────────────────────────────────────

    public void register(String name, DirectiveHandler handler, ArgumentAdapter adapter) {
        put(DirectiveEntry.handler(name, handler, adapter));
    }

    public void registerValue(String name, Object value) {
        put(DirectiveEntry.value(name, value));
    }

    private void put(DirectiveEntry entry) {
        if (entries.containsKey(entry.getName())) {
            throw new IllegalStateException(
                "Duplicate directive '" + entry.getName() + "': " +
                entries.get(entry.getName()) + " and " + entry);
        }
        entries.put(entry.getName(), entry);
        log.trace("DirectiveTable: registered {}", entry);
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public DirectiveEntry resolve(String name) {
        DirectiveEntry entry = entries.get(name);
        if (entry == null) {
            throw new UnknownDirectiveException(name);
        }
        return entry;
    }

    public Collection<DirectiveEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    // ── Dispatch ──────────────────────────────────────────────────────────────

    /**
     * Runs one stage entry.
     *
     * @throws CaseConfigException if the entry does not hold exactly one directive
     */
    public Object runEntry(Map<String, Object> stageEntry) {
        if (stageEntry == null || stageEntry.size() != 1) {
            String message = "each stage entry must hold exactly one directive, got " +
                (stageEntry == null ? "nothing" : stageEntry.keySet());
            log.error("DirectiveTable: {}", message);
            throw new CaseConfigException(message);
        }
        Map.Entry<String, Object> only = stageEntry.entrySet().iterator().next();
        return invoke(only.getKey(), only.getValue());
    }

    /**
     * Adapts {@code declared} and calls the handler, unless the adapter reports
     * the directive as declarative-only.
     *
     * @throws UnknownDirectiveException if {@code name} is not registered
     * @throws CaseConfigException       if the directive is code-only
     */
    public Object invoke(String name, Object declared) {
        DirectiveEntry entry = resolve(name);
        if (!entry.isDeclarative()) {
            throw new CaseConfigException("directive only available inside a code directive: " + name);
        }
        DirectiveArguments args = entry.getAdapter().adapt(owner, declared);
        if (args == null || args.isDeclarativeOnly()) {
            log.debug("DirectiveTable: {} handled declaratively", name);
            return null;
        }
        log.debug("DirectiveTable: {} {}", name, args);
        return entry.getHandler().handle(owner, args);
    }

    /** Calls a handler directly with already-flat arguments, as embedded code does. */
    public Object call(String name, List<Object> positional, Map<String, Object> keyword) {
        DirectiveEntry entry = resolve(name);
        if (entry.isValue()) {
            throw new CaseConfigException("directive '" + name + "' is a value and cannot be called");
        }
        return entry.getHandler().handle(owner, new DirectiveArguments(positional, keyword));
    }

    /**
     * The value {@code name} has in the symbol table: the plain value for value
     * entries, or a function bound to this case for handlers.
     */
    public Object symbolValue(DirectiveEntry entry) {
        if (entry.isValue()) {
            return entry.getValue();
        }
        return new BoundDirective(entry);
    }

    private final class BoundDirective implements ScriptFunction {
        private final DirectiveEntry entry;

        private BoundDirective(DirectiveEntry entry) {
            this.entry = entry;
        }

        @Override
        public Object call(List<Object> positional, Map<String, Object> keyword) {
            return entry.getHandler().handle(owner, new DirectiveArguments(positional, keyword));
        }

        @Override
        public String toString() {
            return "<directive " + entry.getName() + ">";
        }
    }
}
