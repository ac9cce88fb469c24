package com.caserunner.core;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formats transcript lines and failure messages.
 *
 * Two phases, in this order:
 * <ol>
 *   <li>every {@code {name}} is replaced by the symbol's value (environment
 *       first, then the case symbol table; unknown names stay verbatim);</li>
 *   <li>every {@code {}} is filled from the positional arguments, left to right.
 *       When there are more arguments than slots, {@code ": {} {}..."} is
 *       appended first; slots without an argument render as empty.</li>
 * </ol>
 * Text produced by phase 1 is never scanned for {@code {}} slots.
 */
public class MessageFormatter {

    private static final Pattern NAMED_SYMBOL = Pattern.compile("\\{([^}]+)\\}");
    private static final String  SLOT = "{}";

    private final Function<String, String> environmentResolver;
    private final SymbolTable symbols;

    public MessageFormatter(Function<String, String> environmentResolver, SymbolTable symbols) {
        this.environmentResolver = environmentResolver;
        this.symbols = symbols;
    }

    /**
     * Interpolates named symbols, then fills positional slots with {@code args}.
     */
    public String format(String template, Object... args) {
        List<Object> parts = split(template != null ? template : "null");
        int slots = (int) parts.stream().filter(p -> p == Slot.INSTANCE).count();
        int argCount = args != null ? args.length : 0;

        int missing = argCount - slots;
        if (missing > 0) {
            parts.add(": ");
            for (int i = 0; i < missing; i++) {
                if (i > 0) parts.add(" ");
                parts.add(Slot.INSTANCE);
            }
        }

        StringBuilder sb = new StringBuilder();
        int next = 0;
        for (Object part : parts) {
            if (part == Slot.INSTANCE) {
                if (next < argCount) sb.append(args[next]);
                next++;
            } else {
                sb.append((String) part);
            }
        }
        return sb.toString();
    }

    /** Phase 1 only. */
    public String interpolate(String template) {
        return interpolateSymbols(template, this::resolve);
    }

    /** Number of positional slots {@code template} has after interpolation. */
    public int countSlots(String template) {
        return (int) split(template).stream().filter(p -> p == Slot.INSTANCE).count();
    }

    /**
     * Replaces every {@code {name}} in {@code msg} with {@code resolver(name)},
     * leaving the placeholder untouched when the resolver returns {@code null}.
     */
    public static String interpolateSymbols(String msg, Function<String, String> resolver) {
        Matcher m = NAMED_SYMBOL.matcher(msg);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = resolver.apply(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    private String resolve(String name) {
        String value = environmentResolver != null ? environmentResolver.apply(name) : null;
        if (value == null && symbols != null && symbols.contains(name)) {
            value = String.valueOf(symbols.get(name));
        }
        return value;
    }

    /** Splits into literal strings (already interpolated) and slot markers. */
    private List<Object> split(String template) {
        List<Object> parts = new ArrayList<>();
        int start = 0;
        int idx;
        while ((idx = template.indexOf(SLOT, start)) >= 0) {
            parts.add(interpolate(template.substring(start, idx)));
            parts.add(Slot.INSTANCE);
            start = idx + SLOT.length();
        }
        parts.add(interpolate(template.substring(start)));
        return parts;
    }

    private enum Slot { INSTANCE }
}
