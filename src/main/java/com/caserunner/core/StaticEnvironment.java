package com.caserunner.core;

import com.caserunner.model.CallTarget;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An {@link Environment} backed by fixed maps, for embedding and tests.
 *
 * A target resolves to its registered command with each positional argument
 * appended after a space and each named parameter appended as
 * {@code --name=value}:
 *
 * <pre>
 *   StaticEnvironment env = StaticEnvironment.builder()
 *       .target("greet", "echo hello")
 *       .symbol("lang", "java")
 *       .build();
 *   env.resolveCall("greet", List.of("world"), Map.of("loud", "yes"));
 *   // -> "echo hello world --loud=yes"
 * </pre>
 *
 * Environment variables fall back to {@link System#getenv} unless overridden.
 */
public class StaticEnvironment implements Environment {

    private final Map<String, String> commands;
    private final Map<String, Path>   directories;
    private final Map<String, String> symbols;
    private final Map<String, String> settings;
    private final Map<String, String> variables;

    private StaticEnvironment(Builder b) {
        this.commands    = Map.copyOf(b.commands);
        this.directories = Map.copyOf(b.directories);
        this.symbols     = Map.copyOf(b.symbols);
        this.settings    = Map.copyOf(b.settings);
        this.variables   = Map.copyOf(b.variables);
    }

    @Override
    public CallTarget resolveCall(String target, List<Object> args, Map<String, Object> params) {
        String command = commands.get(target);
        if (command == null) {
            throw new IllegalArgumentException("unknown call target '" + target + "'");
        }
        StringBuilder sb = new StringBuilder(command);
        if (args != null) {
            for (Object arg : args) sb.append(' ').append(arg);
        }
        if (params != null) {
            params.forEach((name, value) -> sb.append(" --").append(name).append('=').append(value));
        }
        return new CallTarget(sb.toString(), directories.get(target));
    }

    @Override
    public String resolveSymbol(String name) {
        return symbols.get(name);
    }

    @Override
    public Map<String, String> getSettings() {
        return settings;
    }

    @Override
    public String getenv(String name) {
        String value = variables.get(name);
        return value != null ? value : System.getenv(name);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private final Map<String, String> commands    = new HashMap<>();
        private final Map<String, Path>   directories = new HashMap<>();
        private final Map<String, String> symbols     = new HashMap<>();
        private final Map<String, String> settings    = new HashMap<>();
        private final Map<String, String> variables   = new HashMap<>();

        public Builder target(String name, String command)                 { commands.put(name, command); return this; }
        public Builder symbol(String name, String value)                   { symbols.put(name, value); return this; }
        public Builder setting(String key, String value)                   { settings.put(key, value); return this; }
        public Builder variable(String name, String value)                 { variables.put(name, value); return this; }

        public Builder target(String name, String command, Path directory) {
            commands.put(name, command);
            if (directory != null) directories.put(name, directory);
            return this;
        }

        public StaticEnvironment build() { return new StaticEnvironment(this); }
    }
}
