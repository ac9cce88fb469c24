package com.caserunner.executor;

import com.caserunner.core.CaseRunnerConfig;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Discovers and holds extension directives.
 *
 * At construction time the registry:
 *   1. Uses the Reflections library to scan the given package
 *   2. Finds every class annotated with {@link HandlesDirective}
 *   3. Instantiates each one via its no-arg constructor
 *   4. Registers it under the name declared in the annotation
 *
 * Scanning happens once; the registry is then immutable and can be shared by
 * every case of a run. Each case copies the extensions into its own
 * {@link DirectiveTable} after the built-ins, see {@link #registerInto}.
 *
 * Two classes declaring the same name, or an annotated class that is not a
 * {@link DirectiveHandler}, fail discovery with {@link IllegalStateException}.
 */
public class DirectiveHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(DirectiveHandlerRegistry.class);

    private static final DirectiveHandlerRegistry EMPTY = new DirectiveHandlerRegistry();

    private final Map<String, DirectiveHandler> registry = new TreeMap<>();

    private DirectiveHandlerRegistry() {}

    public DirectiveHandlerRegistry(String packageName) {
        discoverAndRegister(packageName);
        log.info("DirectiveHandlerRegistry: {} extension directive(s) registered from {}",
            registry.size(), packageName);
    }

    public static DirectiveHandlerRegistry empty() {
        return EMPTY;
    }

    public static DirectiveHandlerRegistry fromConfig(CaseRunnerConfig config) {
        return config.isExtensionScanEnabled()
            ? new DirectiveHandlerRegistry(config.getDirectivePackage())
            : EMPTY;
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    public Optional<DirectiveHandler> find(String name) {
        return Optional.ofNullable(registry.get(name));
    }

    public boolean hasHandler(String name) {
        return registry.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    public int size() {
        return registry.size();
    }

    /**
     * Adds every extension to {@code table}. A handler that also implements
     * {@link ArgumentAdapter} adapts its own stage arguments; otherwise it is
     * code-only.
     *
     * @throws IllegalStateException if a name is already taken in {@code table}
     */
    public void registerInto(DirectiveTable table) {
        registry.forEach((name, handler) -> {
            if (table.contains(name)) {
                throw new IllegalStateException(
                    "Extension directive '" + name + "' (" + handler.getClass().getName() +
                    ") clashes with an existing directive");
            }
            ArgumentAdapter adapter = handler instanceof ArgumentAdapter a ? a : null;
            table.register(name, handler, adapter);
        });
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private void discoverAndRegister(String packageName) {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(packageName)
                .filterInputsBy(new FilterBuilder().includePackage(packageName))
                .setScanners(Scanners.TypesAnnotated)
        );

        for (Class<?> cls : reflections.getTypesAnnotatedWith(HandlesDirective.class)) {
            String name = cls.getAnnotation(HandlesDirective.class).value();
            claim(name, cls);
            registry.put(name, instantiate(name, cls));
            log.debug("DirectiveHandlerRegistry: {} -> {}", name, cls.getSimpleName());
        }
    }

    /** Rejects a second class for {@code name} and classes that cannot handle directives. */
    private void claim(String name, Class<?> cls) {
        String problem = null;
        if (!DirectiveHandler.class.isAssignableFrom(cls)) {
            problem = cls.getName() + " declares directive '" + name + "' without implementing DirectiveHandler";
        } else if (registry.containsKey(name)) {
            problem = "directive '" + name + "' is declared by both " +
                registry.get(name).getClass().getName() + " and " + cls.getName();
        }
        if (problem != null) {
            log.error("DirectiveHandlerRegistry: {}", problem);
            throw new IllegalStateException(problem);
        }
    }

    private static DirectiveHandler instantiate(String name, Class<?> cls) {
        try {
            var constructor = cls.getDeclaredConstructor();
            constructor.setAccessible(true);  // package-private extensions are allowed
            return (DirectiveHandler) constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(
                "cannot create " + cls.getName() + " for directive '" + name + "': " + e.getMessage(), e);
        }
    }
}
