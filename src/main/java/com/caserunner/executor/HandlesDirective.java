package com.caserunner.executor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as an extension directive.
 *
 * The {@link DirectiveHandlerRegistry} scans the configured package, finds
 * every class annotated with {@code @HandlesDirective}, instantiates it through
 * its no-arg constructor and makes it available to every case under the given
 * name.
 *
 * <pre>
 *   // code-only: callable as word_count(text) inside a code directive
 *   {@literal @}HandlesDirective("word_count")
 *   public class WordCountDirective implements DirectiveHandler { ... }
 *
 *   // also usable as a stage entry, because it adapts its own arguments
 *   {@literal @}HandlesDirective("http_get")
 *   public class HttpGetDirective implements DirectiveHandler, ArgumentAdapter { ... }
 * </pre>
 *
 * Rules:
 *   - The annotated class must implement {@link DirectiveHandler}.
 *   - It must have a no-arg constructor.
 *   - A name may not clash with a built-in directive or another extension.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface HandlesDirective {
    String value();
}
