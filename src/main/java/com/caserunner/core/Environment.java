package com.caserunner.core;

import com.caserunner.model.CallTarget;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The environment a case runs against, supplied by the suite orchestrator.
 *
 * It knows how to turn a named call target (plus arguments) into a concrete
 * command line, which symbols messages may refer to with {@code {name}}, and
 * which per-suite settings apply.
 *
 * Implementations may throw any unchecked exception from
 * {@link #resolveCall}; the case reports it as a call error.
 */
public interface Environment {

    /** Settings key naming the field that holds a call's target. */
    String SETTING_CALL_TARGET = "call.target";

    /** Default target field name when {@link #SETTING_CALL_TARGET} is not set. */
    String DEFAULT_CALL_TARGET_KEY = "target";

    /**
     * Resolves {@code target} to the command line to run.
     *
     * @param target the call target name from the directive
     * @param args   positional arguments, already resolved from variables/literals
     * @param params named parameters, already resolved from variables/literals
     */
    CallTarget resolveCall(String target, List<Object> args, Map<String, Object> params);

    /**
     * Returns the value of an environment-level symbol used for {@code {name}}
     * interpolation, or {@code null} when the environment does not know it.
     */
    String resolveSymbol(String name);

    /** Per-suite settings. */
    default Map<String, String> getSettings() {
        return Collections.emptyMap();
    }

    /** Looks up a process environment variable for the {@code env} directive. */
    default String getenv(String name) {
        return System.getenv(name);
    }
}
