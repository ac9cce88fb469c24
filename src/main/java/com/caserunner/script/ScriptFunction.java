package com.caserunner.script;

import java.util.List;
import java.util.Map;

/**
 * A value scripts can call: {@code name(a, b, key=value)}.
 */
@FunctionalInterface
public interface ScriptFunction {

    Object call(List<Object> positional, Map<String, Object> keyword);
}
