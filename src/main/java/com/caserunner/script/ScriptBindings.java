package com.caserunner.script;

/**
 * The only names a script can see. Reads of unknown names fail; assignments
 * always succeed and overwrite.
 */
public interface ScriptBindings {

    boolean contains(String name);

    /** Returns the bound value, or {@code null} if unbound or bound to null. */
    Object get(String name);

    void set(String name, Object value);
}
