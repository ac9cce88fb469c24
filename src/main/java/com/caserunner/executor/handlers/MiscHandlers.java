package com.caserunner.executor.handlers;

import com.caserunner.core.SymbolTable;
import com.caserunner.core.TestCase;
import com.caserunner.executor.CaseConfigException;
import com.caserunner.executor.DirectiveArguments;
import com.caserunner.executor.DirectiveHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

// ── uuid ──────────────────────────────────────────────────────────────────────

class UuidHandler implements DirectiveHandler {

    static String newUuid() {
        return UUID.randomUUID().toString();
    }

    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        return newUuid();
    }
}

// ── env ───────────────────────────────────────────────────────────────────────

class EnvHandler implements DirectiveHandler {
    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        String name = BuiltinDirectives.requireString(arguments, 0, "env", "a variable name");
        return testCase.getEnvironmentVariable(name);
    }
}

// ── log ───────────────────────────────────────────────────────────────────────

/** Appends a formatted line to the transcript. */
class LogHandler implements DirectiveHandler {
    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        String message = BuiltinDirectives.requireString(arguments, 0, "log", "a message");
        testCase.getTranscript().printOut(message, arguments.rest(1).toArray());
        return null;
    }
}

// ── extract_match ─────────────────────────────────────────────────────────────

/**
 * Searches the last call's output for {@code pattern} and binds its capture
 * groups: the first group to {@code variable}, or the groups in order to the
 * names in {@code groups}. Every target name is bound to null before
 * matching, so a miss leaves them null.
 */
class ExtractMatchHandler implements DirectiveHandler {
    private static final Logger log = LoggerFactory.getLogger(ExtractMatchHandler.class);

    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        Object pattern  = arguments.getEither(ArgumentAdapters.KEY_PATTERN, 0);
        Object variable = arguments.getEither(ArgumentAdapters.KEY_VARIABLE, 1);
        Object groups   = arguments.getEither(ArgumentAdapters.KEY_GROUPS, 2);

        if (pattern == null || String.valueOf(pattern).isEmpty()) {
            throw configError("extract_match requires pattern to match");
        }
        boolean hasVariable = variable != null && !String.valueOf(variable).isEmpty();
        boolean hasGroups   = groups != null;
        if (!hasVariable && !hasGroups) {
            throw configError("extract_match requires variable or groups");
        }
        if (hasVariable && hasGroups) {
            throw configError("extract_match cannot accept both variables and groups");
        }

        List<String> names = new ArrayList<>();
        if (hasVariable) {
            names.add(String.valueOf(variable));
        } else if (groups instanceof List<?> list) {
            list.forEach(g -> names.add(String.valueOf(g)));
        } else {
            throw configError("extract_match groups must be a list of names, got " + groups);
        }

        Pattern compiled;
        try {
            compiled = Pattern.compile(String.valueOf(pattern));
        } catch (PatternSyntaxException e) {
            throw configError("extract_match has an invalid pattern: " + e.getDescription(), e);
        }

        SymbolTable symbols = testCase.getSymbols();
        names.forEach(name -> symbols.set(name, null));

        Matcher m = compiled.matcher(testCase.getInvoker().getLastOutput());
        if (m.find() && m.groupCount() > 0) {
            for (int i = 0; i < names.size() && i < m.groupCount(); i++) {
                symbols.set(names.get(i), m.group(i + 1));
            }
            log.debug("ExtractMatchHandler: /{}/ bound {}", pattern, names);
        } else {
            log.debug("ExtractMatchHandler: /{}/ did not match the last output", pattern);
        }
        return null;
    }

    private static CaseConfigException configError(String message) {
        return configError(message, null);
    }

    private static CaseConfigException configError(String message, Throwable cause) {
        log.error("ExtractMatchHandler: {}", message);
        return cause != null ? new CaseConfigException(message, cause) : new CaseConfigException(message);
    }
}

// ── code ──────────────────────────────────────────────────────────────────────

/** Runs a script against the case's symbol table and returns its last value. */
class CodeHandler implements DirectiveHandler {
    @Override
    public Object handle(TestCase testCase, DirectiveArguments arguments) {
        String source = BuiltinDirectives.requireString(arguments, 0, "code", "a script");
        return testCase.getScriptEngine().execute(source, testCase.getSymbols());
    }
}
