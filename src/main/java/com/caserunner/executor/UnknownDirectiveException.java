package com.caserunner.executor;

/**
 * A stage entry or script named a directive that is not in the dispatch table.
 */
public class UnknownDirectiveException extends CaseConfigException {

    private final String directive;

    public UnknownDirectiveException(String directive) {
        super("unknown directive: " + directive);
        this.directive = directive;
    }

    public String getDirective() {
        return directive;
    }
}
