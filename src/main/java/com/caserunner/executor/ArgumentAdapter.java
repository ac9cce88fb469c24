package com.caserunner.executor;

import com.caserunner.core.TestCase;

/**
 * Translates the argument block declared in a stage entry into the positional
 * and keyword arguments of a {@link DirectiveHandler}.
 *
 * An adapter may do the directive's whole job itself (for example bind a
 * symbol) and return {@link DirectiveArguments#declarativeOnly()}, in which
 * case the handler is not called.
 *
 * A directive registered without an adapter can only be called from embedded
 * code.
 */
@FunctionalInterface
public interface ArgumentAdapter {

    DirectiveArguments adapt(TestCase testCase, Object declared);
}
