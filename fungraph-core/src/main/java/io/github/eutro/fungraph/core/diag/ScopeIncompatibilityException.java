package io.github.eutro.fungraph.core.diag;

/**
 * Thrown when a node combines inputs from scopes that do not nest.
 */
public class ScopeIncompatibilityException extends CompilationException {
    public ScopeIncompatibilityException(String message, String construct) {
        super(new Diagnostic(Diagnostic.Kind.SCOPE_INCOMPATIBILITY, message, construct));
    }
}
