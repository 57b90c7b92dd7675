package io.github.eutro.fungraph.core.diag;

/**
 * Thrown when the cache holds a node that is structurally equal to a new one but
 * disagrees with it on its value type.
 */
public class InconsistentCacheException extends CompilationException {
    public InconsistentCacheException(String message, String construct) {
        super(new Diagnostic(Diagnostic.Kind.INCONSISTENT_CACHE, message, construct));
    }
}
