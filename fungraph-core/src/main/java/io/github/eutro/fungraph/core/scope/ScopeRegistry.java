package io.github.eutro.fungraph.core.scope;

import io.github.eutro.fungraph.core.diag.ScopeIncompatibilityException;
import org.jetbrains.annotations.NotNull;

/**
 * Answers nesting questions between area templates and closures.
 */
public interface ScopeRegistry {
    /**
     * Signals that two scopes do not nest.
     */
    int NO_COMMON_SCOPE = -1;

    /**
     * Whether template {@code inner} is {@code outer} or one of its descendants.
     * Every template nests in the global template.
     *
     * @param inner The inner template.
     * @param outer The outer template.
     * @return Whether inner lies inside outer.
     */
    boolean scopeNests(int inner, int outer);

    /**
     * The deepest of two nesting templates, where a node combining both must live.
     *
     * @param a A template.
     * @param b Another template.
     * @return The least upper bound, or {@link #NO_COMMON_SCOPE} if they do not nest.
     */
    default int leastCommonScope(int a, int b) {
        if (scopeNests(a, b)) return a;
        if (scopeNests(b, a)) return b;
        return NO_COMMON_SCOPE;
    }

    /**
     * Whether closure {@code outer} is on the closure stack of {@code inner}
     * (or they are equal). Every closure lies inside {@link Scope#NO_CLOSURE}.
     *
     * @param inner The inner closure.
     * @param outer The outer closure.
     * @return Whether inner lies inside outer.
     */
    boolean closureEncloses(int inner, int outer);

    /**
     * The nesting depth of a template, the global template having depth 0.
     *
     * @param template The template.
     * @return The depth.
     */
    int templateDepth(int template);

    /**
     * Merge the scopes of two nodes into the scope of a node that depends on both.
     *
     * @param a         A scope.
     * @param b         Another scope.
     * @param construct What is being built, for the diagnostic.
     * @return The least upper bound.
     * @throws ScopeIncompatibilityException If the scopes do not nest.
     */
    @NotNull
    default Scope merge(@NotNull Scope a, @NotNull Scope b, String construct) {
        if (a.equals(b)) return a;
        int template = leastCommonScope(a.template, b.template);
        if (template == NO_COMMON_SCOPE) {
            throw new ScopeIncompatibilityException("templates " + a.template + " and " + b.template + " do not nest", construct);
        }
        int closure;
        if (closureEncloses(a.closure, b.closure)) {
            closure = a.closure;
        } else if (closureEncloses(b.closure, a.closure)) {
            closure = b.closure;
        } else {
            throw new ScopeIncompatibilityException("closures " + a.closure + " and " + b.closure + " do not nest", construct);
        }
        return Scope.of(template, closure);
    }
}
