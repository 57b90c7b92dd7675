package io.github.eutro.fungraph.core.scope;

/**
 * Where a node's value is meaningful: an area template (or global) and a closure (or none).
 */
public final class Scope {
    /**
     * The template id of the global scope.
     */
    public static final int GLOBAL_TEMPLATE = 0;
    /**
     * The closure id meaning "not inside a closure".
     */
    public static final int NO_CLOSURE = 0;
    /**
     * The global scope.
     */
    public static final Scope GLOBAL = new Scope(GLOBAL_TEMPLATE, NO_CLOSURE);

    public final int template;
    public final int closure;

    private Scope(int template, int closure) {
        this.template = template;
        this.closure = closure;
    }

    public static Scope of(int template, int closure) {
        if (template == GLOBAL_TEMPLATE && closure == NO_CLOSURE) return GLOBAL;
        return new Scope(template, closure);
    }

    public static Scope template(int template) {
        return of(template, NO_CLOSURE);
    }

    public boolean isGlobal() {
        return template == GLOBAL_TEMPLATE && closure == NO_CLOSURE;
    }

    public boolean inClosure() {
        return closure != NO_CLOSURE;
    }

    /**
     * The scope outside any closure, in the same template.
     *
     * @return The scope.
     */
    public Scope withoutClosure() {
        return of(template, NO_CLOSURE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Scope scope = (Scope) o;
        return template == scope.template && closure == scope.closure;
    }

    @Override
    public int hashCode() {
        return 31 * template + closure;
    }

    @Override
    public String toString() {
        if (isGlobal()) return "global";
        return "@" + template + (closure == NO_CLOSURE ? "" : "/" + closure);
    }
}
