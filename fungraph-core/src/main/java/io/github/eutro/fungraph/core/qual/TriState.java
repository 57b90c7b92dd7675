package io.github.eutro.fungraph.core.qual;

/**
 * The outcome of evaluating a qualifier against what is known statically.
 */
public enum TriState {
    TRUE,
    FALSE,
    UNKNOWN,
    ;

    public static TriState of(boolean b) {
        return b ? TRUE : FALSE;
    }

    public TriState not() {
        switch (this) {
            case TRUE:
                return FALSE;
            case FALSE:
                return TRUE;
            default:
                return UNKNOWN;
        }
    }

    public TriState and(TriState other) {
        if (this == FALSE || other == FALSE) return FALSE;
        if (this == TRUE && other == TRUE) return TRUE;
        return UNKNOWN;
    }

    public TriState or(TriState other) {
        if (this == TRUE || other == TRUE) return TRUE;
        if (this == FALSE && other == FALSE) return FALSE;
        return UNKNOWN;
    }
}
