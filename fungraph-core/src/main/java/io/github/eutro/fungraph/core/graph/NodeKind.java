package io.github.eutro.fungraph.core.graph;

/**
 * The kinds of node in the function graph. The cache indexes nodes by kind,
 * and the export form names each node by its kind's mnemonic.
 */
public enum NodeKind {
    CONST("const"),
    STORAGE("storage"),
    AV("av"),
    BOOL_GATE("boolGate"),
    BOOL_MATCH("boolMatch"),
    QUALIFIERS("qualifiers"),
    VARIANT("variant"),
    FUNCTION_APPLICATION("apply"),
    CLASS_OF("classOf"),
    GEOMETRY("geometry"),
    SORT("sort"),
    QUERY_APPLICATION("query"),
    ORDERED_SET("o"),
    RANGE("r"),
    NEGATION("n"),
    SUB_STRING("s"),
    COMPARISON("c"),
    AREA_PROJECTION("areaProjection"),
    AREA_SELECTION("areaSelection"),
    CHILD_AREAS("childAreas"),
    AREA_OF_CLASS("areaOfClass"),
    ME("me"),
    COND("cond"),
    CLOSURE("defun"),
    STUB("stub"),
    CYCLE("cycle"),
    ;

    public final String mnemonic;

    NodeKind(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
