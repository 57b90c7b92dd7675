package io.github.eutro.fungraph.core.ext;

import io.github.eutro.fungraph.core.graph.BuiltInFunction;
import io.github.eutro.fungraph.core.graph.FunctionApplicationNode;
import io.github.eutro.fungraph.core.graph.FunctionNode;
import io.github.eutro.fungraph.core.passes.meta.MarkWritables;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;

import java.util.List;
import java.util.Map;

/**
 * The {@link Ext}s used by the graph builder and its passes.
 */
public class GraphExts {
    /**
     * Attached to a {@link FunctionNode}. The source construct the node was built for, used to locate diagnostics.
     */
    public static final Ext<String> ORIGIN = Ext.create(String.class, "ORIGIN");

    /**
     * Attached to a cached {@link FunctionNode}. The specializations of the node computed so far,
     * by the qualifiers they were specialized under.
     */
    public static final Ext<Map<KnownQualifiers, FunctionNode>> SPECIALIZATIONS = Ext.create(Map.class, "SPECIALIZATIONS");

    /**
     * Attached to a cached {@link FunctionNode}, computed by {@link MarkWritables}.
     * The nodes that may pass writes on to this node.
     */
    public static final Ext<List<FunctionNode>> WRITE_USERS = Ext.create(List.class, "WRITE_USERS");

    /**
     * Attached to a {@link BuiltInFunction} or {@link FunctionApplicationNode}.
     * Whether the function has no side effects.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    /**
     * Attached to a {@link BuiltInFunction} or {@link FunctionApplicationNode}.
     * The index of the argument a write to the application passes on to.
     */
    public static final Ext<Integer> WRITE_THROUGH_ARG = Ext.create(Integer.class, "WRITE_THROUGH_ARG");

    /**
     * Attached to a {@link BuiltInFunction}. Whether an application to the given
     * arguments always yields a true value.
     */
    public static final Ext<F<List<FunctionNode>, Boolean>> ALWAYS_TRUE = Ext.create(F.class, "ALWAYS_TRUE");

    /**
     * Attached to a {@link BuiltInFunction}. The value type of an application, given the argument types.
     */
    public static final Ext<F<List<ValueType>, ValueType>> RESULT_TYPE = Ext.create(F.class, "RESULT_TYPE");

    /**
     * Attached to a {@link BuiltInFunction}. Computes the result of an application to constant arguments,
     * or returns null if it cannot be folded.
     */
    public static final Ext<F<List<Object>, Object>> CONSTANT_FOLDER = Ext.create(F.class, "CONSTANT_FOLDER");

    /**
     * Mark something as pure, by attaching {@link #IS_PURE} {@code = true} to it.
     *
     * @param t   The thing to mark as pure.
     * @param <T> The type of {@code t}.
     * @return {@code t}.
     */
    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }
}
