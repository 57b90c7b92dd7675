package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.ext.GraphExts;
import io.github.eutro.fungraph.core.qual.SingleQualifier;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;

import java.util.*;

/**
 * The built-in function catalogue.
 */
public class BuiltInFunctions {
    private static final Map<String, BuiltInFunction> BY_NAME = new LinkedHashMap<>();

    private static final int VARIADIC = Integer.MAX_VALUE;

    public static final BuiltInFunction PLUS = register("plus", 2, 2);
    public static final BuiltInFunction MINUS = register("minus", 2, 2);
    public static final BuiltInFunction MUL = register("mul", 2, 2);
    public static final BuiltInFunction NOT = register("not", 1, 1);
    public static final BuiltInFunction AND = register("and", 1, VARIADIC);
    public static final BuiltInFunction OR = register("or", 1, VARIADIC);
    public static final BuiltInFunction EQUAL = register("equal", 2, 2);
    public static final BuiltInFunction NOT_EQUAL = register("notEqual", 2, 2);
    public static final BuiltInFunction IDENTITY = register("identity", 1, 1);
    public static final BuiltInFunction FIRST = register("first", 1, 1);
    public static final BuiltInFunction LAST = register("last", 1, 1);
    public static final BuiltInFunction SIZE = register("size", 1, 1);
    public static final BuiltInFunction EMPTY = register("empty", 1, 1);
    public static final BuiltInFunction NOT_EMPTY = register("notEmpty", 1, 1);
    public static final BuiltInFunction CONCAT_STR = register("concatStr", 1, VARIADIC);
    public static final BuiltInFunction CLASS_OF_AREA = register("classOfArea", 1, 1);
    public static final BuiltInFunction OFFSET = register("offset", 3, 3);
    public static final BuiltInFunction OVERLAP = register("overlap", 2, 2);
    public static final BuiltInFunction SORT = register("sort", 1, 1);
    public static final BuiltInFunction INTERNAL_APPLY = register("internalApply", 1, VARIADIC);
    public static final BuiltInFunction INTERNAL_PUSH = register("internalPush", 2, 2);

    private static BuiltInFunction register(String name, int minArgs, int maxArgs) {
        BuiltInFunction fn = new BuiltInFunction(name, minArgs, maxArgs);
        BY_NAME.put(name, fn);
        return fn;
    }

    /**
     * Look up a function by mnemonic.
     *
     * @param name The mnemonic.
     * @return The function.
     * @throws IllegalArgumentException If there is no such function.
     */
    public static BuiltInFunction byName(String name) {
        BuiltInFunction fn = BY_NAME.get(name);
        if (fn == null) throw new IllegalArgumentException("unknown function " + name);
        return fn;
    }

    public static Collection<BuiltInFunction> all() {
        return Collections.unmodifiableCollection(BY_NAME.values());
    }

    private static final ValueType BOOLEAN = ValueType.single(ValueType.Base.BOOLEAN);
    private static final ValueType NUMBER = ValueType.single(ValueType.Base.NUMBER);
    private static final ValueType STRING = ValueType.single(ValueType.Base.STRING);

    private static Double number(Object o) {
        return o instanceof Double ? (Double) o : null;
    }

    private static F<List<Object>, Object> arithmetic(F<double[], Double> op) {
        return args -> {
            Double a = number(args.get(0));
            Double b = number(args.get(1));
            return a == null || b == null ? null : op.apply(new double[]{a, b});
        };
    }

    private static List<?> asList(Object o) {
        return o instanceof List ? (List<?>) o : Collections.singletonList(o);
    }

    private static F<List<ValueType>, ValueType> constantType(ValueType vt) {
        return $ -> vt;
    }

    private static void rules(BuiltInFunction fn,
                              F<List<ValueType>, ValueType> resultType,
                              F<List<Object>, Object> folder) {
        GraphExts.markPure(fn);
        fn.attachExt(GraphExts.RESULT_TYPE, resultType);
        if (folder != null) fn.attachExt(GraphExts.CONSTANT_FOLDER, folder);
    }

    static {
        rules(PLUS, constantType(NUMBER), arithmetic(ab -> ab[0] + ab[1]));
        rules(MINUS, constantType(NUMBER), arithmetic(ab -> ab[0] - ab[1]));
        rules(MUL, constantType(NUMBER), arithmetic(ab -> ab[0] * ab[1]));
        rules(NOT, constantType(BOOLEAN), args -> !SingleQualifier.isTrue(args.get(0)));
        rules(AND, constantType(BOOLEAN), args -> {
            for (Object arg : args) {
                if (!SingleQualifier.isTrue(arg)) return false;
            }
            return true;
        });
        rules(OR, constantType(BOOLEAN), args -> {
            for (Object arg : args) {
                if (SingleQualifier.isTrue(arg)) return true;
            }
            return false;
        });
        OR.attachExt(GraphExts.ALWAYS_TRUE, args -> {
            for (FunctionNode arg : args) {
                if (arg.resolve().isAlwaysTrue()) return true;
            }
            return false;
        });
        AND.attachExt(GraphExts.ALWAYS_TRUE, args -> {
            for (FunctionNode arg : args) {
                if (!arg.resolve().isAlwaysTrue()) return false;
            }
            return true;
        });
        rules(EQUAL, constantType(BOOLEAN), args -> args.get(0).equals(args.get(1)));
        rules(NOT_EQUAL, constantType(BOOLEAN), args -> !args.get(0).equals(args.get(1)));
        rules(IDENTITY, types -> types.get(0), args -> args.get(0));
        IDENTITY.attachExt(GraphExts.WRITE_THROUGH_ARG, 0);
        IDENTITY.attachExt(GraphExts.ALWAYS_TRUE, args -> args.get(0).resolve().isAlwaysTrue());
        rules(FIRST, types -> types.get(0).withSize(0, 1), args -> {
            List<?> ls = asList(args.get(0));
            return ls.isEmpty() ? Collections.emptyList() : ls.get(0);
        });
        rules(LAST, types -> types.get(0).withSize(0, 1), args -> {
            List<?> ls = asList(args.get(0));
            return ls.isEmpty() ? Collections.emptyList() : ls.get(ls.size() - 1);
        });
        rules(SIZE, constantType(NUMBER), args -> (double) asList(args.get(0)).size());
        rules(EMPTY, constantType(BOOLEAN), args -> asList(args.get(0)).isEmpty());
        rules(NOT_EMPTY, constantType(BOOLEAN), args -> !asList(args.get(0)).isEmpty());
        NOT_EMPTY.attachExt(GraphExts.ALWAYS_TRUE, args -> args.get(0).resolve().getValueType().getMinSize() > 0);
        rules(CONCAT_STR, constantType(STRING), args -> {
            StringBuilder sb = new StringBuilder();
            for (Object arg : args) {
                for (Object elt : asList(arg)) {
                    if (elt instanceof Map || elt instanceof List) return null;
                    sb.append(elt instanceof Double ? ConstNode.render(elt) : String.valueOf(elt));
                }
            }
            return sb.toString();
        });
        rules(CLASS_OF_AREA, constantType(BOOLEAN), null);
        rules(OFFSET, constantType(NUMBER), null);
        rules(OVERLAP, constantType(BOOLEAN), null);
        rules(SORT, types -> types.get(0), null);
        INTERNAL_APPLY.attachExt(GraphExts.RESULT_TYPE, $ -> ValueType.UNKNOWN);
        INTERNAL_PUSH.attachExt(GraphExts.RESULT_TYPE, constantType(ValueType.UNDEFINED));
    }
}
