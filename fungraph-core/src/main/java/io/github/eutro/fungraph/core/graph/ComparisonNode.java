package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.types.ValueType;

import java.util.*;

/**
 * {@code c(op1, e1, op2, e2, ...)}: matches values for which every comparison holds.
 * Each element is paired with the operator at the same index.
 */
public class ComparisonNode extends SetConstructionNode {
    private static final Set<String> OPERATORS = new HashSet<>(Arrays.asList("<", "<=", ">", ">=", "==", "!="));

    private final List<String> operators;

    public ComparisonNode(GraphContext ctx, List<String> operators, List<FunctionNode> operands) {
        super(ctx, operands, ValueType.single(ValueType.Base.ANY_DATA));
        if (operators.size() != operands.size()) {
            throw new IllegalArgumentException("comparison needs one operand per operator");
        }
        for (String op : operators) {
            if (!OPERATORS.contains(op)) throw new IllegalArgumentException("unknown comparison " + op);
        }
        this.operators = Collections.unmodifiableList(new ArrayList<>(operators));
    }

    public List<String> getOperators() {
        return operators;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMPARISON;
    }

    @Override
    protected boolean isOrderSensitive() {
        return true;
    }

    @Override
    protected boolean paramsEqual(SetConstructionNode other) {
        return operators.equals(((ComparisonNode) other).operators);
    }

    @Override
    protected List<String> exportParams() {
        List<String> ps = new ArrayList<>(operators.size());
        for (String op : operators) ps.add('"' + op + '"');
        return ps;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new ComparisonNode(ctx, operators, inputs);
    }
}
