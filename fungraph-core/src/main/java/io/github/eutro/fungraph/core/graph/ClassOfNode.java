package io.github.eutro.fungraph.core.graph;

import java.util.Collections;
import java.util.List;

/**
 * Whether the areas are members of a class.
 */
public class ClassOfNode extends FunctionApplicationNode {
    private final String className;

    public ClassOfNode(GraphContext ctx, String className, FunctionNode areas) {
        super(ctx, BuiltInFunctions.CLASS_OF_AREA, Collections.singletonList(areas));
        this.className = className;
    }

    public String getClassName() {
        return className;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLASS_OF;
    }

    @Override
    protected boolean paramsEqual(FunctionApplicationNode other) {
        return className.equals(((ClassOfNode) other).className);
    }

    @Override
    protected List<String> exportParams() {
        return Collections.singletonList('"' + className + '"');
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return new ClassOfNode(ctx, className, inputs.get(0));
    }
}
