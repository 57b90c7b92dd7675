package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.qual.Conjunction;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.qual.SingleQualifier;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;

import java.util.*;

/**
 * The guards of a {@link VariantNode}, one conjunction per alternative.
 * Its inputs are the distinct nodes the qualifiers test.
 */
public class QualifiersNode extends FunctionNode {
    private List<Conjunction> guards;

    public QualifiersNode(GraphContext ctx, List<Conjunction> guards) {
        super(ctx, scopeOf(ctx, Scope.GLOBAL, subjects(guards)), ValueType.single(ValueType.Base.BOOLEAN).addSize(0, guards.size()));
        this.guards = Collections.unmodifiableList(new ArrayList<>(guards));
    }

    private static List<FunctionNode> subjects(List<Conjunction> guards) {
        Set<FunctionNode> subjects = Collections.newSetFromMap(new IdentityHashMap<>());
        List<FunctionNode> ordered = new ArrayList<>();
        for (Conjunction c : guards) {
            for (SingleQualifier q : c) {
                FunctionNode s = q.getSubject();
                if (subjects.add(s)) ordered.add(s);
            }
        }
        return ordered;
    }

    public List<Conjunction> getGuards() {
        return guards;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.QUALIFIERS;
    }

    @Override
    public List<FunctionNode> getInputs() {
        return subjects(guards);
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        // qualifiers may also be held by memo keys
        guards = rebuild(guards, f);
    }

    private static List<Conjunction> rebuild(List<Conjunction> guards, F<FunctionNode, FunctionNode> f) {
        List<Conjunction> ng = new ArrayList<>(guards.size());
        for (Conjunction c : guards) {
            List<SingleQualifier> qs = new ArrayList<>(c.size());
            for (SingleQualifier q : c) {
                FunctionNode subject = q.getSubject();
                FunctionNode replaced = f.apply(subject);
                qs.add(replaced == subject ? q : q.withSubject(replaced));
            }
            ng.add(Conjunction.of(qs));
        }
        return Collections.unmodifiableList(ng);
    }

    @Override
    protected boolean contentEquals(FunctionNode other) {
        QualifiersNode o = (QualifiersNode) other;
        if (!guards.equals(o.guards)) return false;
        List<FunctionNode> mine = getInputs();
        List<FunctionNode> theirs = o.getInputs();
        if (mine.size() != theirs.size()) return false;
        for (int i = 0; i < mine.size(); i++) {
            if (mine.get(i) != theirs.get(i)) return false;
        }
        return true;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        Map<FunctionNode, FunctionNode> mapping = new IdentityHashMap<>();
        List<FunctionNode> old = getInputs();
        for (int i = 0; i < old.size(); i++) mapping.put(old.get(i), inputs.get(i));
        return new QualifiersNode(ctx, rebuild(guards, s -> mapping.getOrDefault(s, s)));
    }

    @Override
    protected FunctionNode specialize(GraphContext ctx, KnownQualifiers known) {
        // guards are specialized by the variant that owns them
        return this;
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        List<String> args = new ArrayList<>(guards.size());
        for (Conjunction c : guards) {
            StringJoiner sj = new StringJoiner(", ", "{", "}");
            for (SingleQualifier q : c) {
                sj.add(ref.apply(q.getSubject()) + ": " + ConstNode.render(q.value));
            }
            args.add(sj.toString());
        }
        return args;
    }

    @Override
    public String shape() {
        return super.shape() + guards;
    }
}
