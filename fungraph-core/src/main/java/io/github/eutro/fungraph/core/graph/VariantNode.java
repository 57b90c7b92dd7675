package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.ext.GraphExts;
import io.github.eutro.fungraph.core.qual.*;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Selects among guarded alternatives: the value is that of the alternatives whose guard holds, in order;
 * an unmergeable value wins outright, mergeable values are merged with those of later matching alternatives.
 * <p>
 * The guard list (held by the {@link QualifiersNode}) and the alternative list are parallel.
 */
public class VariantNode extends FunctionNode {
    private QualifiersNode qualifiers;
    private final List<FunctionNode> alternatives;

    private boolean repairable = false;
    @NotNull
    private KnownQualifiers context = KnownQualifiers.EMPTY;
    @Nullable
    private StubNode owner;

    public VariantNode(GraphContext ctx, QualifiersNode qualifiers, List<FunctionNode> alternatives) {
        super(ctx, scopeOf(ctx, qualifiers.getScope(), alternatives), typeOf(alternatives));
        if (qualifiers.getGuards().size() != alternatives.size()) {
            throw new IllegalArgumentException("variant needs one guard per alternative");
        }
        this.qualifiers = qualifiers;
        this.alternatives = new ArrayList<>(alternatives);
    }

    private static ValueType typeOf(List<FunctionNode> alternatives) {
        ValueType vt = ValueType.UNDEFINED;
        for (FunctionNode alt : alternatives) vt = vt.merge(alt.resolve().getValueType());
        return vt.addSize(0, 0);
    }

    public QualifiersNode getQualifiers() {
        return qualifiers;
    }

    public List<Conjunction> getGuards() {
        return qualifiers.getGuards();
    }

    public List<FunctionNode> getAlternatives() {
        return Collections.unmodifiableList(alternatives);
    }

    /**
     * Whether a cycle through this variant may be repaired by specializing its alternatives.
     * Cleared once the repair has been tried.
     *
     * @return Whether the variant is repairable.
     */
    public boolean isRepairable() {
        return repairable && id < 0;
    }

    public void setRepairable(boolean repairable) {
        this.repairable = repairable;
    }

    /**
     * The qualifiers known where this variant was built, under which a repair specializes it.
     *
     * @return The context.
     */
    @NotNull
    public KnownQualifiers getContext() {
        return context;
    }

    public void setContext(@NotNull KnownQualifiers context) {
        this.context = context;
    }

    /**
     * Set the forward reference for the attribute this variant defines, re-pointed when the variant is repaired.
     *
     * @param owner The forward reference.
     */
    public void setOwner(@Nullable StubNode owner) {
        this.owner = owner;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIANT;
    }

    @Override
    public List<FunctionNode> getInputs() {
        List<FunctionNode> inputs = new ArrayList<>(1 + alternatives.size());
        inputs.add(qualifiers);
        inputs.addAll(alternatives);
        return inputs;
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        qualifiers = (QualifiersNode) f.apply(qualifiers);
        alternatives.replaceAll(f::apply);
    }

    @Override
    protected boolean contentEquals(FunctionNode other) {
        VariantNode o = (VariantNode) other;
        if (qualifiers != o.qualifiers || alternatives.size() != o.alternatives.size()) return false;
        for (int i = 0; i < alternatives.size(); i++) {
            if (alternatives.get(i) != o.alternatives.get(i)) return false;
        }
        return true;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return derive(ctx, (QualifiersNode) inputs.get(0), inputs.subList(1, inputs.size()));
    }

    private VariantNode derive(GraphContext ctx, QualifiersNode qualifiers, List<FunctionNode> alternatives) {
        VariantNode v = new VariantNode(ctx, qualifiers, alternatives);
        v.repairable = repairable;
        v.context = context;
        String origin = getNullable(GraphExts.ORIGIN);
        if (origin != null) v.attachExt(GraphExts.ORIGIN, origin);
        return v;
    }

    /**
     * Drop impossible alternatives, resolve alternatives decided by constant subjects, and merge
     * neighbouring alternatives with the same value whose guards combine into one conjunction.
     *
     * @param ctx The graph context.
     * @return The simplified node.
     */
    @Override
    public FunctionNode simplify(GraphContext ctx) {
        List<Conjunction> guards = new ArrayList<>();
        List<FunctionNode> alts = new ArrayList<>();
        boolean changed = false;
        for (int i = 0; i < alternatives.size(); i++) {
            Conjunction c = staticallyReduce(qualifiers.getGuards().get(i));
            if (c == null) {
                changed = true;
                continue;
            }
            changed |= c != qualifiers.getGuards().get(i);
            FunctionNode alt = alternatives.get(i);
            int last = alts.size() - 1;
            if (last >= 0 && alts.get(last).resolve() == alt.resolve()) {
                Guard merged = Guard.of(guards.get(last), c).simplify();
                if (merged.getTerms().size() == 1) {
                    guards.set(last, merged.getTerms().get(0));
                    changed = true;
                    continue;
                }
            }
            guards.add(c);
            alts.add(alt);
            if (c.isTrue() && alt.resolve().isUnmergeable()) {
                changed |= i < alternatives.size() - 1;
                break;
            }
        }
        if (alts.isEmpty()) return new ConstNode(ctx, Collections.emptyList());
        if (alts.size() == 1 && guards.get(0).isTrue()) return alts.get(0);
        if (!changed) return this;
        VariantNode v = derive(ctx, new QualifiersNode(ctx, guards), alts);
        v.owner = owner;
        return v;
    }

    /**
     * Evaluate the qualifiers whose subject is a constant.
     *
     * @param c The conjunction.
     * @return The remaining conjunction, or null if it cannot hold.
     */
    @Nullable
    private static Conjunction staticallyReduce(Conjunction c) {
        List<SingleQualifier> remaining = new ArrayList<>(c.size());
        for (SingleQualifier q : c) {
            FunctionNode subject = q.getSubject();
            if (subject instanceof ConstNode && ((ConstNode) subject).wontChangeValue()) {
                if (!q.matches(((ConstNode) subject).getValue())) return null;
            } else if (q.isBoolean() && subject.isAlwaysTrue()) {
                if (!Boolean.TRUE.equals(q.value)) return null;
            } else {
                remaining.add(q);
            }
        }
        return remaining.size() == c.size() ? c : Conjunction.of(remaining);
    }

    @Override
    protected FunctionNode specialize(GraphContext ctx, KnownQualifiers known) {
        List<Conjunction> guards = qualifiers.getGuards();
        List<Conjunction> nGuards = new ArrayList<>();
        List<FunctionNode> nAlts = new ArrayList<>();
        List<TriState> states = new ArrayList<>();
        boolean changed = false;
        KnownQualifiers running = known;
        for (int i = 0; i < alternatives.size(); i++) {
            Conjunction c = guards.get(i);
            TriState state = c.evaluate(running);
            KnownQualifiers inside = state == TriState.FALSE ? null : running.assume(c);
            if (inside == null) {
                changed = true;
                continue;
            }
            FunctionNode alt = alternatives.get(i);
            FunctionNode picked = isLocal(alt) ? alt.pickQualifiedExpression(ctx, inside) : alt;
            Conjunction stripped = c.strip(known);
            changed |= picked != alt || stripped != c;
            nGuards.add(stripped);
            nAlts.add(picked);
            states.add(state);
            boolean unmergeable = alt.resolve().isUnmergeable();
            if (state == TriState.TRUE && unmergeable) {
                changed |= i < alternatives.size() - 1;
                break;
            }
            if (unmergeable) running = running.assumeFalse(c);
        }
        if (nAlts.isEmpty()) return new ConstNode(ctx, Collections.emptyList());
        if (nAlts.size() == 1 && states.get(0) == TriState.TRUE) return nAlts.get(0);
        if (!changed) return this;
        VariantNode v = derive(ctx, new QualifiersNode(ctx, nGuards), nAlts);
        v.context = known;
        return v.simplify(ctx);
    }

    /**
     * Specialize every alternative under its own guard, in the context this variant was built in.
     * Used when internalizing this variant ran into a cycle through itself; the result is not repairable again.
     *
     * @param ctx The graph context.
     * @return The repaired variant.
     */
    VariantNode repair(GraphContext ctx) {
        List<Conjunction> guards = qualifiers.getGuards();
        List<FunctionNode> alts = new ArrayList<>(alternatives.size());
        KnownQualifiers running = context;
        ctx.enterPick(this);
        try {
            for (int i = 0; i < alternatives.size(); i++) {
                FunctionNode alt = alternatives.get(i);
                KnownQualifiers inside = running.assume(guards.get(i));
                if (inside == null) {
                    alts.add(new ConstNode(ctx, Collections.emptyList()));
                    continue;
                }
                alts.add(isLocal(alt) ? alt.pickQualifiedExpression(ctx, inside) : alt);
                if (alt.resolve().isUnmergeable()) running = running.assumeFalse(guards.get(i));
            }
        } finally {
            ctx.exitPick(this);
        }
        VariantNode repaired = derive(ctx, qualifiers, alts);
        repaired.repairable = false;
        repaired.owner = owner;
        if (owner != null) owner.resolveTo(repaired);
        return repaired;
    }

    @Override
    public List<FunctionNode> getWriteThroughInputs() {
        return Collections.unmodifiableList(alternatives);
    }

    @Override
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        List<Conjunction> guards = qualifiers.getGuards();
        List<WritableDestination> dests = new ArrayList<>();
        alternatives:
        for (int i = 0; i < alternatives.size(); i++) {
            Conjunction guard = guards.get(i);
            for (int j = 0; j < i; j++) {
                // a write lands on the first matching alternative
                if (guard.implies(guards.get(j))) continue alternatives;
            }
            List<WritableDestination> ds = alternatives.get(i).extractWritableDestinations(ctx, path, visited);
            if (ds == null) return null;
            dests.addAll(BoolGateNode.guarded(ds, guard));
        }
        return dests;
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        List<String> args = new ArrayList<>();
        for (FunctionNode input : getInputs()) args.add(ref.apply(input));
        return args;
    }

    @Override
    public String shape() {
        return super.shape() + alternatives.size();
    }
}
