package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.qual.Conjunction;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.qual.SingleQualifier;
import io.github.eutro.fungraph.core.qual.TriState;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * {@code cond(selector, o({on: p1, use: v1}, ...))}: the {@code use} of the first alternative
 * whose {@code on} pattern matches the selector, or {@code o()}.
 */
public class CondNode extends FunctionNode {
    private FunctionNode selector;
    private final List<FunctionNode> ons;
    private final List<FunctionNode> uses;

    public CondNode(GraphContext ctx, FunctionNode selector, List<FunctionNode> ons, List<FunctionNode> uses) {
        super(ctx, scopeOf(ctx, scopeOf(ctx, selector.resolve().getScope(), ons), uses), typeOf(uses));
        if (ons.size() != uses.size()) throw new IllegalArgumentException("cond needs one use per on");
        this.selector = selector;
        this.ons = new ArrayList<>(ons);
        this.uses = new ArrayList<>(uses);
    }

    private static ValueType typeOf(List<FunctionNode> uses) {
        ValueType vt = ValueType.UNDEFINED;
        for (FunctionNode use : uses) vt = vt.merge(use.resolve().getValueType());
        return vt.addSize(0, 0);
    }

    public FunctionNode getSelector() {
        return selector;
    }

    public List<FunctionNode> getOns() {
        return Collections.unmodifiableList(ons);
    }

    public List<FunctionNode> getUses() {
        return Collections.unmodifiableList(uses);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COND;
    }

    @Override
    public List<FunctionNode> getInputs() {
        List<FunctionNode> inputs = new ArrayList<>(1 + 2 * ons.size());
        inputs.add(selector);
        for (int i = 0; i < ons.size(); i++) {
            inputs.add(ons.get(i));
            inputs.add(uses.get(i));
        }
        return inputs;
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        selector = f.apply(selector);
        ons.replaceAll(f::apply);
        uses.replaceAll(f::apply);
    }

    @Override
    protected boolean contentEquals(FunctionNode other) {
        CondNode o = (CondNode) other;
        if (selector != o.selector || ons.size() != o.ons.size()) return false;
        for (int i = 0; i < ons.size(); i++) {
            if (ons.get(i) != o.ons.get(i) || uses.get(i) != o.uses.get(i)) return false;
        }
        return true;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        List<FunctionNode> nOns = new ArrayList<>();
        List<FunctionNode> nUses = new ArrayList<>();
        for (int i = 1; i < inputs.size(); i += 2) {
            nOns.add(inputs.get(i));
            nUses.add(inputs.get(i + 1));
        }
        return new CondNode(ctx, inputs.get(0), nOns, nUses);
    }

    @Nullable
    private SingleQualifier onQualifier(int i) {
        FunctionNode on = ons.get(i).resolve();
        return on instanceof ConstNode ? SingleQualifier.onNode(selector.resolve(), ((ConstNode) on).getValue()) : null;
    }

    @Override
    public FunctionNode simplify(GraphContext ctx) {
        if (ons.isEmpty()) return new ConstNode(ctx, Collections.emptyList());
        if (ons.size() == 1) {
            FunctionNode on = ons.get(0).resolve();
            if (on instanceof ConstNode && Boolean.TRUE.equals(((ConstNode) on).getValue())) {
                return new BoolGateNode(ctx, selector, uses.get(0)).simplify(ctx);
            }
            if (on instanceof ConstNode) {
                return new BoolMatchNode(ctx, selector, on, uses.get(0)).simplify(ctx);
            }
        }
        FunctionNode sel = selector.resolve();
        if (sel instanceof ConstNode && ((ConstNode) sel).wontChangeValue()) {
            for (int i = 0; i < ons.size(); i++) {
                FunctionNode on = ons.get(i).resolve();
                if (!(on instanceof ConstNode)) return this;
                if (SingleQualifier.matchesPattern(((ConstNode) on).getValue(), ((ConstNode) sel).getValue())) {
                    return uses.get(i);
                }
            }
            return new ConstNode(ctx, Collections.emptyList());
        }
        return this;
    }

    @Override
    protected FunctionNode specialize(GraphContext ctx, KnownQualifiers known) {
        List<FunctionNode> nOns = new ArrayList<>();
        List<FunctionNode> nUses = new ArrayList<>();
        boolean changed = false;
        for (int i = 0; i < ons.size(); i++) {
            SingleQualifier q = onQualifier(i);
            TriState state = q == null ? TriState.UNKNOWN : known.evaluate(q);
            if (state == TriState.FALSE) {
                changed = true;
                continue;
            }
            FunctionNode use = uses.get(i);
            FunctionNode picked = isLocal(use) ? use.pickQualifiedExpression(ctx, known) : use;
            changed |= picked != use;
            if (state == TriState.TRUE && nOns.isEmpty()) return picked;
            nOns.add(ons.get(i));
            nUses.add(picked);
            if (state == TriState.TRUE) {
                changed |= i < ons.size() - 1;
                break;
            }
        }
        return changed ? new CondNode(ctx, selector, nOns, nUses).simplify(ctx) : this;
    }

    @Override
    public List<FunctionNode> getWriteThroughInputs() {
        return Collections.unmodifiableList(uses);
    }

    @Override
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        List<WritableDestination> dests = new ArrayList<>();
        List<Conjunction> earlier = new ArrayList<>();
        alternatives:
        for (int i = 0; i < ons.size(); i++) {
            SingleQualifier q = onQualifier(i);
            if (q == null) return null;
            Conjunction guard = Conjunction.of(q);
            for (Conjunction e : earlier) {
                // a write lands on the first matching alternative
                if (guard.implies(e)) continue alternatives;
            }
            earlier.add(guard);
            List<WritableDestination> ds = uses.get(i).extractWritableDestinations(ctx, path, visited);
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
}
