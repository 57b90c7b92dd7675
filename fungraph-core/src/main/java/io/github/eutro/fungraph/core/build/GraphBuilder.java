package io.github.eutro.fungraph.core.build;

import io.github.eutro.fungraph.core.build.VariantTerm.QualifierTerm;
import io.github.eutro.fungraph.core.diag.Diagnostic;
import io.github.eutro.fungraph.core.ext.GraphExts;
import io.github.eutro.fungraph.core.graph.*;
import io.github.eutro.fungraph.core.graph.StorageNode.StorageKind;
import io.github.eutro.fungraph.core.qual.Conjunction;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.qual.SingleQualifier;
import io.github.eutro.fungraph.core.qual.TriState;
import io.github.eutro.fungraph.core.scope.AreaTemplate;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Lowers expressions into the graph of a {@link GraphContext}.
 * <p>
 * Every factory method builds a node, simplifies it and internalizes it. A node that depends on a context
 * attribute still being defined cannot be cached yet; it is returned uncached and cached by {@link #complete()}.
 * <p>
 * Context attributes are built lazily, the first time something asks for them. While an attribute is being
 * defined, requests for it get a forward reference ({@link StubNode}), which is resolved once the definition is built.
 */
public class GraphBuilder {
    private static final Logger logger = LogManager.getLogger();

    private final GraphContext ctx;
    private final Map<AttributeKey, FunctionNode> contextAttributes = new LinkedHashMap<>();
    private final Map<AttributeKey, StubNode> underConstruction = new HashMap<>();
    private final Deque<AttributeKey> defining = new ArrayDeque<>();
    private final List<ClosureNode> closures = new ArrayList<>();
    private final List<WriteAction> writes = new ArrayList<>();
    private final List<FunctionNode> roots = new ArrayList<>();

    public GraphBuilder(GraphContext ctx) {
        this.ctx = ctx;
    }

    public GraphContext getContext() {
        return ctx;
    }

    /**
     * Simplify and internalize a node, recording the construct it was built for.
     *
     * @param node The node.
     * @return The cached node, or the simplified node if it cannot be cached yet.
     */
    @NotNull
    public FunctionNode intern(FunctionNode node) {
        FunctionNode simplified = node.simplify(ctx);
        String construct = ctx.getProbes().currentConstruct();
        if (construct != null && !simplified.isCached() && simplified.getNullable(GraphExts.ORIGIN) == null) {
            simplified.attachExt(GraphExts.ORIGIN, construct);
        }
        CacheResult result = ctx.internalize(simplified);
        return result.isCached() ? result.getNode() : simplified;
    }

    public FunctionNode constant(@Nullable Object value) {
        return intern(new ConstNode(ctx, value));
    }

    /**
     * {@code o()}, the empty ordered set.
     *
     * @return The node.
     */
    public FunctionNode undefined() {
        return constant(Collections.emptyList());
    }

    public StorageNode storage(StorageKind kind, Scope scope, List<String> path, @Nullable FunctionNode initialValue) {
        ValueType vt = initialValue == null ? ValueType.UNDEFINED : initialValue.resolve().getValueType();
        return (StorageNode) intern(new StorageNode(ctx, kind, scope, path, initialValue, vt));
    }

    /**
     * Writable state of an area template, initialized to {@code initialValue}.
     *
     * @param template     The template.
     * @param attribute    The attribute holding the state.
     * @param initialValue The initial value, or null.
     * @return The storage node.
     */
    public StorageNode areaState(AreaTemplate template, String attribute, @Nullable FunctionNode initialValue) {
        return storage(StorageKind.PLAIN, Scope.template(template.id),
                Arrays.asList(template.getPath(), attribute), initialValue);
    }

    public StorageNode globalVariable(String name, @Nullable FunctionNode initialValue) {
        return storage(StorageKind.PLAIN, Scope.GLOBAL, Collections.singletonList(name), initialValue);
    }

    public StorageNode messageQueue() {
        return storage(StorageKind.QUEUE, Scope.GLOBAL, Collections.singletonList("message"), null);
    }

    public StorageNode pointer() {
        return storage(StorageKind.POINTER, Scope.GLOBAL, Collections.singletonList("pointer"), null);
    }

    public FunctionNode av(Map<String, ? extends FunctionNode> attributes) {
        return intern(new AVNode(ctx, new TreeMap<>(attributes)));
    }

    public FunctionNode apply(BuiltInFunction function, FunctionNode... args) {
        return apply(function, Arrays.asList(args));
    }

    public FunctionNode apply(BuiltInFunction function, List<FunctionNode> args) {
        return intern(new FunctionApplicationNode(ctx, function, args));
    }

    /**
     * Apply a function, evaluating it with at least the given priority.
     *
     * @param function The function.
     * @param priority The priority class.
     * @param args     The arguments.
     * @return The node.
     */
    public FunctionNode applyWithPriority(BuiltInFunction function, int priority, List<FunctionNode> args) {
        return intern(new FunctionApplicationNode(ctx, function, args, priority));
    }

    public FunctionNode boolGate(FunctionNode condition, FunctionNode value) {
        return intern(new BoolGateNode(ctx, condition, value));
    }

    public FunctionNode boolMatch(FunctionNode value, FunctionNode pattern, FunctionNode result) {
        return intern(new BoolMatchNode(ctx, value, pattern, result));
    }

    /**
     * {@code cond(selector, {on: ons[i], use: uses[i]}...)}.
     *
     * @param selector The selector.
     * @param ons      The values matched against the selector.
     * @param uses     The value of each alternative.
     * @return The node.
     */
    public FunctionNode cond(FunctionNode selector, List<FunctionNode> ons, List<FunctionNode> uses) {
        return intern(new CondNode(ctx, selector, ons, uses));
    }

    public FunctionNode orderedSet(FunctionNode... elements) {
        return intern(new OrderedSetNode(ctx, Arrays.asList(elements)));
    }

    public FunctionNode range(FunctionNode low, FunctionNode high, boolean closedLower, boolean closedUpper) {
        return intern(new RangeNode(ctx, Arrays.asList(low, high), closedLower, closedUpper));
    }

    public FunctionNode negation(FunctionNode... elements) {
        return intern(new NegationNode(ctx, Arrays.asList(elements)));
    }

    public FunctionNode subString(FunctionNode... elements) {
        return intern(new SubStringNode(ctx, Arrays.asList(elements)));
    }

    public FunctionNode comparison(List<String> operators, List<FunctionNode> operands) {
        return intern(new ComparisonNode(ctx, operators, operands));
    }

    public FunctionNode classOf(String className, FunctionNode areas) {
        return intern(new ClassOfNode(ctx, className, areas));
    }

    public FunctionNode geometry(BuiltInFunction function, List<FunctionNode> args, SortedSet<Integer> templates) {
        return intern(new GeometryNode(ctx, function, args, templates));
    }

    public FunctionNode sort(FunctionNode data, List<String> keyPath, boolean ascending) {
        return intern(new SortNode(ctx, data, keyPath, ascending));
    }

    /**
     * Apply a query (an attribute path) to some data.
     *
     * @param path The attribute path.
     * @param data The data.
     * @return The node.
     */
    public FunctionNode query(List<String> path, FunctionNode data) {
        return intern(new QueryApplicationNode(ctx, path, data));
    }

    /**
     * {@code [me]}.
     *
     * @param template The template of the area.
     * @return The node.
     */
    public FunctionNode me(AreaTemplate template) {
        return intern(new MeNode(ctx, template.id));
    }

    /**
     * Project an exported attribute out of some areas.
     *
     * @param attribute The attribute, which becomes an export of every template involved.
     * @param areas     The areas.
     * @return The node.
     */
    public FunctionNode project(String attribute, FunctionNode areas) {
        return intern(new AreaProjectionNode(ctx, ctx.getTemplates().exportId(attribute), attribute, areas));
    }

    /**
     * Select the areas whose exported attribute matches.
     *
     * @param attribute The attribute to match on.
     * @param selection The values to match.
     * @param areas     The areas.
     * @return The node.
     */
    public FunctionNode select(String attribute, FunctionNode selection, FunctionNode areas) {
        return intern(new AreaSelectionNode(ctx, ctx.getTemplates().exportId(attribute), selection, areas));
    }

    public FunctionNode children(String childName, FunctionNode areas) {
        return intern(new ChildAreasNode(ctx, childName, areas));
    }

    public FunctionNode areaOfClass(String className) {
        return intern(new AreaOfClassNode(ctx, className));
    }

    /**
     * Define a closure. Its body is built when first requested, at the latest by {@link #complete()}.
     *
     * @param enclosing The scope the closure is defined in.
     * @param arity     The number of parameters.
     * @param body      Builds the body from the parameters.
     * @return The closure.
     */
    public ClosureNode closure(Scope enclosing, int arity, F<List<StorageNode>, FunctionNode> body) {
        int closureId = ctx.getTemplates().newClosure(enclosing.template, enclosing.closure);
        Scope bodyScope = Scope.of(enclosing.template, closureId);
        List<StorageNode> params = new ArrayList<>(arity);
        for (int i = 0; i < arity; i++) {
            params.add(new StorageNode(ctx, StorageKind.PARAM, bodyScope,
                    Collections.singletonList("param" + i), null, ValueType.UNKNOWN));
        }
        ClosureNode closure = new ClosureNode(ctx, enclosing, closureId, params, () -> body.apply(params));
        closures.add(closure);
        intern(closure);
        return closure;
    }

    /**
     * Get a context attribute of a template, specialized for the given qualifiers.
     * <p>
     * An attribute without a definition is {@code o()}.
     *
     * @param template  The template.
     * @param attribute The attribute.
     * @param known     What is known where the attribute is used.
     * @return The node, or a forward reference if the attribute is being defined.
     */
    public FunctionNode contextAttribute(AreaTemplate template, String attribute, KnownQualifiers known) {
        AttributeKey key = AttributeKey.of(template, attribute);
        FunctionNode node = contextAttributes.get(key);
        if (node == null) {
            StubNode stub = underConstruction.get(key);
            if (stub != null) return stub.pickQualifiedExpression(ctx, known);
            node = defineContextAttribute(template, attribute, key);
        }
        if (known.isEmpty() || !ctx.getOptions().isOptimize()) return node;
        return node.pickQualifiedExpression(ctx, known);
    }

    private FunctionNode defineContextAttribute(AreaTemplate template, String attribute, AttributeKey key) {
        ContextDefinition definition = template.getContextDefinition(attribute);
        if (definition == null) {
            FunctionNode undefined = undefined();
            contextAttributes.put(key, undefined);
            return undefined;
        }
        String construct = template.getPath() + ":" + attribute;
        StubNode stub = new StubNode(ctx, Scope.template(template.id), construct);
        underConstruction.put(key, stub);
        defining.push(key);
        ctx.getProbes().pushConstruct(construct);
        try {
            FunctionNode result = intern(definition.build(this, template, KnownQualifiers.EMPTY));
            if (!stub.isResolved()) stub.resolveTo(result);
            FunctionNode node = stub.resolve();
            contextAttributes.put(key, node);
            logger.debug("built {} as {}", construct, node);
            return node;
        } finally {
            ctx.getProbes().pop();
            defining.pop();
            underConstruction.remove(key);
        }
    }

    /**
     * Build the variant defining the context attribute currently being defined.
     * Qualifiers on that same attribute are cyclic, and are resolved against the value of
     * their alternative, or turned into a forward reference to the variant itself.
     *
     * @param template The template.
     * @param terms    The alternatives.
     * @param known    What is known.
     * @return The node.
     */
    public FunctionNode definingVariant(AreaTemplate template, List<VariantTerm> terms, KnownQualifiers known) {
        AttributeKey key = defining.peek();
        if (key == null || key.template != template.id) {
            throw new IllegalStateException("no context attribute of " + template + " is being defined");
        }
        StubNode owner = underConstruction.get(key);
        return buildVariant(template, key.attribute, owner != null && !owner.isResolved() ? owner : null, terms, known);
    }

    /**
     * Build a variant that does not define a context attribute.
     *
     * @param template The template.
     * @param terms    The alternatives.
     * @param known    What is known.
     * @return The node.
     */
    public FunctionNode variant(AreaTemplate template, List<VariantTerm> terms, KnownQualifiers known) {
        return buildVariant(template, null, null, terms, known);
    }

    private FunctionNode buildVariant(AreaTemplate template, @Nullable String ownAttribute, @Nullable StubNode owner,
                                      List<VariantTerm> terms, KnownQualifiers known) {
        boolean optimize = ctx.getOptions().isOptimize();
        KnownQualifiers context = optimize ? known : KnownQualifiers.EMPTY;
        KnownQualifiers running = context;
        List<Conjunction> guards = new ArrayList<>();
        List<FunctionNode> alts = new ArrayList<>();
        terms:
        for (VariantTerm term : terms) {
            List<SingleQualifier> qs = new ArrayList<>();
            SingleQualifier cyclic = null;
            for (QualifierTerm qt : term.qualifiers) {
                AreaTemplate target = template.getAncestor(qt.level);
                boolean self = ownAttribute != null && qt.level == 0 && qt.attribute.equals(ownAttribute);
                FunctionNode subject = self
                        ? new CycleNode(ctx, Scope.template(target.id), qt.attribute)
                        : contextAttribute(target, qt.attribute, KnownQualifiers.EMPTY);
                SingleQualifier q = new SingleQualifier(subject, qt.attribute, qt.value, target.id);
                if (optimize) {
                    TriState state = running.evaluate(q);
                    if (state == TriState.FALSE) continue terms;
                    if (state == TriState.TRUE) continue;
                }
                if (self) cyclic = q;
                qs.add(q);
            }
            Conjunction guard = Conjunction.of(qs);
            KnownQualifiers inside = optimize ? running.assume(guard) : context;
            if (inside == null) continue;
            FunctionNode alt = term.value.build(this, template, inside);
            if (cyclic != null) {
                guard = resolveCyclicQualifier(guard, cyclic, alt, owner);
                if (guard == null) continue;
            }
            guards.add(guard);
            alts.add(alt);
            if (optimize && alt.resolve().isUnmergeable()) {
                if (guard.isTrue()) break;
                running = running.assumeFalse(guard);
            }
        }
        if (alts.isEmpty()) return undefined();

        VariantNode variant = new VariantNode(ctx, new QualifiersNode(ctx, guards), alts);
        variant.setContext(context);
        variant.setRepairable(ctx.getOptions().isCycleRepair());
        variant.setOwner(owner);
        FunctionNode simplified = variant.simplify(ctx);
        if (owner != null) owner.resolveTo(simplified);
        return intern(simplified);
    }

    @Nullable
    private Conjunction resolveCyclicQualifier(Conjunction guard, SingleQualifier cyclic, FunctionNode alt, @Nullable StubNode owner) {
        String construct = ctx.getProbes().currentConstruct();
        FunctionNode value = alt.resolve();
        if (value instanceof ConstNode && ((ConstNode) value).wontChangeValue()) {
            if (cyclic.matches(((ConstNode) value).getValue())) {
                ctx.getDiagnostics().warnOnce(Diagnostic.Kind.CYCLIC_QUALIFIER,
                        "qualifier " + cyclic + " is redundant, the alternative always satisfies it", construct);
                return guard.without(cyclic);
            }
            ctx.getDiagnostics().warnOnce(Diagnostic.Kind.CYCLIC_QUALIFIER,
                    "alternative " + value + " contradicts its own qualifier " + cyclic + " and never applies", construct);
            return null;
        }
        ctx.getDiagnostics().warnOnce(Diagnostic.Kind.CYCLIC_QUALIFIER, "cycle in qualifier " + cyclic, construct);
        if (owner == null) return guard;
        return guard.without(cyclic).with(cyclic.withSubject(owner));
    }

    /**
     * Export an attribute of a template, making it visible to area navigation.
     *
     * @param template  The template.
     * @param attribute The attribute.
     * @param node      Its value.
     */
    public void export(AreaTemplate template, String attribute, FunctionNode node) {
        template.setExport(ctx.getTemplates().exportId(attribute), node);
    }

    public void classMembership(AreaTemplate template, String className, FunctionNode membership) {
        template.setClassMembership(className, membership);
    }

    /**
     * Add a write.
     *
     * @param name  The name of the handler, used in diagnostics.
     * @param upon  The trigger.
     * @param to    The target.
     * @param merge The value written.
     * @return The write.
     */
    public WriteAction write(String name, FunctionNode upon, FunctionNode to, FunctionNode merge) {
        WriteAction write = new WriteAction(name, upon, to, merge);
        writes.add(write);
        return write;
    }

    /**
     * Keep a node alive through compaction.
     *
     * @param node The node.
     */
    public void addRoot(FunctionNode node) {
        roots.add(node);
    }

    /**
     * Build every context attribute of a template.
     *
     * @param template The template.
     */
    public void buildTemplate(AreaTemplate template) {
        for (String attribute : template.getContextAttributes()) {
            contextAttribute(template, attribute, KnownQualifiers.EMPTY);
        }
    }

    /**
     * Build every context attribute of every template.
     */
    public void buildAll() {
        for (AreaTemplate template : ctx.getTemplates().getTemplates()) {
            buildTemplate(template);
        }
    }

    /**
     * Get a context attribute that has been built.
     *
     * @param template  The template.
     * @param attribute The attribute.
     * @return The node, or null if it was not built.
     */
    @Nullable
    public FunctionNode getContextAttribute(AreaTemplate template, String attribute) {
        FunctionNode node = contextAttributes.get(AttributeKey.of(template, attribute));
        return node == null ? null : node.resolve();
    }

    /**
     * Cache everything that could not be cached while it was built, build closure bodies,
     * and register roots and writes with the context.
     *
     * @throws io.github.eutro.fungraph.core.diag.CycleException If something depends on itself.
     */
    public void complete() {
        contextAttributes.replaceAll((key, node) -> ctx.cache(node));
        for (AreaTemplate template : ctx.getTemplates().getTemplates()) {
            for (Map.Entry<Integer, FunctionNode> export : template.getExports().entrySet()) {
                export.setValue(ctx.cache(export.getValue()));
            }
            for (Map.Entry<String, FunctionNode> membership : template.getClassMemberships().entrySet()) {
                membership.setValue(ctx.cache(membership.getValue()));
            }
        }
        roots.replaceAll(ctx::cache);
        for (WriteAction write : writes) {
            write.cacheNodes(ctx);
        }
        for (int i = 0; i < closures.size(); i++) {
            closures.get(i).getBody(ctx);
        }

        for (FunctionNode node : contextAttributes.values()) ctx.addRoot(node);
        for (FunctionNode node : roots) ctx.addRoot(node);
        for (ClosureNode closure : closures) ctx.addRoot(closure);
        for (WriteAction write : writes) ctx.addWrite(write);
        writes.clear();
        roots.clear();
        logger.debug("graph complete with {} nodes", ctx.size());
    }
}
