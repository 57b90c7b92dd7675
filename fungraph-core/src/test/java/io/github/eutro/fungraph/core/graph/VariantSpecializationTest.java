package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.conf.GraphOptions;
import io.github.eutro.fungraph.core.qual.Conjunction;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.qual.SingleQualifier;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.scope.TemplateTree;
import io.github.eutro.fungraph.core.types.ValueType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.*;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Specializing a variant under what is known must not change its value in any environment
 * where what is known actually holds.
 */
public class VariantSpecializationTest {
    static final String[] ATTRIBUTES = {"a", "b", "c"};
    static final Object[] VALUES = {false, 0, 1, 2};
    static final Object[] PATTERNS = {true, false, 0, 1, 2, Arrays.asList(0, 1), Arrays.asList(1, 2)};
    static final String[] STORED = {"d", "e"};

    final GraphContext ctx = new GraphContext(GraphOptions.DEFAULT, new TemplateTree());
    final Map<String, StorageNode> subjects = new HashMap<>();
    final List<FunctionNode> results = new ArrayList<>();
    final List<FunctionNode> stored = new ArrayList<>();

    {
        for (String attribute : ATTRIBUTES) {
            subjects.put(attribute, new StorageNode(ctx, StorageNode.StorageKind.PLAIN, Scope.template(1),
                    Collections.singletonList(attribute), null, ValueType.UNDEFINED));
        }
        for (int i = 0; i < 4; i++) results.add(new ConstNode(ctx, 10 + i));
        for (String attribute : STORED) {
            stored.add(new StorageNode(ctx, StorageNode.StorageKind.PLAIN, Scope.template(1),
                    Collections.singletonList(attribute), null, ValueType.single(ValueType.Base.NUMBER)));
        }
    }

    static IntStream seeds() {
        return IntStream.range(0, 200);
    }

    SingleQualifier randomQualifier(Random rand) {
        String attribute = ATTRIBUTES[rand.nextInt(ATTRIBUTES.length)];
        return new SingleQualifier(subjects.get(attribute), attribute, PATTERNS[rand.nextInt(PATTERNS.length)], 1);
    }

    Conjunction randomConjunction(Random rand, int max) {
        List<SingleQualifier> qs = new ArrayList<>();
        int n = rand.nextInt(max + 1);
        for (int i = 0; i < n; i++) qs.add(randomQualifier(rand));
        return Conjunction.of(qs);
    }

    VariantNode randomVariant(Random rand) {
        int n = 1 + rand.nextInt(5);
        List<Conjunction> guards = new ArrayList<>();
        List<FunctionNode> alts = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            guards.add(randomConjunction(rand, 3));
            alts.add(results.get(rand.nextInt(results.size())));
        }
        return new VariantNode(ctx, new QualifiersNode(ctx, guards), alts);
    }

    /**
     * Neighbouring alternatives often share a value, and their guards often absorb one another
     * or differ in a single boolean test, so that simplification merges them.
     */
    VariantNode randomMergingVariant(Random rand) {
        List<FunctionNode> pool = new ArrayList<>(stored);
        pool.add(results.get(0));
        int n = 2 + rand.nextInt(5);
        List<Conjunction> guards = new ArrayList<>();
        List<FunctionNode> alts = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Conjunction guard;
            if (i == 0) {
                guard = randomConjunction(rand, 2);
            } else {
                Conjunction previous = guards.get(i - 1);
                switch (rand.nextInt(3)) {
                    case 0:
                        guard = previous.with(randomQualifier(rand));
                        break;
                    case 1:
                        guard = flipBoolean(rand, previous);
                        break;
                    default:
                        guard = randomConjunction(rand, 2);
                }
            }
            guards.add(guard);
            alts.add(i > 0 && rand.nextBoolean() ? alts.get(i - 1) : pool.get(rand.nextInt(pool.size())));
        }
        return new VariantNode(ctx, new QualifiersNode(ctx, guards), alts);
    }

    Conjunction flipBoolean(Random rand, Conjunction c) {
        for (SingleQualifier q : c) {
            if (q.isBoolean()) {
                return c.without(q).with(new SingleQualifier(q.getSubject(), q.attribute, !(Boolean) q.value, 1));
            }
        }
        String attribute = ATTRIBUTES[rand.nextInt(ATTRIBUTES.length)];
        return c.with(new SingleQualifier(subjects.get(attribute), attribute, rand.nextBoolean(), 1));
    }

    Map<String, Object> randomEnvironment(Random rand) {
        Map<String, Object> env = new HashMap<>();
        for (String attribute : ATTRIBUTES) env.put(attribute, VALUES[rand.nextInt(VALUES.length)]);
        for (String attribute : STORED) env.put(attribute, 20 + rand.nextInt(4));
        return env;
    }

    static boolean holds(Conjunction c, Map<String, Object> env) {
        for (SingleQualifier q : c) {
            if (!q.matches(env.get(q.attribute))) return false;
        }
        return true;
    }

    KnownQualifiers randomKnowledge(Random rand, Map<String, Object> env) {
        List<SingleQualifier> trueQs = new ArrayList<>();
        int nTrue = rand.nextInt(3);
        while (trueQs.size() < nTrue) {
            SingleQualifier q = randomQualifier(rand);
            if (q.matches(env.get(q.attribute))) trueQs.add(q);
        }
        List<Conjunction> falseQs = new ArrayList<>();
        int nFalse = rand.nextInt(3);
        while (falseQs.size() < nFalse) {
            Conjunction c = randomConjunction(rand, 2);
            if (!c.isTrue() && !holds(c, env)) falseQs.add(c);
        }
        return KnownQualifiers.of(Conjunction.of(trueQs), falseQs);
    }

    /**
     * The first alternative whose guard holds wins; every result here is an unmergeable number.
     */
    static Object evaluate(FunctionNode node, Map<String, Object> env) {
        FunctionNode n = node.resolve();
        if (n instanceof ConstNode) return ((ConstNode) n).getValue();
        if (n instanceof StorageNode) return env.get(((StorageNode) n).getPath().get(0));
        VariantNode v = (VariantNode) n;
        for (int i = 0; i < v.getAlternatives().size(); i++) {
            if (holds(v.getGuards().get(i), env)) return evaluate(v.getAlternatives().get(i), env);
        }
        return Collections.emptyList();
    }

    @ParameterizedTest
    @MethodSource("seeds")
    void simplifyPreservesValue(int seed) {
        Random rand = new Random(seed);
        VariantNode variant = randomVariant(rand);
        FunctionNode simplified = variant.simplify(ctx);
        for (int i = 0; i < 20; i++) {
            Map<String, Object> env = randomEnvironment(rand);
            assertEquals(evaluate(variant, env), evaluate(simplified, env),
                    () -> variant.getGuards() + " in " + env);
        }
    }

    @ParameterizedTest
    @MethodSource("seeds")
    void specializationPreservesValue(int seed) {
        Random rand = new Random(seed);
        VariantNode variant = randomVariant(rand);
        for (int i = 0; i < 20; i++) {
            Map<String, Object> env = randomEnvironment(rand);
            KnownQualifiers known = randomKnowledge(rand, env);
            FunctionNode picked = variant.pickQualifiedExpression(ctx, known);
            assertEquals(evaluate(variant, env), evaluate(picked, env),
                    () -> variant.getGuards() + " under " + known + " in " + env);
        }
    }

    @ParameterizedTest
    @MethodSource("seeds")
    void mergingNeighboursPreservesValue(int seed) {
        Random rand = new Random(seed);
        VariantNode variant = randomMergingVariant(rand);
        FunctionNode simplified = variant.simplify(ctx);
        for (int i = 0; i < 20; i++) {
            Map<String, Object> env = randomEnvironment(rand);
            assertEquals(evaluate(variant, env), evaluate(simplified, env),
                    () -> variant.getGuards() + " in " + env);
        }
    }

    @ParameterizedTest
    @MethodSource("seeds")
    void specializingMergeableNeighboursPreservesValue(int seed) {
        Random rand = new Random(seed);
        VariantNode variant = randomMergingVariant(rand);
        for (int i = 0; i < 20; i++) {
            Map<String, Object> env = randomEnvironment(rand);
            KnownQualifiers known = randomKnowledge(rand, env);
            FunctionNode picked = variant.pickQualifiedExpression(ctx, known);
            assertEquals(evaluate(variant, env), evaluate(picked, env),
                    () -> variant.getGuards() + " under " + known + " in " + env);
        }
    }

    @Test
    void neighboursWithSameValueMerge() {
        StorageNode a = subjects.get("a");
        StorageNode b = subjects.get("b");
        FunctionNode d = stored.get(0);
        SingleQualifier aSet = new SingleQualifier(a, "a", true, 1);
        SingleQualifier aUnset = new SingleQualifier(a, "a", false, 1);
        SingleQualifier bOne = new SingleQualifier(b, "b", 1, 1);
        VariantNode absorbed = new VariantNode(ctx, new QualifiersNode(ctx, Arrays.asList(
                Conjunction.of(aSet), Conjunction.of(aSet, bOne), Conjunction.of())),
                Arrays.asList(d, d, results.get(0)));
        VariantNode simplified = (VariantNode) absorbed.simplify(ctx);
        assertEquals(Arrays.asList(Conjunction.of(aSet), Conjunction.of()), simplified.getGuards());
        assertSame(d, simplified.getAlternatives().get(0));

        VariantNode complementary = new VariantNode(ctx, new QualifiersNode(ctx, Arrays.asList(
                Conjunction.of(aSet, bOne), Conjunction.of(aUnset, bOne), Conjunction.of())),
                Arrays.asList(d, d, results.get(1)));
        simplified = (VariantNode) complementary.simplify(ctx);
        assertEquals(Arrays.asList(Conjunction.of(bOne), Conjunction.of()), simplified.getGuards());
    }
}
