package io.github.eutro.fungraph.core.types;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The static type and cardinality of a node's value.
 * <p>
 * Value types form a join semilattice under {@link #merge(ValueType)}; the graph builder only merges
 * and compares them. Instances are immutable, every {@code add*} method returns a new value type.
 */
public final class ValueType {
    /**
     * The kinds of simple value a value type may describe.
     */
    public enum Base {
        BOOLEAN,
        NUMBER,
        STRING,
        RANGE,
        OBJECT,
        AREA,
        DEFUN,
        ANY_DATA,
    }

    /**
     * Stands for an infinite upper bound on the number of elements.
     */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * A value type about which nothing is known yet; the bottom of the lattice.
     */
    public static final ValueType UNKNOWN = new ValueType(true, EnumSet.noneOf(Base.class),
            Collections.emptySortedMap(), Collections.emptySortedSet(), UNBOUNDED, -1);
    /**
     * The type of {@code o()}, the empty ordered set.
     */
    public static final ValueType UNDEFINED = new ValueType(false, EnumSet.noneOf(Base.class),
            Collections.emptySortedMap(), Collections.emptySortedSet(), 0, 0);

    private final boolean unknown;
    private final EnumSet<Base> bases;
    private final SortedMap<String, ValueType> attributes;
    private final SortedSet<Integer> areas;
    private final int minSize;
    private final int maxSize;

    private ValueType(boolean unknown, EnumSet<Base> bases,
                      SortedMap<String, ValueType> attributes, SortedSet<Integer> areas,
                      int minSize, int maxSize) {
        this.unknown = unknown;
        this.bases = bases;
        this.attributes = attributes;
        this.areas = areas;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    /**
     * A single value of the given kind.
     *
     * @param base The kind.
     * @return The value type.
     */
    public static ValueType single(Base base) {
        return UNDEFINED.add(base).withSize(1, 1);
    }

    /**
     * Derive the value type of a constant.
     *
     * @param value The constant: a {@link Boolean}, {@link Number}, {@link String}, {@link RangeValue},
     *              {@link List} (an ordered set), {@link Map} (an attribute-value object) or the {@link Projector}.
     * @return Its value type.
     */
    public static ValueType fromConstant(@Nullable Object value) {
        if (value == null) {
            return UNDEFINED;
        } else if (value instanceof List) {
            List<?> os = (List<?>) value;
            ValueType vt = UNDEFINED;
            for (Object elt : os) {
                vt = vt.merge(fromConstant(elt));
            }
            return vt.withSize(os.size(), os.size());
        } else if (value instanceof Map) {
            ValueType vt = UNDEFINED.add(Base.OBJECT);
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                vt = vt.addAttribute(String.valueOf(entry.getKey()), fromConstant(entry.getValue()));
            }
            return vt.withSize(1, 1);
        } else if (value instanceof Boolean) {
            return single(Base.BOOLEAN);
        } else if (value instanceof Number) {
            return single(Base.NUMBER);
        } else if (value instanceof String) {
            return single(Base.STRING);
        } else if (value instanceof RangeValue) {
            return single(Base.RANGE);
        } else {
            return single(Base.ANY_DATA);
        }
    }

    /**
     * Add a base kind.
     *
     * @param base The kind.
     * @return The new value type.
     */
    @Contract(pure = true)
    public ValueType add(Base base) {
        EnumSet<Base> nb = EnumSet.copyOf(bases.isEmpty() ? EnumSet.noneOf(Base.class) : bases);
        nb.add(base);
        return new ValueType(false, nb, attributes, areas, sizeMinOrZero(), Math.max(maxSize, 0));
    }

    /**
     * Add an attribute; implies {@link Base#OBJECT}.
     *
     * @param name The attribute name.
     * @param type The type of its value.
     * @return The new value type.
     */
    @Contract(pure = true)
    public ValueType addAttribute(String name, ValueType type) {
        ValueType withObj = add(Base.OBJECT);
        SortedMap<String, ValueType> na = new TreeMap<>(attributes);
        na.merge(name, type, ValueType::merge);
        return new ValueType(false, withObj.bases, Collections.unmodifiableSortedMap(na), areas, withObj.minSize, withObj.maxSize);
    }

    /**
     * Add an area template; implies {@link Base#AREA}.
     *
     * @param templateId The template id.
     * @return The new value type.
     */
    @Contract(pure = true)
    public ValueType addArea(int templateId) {
        ValueType withArea = add(Base.AREA);
        SortedSet<Integer> na = new TreeSet<>(areas);
        na.add(templateId);
        return new ValueType(false, withArea.bases, attributes, Collections.unmodifiableSortedSet(na), withArea.minSize, withArea.maxSize);
    }

    /**
     * Extend the cardinality interval to include {@code [min, max]}. An unknown type stays unknown.
     *
     * @param min The minimum number of elements.
     * @param max The maximum number of elements, or {@link #UNBOUNDED}.
     * @return The new value type.
     */
    @Contract(pure = true)
    public ValueType addSize(int min, int max) {
        if (unknown) return this;
        return withSize(Math.min(minSize, min), Math.max(maxSize, max));
    }

    /**
     * Replace the cardinality interval.
     *
     * @param min The minimum number of elements.
     * @param max The maximum number of elements, or {@link #UNBOUNDED}.
     * @return The new value type.
     */
    @Contract(pure = true)
    public ValueType withSize(int min, int max) {
        return new ValueType(false, bases, attributes, areas, min, max);
    }

    private int sizeMinOrZero() {
        return unknown ? 0 : minSize;
    }

    /**
     * The least upper bound of this and {@code other}.
     *
     * @param other The other type.
     * @return The merged type.
     */
    @Contract(pure = true)
    public ValueType merge(@NotNull ValueType other) {
        if (other.unknown) return this;
        if (unknown) return other;
        EnumSet<Base> nb = EnumSet.noneOf(Base.class);
        nb.addAll(bases);
        nb.addAll(other.bases);
        SortedMap<String, ValueType> na = new TreeMap<>(attributes);
        other.attributes.forEach((k, v) -> na.merge(k, v, ValueType::merge));
        SortedSet<Integer> nareas = new TreeSet<>(areas);
        nareas.addAll(other.areas);
        return new ValueType(false, nb,
                Collections.unmodifiableSortedMap(na), Collections.unmodifiableSortedSet(nareas),
                Math.min(minSize, other.minSize), Math.max(maxSize, other.maxSize));
    }

    /**
     * Whether every value described by {@code other} is described by this.
     *
     * @param other The other type.
     * @return Whether {@code this >= other} in the lattice.
     */
    public boolean subsumes(@NotNull ValueType other) {
        if (other.unknown) return true;
        if (unknown) return false;
        if (!bases.containsAll(other.bases)) return false;
        if (!areas.containsAll(other.areas)) return false;
        if (other.minSize < minSize || other.maxSize > maxSize) return false;
        for (Map.Entry<String, ValueType> entry : other.attributes.entrySet()) {
            ValueType mine = attributes.get(entry.getKey());
            if (mine == null || !mine.subsumes(entry.getValue())) return false;
        }
        return true;
    }

    /**
     * Whether this and {@code other} are equal, or either is still unknown.
     *
     * @param other The other type.
     * @return Whether the types are compatible for caching.
     */
    public boolean isEqualOrUnknown(@NotNull ValueType other) {
        return unknown || other.unknown || equals(other);
    }

    public boolean isUnknown() {
        return unknown;
    }

    public boolean isUndefined() {
        return !unknown && maxSize == 0;
    }

    public boolean has(Base base) {
        return bases.contains(base);
    }

    public int getMinSize() {
        return minSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Whether this describes at most one strictly boolean value.
     *
     * @return Whether this is a boolean.
     */
    public boolean isStrictlyBoolean() {
        return !unknown && bases.size() == 1 && bases.contains(Base.BOOLEAN) && maxSize <= 1;
    }

    /**
     * Whether values of this type could be merged attribute-wise with others
     * (objects), as opposed to simple values, where the first value wins.
     *
     * @return Whether merging may change the value.
     */
    public boolean isPotentiallyMergeable() {
        return unknown || bases.contains(Base.OBJECT) || bases.contains(Base.ANY_DATA);
    }

    /**
     * Whether the value mixes area references with data.
     *
     * @return Whether both areas and other kinds are present.
     */
    public boolean isDataAndAreas() {
        return bases.contains(Base.AREA) && bases.size() > 1;
    }

    /**
     * Get the value type of an attribute.
     *
     * @param name The attribute name.
     * @return Its type, or {@link #UNKNOWN} if absent.
     */
    public ValueType getAttribute(String name) {
        return attributes.getOrDefault(name, UNKNOWN);
    }

    public SortedSet<Integer> getAreas() {
        return areas;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValueType that = (ValueType) o;
        return unknown == that.unknown && minSize == that.minSize && maxSize == that.maxSize
                && bases.equals(that.bases) && attributes.equals(that.attributes) && areas.equals(that.areas);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unknown, bases, attributes, areas, minSize, maxSize);
    }

    @Override
    public String toString() {
        if (unknown) return "unknown";
        StringBuilder sb = new StringBuilder();
        sb.append(bases.isEmpty() ? "undefined" : bases.toString().toLowerCase(Locale.ROOT));
        if (!attributes.isEmpty()) sb.append(attributes);
        if (!areas.isEmpty()) sb.append("@").append(areas);
        sb.append('[').append(minSize).append(',')
                .append(maxSize == UNBOUNDED ? "inf" : String.valueOf(maxSize)).append(']');
        return sb.toString();
    }
}
