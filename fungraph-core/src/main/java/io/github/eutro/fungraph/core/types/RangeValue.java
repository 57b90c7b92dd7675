package io.github.eutro.fungraph.core.types;

import java.util.Objects;

/**
 * A numeric or string range, {@code r(low, high)}, with open or closed bounds.
 * <p>
 * Bounds are unordered on construction: {@code r(5, 1)} is the same range as {@code r(1, 5)}.
 */
public final class RangeValue {
    public final Comparable<Object> low;
    public final Comparable<Object> high;
    public final boolean closedLow;
    public final boolean closedHigh;

    @SuppressWarnings("unchecked")
    public RangeValue(Comparable<?> a, Comparable<?> b, boolean closedLow, boolean closedHigh) {
        Comparable<Object> ca = (Comparable<Object>) normalize(a);
        Comparable<Object> cb = (Comparable<Object>) normalize(b);
        if (ca.compareTo(cb) <= 0) {
            this.low = ca;
            this.high = cb;
            this.closedLow = closedLow;
            this.closedHigh = closedHigh;
        } else {
            this.low = cb;
            this.high = ca;
            this.closedLow = closedHigh;
            this.closedHigh = closedLow;
        }
    }

    public RangeValue(Comparable<?> a, Comparable<?> b) {
        this(a, b, true, true);
    }

    private static Comparable<?> normalize(Comparable<?> c) {
        return c instanceof Number ? Double.valueOf(((Number) c).doubleValue()) : c;
    }

    /**
     * Whether a simple value lies in this range.
     *
     * @param value The value.
     * @return Whether it lies inside the bounds; false for incomparable values.
     */
    public boolean contains(Object value) {
        Object v = value instanceof Number ? Double.valueOf(((Number) value).doubleValue()) : value;
        if (v == null || v.getClass() != low.getClass()) return false;
        int lc = low.compareTo(v);
        int hc = high.compareTo(v);
        return (lc < 0 || lc == 0 && closedLow) && (hc > 0 || hc == 0 && closedHigh);
    }

    /**
     * Whether every value of {@code other} lies in this range.
     *
     * @param other The other range.
     * @return Whether it is included.
     */
    public boolean includes(RangeValue other) {
        if (other.low.getClass() != low.getClass()) return false;
        int lc = low.compareTo(other.low);
        int hc = high.compareTo(other.high);
        boolean lowOk = lc < 0 || lc == 0 && (closedLow || !other.closedLow);
        boolean highOk = hc > 0 || hc == 0 && (closedHigh || !other.closedHigh);
        return lowOk && highOk;
    }

    /**
     * Whether this range and {@code other} have no value in common.
     *
     * @param other The other range.
     * @return Whether they are disjoint.
     */
    public boolean isDisjoint(RangeValue other) {
        if (other.low.getClass() != low.getClass()) return true;
        int c1 = high.compareTo(other.low);
        int c2 = other.high.compareTo(low);
        return c1 < 0 || c1 == 0 && !(closedHigh && other.closedLow)
                || c2 < 0 || c2 == 0 && !(other.closedHigh && closedLow);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RangeValue that = (RangeValue) o;
        return closedLow == that.closedLow && closedHigh == that.closedHigh
                && low.equals(that.low) && high.equals(that.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(low, high, closedLow, closedHigh);
    }

    @Override
    public String toString() {
        return (closedLow ? "r(" : "Rco(") + low + ", " + high + (closedHigh ? ")" : "[");
    }
}
