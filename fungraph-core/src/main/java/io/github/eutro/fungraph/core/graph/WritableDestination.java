package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.qual.Conjunction;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A storage leaf a write may land on: the attribute path below the storage node,
 * and the condition under which the write goes there.
 */
public final class WritableDestination {
    public final StorageNode storage;
    public final List<String> path;
    public final Conjunction guard;

    public WritableDestination(StorageNode storage, List<String> path, Conjunction guard) {
        this.storage = storage;
        this.path = Collections.unmodifiableList(path);
        this.guard = guard;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WritableDestination that = (WritableDestination) o;
        return storage == that.storage && path.equals(that.path) && guard.equals(that.guard);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(storage), path, guard);
    }

    @Override
    public String toString() {
        return storage + (path.isEmpty() ? "" : "." + String.join(".", path)) + " if " + guard;
    }
}
