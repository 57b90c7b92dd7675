package io.github.eutro.fungraph.core.graph;

import io.github.eutro.fungraph.core.qual.Conjunction;
import io.github.eutro.fungraph.core.qual.KnownQualifiers;
import io.github.eutro.fungraph.core.scope.Scope;
import io.github.eutro.fungraph.core.types.ValueType;
import io.github.eutro.fungraph.core.util.F;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A storage leaf: state that writes can change, such as an area's writable attribute,
 * the message queue, the pointer or a closure parameter.
 */
public class StorageNode extends FunctionNode {
    public enum StorageKind {
        /**
         * Attribute state of an area template, or a global variable.
         */
        PLAIN,
        /**
         * State held by a remote data source.
         */
        REMOTE,
        /**
         * The message queue.
         */
        QUEUE,
        /**
         * A parameter of a closure.
         */
        PARAM,
        /**
         * The pointer state.
         */
        POINTER,
    }

    private final StorageKind storageKind;
    private final List<String> path;
    @Nullable
    private FunctionNode initialValue;

    public StorageNode(GraphContext ctx, StorageKind storageKind, Scope scope, List<String> path,
                       @Nullable FunctionNode initialValue, ValueType valueType) {
        super(ctx, scope, valueType, isInput(storageKind) ? PRIORITY_INPUT : PRIORITY_DEFAULT);
        this.storageKind = storageKind;
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
        this.initialValue = initialValue;
    }

    private static boolean isInput(StorageKind kind) {
        return kind == StorageKind.QUEUE || kind == StorageKind.POINTER;
    }

    public StorageKind getStorageKind() {
        return storageKind;
    }

    public List<String> getPath() {
        return path;
    }

    @Nullable
    public FunctionNode getInitialValue() {
        return initialValue;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STORAGE;
    }

    @Override
    public List<FunctionNode> getInputs() {
        return initialValue == null ? Collections.emptyList() : Collections.singletonList(initialValue);
    }

    @Override
    protected void replaceInputs(F<FunctionNode, FunctionNode> f) {
        if (initialValue != null) initialValue = f.apply(initialValue);
    }

    @Override
    protected boolean contentEquals(FunctionNode other) {
        StorageNode o = (StorageNode) other;
        return storageKind == o.storageKind && path.equals(o.path) && initialValue == o.initialValue;
    }

    @Override
    protected FunctionNode withInputs(GraphContext ctx, List<FunctionNode> inputs) {
        return this;
    }

    @Override
    protected FunctionNode specialize(GraphContext ctx, KnownQualifiers known) {
        // storage is shared state, specializing its initial value would split it
        return this;
    }

    @Override
    public boolean isPriorityFixed() {
        return true;
    }

    @Override
    public boolean isScheduledProperly(FunctionNode input) {
        // the initial value is only read once, before anything runs
        return true;
    }

    @Override
    protected List<WritableDestination> collectWritableDestinations(GraphContext ctx, List<String> path, Set<FunctionNode> visited) {
        return Collections.singletonList(new WritableDestination(this, path, Conjunction.TRUE));
    }

    @Override
    public List<String> exportArguments(F<FunctionNode, String> ref) {
        List<String> args = new ArrayList<>();
        args.add(storageKind.name().toLowerCase(Locale.ROOT));
        args.add('"' + String.join(".", path) + '"');
        if (initialValue != null) args.add(ref.apply(initialValue));
        return args;
    }

    @Override
    public String shape() {
        return super.shape() + storageKind + path;
    }

    @Override
    public String toString() {
        return super.toString() + "(" + storageKind + " " + String.join(".", path) + ")";
    }
}
