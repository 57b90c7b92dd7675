package io.github.eutro.fungraph.core.build;

import io.github.eutro.fungraph.core.graph.*;
import io.github.eutro.fungraph.core.types.ValueType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A write: when {@code upon} changes, the value of {@code merge} is written to
 * wherever {@code to} points.
 * <p>
 * Before it can run a write is lowered to the storage leaves it lands on.
 * A write whose target is constant, or cannot be traced to storage, becomes a no-op with a warning.
 */
public final class WriteAction {
    private static final Logger logger = LogManager.getLogger();

    private final String name;
    private FunctionNode upon;
    private FunctionNode to;
    private FunctionNode merge;
    private List<WritableDestination> destinations = Collections.emptyList();
    private boolean noOp = false;

    public WriteAction(@NotNull String name, @NotNull FunctionNode upon, @NotNull FunctionNode to, @NotNull FunctionNode merge) {
        this.name = name;
        this.upon = upon;
        this.to = to;
        this.merge = merge;
    }

    public String getName() {
        return name;
    }

    public FunctionNode getUpon() {
        return upon;
    }

    public FunctionNode getTo() {
        return to;
    }

    public FunctionNode getMerge() {
        return merge;
    }

    public List<FunctionNode> getNodes() {
        return Arrays.asList(upon, to, merge);
    }

    /**
     * Replace the nodes of this write with their cached versions.
     *
     * @param ctx The graph context.
     */
    void cacheNodes(GraphContext ctx) {
        upon = ctx.cache(upon);
        to = ctx.cache(to);
        merge = ctx.cache(merge);
    }

    /**
     * Find the storage this write lands on, and widen the type of each to include what is written.
     *
     * @param ctx The graph context.
     * @return The destinations; empty if the write is a no-op.
     */
    public List<WritableDestination> lower(GraphContext ctx) {
        FunctionNode target = to.resolve();
        List<WritableDestination> dests;
        if (target instanceof ConstNode) {
            ctx.warnUnsupportedWrite("cannot write to constant " + target, name);
            dests = null;
        } else {
            dests = target.extractWritableDestinations(ctx, Collections.emptyList(),
                    Collections.newSetFromMap(new IdentityHashMap<>()));
            if (dests == null || dests.isEmpty()) {
                ctx.warnUnsupportedWrite("cannot write to " + target, name);
                dests = null;
            }
        }
        if (dests == null) {
            noOp = true;
            destinations = Collections.emptyList();
            return destinations;
        }
        ValueType written = merge.resolve().getValueType();
        for (WritableDestination dest : dests) {
            dest.storage.widenValueType(wrap(written, dest.path));
        }
        logger.debug("write {} lands on {}", name, dests);
        noOp = false;
        destinations = Collections.unmodifiableList(dests);
        return destinations;
    }

    private static ValueType wrap(ValueType type, List<String> path) {
        ValueType vt = type;
        for (int i = path.size() - 1; i >= 0; i--) {
            vt = ValueType.UNDEFINED.addAttribute(path.get(i), vt).withSize(1, 1);
        }
        return vt;
    }

    public List<WritableDestination> getDestinations() {
        return destinations;
    }

    public boolean isNoOp() {
        return noOp;
    }

    @Override
    public String toString() {
        return "write " + name + " upon " + upon + " to " + to;
    }
}
