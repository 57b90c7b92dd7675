package io.github.eutro.fungraph.core.scope;

import io.github.eutro.fungraph.core.build.ContextDefinition;
import io.github.eutro.fungraph.core.graph.FunctionNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A node of the area-template tree: the static description of a class of areas, with its
 * children, its export table and its class memberships.
 */
public final class AreaTemplate {
    public final int id;
    @Nullable
    public final AreaTemplate parent;
    @Nullable
    public final String childName;
    public final int depth;

    final Map<String, AreaTemplate> children = new LinkedHashMap<>();
    private final SortedMap<Integer, FunctionNode> exports = new TreeMap<>();
    private final SortedMap<String, FunctionNode> classes = new TreeMap<>();
    private final Map<String, ContextDefinition> contextDefinitions = new LinkedHashMap<>();

    AreaTemplate(int id, @Nullable AreaTemplate parent, @Nullable String childName) {
        this.id = id;
        this.parent = parent;
        this.childName = childName;
        this.depth = parent == null ? 1 : parent.depth + 1;
    }

    /**
     * Get a child template by name.
     *
     * @param name The child name.
     * @return The child, or null.
     */
    @Nullable
    public AreaTemplate getChild(String name) {
        return children.get(name);
    }

    public Collection<AreaTemplate> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    /**
     * Get the ancestor {@code level} steps up.
     *
     * @param level The number of steps; 0 is this.
     * @return The ancestor.
     * @throws IllegalArgumentException If there is no such ancestor.
     */
    @NotNull
    public AreaTemplate getAncestor(int level) {
        AreaTemplate t = this;
        for (int i = 0; i < level; i++) {
            if (t.parent == null) {
                throw new IllegalArgumentException("template " + id + " has no ancestor at level " + level);
            }
            t = t.parent;
        }
        return t;
    }

    /**
     * Register the node computing an export of this template.
     *
     * @param exportId The small integer export id.
     * @param node     The node.
     */
    public void setExport(int exportId, FunctionNode node) {
        exports.put(exportId, node);
    }

    @Nullable
    public FunctionNode getExport(int exportId) {
        return exports.get(exportId);
    }

    public SortedMap<Integer, FunctionNode> getExports() {
        return exports;
    }

    /**
     * Register the boolean node telling whether areas of this template belong to a class.
     *
     * @param className  The class name.
     * @param membership The membership node.
     */
    public void setClassMembership(String className, FunctionNode membership) {
        classes.put(className, membership);
    }

    @Nullable
    public FunctionNode getClassMembership(String className) {
        return classes.get(className);
    }

    public SortedMap<String, FunctionNode> getClassMemberships() {
        return classes;
    }

    /**
     * Define a context attribute. It is built lazily, the first time it is requested.
     *
     * @param attribute  The attribute name.
     * @param definition How to build it.
     */
    public void defineContext(String attribute, ContextDefinition definition) {
        contextDefinitions.put(attribute, definition);
    }

    @Nullable
    public ContextDefinition getContextDefinition(String attribute) {
        return contextDefinitions.get(attribute);
    }

    public Set<String> getContextAttributes() {
        return Collections.unmodifiableSet(contextDefinitions.keySet());
    }

    /**
     * The path of child names from the root, for diagnostics.
     *
     * @return The path, e.g. {@code screenArea.list.item}.
     */
    public String getPath() {
        if (parent == null) return childName == null ? "screenArea" : childName;
        return parent.getPath() + "." + childName;
    }

    @Override
    public String toString() {
        return "template " + id + " (" + getPath() + ")";
    }
}
