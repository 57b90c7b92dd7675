package io.github.eutro.fungraph.core.scope;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * The area-template tree plus the closure stack: the {@link ScopeRegistry} of one program.
 * <p>
 * Template 0 is the global pseudo-template, template 1 the root ("screen") area.
 */
public class TemplateTree implements ScopeRegistry {
    private final List<AreaTemplate> templates = new ArrayList<>();
    private final List<ClosureInfo> closures = new ArrayList<>();
    private final Map<String, Integer> exportIds = new LinkedHashMap<>();

    /**
     * A closure (user-defined function body) and where it is nested.
     */
    public static final class ClosureInfo {
        public final int id;
        public final int parent;
        public final int template;
        public final int depth;

        ClosureInfo(int id, int parent, int template, int depth) {
            this.id = id;
            this.parent = parent;
            this.template = template;
            this.depth = depth;
        }
    }

    public TemplateTree() {
        templates.add(null); // global
        closures.add(null); // no closure
        templates.add(new AreaTemplate(1, null, null));
    }

    @NotNull
    public AreaTemplate getRoot() {
        return templates.get(1);
    }

    @NotNull
    public AreaTemplate getTemplate(int id) {
        if (id <= 0 || id >= templates.size()) {
            throw new IllegalArgumentException("no area template " + id);
        }
        return templates.get(id);
    }

    /**
     * All real templates, in id order.
     *
     * @return The templates.
     */
    public List<AreaTemplate> getTemplates() {
        return Collections.unmodifiableList(templates.subList(1, templates.size()));
    }

    /**
     * Add a child template.
     *
     * @param parent The embedding template.
     * @param name   The child name.
     * @return The new template.
     */
    public AreaTemplate addChild(AreaTemplate parent, String name) {
        if (parent.children.containsKey(name)) {
            throw new IllegalArgumentException("duplicate child " + name + " in " + parent);
        }
        AreaTemplate child = new AreaTemplate(templates.size(), parent, name);
        templates.add(child);
        parent.children.put(name, child);
        return child;
    }

    /**
     * Open a new closure.
     *
     * @param template The template it is defined in.
     * @param parent   The enclosing closure, or {@link Scope#NO_CLOSURE}.
     * @return The closure id.
     */
    public int newClosure(int template, int parent) {
        int depth = parent == Scope.NO_CLOSURE ? 1 : getClosure(parent).depth + 1;
        int id = closures.size();
        closures.add(new ClosureInfo(id, parent, template, depth));
        return id;
    }

    @NotNull
    public ClosureInfo getClosure(int id) {
        if (id <= 0 || id >= closures.size()) {
            throw new IllegalArgumentException("no closure " + id);
        }
        return closures.get(id);
    }

    public int getClosureCount() {
        return closures.size() - 1;
    }

    /**
     * Get the export id for an attribute path, allocating one on first use. Export ids are
     * shared by all templates, so navigation nodes can refer to them without knowing the
     * target template.
     *
     * @param path The attribute path, e.g. {@code "content.value"}.
     * @return The export id.
     */
    public int exportId(String path) {
        return exportIds.computeIfAbsent(path, $ -> exportIds.size());
    }

    @Override
    public boolean scopeNests(int inner, int outer) {
        if (outer == Scope.GLOBAL_TEMPLATE) return true;
        if (inner == Scope.GLOBAL_TEMPLATE) return false;
        for (AreaTemplate t = getTemplate(inner); t != null; t = t.parent) {
            if (t.id == outer) return true;
        }
        return false;
    }

    @Override
    public boolean closureEncloses(int inner, int outer) {
        if (outer == Scope.NO_CLOSURE) return true;
        for (int c = inner; c != Scope.NO_CLOSURE; c = getClosure(c).parent) {
            if (c == outer) return true;
        }
        return false;
    }

    @Override
    public int templateDepth(int template) {
        return template == Scope.GLOBAL_TEMPLATE ? 0 : getTemplate(template).depth;
    }
}
