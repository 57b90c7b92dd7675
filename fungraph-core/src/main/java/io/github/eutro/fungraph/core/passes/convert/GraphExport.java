package io.github.eutro.fungraph.core.passes.convert;

import io.github.eutro.fungraph.core.scope.Scope;

import java.util.*;

/**
 * The export form of a graph: for each scope, the lines of its nodes in id order.
 */
public final class GraphExport {
    private final Map<Scope, List<String>> scopes = new LinkedHashMap<>();

    void add(Scope scope, String line) {
        scopes.computeIfAbsent(scope, $ -> new ArrayList<>()).add(line);
    }

    public Set<Scope> getScopes() {
        return Collections.unmodifiableSet(scopes.keySet());
    }

    /**
     * Get the lines of a scope.
     *
     * @param scope The scope.
     * @return The lines, empty if the scope has no nodes.
     */
    public List<String> getLines(Scope scope) {
        List<String> lines = scopes.get(scope);
        return lines == null ? Collections.emptyList() : Collections.unmodifiableList(lines);
    }

    public int size() {
        int size = 0;
        for (List<String> lines : scopes.values()) size += lines.size();
        return size;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Scope, List<String>> entry : scopes.entrySet()) {
            sb.append("scope ").append(entry.getKey()).append('\n');
            for (String line : entry.getValue()) {
                sb.append("  ").append(line).append('\n');
            }
        }
        return sb.toString();
    }
}
