package com.di.martflow.catalog;

import com.di.martflow.exception.QueryNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered registry of named statements. Lookup goes through the map; "run all" order comes
 * from the separate list, never from map iteration order.
 */
public final class QueryCatalog {

    private final List<QueryDefinition> ordered;
    private final Map<String, QueryDefinition> byName;

    QueryCatalog(List<QueryDefinition> definitions) {
        this.ordered = List.copyOf(definitions);
        Map<String, QueryDefinition> index = new HashMap<>();
        for (QueryDefinition d : ordered) {
            if (index.putIfAbsent(d.name(), d) != null) {
                throw new IllegalArgumentException("Duplicate query name: " + d.name());
            }
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    /** Definitions in document order. */
    public List<QueryDefinition> definitions() {
        return ordered;
    }

    /** Names in document order. */
    public List<String> names() {
        List<String> names = new ArrayList<>(ordered.size());
        for (QueryDefinition d : ordered) {
            names.add(d.name());
        }
        return names;
    }

    public Optional<QueryDefinition> find(String name) {
        return Optional.ofNullable(name == null ? null : byName.get(name));
    }

    /**
     * @throws QueryNotFoundException naming every valid identifier (sorted)
     */
    public QueryDefinition get(String name) {
        return find(name).orElseThrow(() -> {
            List<String> available = names();
            Collections.sort(available);
            return new QueryNotFoundException(name, available);
        });
    }

    public boolean contains(String name) {
        return name != null && byName.containsKey(name);
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    /**
     * Re-serialises the catalog as a document that parses back to the same mapping.
     */
    public String toDocument() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ordered.size(); i++) {
            QueryDefinition d = ordered.get(i);
            sb.append(QueryCatalogParser.MARKER_PREFIX).append(' ').append(d.name()).append('\n');
            sb.append(d.statementText());
            boolean last = i == ordered.size() - 1;
            if (!last && !d.statementText().isEmpty() && !d.statementText().endsWith("\n")) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "QueryCatalog" + names();
    }
}
