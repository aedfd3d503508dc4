package com.di.martflow.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running several catalog statements, keyed by name in execution order. Every
 * attempted statement has exactly one entry.
 */
@Value
public class QueryRunReport {

    Map<String, QueryOutcome> outcomes;

    public QueryRunReport(List<QueryOutcome> outcomes) {
        Map<String, QueryOutcome> byName = new LinkedHashMap<>();
        for (QueryOutcome o : outcomes) {
            byName.put(o.getQueryName(), o);
        }
        this.outcomes = Collections.unmodifiableMap(byName);
    }

    public List<String> getSucceeded() {
        return namesWhere(true);
    }

    public List<String> getFailed() {
        return namesWhere(false);
    }

    public boolean isAllSucceeded() {
        return getFailed().isEmpty();
    }

    public int size() {
        return outcomes.size();
    }

    public QueryOutcome get(String name) {
        return outcomes.get(name);
    }

    private List<String> namesWhere(boolean succeeded) {
        List<String> names = new ArrayList<>();
        outcomes.forEach((name, o) -> {
            if (o.isSucceeded() == succeeded) {
                names.add(name);
            }
        });
        return names;
    }
}
