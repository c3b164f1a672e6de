package org.healthdata.reporting.service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link SavedQueryStore} kept in a map, for tests and for running without a persistent store.
 */
public class InMemorySavedQueryStore implements SavedQueryStore {
    private final Map<String, SavedQuery> queries = new ConcurrentHashMap<>();

    @Override
    public Optional<SavedQuery> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(queries.get(id));
    }

    @Override
    public SavedQuery save(SavedQuery query) {
        if (query.id() == null || query.id().isBlank()) {
            throw new IllegalArgumentException("Saved query id is required");
        }
        queries.put(query.id(), query);
        return query;
    }

    public int size() {
        return queries.size();
    }
}
