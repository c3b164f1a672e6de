package org.healthdata.reporting.service;

import java.util.Optional;

/**
 * Port to wherever saved queries are persisted.
 */
public interface SavedQueryStore {
    Optional<SavedQuery> findById(String id);

    SavedQuery save(SavedQuery query);
}
