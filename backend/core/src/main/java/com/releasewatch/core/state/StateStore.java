package com.releasewatch.core.state;

import com.releasewatch.core.model.StateRecord;

import java.util.Optional;
import java.util.Set;

/**
 * Durable last-observed state, one record per entity key. Writes for distinct keys are
 * independent; {@link #put} is an atomic upsert and {@link #reset} atomically clears every record.
 */
public interface StateStore {
    Optional<StateRecord> get(String entityKey);

    /**
     * @throws PersistenceException when the record could not be made durable
     */
    void put(StateRecord record);

    void reset();

    Set<String> keys();
}
