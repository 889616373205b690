package io.trigger4j.store;

import io.trigger4j.core.Trigger;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of triggers. Implementations wrap data-access failures in
 * {@link io.trigger4j.core.StoreException}.
 */
public interface TriggerStore {

    /**
     * Insert a trigger that has no id yet and return it with the assigned id.
     */
    Trigger insert(Trigger trigger);

    Optional<Trigger> findById(String id);

    Optional<Trigger> findByIdAndOwner(String id, String ownerId);

    /**
     * All triggers of an owner in insertion order.
     */
    List<Trigger> findByOwner(String ownerId);

    List<Trigger> findAllScheduled();

    /**
     * @return true if a row was removed
     */
    boolean deleteById(String id);
}
