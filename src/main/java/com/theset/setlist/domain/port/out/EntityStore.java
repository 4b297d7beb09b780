package com.theset.setlist.domain.port.out;

import com.theset.setlist.domain.model.WriteOutcome;
import java.util.Optional;

/**
 * Store port for records keyed by entity id.
 * Writes never throw: failures come back as a tagged {@link WriteOutcome},
 * with permission denial distinguished from every other failure.
 */
public interface EntityStore<T> {

    /**
     * Point lookup. Absent records and lookup failures both yield Optional.empty()
     */
    Optional<T> findById(String id);

    /**
     * Insert-or-update keyed by id
     */
    WriteOutcome<T> upsert(T record);

    /**
     * Insert only, never update. Used when update privileges are denied.
     */
    WriteOutcome<T> insert(T record);
}
