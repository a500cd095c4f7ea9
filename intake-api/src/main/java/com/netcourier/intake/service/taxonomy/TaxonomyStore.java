package com.netcourier.intake.service.taxonomy;

import java.util.List;
import java.util.Optional;

/**
 * Ordered set of known document types.
 */
public interface TaxonomyStore {

    List<TypeEntry> findAll();

    /**
     * Case-insensitive lookup by type name.
     */
    Optional<TypeEntry> findByName(String name);

    /**
     * Appends the entry unless an entry with exactly the same name exists.
     *
     * @return the taxonomy after the call
     */
    List<TypeEntry> appendIfAbsent(TypeEntry entry);
}
