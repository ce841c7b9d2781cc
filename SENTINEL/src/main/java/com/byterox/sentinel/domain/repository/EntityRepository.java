package com.byterox.sentinel.domain.repository;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository abstraction shared by SENTINEL's aggregates.
 */
public interface EntityRepository<T> {

    /**
     * Persist the given entity. Existing entities with the same ID are replaced.
     */
    T save(T entity);

    /**
     * Look up an entity by ID.
     */
    Optional<T> findById(String id);

    /**
     * Retrieve all entities.
     */
    List<T> findAll();

    /**
     * Apply a mutation atomically with respect to other updates of the same ID.
     *
     * @return the updated entity, or empty if the ID is unknown
     */
    Optional<T> update(String id, UnaryOperator<T> mutation);

    /**
     * Remove an entity.
     *
     * @return true if something was removed
     */
    boolean delete(String id);

    default boolean existsById(String id) {
        return findById(id).isPresent();
    }

    default long count() {
        return findAll().size();
    }
}
