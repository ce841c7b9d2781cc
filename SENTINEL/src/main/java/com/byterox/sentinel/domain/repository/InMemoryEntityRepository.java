package com.byterox.sentinel.domain.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Basic in-memory repository used until a durable store is wired up.
 */
public abstract class InMemoryEntityRepository<T> implements EntityRepository<T> {

    private final Map<String, T> store = new ConcurrentHashMap<>();
    private final Function<T, String> idOf;

    protected InMemoryEntityRepository(Function<T, String> idOf) {
        this.idOf = idOf;
    }

    @Override
    public T save(T entity) {
        String id = Objects.requireNonNull(idOf.apply(entity), "entity id");
        store.put(id, entity);
        return entity;
    }

    @Override
    public Optional<T> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(store.get(id));
    }

    @Override
    public List<T> findAll() {
        return new ArrayList<>(store.values());
    }

    @Override
    public Optional<T> update(String id, UnaryOperator<T> mutation) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(store.computeIfPresent(id, (key, current) -> mutation.apply(current)));
    }

    @Override
    public boolean delete(String id) {
        return id != null && store.remove(id) != null;
    }

    @Override
    public long count() {
        return store.size();
    }
}
