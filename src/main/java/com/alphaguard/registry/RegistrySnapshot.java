package com.alphaguard.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Immutable, versioned view of a registry's entity set.
 *
 * <p>Writers never modify a snapshot; they build the next one with
 * {@link #with(String, Object)} or {@link #of(Collection, Function, long)}
 * and publish it with an atomic reference swap. A reader holding a snapshot
 * therefore sees either the state before an update or after it, never a mix.
 *
 * <p>Entities are kept in identifier order so iteration is deterministic.
 */
public final class RegistrySnapshot<T> {

    private static final RegistrySnapshot<?> EMPTY = new RegistrySnapshot<>(new TreeMap<>(), 0L);

    private final SortedMap<String, T> byId;
    private final long version;

    private RegistrySnapshot(SortedMap<String, T> byId, long version) {
        this.byId = Collections.unmodifiableSortedMap(byId);
        this.version = version;
    }

    @SuppressWarnings("unchecked")
    public static <T> RegistrySnapshot<T> empty() {
        return (RegistrySnapshot<T>) EMPTY;
    }

    public static <T> RegistrySnapshot<T> of(Collection<T> entities, Function<T, String> idFn, long version) {
        SortedMap<String, T> map = new TreeMap<>();
        for (T entity : entities) {
            map.put(idFn.apply(entity), entity);
        }
        return new RegistrySnapshot<>(map, version);
    }

    /** Returns a new snapshot with the entity added or replaced and the version bumped. */
    public RegistrySnapshot<T> with(String id, T entity) {
        SortedMap<String, T> next = new TreeMap<>(byId);
        next.put(id, entity);
        return new RegistrySnapshot<>(next, version + 1);
    }

    public Optional<T> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public List<T> values() {
        return List.copyOf(byId.values());
    }

    public Map<String, T> asMap() {
        return byId;
    }

    public int size() {
        return byId.size();
    }

    public long getVersion() {
        return version;
    }
}
