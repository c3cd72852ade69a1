package com.scandrift.core.catalog;

import com.scandrift.core.fetch.FetchStatus;
import com.scandrift.core.model.CanonicalKey;
import com.scandrift.core.model.HostRepository;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable map of the hosting platform's repositories by canonical key.
 *
 * <p>Built once per run by {@link HostCatalogBuilder}. Keys iterate in canonical-key order.
 */
public final class HostCatalog {

    private final SortedMap<CanonicalKey, HostRepository> repositories;
    private final FetchStatus status;

    HostCatalog(Map<CanonicalKey, HostRepository> repositories, FetchStatus status) {
        this.repositories = Collections.unmodifiableSortedMap(new TreeMap<>(repositories));
        this.status = status;
    }

    public static HostCatalog empty() {
        return new HostCatalog(Map.of(), FetchStatus.COMPLETE);
    }

    public SortedSet<CanonicalKey> keys() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(repositories.keySet()));
    }

    public Optional<HostRepository> get(CanonicalKey key) {
        return Optional.ofNullable(repositories.get(key));
    }

    public boolean contains(CanonicalKey key) {
        return repositories.containsKey(key);
    }

    public SortedMap<CanonicalKey, HostRepository> entries() {
        return repositories;
    }

    public int size() {
        return repositories.size();
    }

    public boolean isEmpty() {
        return repositories.isEmpty();
    }

    /**
     * How the repository listing ended; {@link FetchStatus#PARTIAL} means the catalog may be missing entries.
     */
    public FetchStatus status() {
        return status;
    }
}
