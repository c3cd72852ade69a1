package com.scandrift.core.catalog;

import com.scandrift.core.client.HostPlatformApi;
import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.fetch.FetchStatus;
import com.scandrift.core.identity.HttpUrlParts;
import com.scandrift.core.model.CanonicalKey;
import com.scandrift.core.model.HostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates host repositories and freezes them into a {@link HostCatalog}.
 *
 * <p>A repository is keyed by the host of its web URL, or the platform's host when the URL is unusable, plus its
 * full path. Archived repositories are skipped. The first repository seen for a key wins.
 */
public class HostCatalogBuilder {
    private static final Logger log = LoggerFactory.getLogger(HostCatalogBuilder.class);

    private final String defaultHost;
    private final Map<CanonicalKey, HostRepository> repositories = new LinkedHashMap<>();
    private FetchStatus status = FetchStatus.COMPLETE;
    private boolean frozen;

    public HostCatalogBuilder(String defaultHost) {
        this.defaultHost = defaultHost;
    }

    /**
     * Lists every repository on the platform and builds the catalog.
     *
     * @param api hosting platform
     * @return frozen catalog
     */
    public static HostCatalog collect(HostPlatformApi api) {
        HostCatalogBuilder builder = new HostCatalogBuilder(api.host());
        FetchResult<HostRepository> listing = api.listRepositories();
        if (!listing.isComplete()) {
            log.warn("Repository listing from {} ended {}: {}", api.host(), listing.status(), listing.reason());
        }
        builder.status(listing.status());
        listing.items().forEach(builder::add);
        HostCatalog catalog = builder.freeze();
        log.info("Host catalog: {} repositories from {}", catalog.size(), api.host());
        return catalog;
    }

    /**
     * Adds a repository.
     *
     * @param repository repository to add
     * @return this builder
     * @throws IllegalStateException if already frozen
     */
    public HostCatalogBuilder add(HostRepository repository) {
        checkNotFrozen();
        if (repository.archived()) {
            log.debug("Skipping archived repository {}", repository.fullPath());
            return this;
        }
        CanonicalKey key = keyOf(repository);
        HostRepository existing = repositories.putIfAbsent(key, repository);
        if (existing != null) {
            log.warn("Repository {} listed twice, keeping id {}", key, existing.id());
        }
        return this;
    }

    public HostCatalogBuilder status(FetchStatus listingStatus) {
        checkNotFrozen();
        this.status = listingStatus;
        return this;
    }

    public HostCatalog freeze() {
        checkNotFrozen();
        frozen = true;
        return new HostCatalog(repositories, status);
    }

    CanonicalKey keyOf(HostRepository repository) {
        String host = HttpUrlParts.parse(repository.webUrl())
            .map(HttpUrlParts::host)
            .orElse(defaultHost);
        return CanonicalKey.of(host, repository.fullPath());
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Host catalog already frozen");
        }
    }
}
