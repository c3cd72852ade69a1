package com.scandrift.core.catalog;

import com.scandrift.core.client.InMemoryHostPlatformApi;
import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.fetch.FetchStatus;
import com.scandrift.core.model.CanonicalKey;
import com.scandrift.core.model.HostRepository;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HostCatalogBuilder}.
 */
class HostCatalogBuilderTest {

    @Test
    void collect_keysRepositoriesByWebUrlHostAndFullPath() {
        // Given
        InMemoryHostPlatformApi api = new InMemoryHostPlatformApi("gitlab.example.com")
            .repository(repo(1, "group/sub/service", "https://gitlab.example.com/group/sub/service", false))
            .repository(repo(2, "group/api", "https://gitlab.example.com/group/api", false));

        // When
        HostCatalog catalog = HostCatalogBuilder.collect(api);

        // Then
        assertThat(catalog.keys()).containsExactly(
            CanonicalKey.of("gitlab.example.com", "group/api"),
            CanonicalKey.of("gitlab.example.com", "group/sub/service"));
        assertThat(catalog.status()).isEqualTo(FetchStatus.COMPLETE);
        assertThat(catalog.get(CanonicalKey.of("gitlab.example.com", "group/api")))
            .hasValueSatisfying(repo -> assertThat(repo.id()).isEqualTo(2));
    }

    @Test
    void add_archivedRepository_isSkipped() {
        HostCatalog catalog = new HostCatalogBuilder("gitlab.com")
            .add(repo(1, "team/old", "https://gitlab.com/team/old", true))
            .add(repo(2, "team/live", "https://gitlab.com/team/live", false))
            .freeze();

        assertThat(catalog.keys()).containsExactly(CanonicalKey.of("gitlab.com", "team/live"));
    }

    @Test
    void add_sameKeyTwice_keepsFirstEntry() {
        HostCatalog catalog = new HostCatalogBuilder("gitlab.com")
            .add(repo(10, "team/app", "https://gitlab.com/team/app", false))
            .add(repo(11, "team/app", "https://gitlab.com/team/app", false))
            .freeze();

        assertThat(catalog.size()).isEqualTo(1);
        assertThat(catalog.entries().values()).extracting(HostRepository::id).containsExactly(10L);
    }

    @Test
    void keyOf_missingWebUrl_fallsBackToDefaultHost() {
        HostCatalogBuilder builder = new HostCatalogBuilder("https://GitLab.Example.com/");

        CanonicalKey key = builder.keyOf(repo(1, "team/app", "", false));

        assertThat(key.value()).isEqualTo("gitlab.example.com/team/app");
    }

    @Test
    void keyOf_webUrlHostWinsOverDefaultHost() {
        HostCatalogBuilder builder = new HostCatalogBuilder("gitlab.com");

        CanonicalKey key = builder.keyOf(repo(1, "team/app", "https://mirror.example.org/team/app", false));

        assertThat(key.host()).isEqualTo("mirror.example.org");
    }

    @Test
    void collect_partialListing_keepsItemsAndStatus() {
        InMemoryHostPlatformApi api = new InMemoryHostPlatformApi("gitlab.com")
            .listing(FetchResult.partial(
                List.of(repo(1, "team/app", "https://gitlab.com/team/app", false)), "v4", 503, "HTTP 503"));

        HostCatalog catalog = HostCatalogBuilder.collect(api);

        assertThat(catalog.size()).isEqualTo(1);
        assertThat(catalog.status()).isEqualTo(FetchStatus.PARTIAL);
    }

    @Test
    void add_afterFreeze_throwsException() {
        HostCatalogBuilder builder = new HostCatalogBuilder("gitlab.com");
        builder.freeze();

        assertThatThrownBy(() -> builder.add(repo(1, "team/app", "", false)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("frozen");
    }

    private static HostRepository repo(long id, String fullPath, String webUrl, boolean archived) {
        return new HostRepository(id, "main", fullPath, webUrl, webUrl, archived);
    }
}
