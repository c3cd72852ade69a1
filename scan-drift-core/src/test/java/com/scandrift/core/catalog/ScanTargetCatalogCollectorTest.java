package com.scandrift.core.catalog;

import com.scandrift.core.client.InMemoryScanToolApi;
import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.identity.RepoIdentityResolver;
import com.scandrift.core.model.CanonicalKey;
import com.scandrift.core.model.ScanTarget;
import com.scandrift.core.model.UnresolvableReason;
import com.scandrift.core.model.UnresolvableTarget;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScanTargetCatalogCollector}.
 */
class ScanTargetCatalogCollectorTest {

    private static final CanonicalKey SERVICE = CanonicalKey.of("gitlab.com", "platform/backend/service");

    @Test
    void collect_urlVariantsOfSameRepo_shareOneKey() {
        // Given
        InMemoryScanToolApi api = new InMemoryScanToolApi()
            .targets("org-1",
                target("org-1", "t1", "https://gitlab.com/platform/backend/service"),
                target("org-1", "t2", "git@gitlab.com:platform/backend/service.git"))
            .targets("org-2",
                target("org-2", "t3", "https://gitlab.com/platform/backend/service/-/tree/develop"));

        // When
        ScanTargetCatalog catalog = collector(api).collect(List.of("org-1", "org-2"));

        // Then
        assertThat(catalog.keys()).containsExactly(SERVICE);
        assertThat(catalog.targets(SERVICE))
            .extracting(ScanTarget::targetId)
            .containsExactly("t1", "t2", "t3");
        assertThat(catalog.targets(SERVICE)).allSatisfy(t -> assertThat(t.identity()).isNotNull());
    }

    @Test
    void route_targetWithoutUrl_isUnresolvableNoUrl() {
        ScanTargetCatalogBuilder builder = new ScanTargetCatalogBuilder();

        collector(new InMemoryScanToolApi()).route(target("org-1", "t1", null), builder);

        assertThat(builder.freeze().unresolvable())
            .extracting(UnresolvableTarget::reason)
            .containsExactly(UnresolvableReason.NO_URL);
    }

    @Test
    void route_garbageUrl_isUnresolvableUnparseable() {
        ScanTargetCatalogBuilder builder = new ScanTargetCatalogBuilder();

        collector(new InMemoryScanToolApi()).route(target("org-1", "t1", "not a url"), builder);

        ScanTargetCatalog catalog = builder.freeze();
        assertThat(catalog.keys()).isEmpty();
        assertThat(catalog.unresolvable())
            .extracting(UnresolvableTarget::reason)
            .containsExactly(UnresolvableReason.UNPARSEABLE_URL);
    }

    @Test
    void route_localPath_isUnresolvableLocalPath() {
        ScanTargetCatalogBuilder builder = new ScanTargetCatalogBuilder();

        collector(new InMemoryScanToolApi()).route(target("org-1", "t1", "/home/ci/builds/service"), builder);

        assertThat(builder.freeze().unresolvable()).singleElement().satisfies(entry -> {
            assertThat(entry.reason()).isEqualTo(UnresolvableReason.LOCAL_PATH);
            assertThat(entry.target().identity().local()).isTrue();
        });
    }

    @Test
    void collect_deniedOrganization_recordsFailureAndContinues() {
        // Given
        InMemoryScanToolApi api = new InMemoryScanToolApi()
            .deny("org-1", "Access denied (HTTP 403)")
            .targets("org-2", target("org-2", "t1", "https://gitlab.com/platform/backend/service"));

        // When
        ScanTargetCatalog catalog = collector(api).collect(List.of("org-1", "org-2"));

        // Then
        assertThat(catalog.organizationFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.orgId()).isEqualTo("org-1");
            assertThat(failure.reason()).isEqualTo("Access denied (HTTP 403)");
        });
        assertThat(catalog.keys()).containsExactly(SERVICE);
    }

    @Test
    void collect_targetsUnavailable_recordsFailure() {
        InMemoryScanToolApi api = new InMemoryScanToolApi()
            .targets("org-1", FetchResult.<ScanTarget>unavailable(404, "No version served targets"));

        ScanTargetCatalog catalog = collector(api).collect(List.of("org-1"));

        assertThat(catalog.keys()).isEmpty();
        assertThat(catalog.organizationFailures()).singleElement()
            .satisfies(failure -> assertThat(failure.reason()).startsWith("Targets unavailable"));
    }

    @Test
    void collect_partialTargetListing_keepsGatheredTargets() {
        InMemoryScanToolApi api = new InMemoryScanToolApi()
            .targets("org-1", FetchResult.partial(
                List.of(target("org-1", "t1", "https://gitlab.com/platform/backend/service")),
                "2024-10-15", 503, "HTTP 503"));

        ScanTargetCatalog catalog = collector(api).collect(List.of("org-1"));

        assertThat(catalog.keys()).containsExactly(SERVICE);
        assertThat(catalog.organizationFailures()).isEmpty();
    }

    @Test
    void collect_noOrganizations_returnsEmptyCatalog() {
        ScanTargetCatalog catalog = collector(new InMemoryScanToolApi()).collect(List.of());

        assertThat(catalog.keys()).isEmpty();
        assertThat(catalog.unresolvable()).isEmpty();
    }

    private static ScanTargetCatalogCollector collector(InMemoryScanToolApi api) {
        return new ScanTargetCatalogCollector(api, RepoIdentityResolver.defaults(), List.of("gitlab", "cli"));
    }

    private static ScanTarget target(String orgId, String id, String url) {
        return new ScanTarget(orgId, id, "target-" + id, url, "gitlab", null);
    }
}
