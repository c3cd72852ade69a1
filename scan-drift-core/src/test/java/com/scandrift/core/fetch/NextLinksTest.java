package com.scandrift.core.fetch;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NextLinks}.
 */
class NextLinksTest {

    private static final String BASE = "https://api.snyk.io/rest";
    private static final String CURRENT = BASE + "/orgs/o1/projects?version=2024-06-21";

    @Test
    void resolve_absoluteLink_passesThrough() {
        assertThat(NextLinks.resolve(BASE, CURRENT, "https://other.example.com/x?y=1"))
            .isEqualTo("https://other.example.com/x?y=1");
    }

    @Test
    void resolve_hostRelativeLinkWithoutBasePath_prefixesBasePath() {
        assertThat(NextLinks.resolve(BASE, CURRENT, "/orgs/o1/projects?starting_after=abc"))
            .isEqualTo("https://api.snyk.io/rest/orgs/o1/projects?starting_after=abc");
    }

    @Test
    void resolve_hostRelativeLinkWithBasePath_keepsIt() {
        assertThat(NextLinks.resolve(BASE, CURRENT, "/rest/orgs/o1/projects?starting_after=abc"))
            .isEqualTo("https://api.snyk.io/rest/orgs/o1/projects?starting_after=abc");
    }

    @Test
    void resolve_pathRelativeLink_resolvesAgainstCurrentUrl() {
        assertThat(NextLinks.resolve(BASE, CURRENT, "projects?starting_after=abc"))
            .isEqualTo("https://api.snyk.io/rest/orgs/o1/projects?starting_after=abc");
    }

    @Test
    void missingParams_returnsOnlyParamsAbsentFromLink() {
        Map<String, String> base = new LinkedHashMap<>();
        base.put("version", "2024-06-21");
        base.put("limit", "100");

        Map<String, String> missing = NextLinks.missingParams(BASE + "/orgs?version=2024-06-21&starting_after=x", base);

        assertThat(missing).containsExactly(Map.entry("limit", "100"));
    }
}
