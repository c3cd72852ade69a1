package com.scandrift.core.identity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link UrlNormalizer}.
 */
class UrlNormalizerTest {

    @Test
    void normalize_httpTrailingSlashAndGitSuffix_collapsesToHttps() {
        assertThat(UrlNormalizer.normalize("http://GitLab.com/group/repo.git/"))
            .isEqualTo("https://gitlab.com/group/repo");
    }

    @Test
    void normalize_nonHttp_returnsTrimmedInput() {
        assertThat(UrlNormalizer.normalize("  git@gitlab.com:a/b.git ")).isEqualTo("git@gitlab.com:a/b.git");
    }

    @Test
    void sameRepository_equivalentUrls_returnsTrue() {
        assertThat(UrlNormalizer.sameRepository(
            "https://gitlab.com/group/repo", "http://gitlab.com/group/repo.git")).isTrue();
    }

    @Test
    void sameRepository_blankOrDifferent_returnsFalse() {
        assertThat(UrlNormalizer.sameRepository(null, "https://gitlab.com/a/b")).isFalse();
        assertThat(UrlNormalizer.sameRepository("", "")).isFalse();
        assertThat(UrlNormalizer.sameRepository("https://gitlab.com/a/b", "https://gitlab.com/a/c")).isFalse();
    }
}
