package com.scandrift.core.coverage;

import com.scandrift.core.client.HostApiException;
import com.scandrift.core.client.InMemoryHostPlatformApi;
import com.scandrift.core.model.FileCheck;
import com.scandrift.core.model.FileType;
import com.scandrift.core.model.Platform;
import com.scandrift.core.model.RepoIdentity;
import com.scandrift.core.model.SupportedFile;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileCoverageValidator}.
 */
class FileCoverageValidatorTest {

    private static final RepoIdentity REPO =
        RepoIdentity.ofFullPath(Platform.GITLAB, "gitlab.com", "team/app", "main");

    @ParameterizedTest
    @CsvSource({
        "'',            package.json,             package.json",
        "services/api,  package.json,             services/api/package.json",
        "services/api,  services/api/pom.xml,     services/api/pom.xml",
        "/services/api/, /go.mod,                 services/api/go.mod",
        "'',            /build.gradle,            build.gradle",
        "infra,         infra,                    infra",
        "'win\\dir',    'sub\\requirements.txt',  win/dir/sub/requirements.txt"
    })
    void joinPath_combinesRootAndFileOnce(String root, String file, String expected) {
        assertThat(FileCoverageValidator.joinPath(root, file)).isEqualTo(expected);
    }

    @Test
    void joinPath_nullRoot_returnsFile() {
        assertThat(FileCoverageValidator.joinPath(null, "pom.xml")).isEqualTo("pom.xml");
    }

    @Test
    void validateFile_checksResolvedPath() {
        // Given
        InMemoryHostPlatformApi host = new InMemoryHostPlatformApi("gitlab.com")
            .file("team/app", "backend/pom.xml");
        FileCoverageValidator validator = new FileCoverageValidator(host, SupportedFileTaxonomy.defaults());

        // When
        FileCheck present = validator.validateFile(REPO, "pom.xml", "backend");
        FileCheck missing = validator.validateFile(REPO, "package.json", "backend");

        // Then
        assertThat(present.path()).isEqualTo("backend/pom.xml");
        assertThat(present.exists()).isTrue();
        assertThat(missing.exists()).isFalse();
    }

    @Test
    void scanRepositoryForSupportedFiles_classifiesBlobs() {
        // Given
        InMemoryHostPlatformApi host = new InMemoryHostPlatformApi("gitlab.com")
            .file("team/app", "pom.xml")
            .file("team/app", "web/package.json")
            .file("team/app", "deploy/main.tf")
            .file("team/app", "README.md")
            .file("team/app", ".nvmrc");
        FileCoverageValidator validator = new FileCoverageValidator(host, SupportedFileTaxonomy.defaults());

        // When
        List<SupportedFile> files = validator.scanRepositoryForSupportedFiles(REPO);

        // Then
        assertThat(files).extracting(SupportedFile::path)
            .containsExactlyInAnyOrder("pom.xml", "web/package.json", "deploy/main.tf");
        assertThat(files).filteredOn(f -> f.path().equals("deploy/main.tf"))
            .singleElement()
            .satisfies(f -> assertThat(f.type()).isEqualTo(FileType.TERRAFORM));
    }

    @Test
    void scanRepositoryForSupportedFiles_missingTree_returnsEmpty() {
        FileCoverageValidator validator = new FileCoverageValidator(
            new InMemoryHostPlatformApi("gitlab.com"), SupportedFileTaxonomy.defaults());

        assertThat(validator.scanRepositoryForSupportedFiles(REPO)).isEmpty();
    }

    @Test
    void scanRepositoryForSupportedFiles_failedTree_throwsHostApiException() {
        InMemoryHostPlatformApi host = new InMemoryHostPlatformApi("gitlab.com").failTree("team/app");
        FileCoverageValidator validator = new FileCoverageValidator(host, SupportedFileTaxonomy.defaults());

        assertThatThrownBy(() -> validator.scanRepositoryForSupportedFiles(REPO))
            .isInstanceOf(HostApiException.class)
            .hasMessageContaining("team/app@main");
    }

    @Test
    void untracked_returnsSortedDistinctPathsNotTracked() {
        List<SupportedFile> supported = List.of(
            new SupportedFile("web/package.json", FileType.NPM, "package.json"),
            new SupportedFile("pom.xml", FileType.MAVEN, "pom.xml"),
            new SupportedFile("Dockerfile", FileType.DOCKER, "Dockerfile"),
            new SupportedFile("pom.xml", FileType.MAVEN, "pom.xml"));

        List<String> untracked = FileCoverageValidator.untracked(supported, Set.of("pom.xml"));

        assertThat(untracked).containsExactly("Dockerfile", "web/package.json");
    }
}
