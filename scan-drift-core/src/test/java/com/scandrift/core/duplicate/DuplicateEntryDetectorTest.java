package com.scandrift.core.duplicate;

import com.scandrift.core.model.DuplicateGroup;
import com.scandrift.core.model.ScanProject;
import com.scandrift.core.model.StaleDuplicate;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DuplicateEntryDetector}.
 */
class DuplicateEntryDetectorTest {

    private final DuplicateEntryDetector detector = new DuplicateEntryDetector();

    @Test
    void detect_equivalentPaths_groupTogetherAndKeepNewest() {
        // Given
        List<ScanProject> projects = List.of(
            project("p1", "team/app:./package.json", "t1", "2024-01-01T00:00:00Z"),
            project("p2", "team/app:package.json", "t1", "2024-03-01T00:00:00Z"),
            project("p3", "team/app:../x/../package.json", "t1", "2024-02-01T00:00:00Z"));

        // When
        List<DuplicateGroup> groups = detector.detect(projects);

        // Then
        assertThat(groups).singleElement().satisfies(group -> {
            assertThat(group.targetId()).isEqualTo("t1");
            assertThat(group.identifier()).isEqualTo("package.json");
            assertThat(group.canonical().id()).isEqualTo("p2");
            assertThat(group.stale()).extracting(s -> s.project().id()).containsExactly("p3", "p1");
            assertThat(group.stale()).allSatisfy(s -> {
                assertThat(s.duplicateOfId()).isEqualTo("p2");
                assertThat(s.reason()).isEqualTo(StaleDuplicate.NEWER_VERSION_EXISTS);
            });
            assertThat(group.size()).isEqualTo(3);
        });
    }

    @Test
    void detect_missingCreationDate_sortsLast() {
        List<ScanProject> projects = List.of(
            project("p1", "app:pom.xml", "t1", null),
            project("p2", "app:pom.xml", "t1", "2023-01-01T00:00:00Z"));

        List<DuplicateGroup> groups = detector.detect(projects);

        assertThat(groups).singleElement().satisfies(group -> {
            assertThat(group.canonical().id()).isEqualTo("p2");
            assertThat(group.stale()).extracting(s -> s.project().id()).containsExactly("p1");
        });
    }

    @Test
    void detect_sameIdentifierInDifferentTargets_isNotDuplicate() {
        List<ScanProject> projects = List.of(
            project("p1", "app:pom.xml", "t1", "2024-01-01T00:00:00Z"),
            project("p2", "app:pom.xml", "t2", "2024-01-02T00:00:00Z"));

        assertThat(detector.detect(projects)).isEmpty();
    }

    @Test
    void detect_projectsWithoutSeparatorOrTarget_areIgnored() {
        List<ScanProject> projects = List.of(
            project("p1", "no-separator", "t1", "2024-01-01T00:00:00Z"),
            project("p2", "no-separator", "t1", "2024-01-02T00:00:00Z"),
            project("p3", "app:pom.xml", null, "2024-01-01T00:00:00Z"),
            project("p4", "app:pom.xml", "", "2024-01-02T00:00:00Z"));

        assertThat(detector.detect(projects)).isEmpty();
    }

    @Test
    void detect_normalizationDisabled_keepsLiteralIdentifiers() {
        DuplicateEntryDetector literal = new DuplicateEntryDetector(new DuplicatePolicy(":", false));
        List<ScanProject> projects = List.of(
            project("p1", "app:./pom.xml", "t1", "2024-01-01T00:00:00Z"),
            project("p2", "app:pom.xml", "t1", "2024-01-02T00:00:00Z"));

        assertThat(literal.detect(projects)).isEmpty();
    }

    private static ScanProject project(String id, String name, String targetId, String created) {
        return new ScanProject(id, name, "npm", created == null ? null : Instant.parse(created), "org-1",
            targetId, null, null, null, List.of());
    }
}
