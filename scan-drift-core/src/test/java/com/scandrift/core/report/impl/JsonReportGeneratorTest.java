package com.scandrift.core.report.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scandrift.core.renderer.GeneratedFile;
import com.scandrift.core.report.ReportSettings;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JsonReportGenerator}.
 */
class JsonReportGeneratorTest {

    private final JsonReportGenerator generator = new JsonReportGenerator();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void generate_writesSummaryAndBuckets() throws Exception {
        // When
        GeneratedFile file = generator.generate(ReportFixtures.sampleResult(),
            new ReportSettings(null, ReportFixtures.GENERATED_AT, Map.of()));
        JsonNode root = mapper.readTree(file.content());

        // Then
        assertThat(file.relativePath()).isEqualTo("scan-drift-report.json");
        assertThat(file.contentType()).isEqualTo("application/json");
        assertThat(root.path("generatedAt").asText()).isEqualTo("2024-06-01T12:30:00Z");
        assertThat(root.path("summary").path("matched").asInt()).isEqualTo(1);
        assertThat(root.path("summary").path("staleDuplicates").asInt()).isEqualTo(1);
        assertThat(root.path("targetOnly").get(0).path("key").asText()).isEqualTo("gitlab.com/team/repo2");
        assertThat(root.path("hostOnly").get(0).path("key").asText()).isEqualTo("gitlab.com/team/repo3");
        assertThat(root.path("unresolvable").get(0).path("reason").asText()).isEqualTo("NO_URL");
        assertThat(root.path("organizationFailures").get(0).path("orgId").asText()).isEqualTo("org-2");
        assertThat(root.path("duplicateGroups").get(0).path("identifier").asText()).isEqualTo("package.json");
    }

    @Test
    void generate_matchedRepository_includesFileDetails() throws Exception {
        JsonNode matched = mapper.readTree(
            generator.generate(ReportFixtures.sampleResult(), ReportSettings.defaults()).content())
            .path("matched").get(0);

        assertThat(matched.path("key").asText()).isEqualTo("gitlab.com/team/repo1");
        assertThat(matched.path("platform").asText()).isEqualTo("GITLAB");
        assertThat(matched.path("hasDrift").asBoolean()).isTrue();
        assertThat(matched.path("untrackedFiles").get(0).asText()).isEqualTo("Dockerfile");
        assertThat(matched.path("supportedFiles")).hasSize(2);
        assertThat(matched.path("supportedFiles").get(1).path("category").asText()).isEqualTo("CONTAINER");
    }
}
