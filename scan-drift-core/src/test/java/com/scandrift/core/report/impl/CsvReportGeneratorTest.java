package com.scandrift.core.report.impl;

import com.scandrift.core.model.ReconciliationResult;
import com.scandrift.core.renderer.GeneratedFile;
import com.scandrift.core.report.ReportSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CsvReportGenerator}.
 */
class CsvReportGeneratorTest {

    private final CsvReportGenerator generator = new CsvReportGenerator();

    @Test
    void generate_writesHeaderRow() {
        GeneratedFile file = generator.generate(ReportFixtures.sampleResult(), ReportSettings.defaults());

        assertThat(file.relativePath()).isEqualTo("scan-drift-report.csv");
        assertThat(file.content().lines().findFirst()).hasValue(
            "status,repo_key,file_path,file_type,project_id,project_name,org_id,org_name,project_url,target_id,detail");
    }

    @Test
    void rows_coverEveryFindingOnce() {
        List<CsvReportGenerator.Row> rows = generator.rows(ReportFixtures.sampleResult());

        assertThat(rows).extracting(CsvReportGenerator.Row::status).containsExactly(
            CsvReportGenerator.TRACKED,
            CsvReportGenerator.STALE,
            CsvReportGenerator.UNTRACKED,
            CsvReportGenerator.TARGET_ONLY,
            CsvReportGenerator.HOST_ONLY,
            CsvReportGenerator.UNRESOLVABLE,
            CsvReportGenerator.ORGANIZATION_FAILURE,
            CsvReportGenerator.DUPLICATE);
    }

    @Test
    void rows_staleFinding_carriesProjectColumns() {
        CsvReportGenerator.Row stale = generator.rows(ReportFixtures.sampleResult()).get(1);

        assertThat(stale.repoKey()).isEqualTo("gitlab.com/team/repo1");
        assertThat(stale.filePath()).isEqualTo("services/api/pom.xml");
        assertThat(stale.fileType()).isEqualTo("maven");
        assertThat(stale.projectId()).isEqualTo("p2");
        assertThat(stale.orgName()).isEqualTo("Platform Team");
        assertThat(stale.detail()).isEqualTo("services/api");
    }

    @Test
    void generate_organizationFailure_writesReasonInDetailColumn() {
        GeneratedFile file = generator.generate(ReportFixtures.sampleResult(), ReportSettings.defaults());

        assertThat(file.content().lines().filter(line -> line.startsWith("organization_failure")))
            .singleElement()
            .satisfies(line -> assertThat(line).contains("org-2").contains("Access denied (HTTP 403)"));
        assertThat(file.content()).doesNotContain("null");
    }

    @Test
    void generate_emptyResult_writesHeaderOnly() {
        GeneratedFile file = generator.generate(new ReconciliationResult(null, null, null, null, null, null),
            ReportSettings.defaults());

        assertThat(file.content().lines()).hasSize(1);
    }
}
