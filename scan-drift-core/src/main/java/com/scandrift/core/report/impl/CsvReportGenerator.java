package com.scandrift.core.report.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.scandrift.core.model.DuplicateGroup;
import com.scandrift.core.model.FileFinding;
import com.scandrift.core.model.HostOnlyRepository;
import com.scandrift.core.model.MatchedRepository;
import com.scandrift.core.model.OrganizationFailure;
import com.scandrift.core.model.ReconciliationResult;
import com.scandrift.core.model.ScanTarget;
import com.scandrift.core.model.StaleDuplicate;
import com.scandrift.core.model.TargetOnlyRepository;
import com.scandrift.core.model.TrackedFile;
import com.scandrift.core.model.UnresolvableTarget;
import com.scandrift.core.renderer.GeneratedFile;
import com.scandrift.core.report.ReportGenerator;
import com.scandrift.core.report.ReportSettings;

/**
 * Generates a flat CSV report: one row per file finding and one per repository-level status.
 *
 * <p>The CSV is not truncated; the {@code report} limits apply to the text report only.
 */
public class CsvReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(CsvReportGenerator.class);

    static final String TRACKED = "tracked";
    static final String STALE = "stale";
    static final String UNTRACKED = "untracked";
    static final String TARGET_ONLY = "target_only";
    static final String HOST_ONLY = "host_only";
    static final String UNRESOLVABLE = "unresolvable";
    static final String ORGANIZATION_FAILURE = "organization_failure";
    static final String DUPLICATE = "duplicate";
    static final String ERROR = "error";

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public String getId() {
        return "csv";
    }

    @Override
    public String getDisplayName() {
        return "CSV Report";
    }

    @Override
    public String getFileExtension() {
        return "csv";
    }

    @Override
    public String getContentType() {
        return "text/csv";
    }

    @Override
    public GeneratedFile generate(ReconciliationResult result, ReportSettings settings) {
        Objects.requireNonNull(result, "result must not be null");

        List<Row> rows = rows(result);
        CsvSchema schema = mapper.schemaFor(Row.class).withHeader();
        try {
            String content = mapper.writer(schema).writeValueAsString(rows);
            log.debug("Generated CSV report with {} rows", rows.size());
            return new GeneratedFile(fileName(), content, getContentType());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write CSV report: " + e.getOriginalMessage(), e);
        }
    }

    List<Row> rows(ReconciliationResult result) {
        List<Row> rows = new ArrayList<>();

        for (MatchedRepository repo : result.matched()) {
            String key = repo.key().value();
            for (FileFinding finding : repo.trackedDetails()) {
                rows.add(Row.finding(TRACKED, key, finding, typeOf(repo.trackedFiles(), finding.filePath())));
            }
            for (FileFinding finding : repo.staleDetails()) {
                rows.add(Row.finding(STALE, key, finding, typeOf(repo.staleFiles(), finding.filePath())));
            }
            repo.supportedFiles().stream()
                .filter(file -> repo.untrackedFiles().contains(file.path()))
                .forEach(file -> rows.add(new Row(UNTRACKED, key, file.path(), file.type().label(),
                    "", "", "", "", "", "", "")));
            for (String error : repo.errors()) {
                rows.add(new Row(ERROR, key, "", "", "", "", "", "", "", "", error));
            }
        }

        for (TargetOnlyRepository repo : result.targetOnly()) {
            for (ScanTarget target : repo.targets()) {
                rows.add(new Row(TARGET_ONLY, repo.key().value(), "", "", "", "", target.orgId(), "", "",
                    target.targetId(), nullToEmpty(target.sourceUrl())));
            }
        }

        for (HostOnlyRepository repo : result.hostOnly()) {
            rows.add(new Row(HOST_ONLY, repo.key().value(), "", "", "", "", "", "", "", "",
                repo.repository().webUrl()));
        }

        for (UnresolvableTarget entry : result.unresolvable()) {
            ScanTarget target = entry.target();
            rows.add(new Row(UNRESOLVABLE, "", "", "", "", "", target.orgId(), "", "",
                target.targetId(), entry.reason().name()));
        }

        for (OrganizationFailure failure : result.organizationFailures()) {
            rows.add(new Row(ORGANIZATION_FAILURE, "", "", "", "", "", failure.orgId(), "", "", "",
                failure.reason()));
        }

        for (DuplicateGroup group : result.duplicateGroups()) {
            for (StaleDuplicate stale : group.stale()) {
                rows.add(new Row(DUPLICATE, "", "", "", stale.project().id(), stale.project().name(),
                    nullToEmpty(stale.project().orgId()), "", "", group.targetId(),
                    stale.reason() + " (" + stale.duplicateOfId() + ")"));
            }
        }
        return rows;
    }

    private static String typeOf(List<TrackedFile> files, String path) {
        return files.stream()
            .filter(file -> file.path().equals(path))
            .map(file -> file.type().label())
            .findFirst()
            .orElse("");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * One CSV line.
     */
    @JsonPropertyOrder({"status", "repo_key", "file_path", "file_type", "project_id", "project_name",
        "org_id", "org_name", "project_url", "target_id", "detail"})
    public record Row(
        @JsonProperty("status") String status,
        @JsonProperty("repo_key") String repoKey,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("file_type") String fileType,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("project_name") String projectName,
        @JsonProperty("org_id") String orgId,
        @JsonProperty("org_name") String orgName,
        @JsonProperty("project_url") String projectUrl,
        @JsonProperty("target_id") String targetId,
        @JsonProperty("detail") String detail
    ) {
        static Row finding(String status, String key, FileFinding finding, String fileType) {
            return new Row(status, key, finding.filePath(), fileType, finding.projectId(), finding.projectName(),
                finding.orgId(), finding.orgName(), finding.projectUrl(), "", finding.root());
        }
    }
}
