package com.scandrift.core.report.impl;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scandrift.core.config.DriftConfig;
import com.scandrift.core.model.DuplicateGroup;
import com.scandrift.core.model.FileFinding;
import com.scandrift.core.model.HostOnlyRepository;
import com.scandrift.core.model.MatchedRepository;
import com.scandrift.core.model.OrganizationFailure;
import com.scandrift.core.model.ReconciliationResult;
import com.scandrift.core.model.ScanTarget;
import com.scandrift.core.model.StaleDuplicate;
import com.scandrift.core.model.TargetOnlyRepository;
import com.scandrift.core.model.UnresolvableTarget;
import com.scandrift.core.renderer.GeneratedFile;
import com.scandrift.core.report.ReportGenerator;
import com.scandrift.core.report.ReportSettings;

/**
 * Generates the plain-text reconciliation report.
 *
 * <p>The report opens with a summary of the key partition and then lists each bucket:
 * target-only repositories, host-only repositories, unresolvable targets, organization failures,
 * matched repositories with their tracked, stale and untracked files, and duplicate projects.
 * Long lists are truncated according to {@link DriftConfig.ReportConfig}.
 */
public class TextReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(TextReportGenerator.class);

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final String RULE = "=".repeat(80);
    private static final String SUB_RULE = "-".repeat(40);
    private static final String NEWLINE = "\n";

    private static final String TITLE = "SCAN DRIFT - RECONCILIATION REPORT";
    private static final String SUMMARY = "SUMMARY";
    private static final String TARGET_ONLY_TITLE = "REPOSITORIES TRACKED BY SCANNER BUT MISSING ON HOST";
    private static final String HOST_ONLY_TITLE = "REPOSITORIES ON HOST WITHOUT SCANNER TARGETS";
    private static final String UNRESOLVABLE_TITLE = "UNRESOLVABLE TARGETS";
    private static final String ORG_FAILURES_TITLE = "ORGANIZATION FAILURES";
    private static final String MATCHED_TITLE = "MATCHED REPOSITORIES";
    private static final String DUPLICATES_TITLE = "DUPLICATE PROJECTS";

    private static final String TRACKED_MARK = "    ✅ ";
    private static final String STALE_MARK = "    ❌ ";
    private static final String MORE_FORMAT = "%s... and %d more %s";

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String getDisplayName() {
        return "Plain Text Report";
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    @Override
    public String getContentType() {
        return "text/plain";
    }

    @Override
    public GeneratedFile generate(ReconciliationResult result, ReportSettings settings) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(settings, "settings must not be null");

        DriftConfig.ReportConfig limits = settings.limits();
        StringBuilder sb = new StringBuilder();

        appendHeader(sb, settings);
        appendSummary(sb, result);
        appendTargetOnly(sb, result.targetOnly(), limits);
        appendHostOnly(sb, result.hostOnly(), limits);
        appendUnresolvable(sb, result.unresolvable(), limits);
        appendOrganizationFailures(sb, result.organizationFailures());
        appendMatched(sb, result.matched(), limits);
        appendDuplicates(sb, result.duplicateGroups(), limits);

        log.debug("Generated text report with {} matched repositories", result.matched().size());
        return new GeneratedFile(fileName(), sb.toString(), getContentType());
    }

    private void appendHeader(StringBuilder sb, ReportSettings settings) {
        sb.append(RULE).append(NEWLINE);
        sb.append(TITLE).append(NEWLINE);
        sb.append("Generated: ").append(TIMESTAMP.format(settings.generatedAt())).append(" UTC").append(NEWLINE);
        sb.append(RULE).append(NEWLINE).append(NEWLINE);
    }

    private void appendSummary(StringBuilder sb, ReconciliationResult result) {
        sb.append(SUMMARY).append(NEWLINE).append(SUB_RULE).append(NEWLINE);
        line(sb, "Matched repos (tracked & present): %d", result.matched().size());
        line(sb, "Target-only repos (stale tracking): %d", result.targetOnly().size());
        line(sb, "Host-only repos (not tracked): %d", result.hostOnly().size());
        line(sb, "Unresolvable targets: %d", result.unresolvable().size());
        line(sb, "Organization failures: %d", result.organizationFailures().size());
        line(sb, "Stale files: %d", result.staleFileCount());
        line(sb, "Untracked supported files: %d", result.untrackedFileCount());
        line(sb, "Stale duplicate projects: %d", result.staleDuplicateCount());
        sb.append(NEWLINE);
    }

    private void appendTargetOnly(StringBuilder sb, List<TargetOnlyRepository> repos, DriftConfig.ReportConfig limits) {
        if (repos.isEmpty()) {
            return;
        }
        section(sb, TARGET_ONLY_TITLE);
        for (TargetOnlyRepository repo : head(repos, limits.maxRepositories())) {
            line(sb, "Repo key: %s", repo.key());
            for (ScanTarget target : head(repo.targets(), limits.maxTargetsPerRepository())) {
                line(sb, "  - %s (%s)", target.displayName(), orNone(target.sourceUrl()));
            }
            more(sb, "  ", repo.targets().size(), limits.maxTargetsPerRepository(), "targets");
        }
        more(sb, "", repos.size(), limits.maxRepositories(), "repositories");
        sb.append(NEWLINE);
    }

    private void appendHostOnly(StringBuilder sb, List<HostOnlyRepository> repos, DriftConfig.ReportConfig limits) {
        if (repos.isEmpty()) {
            return;
        }
        section(sb, HOST_ONLY_TITLE);
        for (HostOnlyRepository repo : head(repos, limits.maxRepositories())) {
            line(sb, "Repo key: %s  URL: %s", repo.key(), orNone(repo.repository().webUrl()));
        }
        more(sb, "", repos.size(), limits.maxRepositories(), "repositories");
        sb.append(NEWLINE);
    }

    private void appendUnresolvable(StringBuilder sb, List<UnresolvableTarget> targets, DriftConfig.ReportConfig limits) {
        if (targets.isEmpty()) {
            return;
        }
        section(sb, UNRESOLVABLE_TITLE);
        for (UnresolvableTarget entry : head(targets, limits.maxRepositories())) {
            ScanTarget target = entry.target();
            line(sb, "Target: %s (Org: %s)  Reason: %s", target.displayName(), target.orgId(), entry.reason());
        }
        more(sb, "", targets.size(), limits.maxRepositories(), "targets");
        sb.append(NEWLINE);
    }

    private void appendOrganizationFailures(StringBuilder sb, List<OrganizationFailure> failures) {
        if (failures.isEmpty()) {
            return;
        }
        section(sb, ORG_FAILURES_TITLE);
        for (OrganizationFailure failure : failures) {
            line(sb, "Org: %s  Reason: %s", failure.orgId(), failure.reason());
        }
        sb.append(NEWLINE);
    }

    private void appendMatched(StringBuilder sb, List<MatchedRepository> repos, DriftConfig.ReportConfig limits) {
        if (repos.isEmpty()) {
            return;
        }
        section(sb, MATCHED_TITLE);
        for (MatchedRepository repo : head(repos, limits.maxRepositories())) {
            line(sb, "Repo key: %s", repo.key());
            line(sb, "  Tracked files: %d  Stale files: %d  Supported files: %d",
                repo.trackedFiles().size(), repo.staleFiles().size(), repo.supportedFiles().size());

            if (!repo.trackedDetails().isEmpty()) {
                sb.append("  Tracked files (exist):").append(NEWLINE);
                appendFindings(sb, repo.trackedDetails(), TRACKED_MARK, limits.maxFileDetails());
            }
            if (!repo.staleDetails().isEmpty()) {
                sb.append("  Stale files (missing):").append(NEWLINE);
                appendFindings(sb, repo.staleDetails(), STALE_MARK, limits.maxFileDetails());
            }
            if (!repo.untrackedFiles().isEmpty()) {
                sb.append("  Supported files not tracked:").append(NEWLINE);
                for (String path : head(repo.untrackedFiles(), limits.maxUntrackedFiles())) {
                    line(sb, "    - %s", path);
                }
                more(sb, "    ", repo.untrackedFiles().size(), limits.maxUntrackedFiles(), "files");
            }
            for (String error : repo.errors()) {
                line(sb, "  ! %s", error);
            }
            sb.append(NEWLINE);
        }
        more(sb, "", repos.size(), limits.maxRepositories(), "repositories");
    }

    private void appendFindings(StringBuilder sb, List<FileFinding> findings, String mark, int limit) {
        for (FileFinding finding : head(findings, limit)) {
            sb.append(mark).append(finding.filePath()).append(NEWLINE);
            line(sb, "       Project: %s (%s)", finding.projectName(), finding.projectId());
            line(sb, "       Org: %s", finding.orgName());
            if (!finding.projectUrl().isEmpty()) {
                line(sb, "       URL: %s", finding.projectUrl());
            }
        }
        more(sb, "    ", findings.size(), limit, "files");
    }

    private void appendDuplicates(StringBuilder sb, List<DuplicateGroup> groups, DriftConfig.ReportConfig limits) {
        if (groups.isEmpty()) {
            return;
        }
        section(sb, DUPLICATES_TITLE);
        for (DuplicateGroup group : head(groups, limits.maxRepositories())) {
            line(sb, "Target: %s  Identifier: %s", group.targetId(), group.identifier());
            line(sb, "  Keep: %s (%s)", group.canonical().name(), group.canonical().id());
            for (StaleDuplicate stale : group.stale()) {
                line(sb, "  Stale: %s (%s) - %s", stale.project().name(), stale.project().id(), stale.reason());
            }
        }
        more(sb, "", groups.size(), limits.maxRepositories(), "groups");
        sb.append(NEWLINE);
    }

    private static void section(StringBuilder sb, String title) {
        sb.append(title).append(NEWLINE).append(SUB_RULE).append(NEWLINE);
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(format, args)).append(NEWLINE);
    }

    private static void more(StringBuilder sb, String indent, int total, int limit, String noun) {
        if (total > limit) {
            sb.append(String.format(MORE_FORMAT, indent, total - limit, noun)).append(NEWLINE);
        }
    }

    private static <T> List<T> head(List<T> list, int limit) {
        return list.size() <= limit ? list : list.subList(0, limit);
    }

    private static String orNone(String value) {
        return value == null || value.isBlank() ? "no url" : value;
    }
}
