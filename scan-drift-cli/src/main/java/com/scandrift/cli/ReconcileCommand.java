package com.scandrift.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scandrift.core.catalog.HostCatalog;
import com.scandrift.core.catalog.HostCatalogBuilder;
import com.scandrift.core.catalog.OrganizationResolver;
import com.scandrift.core.catalog.ScanTargetCatalog;
import com.scandrift.core.catalog.ScanTargetCatalogCollector;
import com.scandrift.core.client.gitlab.GitLabClient;
import com.scandrift.core.client.snyk.SnykRestClient;
import com.scandrift.core.config.DriftConfig;
import com.scandrift.core.config.DriftConfigurationException;
import com.scandrift.core.coverage.FileCoverageValidator;
import com.scandrift.core.coverage.SupportedFileTaxonomy;
import com.scandrift.core.duplicate.DuplicateEntryDetector;
import com.scandrift.core.identity.HostClassifier;
import com.scandrift.core.identity.RepoIdentityResolver;
import com.scandrift.core.model.Platform;
import com.scandrift.core.model.ReconciliationResult;
import com.scandrift.core.reconcile.ReconciliationEngine;
import com.scandrift.core.renderer.GeneratedFile;
import com.scandrift.core.renderer.GeneratedOutput;
import com.scandrift.core.renderer.OutputRenderer;
import com.scandrift.core.renderer.RenderContext;
import com.scandrift.core.report.ReportGenerator;
import com.scandrift.core.report.ReportSettings;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Command that reconciles scanner targets with the host's repositories.
 *
 * <p>Orchestrates the full pipeline:
 * <ol>
 *   <li>Resolve the organizations to examine</li>
 *   <li>Build the target catalog and the host catalog</li>
 *   <li>Join the catalogs and validate file coverage per matched repository</li>
 *   <li>Generate the selected report formats</li>
 *   <li>Print the text report and write every report to the output directory</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # All organizations of a group against gitlab.com
 * scan-drift reconcile --group-id 1234 --gitlab-token $GITLAB_TOKEN
 *
 * # One organization, catalogs only
 * scan-drift reconcile --org-id abcd --dry-run
 * }</pre>
 */
@Command(
    name = "reconcile",
    description = "Compare scanner targets with host repositories and report drift",
    mixinStandardHelpOptions = true
)
public class ReconcileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReconcileCommand.class);

    private static final String TEXT_CONTENT_TYPE = "text/plain";

    @Mixin
    ScanToolOptions scanTool = new ScanToolOptions();

    @Option(
        names = {"--gitlab-token"},
        description = "GitLab access token (default: $GITLAB_TOKEN)",
        defaultValue = "${env:GITLAB_TOKEN}"
    )
    String gitlabToken;

    @Option(
        names = {"--gitlab-url"},
        description = "GitLab instance URL (overrides config, default: https://gitlab.com)"
    )
    String gitlabUrl;

    @Option(
        names = {"-o", "--output-dir"},
        description = "Report directory (default: ./scan-drift-report)"
    )
    Path outputDir = Paths.get("scan-drift-report");

    @Option(
        names = {"-f", "--format"},
        split = ",",
        defaultValue = "text,csv,json",
        description = "Report formats to write (default: ${DEFAULT-VALUE})"
    )
    List<String> formats;

    @Option(
        names = {"--dry-run"},
        description = "Build and join catalogs but skip file validation and duplicate detection"
    )
    boolean dryRun;

    @Override
    public Integer call() {
        try {
            DriftConfig config = loadConfiguration();

            if (dryRun) {
                System.out.println("Running in dry-run mode (no file validation)");
                System.out.println();
            }

            SnykRestClient snyk = ClientFactory.scanTool(config, scanTool.token);
            List<String> orgIds = new OrganizationResolver(snyk).resolve(scanTool.groupId, scanTool.orgId);
            System.out.println("✓ Resolved " + orgIds.size() + " organizations");

            GitLabClient gitlab = ClientFactory.host(config, gitlabToken);
            RepoIdentityResolver resolver = RepoIdentityResolver.withKnownHosts(
                HostClassifier.of(Map.of(gitlab.host(), Platform.GITLAB)));

            ScanTargetCatalog targets = new ScanTargetCatalogCollector(
                snyk, resolver, config.scanTool().integrationTypes()).collect(orgIds);
            System.out.println("✓ Collected " + targets.targetCount() + " targets across "
                + targets.size() + " repositories");

            HostCatalog host = HostCatalogBuilder.collect(gitlab);
            System.out.println("✓ Listed " + host.size() + " repositories on " + gitlab.host());

            ReconciliationEngine engine = new ReconciliationEngine(
                snyk,
                new FileCoverageValidator(gitlab, SupportedFileTaxonomy.defaults()),
                new DuplicateEntryDetector(config.duplicates().policy()),
                dryRun);
            ReconciliationResult result = engine.evaluate(host, targets);
            System.out.println("✓ Reconciled " + result.matched().size() + " matched, "
                + result.targetOnly().size() + " target-only, "
                + result.hostOnly().size() + " host-only repositories");

            GeneratedOutput output = generateReports(result, config);
            renderOutput(output);
            System.out.println("✓ Wrote " + output.files().size() + " reports to: " + outputDir.toAbsolutePath());

            System.out.println();
            System.out.println("✓ Reconciliation complete");
            return 0;

        } catch (DriftConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Reconciliation failed", e);
            System.err.println("✗ Reconciliation failed: " + e.getMessage());
            return 1;
        }
    }

    private DriftConfig loadConfiguration() {
        DriftConfig config = scanTool.loadConfig();
        if (gitlabUrl == null || gitlabUrl.isBlank()) {
            return config;
        }
        return new DriftConfig(config.scanTool(), config.host().withUrl(gitlabUrl), config.http(),
            config.duplicates(), config.report());
    }

    /**
     * Runs every discovered generator whose id was requested.
     */
    GeneratedOutput generateReports(ReconciliationResult result, DriftConfig config) {
        Map<String, ReportGenerator> available = new LinkedHashMap<>();
        ServiceLoader.load(ReportGenerator.class).forEach(g -> available.put(g.getId(), g));
        log.debug("Discovered report generators: {}", available.keySet());

        ReportSettings settings = ReportSettings.of(config.report());
        List<GeneratedFile> files = new ArrayList<>();
        for (String format : formats) {
            ReportGenerator generator = available.get(format.trim().toLowerCase(Locale.ROOT));
            if (generator == null) {
                log.warn("Unknown report format '{}'. Available: {}", format, available.keySet());
                continue;
            }
            files.add(generator.generate(result, settings));
        }
        return new GeneratedOutput(files);
    }

    /**
     * Prints the text report and writes all reports to disk.
     */
    private void renderOutput(GeneratedOutput output) {
        Map<String, OutputRenderer> renderers = new LinkedHashMap<>();
        ServiceLoader.load(OutputRenderer.class).forEach(r -> renderers.put(r.getId(), r));

        OutputRenderer fileSystem = renderers.get("filesystem");
        if (fileSystem == null) {
            throw new IllegalStateException("FileSystemRenderer not found");
        }
        RenderContext context = new RenderContext(outputDir.toAbsolutePath().toString(), Map.of());

        OutputRenderer console = renderers.get("console");
        GeneratedOutput textReports = output.ofContentType(TEXT_CONTENT_TYPE);
        if (console != null && !textReports.isEmpty()) {
            System.out.println();
            console.render(textReports, context);
        }

        log.info("Rendering output with: {}", fileSystem.getId());
        fileSystem.render(output, context);
    }
}
