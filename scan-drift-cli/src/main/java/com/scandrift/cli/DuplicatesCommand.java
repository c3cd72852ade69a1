package com.scandrift.cli;

import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scandrift.core.catalog.OrganizationResolver;
import com.scandrift.core.client.snyk.SnykRestClient;
import com.scandrift.core.config.DriftConfig;
import com.scandrift.core.config.DriftConfigurationException;
import com.scandrift.core.duplicate.DuplicateEntryDetector;
import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.model.DuplicateGroup;
import com.scandrift.core.model.ScanProject;
import com.scandrift.core.model.StaleDuplicate;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Command that lists stale duplicate projects per organization.
 *
 * <p>Runs the duplicate detector over each organization's full project list, independent of any
 * host catalog.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * scan-drift duplicates --org-id abcd
 * }</pre>
 */
@Command(
    name = "duplicates",
    description = "List stale duplicate scanner projects",
    mixinStandardHelpOptions = true
)
public class DuplicatesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DuplicatesCommand.class);

    @Mixin
    ScanToolOptions scanTool = new ScanToolOptions();

    @Override
    public Integer call() {
        try {
            DriftConfig config = scanTool.loadConfig();
            SnykRestClient snyk = ClientFactory.scanTool(config, scanTool.token);
            DuplicateEntryDetector detector = new DuplicateEntryDetector(config.duplicates().policy());

            List<String> orgIds = new OrganizationResolver(snyk).resolve(scanTool.groupId, scanTool.orgId);
            System.out.println("✓ Resolved " + orgIds.size() + " organizations");
            System.out.println();

            int staleTotal = 0;
            for (String orgId : orgIds) {
                FetchResult<ScanProject> projects = snyk.listProjects(orgId);
                if (!projects.isAvailable()) {
                    log.warn("Projects of organization {} unavailable: {}", orgId, projects.reason());
                    System.out.println("✗ " + orgId + ": projects unavailable (" + projects.reason() + ")");
                    continue;
                }

                List<DuplicateGroup> groups = detector.detect(projects.items());
                int stale = groups.stream().mapToInt(g -> g.stale().size()).sum();
                staleTotal += stale;
                System.out.printf("%s (%s): %d projects, %d stale duplicates%n",
                    snyk.getOrganizationName(orgId), orgId, projects.items().size(), stale);
                printGroups(groups);
            }

            System.out.println();
            System.out.println("✓ Found " + staleTotal + " stale duplicate projects");
            return 0;

        } catch (DriftConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Duplicate detection failed", e);
            System.err.println("✗ Duplicate detection failed: " + e.getMessage());
            return 1;
        }
    }

    private void printGroups(List<DuplicateGroup> groups) {
        for (DuplicateGroup group : groups) {
            System.out.printf("  • %s (target: %s)%n", group.identifier(), group.targetId());
            System.out.printf("    Keep: %s (%s)%n", group.canonical().name(), group.canonical().id());
            for (StaleDuplicate stale : group.stale()) {
                System.out.printf("    Stale: %s (%s)%n", stale.project().name(), stale.project().id());
            }
        }
    }
}
