package com.scandrift.core.catalog;

import com.scandrift.core.client.OrganizationAccess;
import com.scandrift.core.client.ScanToolApi;
import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.identity.RepoIdentityResolver;
import com.scandrift.core.model.RepoIdentity;
import com.scandrift.core.model.ScanTarget;
import com.scandrift.core.model.UnresolvableReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the {@link ScanTargetCatalog} from the scanning tool, one organization at a time.
 *
 * <p>Each organization is probed for access before its targets are listed. An organization that cannot be read
 * is recorded as a failure and skipped; the others proceed. Each target's source URL is resolved to a canonical
 * key; targets without a URL, with an unparseable URL, or pointing at a local path go to the unresolvable bucket.
 */
public class ScanTargetCatalogCollector {
    private static final Logger log = LoggerFactory.getLogger(ScanTargetCatalogCollector.class);

    private final ScanToolApi scanTool;
    private final RepoIdentityResolver resolver;
    private final List<String> integrationTypes;

    public ScanTargetCatalogCollector(ScanToolApi scanTool, RepoIdentityResolver resolver,
                                      List<String> integrationTypes) {
        this.scanTool = Objects.requireNonNull(scanTool, "scanTool must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.integrationTypes = integrationTypes == null ? List.of() : List.copyOf(integrationTypes);
    }

    /**
     * Collects targets for the given organizations.
     *
     * @param orgIds organization ids, processed in order
     * @return frozen catalog
     */
    public ScanTargetCatalog collect(List<String> orgIds) {
        ScanTargetCatalogBuilder builder = new ScanTargetCatalogBuilder();
        int index = 0;
        for (String orgId : orgIds) {
            index++;
            log.info("Collecting targets for organization {}/{}: {}", index, orgIds.size(), orgId);
            collectOrganization(orgId, builder);
        }
        ScanTargetCatalog catalog = builder.freeze();
        log.info("Target catalog: {} repositories, {} targets, {} unresolvable, {} organization failures",
            catalog.size(), catalog.targetCount(), catalog.unresolvable().size(),
            catalog.organizationFailures().size());
        return catalog;
    }

    private void collectOrganization(String orgId, ScanTargetCatalogBuilder builder) {
        OrganizationAccess access = scanTool.checkOrganizationAccess(orgId);
        if (!access.accessible()) {
            builder.recordOrganizationFailure(orgId, access.reason());
            return;
        }

        FetchResult<ScanTarget> targets = scanTool.listTargets(orgId, integrationTypes);
        if (!targets.isAvailable()) {
            log.warn("Targets of organization {} unavailable: {}", orgId, targets.reason());
            builder.recordOrganizationFailure(orgId, "Targets unavailable: " + targets.reason());
            return;
        }
        if (!targets.isComplete()) {
            log.warn("Target listing for organization {} is incomplete: {}", orgId, targets.reason());
        }
        log.debug("Organization {} has {} targets", orgId, targets.items().size());
        targets.items().forEach(target -> route(target, builder));
    }

    void route(ScanTarget target, ScanTargetCatalogBuilder builder) {
        if (!target.hasSourceUrl()) {
            log.debug("Target {} ({}) has no source URL", target.targetId(), target.integrationType());
            builder.addUnresolvable(target, UnresolvableReason.NO_URL);
            return;
        }
        Optional<RepoIdentity> identity = resolver.resolve(target.sourceUrl());
        if (identity.isEmpty()) {
            log.debug("Target {} has unresolvable URL {}", target.targetId(), target.sourceUrl());
            builder.addUnresolvable(target, UnresolvableReason.UNPARSEABLE_URL);
            return;
        }
        if (identity.get().local()) {
            builder.addUnresolvable(target.withIdentity(identity.get()), UnresolvableReason.LOCAL_PATH);
            return;
        }
        builder.add(identity.get().canonicalKey(), target.withIdentity(identity.get()));
    }
}
