package com.scandrift.core.reconcile;

import com.scandrift.core.catalog.HostCatalog;
import com.scandrift.core.catalog.ScanTargetCatalog;
import com.scandrift.core.client.HostApiException;
import com.scandrift.core.client.ScanToolApi;
import com.scandrift.core.coverage.FileCoverageValidator;
import com.scandrift.core.duplicate.DuplicateEntryDetector;
import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.model.CanonicalKey;
import com.scandrift.core.model.DuplicateGroup;
import com.scandrift.core.model.FileCheck;
import com.scandrift.core.model.FileFinding;
import com.scandrift.core.model.HostOnlyRepository;
import com.scandrift.core.model.HostRepository;
import com.scandrift.core.model.MatchClass;
import com.scandrift.core.model.MatchedRepository;
import com.scandrift.core.model.Platform;
import com.scandrift.core.model.ReconciliationResult;
import com.scandrift.core.model.RepoIdentity;
import com.scandrift.core.model.ScanProject;
import com.scandrift.core.model.ScanTarget;
import com.scandrift.core.model.SupportedFile;
import com.scandrift.core.model.TargetOnlyRepository;
import com.scandrift.core.model.TrackedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Joins the host catalog with the scan-target catalog and measures file coverage of every matched repository.
 *
 * <p>Every key of either catalog lands in exactly one of matched, target-only or host-only; keys are visited in
 * canonical-key order. For a matched key the host entry supplies the identity and default branch, the projects of
 * every target mapped to the key are gathered, their declared files are checked against the repository, and the
 * repository tree is scanned for supported files. When the listing reported no default branch, the host is asked
 * for it. Failures inside one repository are recorded in its {@link MatchedRepository#errors()} and never abort
 * the run.
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ScanToolApi scanTool;
    private final FileCoverageValidator validator;
    private final DuplicateEntryDetector duplicateDetector;
    private final boolean dryRun;

    /**
     * Creates an engine.
     *
     * @param scanTool source of each target's projects
     * @param validator file existence and tree checks
     * @param duplicateDetector duplicate grouping applied per repository
     * @param dryRun classify keys only, skipping project, file and duplicate work
     */
    public ReconciliationEngine(ScanToolApi scanTool, FileCoverageValidator validator,
                                DuplicateEntryDetector duplicateDetector, boolean dryRun) {
        this.scanTool = Objects.requireNonNull(scanTool, "scanTool must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.duplicateDetector = Objects.requireNonNull(duplicateDetector, "duplicateDetector must not be null");
        this.dryRun = dryRun;
    }

    /**
     * Classifies every key of both catalogs.
     *
     * @param hostCatalog repositories on the host
     * @param targetCatalog repositories tracked by the scanning tool
     * @return classification per key, in canonical-key order
     */
    public static SortedMap<CanonicalKey, MatchClass> classify(HostCatalog hostCatalog,
                                                               ScanTargetCatalog targetCatalog) {
        Set<CanonicalKey> union = new TreeSet<>(hostCatalog.keys());
        union.addAll(targetCatalog.keys());

        SortedMap<CanonicalKey, MatchClass> classes = new TreeMap<>();
        for (CanonicalKey key : union) {
            boolean onHost = hostCatalog.contains(key);
            boolean tracked = targetCatalog.contains(key);
            if (onHost && tracked) {
                classes.put(key, MatchClass.MATCHED);
            } else if (tracked) {
                classes.put(key, MatchClass.LEFT_ONLY);
            } else {
                classes.put(key, MatchClass.RIGHT_ONLY);
            }
        }
        return classes;
    }

    /**
     * Runs the reconciliation.
     *
     * @param hostCatalog repositories on the host
     * @param targetCatalog repositories tracked by the scanning tool
     * @return structured result
     */
    public ReconciliationResult evaluate(HostCatalog hostCatalog, ScanTargetCatalog targetCatalog) {
        SortedMap<CanonicalKey, MatchClass> classes = classify(hostCatalog, targetCatalog);
        long matchedTotal = classes.values().stream().filter(MatchClass.MATCHED::equals).count();

        List<MatchedRepository> matched = new ArrayList<>();
        List<TargetOnlyRepository> targetOnly = new ArrayList<>();
        List<HostOnlyRepository> hostOnly = new ArrayList<>();

        int index = 0;
        for (Map.Entry<CanonicalKey, MatchClass> entry : classes.entrySet()) {
            CanonicalKey key = entry.getKey();
            switch (entry.getValue()) {
                case MATCHED -> {
                    index++;
                    log.info("Validating repository {}/{}: {}", index, matchedTotal, key);
                    HostRepository repository = hostCatalog.get(key).orElseThrow();
                    List<ScanTarget> targets = targetCatalog.targets(key);
                    try {
                        matched.add(evaluateMatched(key, repository, targets));
                    } catch (RuntimeException e) {
                        log.error("Validation of {} failed", key, e);
                        matched.add(failedRepository(key, repository, targets, e));
                    }
                }
                case LEFT_ONLY -> targetOnly.add(new TargetOnlyRepository(key, targetCatalog.targets(key)));
                case RIGHT_ONLY -> hostOnly.add(new HostOnlyRepository(key, hostCatalog.get(key).orElseThrow()));
            }
        }

        List<DuplicateGroup> duplicateGroups = matched.stream()
            .flatMap(repo -> repo.duplicates().stream())
            .collect(Collectors.toList());

        log.info("Reconciled {} keys: {} matched, {} target-only, {} host-only, {} unresolvable targets",
            classes.size(), matched.size(), targetOnly.size(), hostOnly.size(), targetCatalog.unresolvable().size());
        return new ReconciliationResult(matched, targetOnly, hostOnly, targetCatalog.unresolvable(),
            targetCatalog.organizationFailures(), duplicateGroups);
    }

    MatchedRepository evaluateMatched(CanonicalKey key, HostRepository repository, List<ScanTarget> targets) {
        RepoIdentity identity = identityOf(key, repository, targets);
        if (dryRun) {
            return emptyRepository(key, repository, identity, targets, List.of());
        }
        if (repository.defaultBranch() == null) {
            identity = RepoIdentity.ofFullPath(identity.platform(), identity.host(), repository.fullPath(),
                validator.defaultBranch(identity));
        }

        CoverageAccumulator coverage = new CoverageAccumulator(identity);
        for (ScanTarget target : targets) {
            FetchResult<ScanProject> projects = scanTool.listProjectsForTarget(target.orgId(), target.targetId());
            if (!projects.isAvailable()) {
                coverage.errors.add("Projects of target " + target.targetId() + " unavailable: " + projects.reason());
                continue;
            }
            if (!projects.isComplete()) {
                coverage.errors.add("Projects of target " + target.targetId() + " incomplete: " + projects.reason());
            }
            for (ScanProject project : projects.items()) {
                if (coverage.projects.putIfAbsent(project.id(), project) == null) {
                    checkDeclaredFiles(coverage, target, project);
                }
            }
        }

        List<SupportedFile> supported = scanTree(identity, coverage.errors);
        Set<String> declared = new LinkedHashSet<>(coverage.existing);
        declared.addAll(coverage.stale);
        List<String> untracked = FileCoverageValidator.untracked(supported, declared);
        List<DuplicateGroup> duplicates = duplicateDetector.detect(new ArrayList<>(coverage.projects.values()));

        log.debug("{}: {} tracked, {} stale, {} untracked, {} duplicate groups", key, coverage.existing.size(),
            coverage.stale.size(), untracked.size(), duplicates.size());
        return new MatchedRepository(
            key,
            repository,
            identity,
            targets,
            coverage.projects.size(),
            toTrackedFiles(coverage.existing),
            toTrackedFiles(coverage.stale),
            supported,
            untracked,
            coverage.trackedDetails,
            coverage.staleDetails,
            duplicates,
            coverage.errors);
    }

    private void checkDeclaredFiles(CoverageAccumulator coverage, ScanTarget target, ScanProject project) {
        for (String declaredPath : project.declaredFiles()) {
            FileCheck check;
            try {
                check = coverage.check(declaredPath, project.root());
            } catch (HostApiException e) {
                log.error("Cannot validate {} in {}: {}", declaredPath, coverage.identity.fullPath(), e.getMessage());
                coverage.errors.add(e.getMessage());
                continue;
            }
            String orgId = project.orgId() != null ? project.orgId() : target.orgId();
            FileFinding finding = new FileFinding(
                check.path(),
                declaredPath,
                project.root(),
                project.id(),
                project.name(),
                orgId,
                scanTool.getOrganizationName(orgId),
                scanTool.projectWebUrl(orgId, project.id()),
                check.exists());
            if (check.exists()) {
                coverage.existing.add(check.path());
                coverage.trackedDetails.add(finding);
            } else {
                coverage.stale.add(check.path());
                coverage.staleDetails.add(finding);
            }
        }
    }

    private List<SupportedFile> scanTree(RepoIdentity identity, List<String> errors) {
        try {
            return validator.scanRepositoryForSupportedFiles(identity);
        } catch (HostApiException e) {
            log.error("Cannot scan {}: {}", identity.fullPath(), e.getMessage());
            errors.add(e.getMessage());
            return List.of();
        }
    }

    private MatchedRepository failedRepository(CanonicalKey key, HostRepository repository, List<ScanTarget> targets,
                                               RuntimeException error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return emptyRepository(key, repository, identityOf(key, repository, targets), targets,
            List.of("Validation failed: " + message));
    }

    private static MatchedRepository emptyRepository(CanonicalKey key, HostRepository repository,
                                                     RepoIdentity identity, List<ScanTarget> targets,
                                                     List<String> errors) {
        return new MatchedRepository(key, repository, identity, targets, 0, List.of(), List.of(), List.of(),
            List.of(), List.of(), List.of(), List.of(), errors);
    }

    private List<TrackedFile> toTrackedFiles(Set<String> paths) {
        return paths.stream()
            .map(path -> new TrackedFile(path, validator.taxonomy().typeOf(path)))
            .collect(Collectors.toList());
    }

    private static RepoIdentity identityOf(CanonicalKey key, HostRepository repository, List<ScanTarget> targets) {
        Platform platform = targets.stream()
            .map(ScanTarget::identity)
            .filter(Objects::nonNull)
            .map(RepoIdentity::platform)
            .findFirst()
            .orElse(Platform.fromHost(key.host()));
        return RepoIdentity.ofFullPath(platform, key.host(), repository.fullPath(), repository.defaultBranch());
    }

    /**
     * Per-repository state while its projects are checked.
     */
    private final class CoverageAccumulator {
        private final RepoIdentity identity;
        private final Map<String, ScanProject> projects = new LinkedHashMap<>();
        private final Map<String, FileCheck> checks = new HashMap<>();
        private final Set<String> existing = new LinkedHashSet<>();
        private final Set<String> stale = new LinkedHashSet<>();
        private final List<FileFinding> trackedDetails = new ArrayList<>();
        private final List<FileFinding> staleDetails = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();

        CoverageAccumulator(RepoIdentity identity) {
            this.identity = identity;
        }

        FileCheck check(String declaredPath, String root) {
            String resolved = FileCoverageValidator.joinPath(root, declaredPath);
            FileCheck cached = checks.get(resolved);
            if (cached != null) {
                return cached;
            }
            FileCheck check = validator.validateFile(identity, declaredPath, root);
            checks.put(check.path(), check);
            return check;
        }
    }
}
