package com.scandrift.core.report.impl;

import com.scandrift.core.model.CanonicalKey;
import com.scandrift.core.model.DuplicateGroup;
import com.scandrift.core.model.FileFinding;
import com.scandrift.core.model.FileType;
import com.scandrift.core.model.HostOnlyRepository;
import com.scandrift.core.model.HostRepository;
import com.scandrift.core.model.MatchedRepository;
import com.scandrift.core.model.OrganizationFailure;
import com.scandrift.core.model.Platform;
import com.scandrift.core.model.ReconciliationResult;
import com.scandrift.core.model.RepoIdentity;
import com.scandrift.core.model.ScanProject;
import com.scandrift.core.model.ScanTarget;
import com.scandrift.core.model.StaleDuplicate;
import com.scandrift.core.model.SupportedFile;
import com.scandrift.core.model.TargetOnlyRepository;
import com.scandrift.core.model.TrackedFile;
import com.scandrift.core.model.UnresolvableReason;
import com.scandrift.core.model.UnresolvableTarget;

import java.time.Instant;
import java.util.List;

/**
 * Sample reconciliation result shared by the report generator tests.
 */
final class ReportFixtures {

    static final Instant GENERATED_AT = Instant.parse("2024-06-01T12:30:00Z");

    private ReportFixtures() {
    }

    static ReconciliationResult sampleResult() {
        CanonicalKey repo1 = CanonicalKey.of("gitlab.com", "team/repo1");
        HostRepository hostRepo1 = new HostRepository(1, "main", "team/repo1",
            "https://gitlab.com/team/repo1", "https://gitlab.com/team/repo1", false);
        ScanTarget target1 = new ScanTarget("org-1", "t1", "team/repo1", "https://gitlab.com/team/repo1",
            "gitlab", null);

        FileFinding tracked = new FileFinding("package.json", "package.json", "", "p1", "team/repo1:package.json",
            "org-1", "Platform Team", "https://app.snyk.io/org/org-1/project/p1", true);
        FileFinding stale = new FileFinding("services/api/pom.xml", "pom.xml", "services/api", "p2",
            "team/repo1:services/api/pom.xml", "org-1", "Platform Team",
            "https://app.snyk.io/org/org-1/project/p2", false);

        ScanProject canonical = project("p1", "team/repo1:package.json", "2024-05-01T00:00:00Z");
        ScanProject older = project("p3", "team/repo1:./package.json", "2024-01-01T00:00:00Z");
        DuplicateGroup duplicates = new DuplicateGroup("t1", "package.json", canonical,
            List.of(new StaleDuplicate(older, null, "p1", canonical.name())));

        MatchedRepository matched = new MatchedRepository(
            repo1,
            hostRepo1,
            RepoIdentity.ofFullPath(Platform.GITLAB, "gitlab.com", "team/repo1", "main"),
            List.of(target1),
            3,
            List.of(new TrackedFile("package.json", FileType.NPM)),
            List.of(new TrackedFile("services/api/pom.xml", FileType.MAVEN)),
            List.of(new SupportedFile("package.json", FileType.NPM, "package.json"),
                new SupportedFile("Dockerfile", FileType.DOCKER, "Dockerfile")),
            List.of("Dockerfile"),
            List.of(tracked),
            List.of(stale),
            List.of(duplicates),
            List.of());

        TargetOnlyRepository targetOnly = new TargetOnlyRepository(CanonicalKey.of("gitlab.com", "team/repo2"),
            List.of(new ScanTarget("org-1", "t2", "team/repo2", "https://gitlab.com/team/repo2", "gitlab", null)));
        HostOnlyRepository hostOnly = new HostOnlyRepository(CanonicalKey.of("gitlab.com", "team/repo3"),
            new HostRepository(3, "main", "team/repo3", "https://gitlab.com/team/repo3", "", false));
        UnresolvableTarget unresolvable = new UnresolvableTarget(
            new ScanTarget("org-1", "t9", "local-build", null, "cli", null), UnresolvableReason.NO_URL);

        return new ReconciliationResult(
            List.of(matched),
            List.of(targetOnly),
            List.of(hostOnly),
            List.of(unresolvable),
            List.of(new OrganizationFailure("org-2", "Access denied (HTTP 403)")),
            List.of(duplicates));
    }

    static ScanProject project(String id, String name, String created) {
        return new ScanProject(id, name, "npm", Instant.parse(created), "org-1", "t1", null, null, "", List.of());
    }
}
