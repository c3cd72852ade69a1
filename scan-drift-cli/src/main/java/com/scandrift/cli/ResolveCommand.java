package com.scandrift.cli;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import com.scandrift.core.identity.RepoIdentityResolver;
import com.scandrift.core.model.RepoIdentity;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Command that prints the identity and canonical key of repository references.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * scan-drift resolve git@gitlab.com:group/sub/repo.git https://github.com/o/r/tree/dev
 * }</pre>
 */
@Command(
    name = "resolve",
    description = "Resolve repository references to canonical keys",
    mixinStandardHelpOptions = true
)
public class ResolveCommand implements Callable<Integer> {

    @Parameters(
        arity = "1..*",
        description = "Repository URLs, SSH remotes or local paths"
    )
    List<String> references;

    private final RepoIdentityResolver resolver = RepoIdentityResolver.defaults();

    @Override
    public Integer call() {
        for (String reference : references) {
            Optional<RepoIdentity> identity = resolver.resolve(reference);
            if (identity.isEmpty()) {
                System.out.printf("%s%n  unresolvable%n", reference);
                continue;
            }
            RepoIdentity resolved = identity.get();
            System.out.printf("%s%n", reference);
            System.out.printf("  Platform: %s%n", resolved.platform());
            System.out.printf("  Host: %s%n", resolved.host());
            System.out.printf("  Owner: %s%n", resolved.owner());
            System.out.printf("  Repo: %s%n", resolved.repo());
            System.out.printf("  Branch: %s%n", resolved.branch());
            System.out.printf("  Key: %s%n", resolved.local() ? "(local path)" : resolved.canonicalKey());
        }
        return 0;
    }
}
