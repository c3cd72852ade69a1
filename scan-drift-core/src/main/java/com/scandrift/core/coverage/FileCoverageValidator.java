package com.scandrift.core.coverage;

import com.scandrift.core.client.HostApiException;
import com.scandrift.core.client.HostPlatformApi;
import com.scandrift.core.client.TreeEntry;
import com.scandrift.core.fetch.FetchResult;
import com.scandrift.core.fetch.FetchStatus;
import com.scandrift.core.model.FileCheck;
import com.scandrift.core.model.RepoIdentity;
import com.scandrift.core.model.SupportedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares declared files with what a repository actually contains.
 *
 * <p>All lookups use {@link RepoIdentity#branch()}, which callers set to the repository's default branch.
 */
public class FileCoverageValidator {
    private static final Logger log = LoggerFactory.getLogger(FileCoverageValidator.class);

    private final HostPlatformApi host;
    private final SupportedFileTaxonomy taxonomy;

    public FileCoverageValidator(HostPlatformApi host, SupportedFileTaxonomy taxonomy) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy must not be null");
    }

    /**
     * Asks the host for the repository's default branch.
     */
    public String defaultBranch(RepoIdentity identity) {
        return host.getDefaultBranch(identity);
    }

    public SupportedFileTaxonomy taxonomy() {
        return taxonomy;
    }

    /**
     * Checks that a declared file exists.
     *
     * @param identity repository, branch set to the ref to check
     * @param filePath declared path
     * @param root project root the path is relative to, may be empty
     * @return resolved repository path and whether it exists
     * @throws HostApiException if the platform answers with anything but success or not-found
     */
    public FileCheck validateFile(RepoIdentity identity, String filePath, String root) {
        String resolved = joinPath(root, filePath);
        boolean exists = host.fileExists(identity, resolved, identity.branch());
        log.debug("{}@{}:{} exists={}", identity.fullPath(), identity.branch(), resolved, exists);
        return new FileCheck(resolved, root, exists);
    }

    /**
     * Lists every file in the repository tree that the taxonomy recognizes.
     *
     * @param identity repository, branch set to the ref to scan
     * @return supported files in tree order
     * @throws HostApiException if the tree cannot be read
     */
    public List<SupportedFile> scanRepositoryForSupportedFiles(RepoIdentity identity) {
        FetchResult<TreeEntry> tree = host.repositoryTree(identity, identity.branch());
        if (tree.status() == FetchStatus.UNAVAILABLE && tree.httpStatus() == 404) {
            log.debug("No tree for {}@{}, treating as empty", identity.fullPath(), identity.branch());
            return List.of();
        }
        if (!tree.isAvailable()) {
            throw new HostApiException("Cannot read tree of " + identity.fullPath() + "@" + identity.branch()
                + ": " + tree.reason(), tree.httpStatus());
        }
        if (!tree.isComplete()) {
            log.warn("Tree of {} is incomplete ({}), coverage may be understated", identity.fullPath(),
                tree.reason());
        }

        List<SupportedFile> supported = new ArrayList<>();
        for (TreeEntry entry : tree.items()) {
            if (!entry.isBlob()) {
                continue;
            }
            Optional<SupportedFile> file = taxonomy.classify(entry.path());
            file.ifPresent(supported::add);
        }
        log.debug("{}: {} supported files among {} tree entries", identity.fullPath(), supported.size(),
            tree.items().size());
        return supported;
    }

    /**
     * Supported files no project declares, sorted.
     *
     * @param supported files found in the tree
     * @param tracked resolved declared paths
     * @return untracked paths
     */
    public static List<String> untracked(Collection<SupportedFile> supported, Set<String> tracked) {
        return supported.stream()
            .map(SupportedFile::path)
            .filter(path -> !tracked.contains(path))
            .distinct()
            .sorted()
            .collect(Collectors.toList());
    }

    /**
     * Joins a project root and a declared path into one repository-relative path.
     *
     * <p>Backslashes become slashes and leading and trailing slashes are trimmed. A path already starting with the
     * root is returned unchanged.
     *
     * @param root project root, may be null or empty
     * @param filePath declared path
     * @return repository-relative path
     */
    public static String joinPath(String root, String filePath) {
        String file = trimSlashes(filePath == null ? "" : filePath.replace('\\', '/'));
        String base = trimSlashes(root == null ? "" : root.replace('\\', '/'));
        if (base.isEmpty() || file.equals(base) || file.startsWith(base + "/")) {
            return file;
        }
        return file.isEmpty() ? base : base + "/" + file;
    }

    private static String trimSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(start, end);
    }
}
