package com.scandrift.core.coverage;

import com.scandrift.core.model.FileType;
import com.scandrift.core.model.SupportedFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of file patterns the scanning tool can analyse.
 *
 * <p>Exact-name patterns are tried before suffix wildcards so {@code build.sbt} is attributed by name.
 */
public final class SupportedFileTaxonomy {

    private final List<FilePattern> patterns;

    public SupportedFileTaxonomy(List<FilePattern> patterns) {
        List<FilePattern> ordered = new ArrayList<>();
        patterns.stream().filter(p -> !p.isWildcard()).forEach(ordered::add);
        patterns.stream().filter(FilePattern::isWildcard).forEach(ordered::add);
        this.patterns = List.copyOf(ordered);
    }

    public static SupportedFileTaxonomy defaults() {
        List<FilePattern> patterns = new ArrayList<>();
        add(patterns, FileType.NPM, "package.json", "package-lock.json");
        add(patterns, FileType.YARN, "yarn.lock");
        add(patterns, FileType.PNPM, "pnpm-lock.yaml");
        add(patterns, FileType.PIP, "requirements.txt");
        add(patterns, FileType.SETUPTOOLS, "setup.py");
        add(patterns, FileType.PIPENV, "Pipfile", "Pipfile.lock");
        add(patterns, FileType.POETRY, "pyproject.toml", "poetry.lock");
        add(patterns, FileType.MAVEN, "pom.xml");
        add(patterns, FileType.GRADLE, "build.gradle", "build.gradle.kts");
        add(patterns, FileType.SBT, "build.sbt", "*.sbt");
        add(patterns, FileType.COMPOSER, "composer.json", "composer.lock");
        add(patterns, FileType.RUBYGEMS, "Gemfile", "Gemfile.lock", "*.gemspec");
        add(patterns, FileType.GO_MODULES, "go.mod", "go.sum");
        add(patterns, FileType.CARGO, "Cargo.toml", "Cargo.lock");
        add(patterns, FileType.NUGET, "packages.config", "nuget.config", "project.assets.json",
            "*.csproj", "*.vbproj", "*.fsproj");
        add(patterns, FileType.COCOAPODS, "Podfile", "Podfile.lock");
        add(patterns, FileType.SWIFT, "Package.swift");
        add(patterns, FileType.HEX, "mix.exs", "mix.lock");
        add(patterns, FileType.DOCKER, "Dockerfile", "docker-compose.yml", "docker-compose.yaml");
        add(patterns, FileType.TERRAFORM, "*.tf", "*.tfvars");
        add(patterns, FileType.HELM, "Chart.yaml");
        return new SupportedFileTaxonomy(patterns);
    }

    /**
     * Classifies a repository path by its basename.
     *
     * @param path repository-relative path
     * @return supported file when some pattern matches
     */
    public Optional<SupportedFile> classify(String path) {
        String basename = basename(path);
        return patterns.stream()
            .filter(pattern -> pattern.matches(basename))
            .findFirst()
            .map(pattern -> new SupportedFile(path, pattern.type(), pattern.pattern()));
    }

    /**
     * File type of a path, {@link FileType#UNRECOGNIZED} when no pattern matches.
     */
    public FileType typeOf(String path) {
        return classify(path).map(SupportedFile::type).orElse(FileType.UNRECOGNIZED);
    }

    public List<FilePattern> patterns() {
        return patterns;
    }

    static String basename(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }

    private static void add(List<FilePattern> patterns, FileType type, String... names) {
        for (String name : names) {
            patterns.add(new FilePattern(name, type));
        }
    }
}
