package com.scandrift.core.model;

/**
 * Closed taxonomy of file types the scanning tool can analyse.
 *
 * <p>Dependency manifests are tagged by ecosystem, containers and infrastructure-as-code by tool.
 * {@link #UNRECOGNIZED} tags tracked files whose name falls outside the taxonomy.
 */
public enum FileType {
    NPM(FileCategory.DEPENDENCY_MANIFEST, "npm"),
    YARN(FileCategory.DEPENDENCY_MANIFEST, "yarn"),
    PNPM(FileCategory.DEPENDENCY_MANIFEST, "pnpm"),
    PIP(FileCategory.DEPENDENCY_MANIFEST, "pip"),
    SETUPTOOLS(FileCategory.DEPENDENCY_MANIFEST, "setuptools"),
    PIPENV(FileCategory.DEPENDENCY_MANIFEST, "pipenv"),
    POETRY(FileCategory.DEPENDENCY_MANIFEST, "poetry"),
    MAVEN(FileCategory.DEPENDENCY_MANIFEST, "maven"),
    GRADLE(FileCategory.DEPENDENCY_MANIFEST, "gradle"),
    SBT(FileCategory.DEPENDENCY_MANIFEST, "sbt"),
    COMPOSER(FileCategory.DEPENDENCY_MANIFEST, "composer"),
    RUBYGEMS(FileCategory.DEPENDENCY_MANIFEST, "rubygems"),
    GO_MODULES(FileCategory.DEPENDENCY_MANIFEST, "gomodules"),
    CARGO(FileCategory.DEPENDENCY_MANIFEST, "cargo"),
    NUGET(FileCategory.DEPENDENCY_MANIFEST, "nuget"),
    COCOAPODS(FileCategory.DEPENDENCY_MANIFEST, "cocoapods"),
    SWIFT(FileCategory.DEPENDENCY_MANIFEST, "swift"),
    HEX(FileCategory.DEPENDENCY_MANIFEST, "hex"),
    DOCKER(FileCategory.CONTAINER, "docker"),
    TERRAFORM(FileCategory.INFRASTRUCTURE_AS_CODE, "terraform"),
    HELM(FileCategory.INFRASTRUCTURE_AS_CODE, "helm"),
    UNRECOGNIZED(FileCategory.OTHER, "unrecognized");

    private final FileCategory category;
    private final String label;

    FileType(FileCategory category, String label) {
        this.category = category;
        this.label = label;
    }

    public FileCategory category() {
        return category;
    }

    public String label() {
        return label;
    }
}
