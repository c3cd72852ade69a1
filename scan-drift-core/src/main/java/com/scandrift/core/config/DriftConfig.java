package com.scandrift.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scandrift.core.duplicate.DuplicatePolicy;
import com.scandrift.core.fetch.RetryPolicy;

import java.time.Duration;
import java.util.List;

/**
 * Root configuration for scan-drift runs.
 *
 * <p>Loaded from {@code scan-drift.yaml}. Every section and every field is optional; anything absent takes the
 * value from {@link #defaults()}. Credentials are not part of the file.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * scanTool:
 *   region: SNYK-EU-01
 *   integrationTypes: [gitlab, cli]
 *
 * host:
 *   url: https://gitlab.example.com
 *   verifySsl: false
 *
 * http:
 *   maxRetries: 5
 *
 * duplicates:
 *   separator: ":"
 * }</pre>
 *
 * @param scanTool scanning-tool API settings
 * @param host hosting-platform settings
 * @param http transport and retry settings
 * @param duplicates duplicate detection policy
 * @param report report truncation limits
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DriftConfig(
    @JsonProperty("scanTool") ScanToolConfig scanTool,
    @JsonProperty("host") HostConfig host,
    @JsonProperty("http") HttpConfig http,
    @JsonProperty("duplicates") DuplicatesConfig duplicates,
    @JsonProperty("report") ReportConfig report
) {
    public DriftConfig {
        if (scanTool == null) {
            scanTool = ScanToolConfig.defaults();
        }
        if (host == null) {
            host = HostConfig.defaults();
        }
        if (http == null) {
            http = HttpConfig.defaults();
        }
        if (duplicates == null) {
            duplicates = DuplicatesConfig.defaults();
        }
        if (report == null) {
            report = ReportConfig.defaults();
        }
    }

    /**
     * Creates the default configuration: US region, gitlab.com, three retries.
     *
     * @return default configuration
     */
    public static DriftConfig defaults() {
        return new DriftConfig(null, null, null, null, null);
    }

    /**
     * Scanning-tool settings.
     *
     * @param region region code such as {@code SNYK-US-01}
     * @param baseUrl explicit REST base URL, overrides the region when set
     * @param integrationTypes target integration types to reconcile
     * @param apiVersions version fallback lists per resource
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScanToolConfig(
        @JsonProperty("region") String region,
        @JsonProperty("baseUrl") String baseUrl,
        @JsonProperty("integrationTypes") List<String> integrationTypes,
        @JsonProperty("apiVersions") ApiVersions apiVersions
    ) {
        public static final String DEFAULT_REGION = "SNYK-US-01";
        public static final List<String> DEFAULT_INTEGRATION_TYPES = List.of("gitlab", "cli");

        public ScanToolConfig {
            if (region == null || region.isBlank()) {
                region = DEFAULT_REGION;
            }
            if (baseUrl != null && baseUrl.isBlank()) {
                baseUrl = null;
            }
            integrationTypes = integrationTypes == null || integrationTypes.isEmpty()
                ? DEFAULT_INTEGRATION_TYPES
                : List.copyOf(integrationTypes);
            if (apiVersions == null) {
                apiVersions = ApiVersions.defaults();
            }
        }

        public static ScanToolConfig defaults() {
            return new ScanToolConfig(null, null, null, null);
        }

        public ScanToolConfig withRegion(String newRegion) {
            return new ScanToolConfig(newRegion, baseUrl, integrationTypes, apiVersions);
        }
    }

    /**
     * API versions to try, in order, for each scanning-tool resource.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiVersions(
        @JsonProperty("organizations") List<String> organizations,
        @JsonProperty("groupOrganizations") List<String> groupOrganizations,
        @JsonProperty("organizationAccess") List<String> organizationAccess,
        @JsonProperty("targets") List<String> targets,
        @JsonProperty("projects") List<String> projects
    ) {
        public ApiVersions {
            organizations = orDefault(organizations, List.of("2024-10-15"));
            groupOrganizations = orDefault(groupOrganizations, List.of("2024-10-15", "2023-05-29"));
            organizationAccess = orDefault(organizationAccess, List.of("2024-10-15", "2023-05-29", "2023-06-18"));
            targets = orDefault(targets, List.of("2024-10-15", "2024-09-04", "2023-05-29", "2023-06-18"));
            projects = orDefault(projects, List.of("2024-10-15"));
        }

        public static ApiVersions defaults() {
            return new ApiVersions(null, null, null, null, null);
        }

        private static List<String> orDefault(List<String> versions, List<String> fallback) {
            return versions == null || versions.isEmpty() ? fallback : List.copyOf(versions);
        }
    }

    /**
     * Hosting-platform settings.
     *
     * @param url instance URL
     * @param verifySsl whether TLS certificates are verified; when false only the certificate chain check is
     *                  skipped, the JDK client still verifies that the host name matches the certificate
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HostConfig(
        @JsonProperty("url") String url,
        @JsonProperty("verifySsl") Boolean verifySsl
    ) {
        public static final String DEFAULT_URL = "https://gitlab.com";

        public HostConfig {
            if (url == null || url.isBlank()) {
                url = DEFAULT_URL;
            }
            if (verifySsl == null) {
                verifySsl = Boolean.TRUE;
            }
        }

        public static HostConfig defaults() {
            return new HostConfig(null, null);
        }

        public HostConfig withUrl(String newUrl) {
            return new HostConfig(newUrl, verifySsl);
        }
    }

    /**
     * Transport and retry settings.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HttpConfig(
        @JsonProperty("maxRetries") Integer maxRetries,
        @JsonProperty("baseDelayMillis") Long baseDelayMillis,
        @JsonProperty("rateLimitFallbackSeconds") Long rateLimitFallbackSeconds,
        @JsonProperty("connectTimeoutSeconds") Long connectTimeoutSeconds,
        @JsonProperty("requestTimeoutSeconds") Long requestTimeoutSeconds,
        @JsonProperty("pageSize") Integer pageSize
    ) {
        public HttpConfig {
            if (maxRetries == null || maxRetries < 0) {
                maxRetries = 3;
            }
            if (baseDelayMillis == null || baseDelayMillis < 0) {
                baseDelayMillis = 1000L;
            }
            if (rateLimitFallbackSeconds == null || rateLimitFallbackSeconds < 0) {
                rateLimitFallbackSeconds = 30L;
            }
            if (connectTimeoutSeconds == null || connectTimeoutSeconds <= 0) {
                connectTimeoutSeconds = 30L;
            }
            if (requestTimeoutSeconds == null || requestTimeoutSeconds <= 0) {
                requestTimeoutSeconds = 60L;
            }
            if (pageSize == null || pageSize <= 0) {
                pageSize = 100;
            }
        }

        public static HttpConfig defaults() {
            return new HttpConfig(null, null, null, null, null, null);
        }

        public RetryPolicy retryPolicy() {
            return new RetryPolicy(maxRetries, Duration.ofMillis(baseDelayMillis),
                Duration.ofSeconds(rateLimitFallbackSeconds));
        }

        public Duration connectTimeout() {
            return Duration.ofSeconds(connectTimeoutSeconds);
        }

        public Duration requestTimeout() {
            return Duration.ofSeconds(requestTimeoutSeconds);
        }
    }

    /**
     * Duplicate detection policy.
     *
     * @param separator character sequence splitting a project name from its sub-identifier
     * @param normalizePaths whether {@code .} and {@code ..} segments are collapsed in sub-identifiers
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DuplicatesConfig(
        @JsonProperty("separator") String separator,
        @JsonProperty("normalizePaths") Boolean normalizePaths
    ) {
        public DuplicatesConfig {
            if (separator == null || separator.isEmpty()) {
                separator = ":";
            }
            if (normalizePaths == null) {
                normalizePaths = Boolean.TRUE;
            }
        }

        public static DuplicatesConfig defaults() {
            return new DuplicatesConfig(null, null);
        }

        public DuplicatePolicy policy() {
            return new DuplicatePolicy(separator, normalizePaths);
        }
    }

    /**
     * Truncation limits for the text report.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportConfig(
        @JsonProperty("maxRepositories") Integer maxRepositories,
        @JsonProperty("maxTargetsPerRepository") Integer maxTargetsPerRepository,
        @JsonProperty("maxFileDetails") Integer maxFileDetails,
        @JsonProperty("maxUntrackedFiles") Integer maxUntrackedFiles
    ) {
        public ReportConfig {
            if (maxRepositories == null || maxRepositories <= 0) {
                maxRepositories = 200;
            }
            if (maxTargetsPerRepository == null || maxTargetsPerRepository <= 0) {
                maxTargetsPerRepository = 5;
            }
            if (maxFileDetails == null || maxFileDetails <= 0) {
                maxFileDetails = 50;
            }
            if (maxUntrackedFiles == null || maxUntrackedFiles <= 0) {
                maxUntrackedFiles = 200;
            }
        }

        public static ReportConfig defaults() {
            return new ReportConfig(null, null, null, null);
        }
    }
}
