package com.scandrift.cli;

import com.scandrift.core.client.gitlab.GitLabClient;
import com.scandrift.core.client.snyk.SnykRegion;
import com.scandrift.core.client.snyk.SnykRestClient;
import com.scandrift.core.config.DriftConfig;
import com.scandrift.core.fetch.PaginatedFetcher;
import com.scandrift.core.fetch.Sleeper;
import com.scandrift.core.http.JdkHttpTransport;

/**
 * Builds the API clients from the effective configuration.
 */
final class ClientFactory {

    private ClientFactory() {
    }

    static SnykRestClient scanTool(DriftConfig config, String token) {
        DriftConfig.HttpConfig http = config.http();
        JdkHttpTransport transport = JdkHttpTransport.builder()
            .connectTimeout(http.connectTimeout())
            .requestTimeout(http.requestTimeout())
            .build();

        return SnykRestClient.builder()
            .fetcher(new PaginatedFetcher(transport, http.retryPolicy(), Sleeper.THREAD))
            .region(SnykRegion.fromCode(config.scanTool().region()))
            .baseUrl(config.scanTool().baseUrl())
            .versions(config.scanTool().apiVersions())
            .token(token)
            .pageSize(http.pageSize())
            .build();
    }

    static GitLabClient host(DriftConfig config, String token) {
        DriftConfig.HttpConfig http = config.http();
        // Self-managed instances may run with private certificates
        JdkHttpTransport transport = JdkHttpTransport.builder()
            .connectTimeout(http.connectTimeout())
            .requestTimeout(http.requestTimeout())
            .verifySsl(config.host().verifySsl())
            .build();

        PaginatedFetcher fetcher = new PaginatedFetcher(transport, http.retryPolicy(), Sleeper.THREAD);
        return new GitLabClient(fetcher, config.host().url(), token, http.pageSize());
    }
}
