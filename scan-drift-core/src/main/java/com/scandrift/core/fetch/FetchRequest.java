package com.scandrift.core.fetch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Description of a versioned, possibly paged collection resource.
 *
 * @param url absolute resource URL
 * @param params query parameters sent with the first page
 * @param headers request headers sent with every page
 * @param versions API versions to try in order; empty for unversioned resources
 * @param versionParam query parameter carrying the version
 * @param pagination paging style
 * @param itemsPointer JSON pointer to the item array, empty string for a top-level array
 * @param linkBase API base URL that host-relative next links are relative to; null to resolve against the host
 */
public record FetchRequest(
    String url,
    Map<String, String> params,
    Map<String, String> headers,
    List<String> versions,
    String versionParam,
    PaginationStyle pagination,
    String itemsPointer,
    String linkBase
) {
    public static final String DEFAULT_VERSION_PARAM = "version";
    public static final String JSON_API_ITEMS = "/data";

    public FetchRequest {
        Objects.requireNonNull(url, "url must not be null");
        params = params == null ? Map.of() : unmodifiableOrdered(params);
        headers = headers == null ? Map.of() : unmodifiableOrdered(headers);
        versions = versions == null ? List.of() : List.copyOf(versions);
        if (versionParam == null || versionParam.isBlank()) {
            versionParam = DEFAULT_VERSION_PARAM;
        }
        if (pagination == null) {
            pagination = PaginationStyle.NONE;
        }
        if (itemsPointer == null) {
            itemsPointer = "";
        }
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    private static Map<String, String> unmodifiableOrdered(Map<String, String> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static class Builder {
        private final String url;
        private final Map<String, String> params = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private List<String> versions = List.of();
        private String versionParam = DEFAULT_VERSION_PARAM;
        private PaginationStyle pagination = PaginationStyle.NONE;
        private String itemsPointer = "";
        private String linkBase;

        private Builder(String url) {
            this.url = url;
        }

        public Builder param(String name, String value) {
            params.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> values) {
            headers.putAll(values);
            return this;
        }

        public Builder versions(List<String> values) {
            this.versions = values;
            return this;
        }

        public Builder versionParam(String name) {
            this.versionParam = name;
            return this;
        }

        public Builder pagination(PaginationStyle style) {
            this.pagination = style;
            return this;
        }

        public Builder itemsPointer(String pointer) {
            this.itemsPointer = pointer;
            return this;
        }

        public Builder linkBase(String base) {
            this.linkBase = base;
            return this;
        }

        public FetchRequest build() {
            return new FetchRequest(url, params, headers, versions, versionParam, pagination, itemsPointer, linkBase);
        }
    }
}
