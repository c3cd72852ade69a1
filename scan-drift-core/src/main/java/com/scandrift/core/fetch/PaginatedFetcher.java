package com.scandrift.core.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scandrift.core.http.HttpResponseData;
import com.scandrift.core.http.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fetches versioned, paged JSON collections.
 *
 * <p>For each version in {@link FetchRequest#versions()} the first page is requested; a 404, 401 or 403 moves on to
 * the next version, any other non-success status fails the fetch. Once a version answers, pages are followed until
 * no next-page indicator remains or a page comes back empty.
 *
 * <p>Every request goes through the retry loop: I/O faults and 5xx responses are retried with exponential backoff
 * up to {@link RetryPolicy#maxRetries()}, 429 responses wait for the server's Retry-After and are retried without
 * limit. When transient retries run out the fetch stops and returns the items gathered so far as
 * {@link FetchStatus#PARTIAL}. A later page that cannot be read, or a next link that is not a valid URL, ends the
 * fetch the same way.
 */
public class PaginatedFetcher {
    private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);

    public static final String NEXT_LINK_POINTER = "/links/next";
    public static final String NEXT_PAGE_HEADER = "X-Next-Page";
    public static final String PAGE_PARAM = "page";

    private final HttpTransport transport;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;

    public PaginatedFetcher(HttpTransport transport, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.objectMapper = new ObjectMapper();
    }

    public PaginatedFetcher(HttpTransport transport) {
        this(transport, RetryPolicy.defaults(), Sleeper.THREAD);
    }

    /**
     * Fetches every item of a collection across all pages.
     *
     * @param request resource description
     * @return items in page order with the fetch outcome
     */
    public FetchResult<JsonNode> fetchAll(FetchRequest request) {
        return fetch(request, true);
    }

    /**
     * Fetches a single JSON document, applying version fallback and retries but no pagination.
     *
     * @param request resource description
     * @return the document as the only item when available
     */
    public FetchResult<JsonNode> fetchDocument(FetchRequest request) {
        return fetch(request, false);
    }

    private FetchResult<JsonNode> fetch(FetchRequest request, boolean collection) {
        List<String> versions = request.versions().isEmpty()
            ? Collections.singletonList(null)
            : request.versions();
        int lastStatus = 0;

        for (String version : versions) {
            Map<String, String> params = new LinkedHashMap<>(request.params());
            if (version != null) {
                params.put(request.versionParam(), version);
            }

            HttpResponseData first;
            try {
                first = send(request.url(), params, request.headers());
            } catch (RetriesExhaustedException e) {
                log.warn("Giving up on {}: {}", request.url(), e.getMessage());
                return FetchResult.partial(List.of(), version, e.statusCode, e.getMessage());
            } catch (IllegalArgumentException e) {
                String reason = "Malformed request URL " + request.url() + ": " + e.getMessage();
                log.warn("Fetch failed: {}", reason);
                return FetchResult.failed(0, reason);
            }

            if (first.isNotFound() || first.isUnauthorized()) {
                lastStatus = first.statusCode();
                log.debug("{} answered {} for version {}", request.url(), first.statusCode(), version);
                continue;
            }
            if (!first.isSuccess()) {
                String reason = "HTTP " + first.statusCode() + " from " + request.url();
                log.warn("Fetch failed: {}", reason);
                return FetchResult.failed(first.statusCode(), reason);
            }
            return collection
                ? collectPages(request, version, params, first)
                : singleDocument(request, version, first);
        }

        String reason = request.versions().isEmpty()
            ? "HTTP " + lastStatus + " from " + request.url()
            : "Not found or not authorized under versions " + request.versions();
        log.debug("{} unavailable: {}", request.url(), reason);
        return FetchResult.unavailable(lastStatus, reason);
    }

    private FetchResult<JsonNode> singleDocument(FetchRequest request, String version, HttpResponseData response) {
        Optional<JsonNode> document = parse(request.url(), response);
        if (document.isEmpty()) {
            return FetchResult.failed(response.statusCode(), "Malformed JSON from " + request.url());
        }
        return FetchResult.complete(List.of(document.get()), version, response.statusCode());
    }

    private FetchResult<JsonNode> collectPages(FetchRequest request, String version,
                                               Map<String, String> firstParams, HttpResponseData first) {
        List<JsonNode> items = new ArrayList<>();
        String currentUrl = request.url();
        Map<String, String> currentParams = firstParams;
        HttpResponseData response = first;
        int page = 1;

        while (true) {
            Optional<JsonNode> body = parse(currentUrl, response);
            if (body.isEmpty()) {
                return unreadablePage(items, version, response, "Malformed JSON from " + currentUrl);
            }
            JsonNode array = request.itemsPointer().isEmpty() ? body.get() : body.get().at(request.itemsPointer());
            if (!array.isArray()) {
                log.warn("Unexpected response shape from {}: no array at '{}'", currentUrl, request.itemsPointer());
                return unreadablePage(items, version, response, "Unexpected response shape from " + currentUrl);
            }
            if (array.isEmpty()) {
                break;
            }
            array.forEach(items::add);
            log.debug("Page {} of {}: {} items, {} total", page, request.url(), array.size(), items.size());

            Optional<NextPage> next;
            try {
                next = nextPage(request, currentUrl, firstParams, body.get(), response);
            } catch (IllegalArgumentException e) {
                String reason = "Malformed next link after page " + page + " of " + request.url() + ": "
                    + e.getMessage();
                log.warn("Keeping {} items: {}", items.size(), reason);
                return FetchResult.partial(items, version, response.statusCode(), reason);
            }
            if (next.isEmpty()) {
                break;
            }
            if (next.get().url().equals(currentUrl) && next.get().params().equals(currentParams)) {
                log.warn("Next page of {} points back at the current page, stopping", request.url());
                break;
            }
            currentUrl = next.get().url();
            currentParams = next.get().params();

            try {
                response = send(currentUrl, currentParams, request.headers());
            } catch (RetriesExhaustedException e) {
                log.warn("Keeping {} items from {} after page {} failed: {}",
                    items.size(), request.url(), page + 1, e.getMessage());
                return FetchResult.partial(items, version, e.statusCode, e.getMessage());
            } catch (IllegalArgumentException e) {
                String reason = "Malformed URL for page " + (page + 1) + " of " + request.url() + ": " + e.getMessage();
                log.warn("Keeping {} items: {}", items.size(), reason);
                return FetchResult.partial(items, version, 0, reason);
            }
            if (!response.isSuccess()) {
                String reason = "HTTP " + response.statusCode() + " on page " + (page + 1) + " of " + request.url();
                log.warn("Keeping {} items: {}", items.size(), reason);
                return FetchResult.partial(items, version, response.statusCode(), reason);
            }
            page++;
        }
        return FetchResult.complete(items, version, response.statusCode());
    }

    /**
     * An unreadable first page fails the fetch; on later pages the items gathered so far are kept.
     */
    private FetchResult<JsonNode> unreadablePage(List<JsonNode> items, String version, HttpResponseData response,
                                                 String reason) {
        if (items.isEmpty()) {
            return FetchResult.failed(response.statusCode(), reason);
        }
        log.warn("Keeping {} items: {}", items.size(), reason);
        return FetchResult.partial(items, version, response.statusCode(), reason);
    }

    private Optional<NextPage> nextPage(FetchRequest request, String currentUrl, Map<String, String> baseParams,
                                        JsonNode body, HttpResponseData response) {
        switch (request.pagination()) {
            case NEXT_LINK: {
                JsonNode link = body.at(NEXT_LINK_POINTER);
                if (!link.isTextual() || link.asText().isBlank()) {
                    return Optional.empty();
                }
                String url = NextLinks.resolve(request.linkBase(), currentUrl, link.asText());
                return Optional.of(new NextPage(url, NextLinks.missingParams(url, baseParams)));
            }
            case PAGE_HEADER: {
                Optional<String> nextPage = response.header(NEXT_PAGE_HEADER)
                    .map(String::trim)
                    .filter(value -> !value.isEmpty());
                if (nextPage.isEmpty()) {
                    return Optional.empty();
                }
                Map<String, String> params = new LinkedHashMap<>(baseParams);
                params.put(PAGE_PARAM, nextPage.get());
                return Optional.of(new NextPage(request.url(), params));
            }
            default:
                return Optional.empty();
        }
    }

    private Optional<JsonNode> parse(String url, HttpResponseData response) {
        try {
            JsonNode node = objectMapper.readTree(response.body());
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON from {}: {}", url, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private HttpResponseData send(String url, Map<String, String> params, Map<String, String> headers)
            throws RetriesExhaustedException {
        int attempt = 0;
        while (true) {
            HttpResponseData response;
            try {
                response = transport.get(url, params, headers);
            } catch (IOException e) {
                if (attempt >= retryPolicy.maxRetries()) {
                    throw new RetriesExhaustedException(
                        "Transient failure after " + (attempt + 1) + " attempts: " + e.getMessage(), 0);
                }
                pause(retryPolicy.backoff(attempt), url, "I/O error: " + e.getMessage());
                attempt++;
                continue;
            }

            if (response.isRateLimited()) {
                Duration delay = retryPolicy.rateLimitDelay(response.header("Retry-After"));
                pause(delay, url, "rate limited");
                continue;
            }
            if (response.isServerError()) {
                if (attempt >= retryPolicy.maxRetries()) {
                    throw new RetriesExhaustedException(
                        "HTTP " + response.statusCode() + " after " + (attempt + 1) + " attempts",
                        response.statusCode());
                }
                pause(retryPolicy.backoff(attempt), url, "HTTP " + response.statusCode());
                attempt++;
                continue;
            }
            return response;
        }
    }

    private void pause(Duration delay, String url, String cause) throws RetriesExhaustedException {
        log.warn("{} for {}, retrying in {} ms", cause, url, delay.toMillis());
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetriesExhaustedException("Interrupted while waiting to retry", 0);
        }
    }

    private record NextPage(String url, Map<String, String> params) {
    }

    private static final class RetriesExhaustedException extends Exception {
        private final int statusCode;

        RetriesExhaustedException(String message, int statusCode) {
            super(message);
            this.statusCode = statusCode;
        }
    }
}
