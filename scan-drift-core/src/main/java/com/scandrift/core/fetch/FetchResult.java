package com.scandrift.core.fetch;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Items gathered by a fetch together with how the fetch ended.
 *
 * <p>An {@link FetchStatus#UNAVAILABLE} result with no items is distinct from a {@link FetchStatus#COMPLETE}
 * result with no items: the former means no API version would serve the resource.
 *
 * @param items items in page order
 * @param status outcome
 * @param version API version that answered, null when none did or the resource is unversioned
 * @param httpStatus last HTTP status seen, 0 if no response was received
 * @param reason human-readable explanation for non-complete outcomes, empty otherwise
 * @param <T> item type
 */
public record FetchResult<T>(
    List<T> items,
    FetchStatus status,
    String version,
    int httpStatus,
    String reason
) {
    public FetchResult {
        Objects.requireNonNull(status, "status must not be null");
        items = items == null ? List.of() : List.copyOf(items);
        if (reason == null) {
            reason = "";
        }
    }

    public static <T> FetchResult<T> complete(List<T> items, String version, int httpStatus) {
        return new FetchResult<>(items, FetchStatus.COMPLETE, version, httpStatus, "");
    }

    public static <T> FetchResult<T> partial(List<T> items, String version, int httpStatus, String reason) {
        return new FetchResult<>(items, FetchStatus.PARTIAL, version, httpStatus, reason);
    }

    public static <T> FetchResult<T> unavailable(int httpStatus, String reason) {
        return new FetchResult<>(List.of(), FetchStatus.UNAVAILABLE, null, httpStatus, reason);
    }

    public static <T> FetchResult<T> failed(int httpStatus, String reason) {
        return new FetchResult<>(List.of(), FetchStatus.FAILED, null, httpStatus, reason);
    }

    /**
     * True when the resource was served under some version, fully or partly.
     */
    public boolean isAvailable() {
        return status == FetchStatus.COMPLETE || status == FetchStatus.PARTIAL;
    }

    public boolean isComplete() {
        return status == FetchStatus.COMPLETE;
    }

    public Optional<T> first() {
        return items.isEmpty() ? Optional.empty() : Optional.ofNullable(items.get(0));
    }

    /**
     * Converts every item, keeping status and metadata.
     */
    public <R> FetchResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().map(mapper).collect(Collectors.toList());
        return new FetchResult<>(mapped, status, version, httpStatus, reason);
    }

    /**
     * Converts every item, dropping those the mapper yields nothing for.
     */
    public <R> FetchResult<R> mapPresent(Function<? super T, Optional<R>> mapper) {
        List<R> mapped = items.stream()
            .map(mapper)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
        return new FetchResult<>(mapped, status, version, httpStatus, reason);
    }

    /**
     * Same outcome with different items.
     */
    public <R> FetchResult<R> withItems(List<R> newItems) {
        return new FetchResult<>(newItems, status, version, httpStatus, reason);
    }
}
