package com.scandrift.core.http;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scripted in-memory {@link HttpTransport}.
 *
 * <p>Routes match on the URL without its query string and, optionally, on a subset of query
 * parameters (taken from both the URL and the params map). The most specific route wins, later
 * registrations breaking ties. Each route replays its responses in order and repeats the last one. Requests with no
 * matching route get a 404.
 */
public class FakeHttpTransport implements HttpTransport {

    private final List<Route> routes = new ArrayList<>();
    private final List<Request> requests = new ArrayList<>();

    /**
     * Registers responses for a URL regardless of its query parameters.
     */
    public FakeHttpTransport on(String url, Object... responses) {
        return on(url, Map.of(), responses);
    }

    /**
     * Registers responses for a URL whose query parameters include {@code params}.
     * Responses are {@link HttpResponseData}, {@link IOException} or {@link RuntimeException} instances.
     */
    public FakeHttpTransport on(String url, Map<String, String> params, Object... responses) {
        Deque<Object> queue = new ArrayDeque<>(List.of(responses));
        routes.add(new Route(url, Map.copyOf(params), queue));
        return this;
    }

    public static HttpResponseData json(String body) {
        return HttpResponseData.of(200, body);
    }

    public static HttpResponseData status(int statusCode) {
        return HttpResponseData.of(statusCode, "{}");
    }

    public static HttpResponseData withHeader(int statusCode, String body, String name, String value) {
        return new HttpResponseData(statusCode, body, Map.of(name, List.of(value)));
    }

    public List<Request> requests() {
        return List.copyOf(requests);
    }

    public List<Request> requestsTo(String url) {
        return requests.stream().filter(r -> r.url().equals(url)).toList();
    }

    @Override
    public HttpResponseData get(String url, Map<String, String> params, Map<String, String> headers)
            throws IOException {
        return respond(url, params, headers);
    }

    private HttpResponseData respond(String url, Map<String, String> params, Map<String, String> headers)
            throws IOException {
        Map<String, String> safeParams = new LinkedHashMap<>();
        int query = url.indexOf('?');
        if (query >= 0) {
            for (String pair : url.substring(query + 1).split("&")) {
                int eq = pair.indexOf('=');
                if (eq > 0) {
                    safeParams.put(pair.substring(0, eq), pair.substring(eq + 1));
                }
            }
            url = url.substring(0, query);
        }
        if (params != null) {
            params.forEach(safeParams::putIfAbsent);
        }
        requests.add(new Request(url, safeParams, headers == null ? Map.of() : Map.copyOf(headers)));

        Route match = null;
        for (Route route : routes) {
            if (route.matches(url, safeParams)
                    && (match == null || route.params().size() >= match.params().size())) {
                match = route;
            }
        }
        if (match == null) {
            return HttpResponseData.of(404, "{\"error\":\"not found\"}");
        }

        Object next = match.responses().size() > 1 ? match.responses().poll() : match.responses().peek();
        if (next instanceof IOException) {
            throw (IOException) next;
        }
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }
        return (HttpResponseData) next;
    }

    public record Request(String url, Map<String, String> params, Map<String, String> headers) {
    }

    private record Route(String url, Map<String, String> params, Deque<Object> responses) {
        boolean matches(String requestUrl, Map<String, String> requestParams) {
            if (!url.equals(requestUrl)) {
                return false;
            }
            return params.entrySet().stream()
                .allMatch(e -> e.getValue().equals(requestParams.get(e.getKey())));
        }
    }
}
