package com.ziplens.service.acs;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ziplens.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

public final class HttpAcsTransport implements AcsTransport {
    public static final String DEFAULT_BASE_URL = "https://api.census.gov/data";
    private static final String ZCTA_PREDICATE = "zip code tabulation area";
    private static final TypeReference<List<List<String>>> TABLE = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public HttpAcsTransport(HttpClient httpClient, String baseUrl, String apiKey, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public AcsTable fetch(AcsQuery query) {
        HttpResponse<String> response = send(query);
        int status = response.statusCode();
        if (status == 204) {
            return AcsTable.empty();
        }
        if (status / 100 != 2) {
            throw AcsRequestException.forStatus(status);
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return AcsTable.empty();
        }
        List<List<String>> table;
        try {
            table = JsonUtils.objectMapper().readValue(body, TABLE);
        } catch (IOException e) {
            throw new AcsRequestException(AcsRequestException.Kind.TRANSIENT, status, "Malformed provider response", e);
        }
        if (table == null || table.isEmpty()) {
            return AcsTable.empty();
        }
        return new AcsTable(table.get(0), table.subList(1, table.size()));
    }

    @Override
    public int probe(AcsQuery query) {
        return send(query).statusCode();
    }

    URI uriFor(AcsQuery query) {
        String get = "NAME," + String.join(",", query.variables());
        StringBuilder uri = new StringBuilder()
                .append(baseUrl).append('/').append(query.year()).append('/').append(query.dataset())
                .append("?get=").append(URLEncoder.encode(get, StandardCharsets.UTF_8))
                .append("&for=").append(URLEncoder.encode(ZCTA_PREDICATE, StandardCharsets.UTF_8).replace("+", "%20"))
                .append(':').append(URLEncoder.encode(String.join(",", query.zips()), StandardCharsets.UTF_8));
        if (apiKey != null && !apiKey.isBlank()) {
            uri.append("&key=").append(URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
        }
        return URI.create(uri.toString());
    }

    private HttpResponse<String> send(AcsQuery query) {
        HttpRequest request = HttpRequest.newBuilder(uriFor(query))
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new AcsRequestException(AcsRequestException.Kind.TRANSIENT, 0,
                    "Provider call timed out after " + timeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new AcsRequestException(AcsRequestException.Kind.TRANSIENT, 0,
                    "Provider call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcsRequestException(AcsRequestException.Kind.TRANSIENT, 0, "Provider call interrupted", e);
        }
    }
}
