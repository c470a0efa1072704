package com.barte.sdk.transport;

import com.barte.sdk.client.ClientConfig;
import com.barte.sdk.decode.DecodingException;
import com.barte.sdk.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/** {@link Transport} backed by the JDK {@link HttpClient}. No retries are attempted. */
public class HttpTransport implements Transport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpTransport.class);

    private final HttpClient http;
    private final String baseUrl;
    private final ClientConfig config;

    public HttpTransport(ClientConfig config) {
        this(config.baseUrl(), config);
    }

    /** Targets an explicit base URL, e.g. a local stub server, with the credentials of {@code config}. */
    public HttpTransport(String baseUrl, ClientConfig config) {
        this(baseUrl, config, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public HttpTransport(String baseUrl, ClientConfig config, HttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.config = config;
        this.http = http;
    }

    @Override
    public JsonNode send(HttpMethod method, String path, Map<String, ?> query, Object body)
            throws IOException, InterruptedException {
        URI uri = URI.create(baseUrl + path + queryString(query));
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header(config.authHeaderName(), config.authHeaderValue())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .method(method.name(), publisher)
                .build();

        LOG.debug("{} {}", method, uri);
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        LOG.debug("{} {} -> HTTP {}", method, path, status);

        if (status < 200 || status >= 300) {
            LOG.warn("{} {} failed with HTTP {}", method, path, status);
            throw new RemoteApiException(status, response.body());
        }
        String text = response.body();
        if (text == null || text.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return Json.MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DecodingException("", "response of " + method + " " + path + " is not valid JSON", e);
        }
    }

    static String queryString(Map<String, ?> query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        for (Map.Entry<String, ?> entry : query.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            joiner.add(encode(entry.getKey()) + "=" + encode(String.valueOf(entry.getValue())));
        }
        String rendered = joiner.toString();
        return rendered.equals("?") ? "" : rendered;
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
