package com.barte.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Map;

/** Contract for issuing one request against the API (HTTP, in-memory fake, etc.). */
public interface Transport {
    /**
     * Sends a request and returns the parsed response.
     *
     * @param method HTTP verb
     * @param path path below the base URL, starting with {@code /}
     * @param query query parameters; {@code null} or empty adds none
     * @param body request payload serialized as JSON, or {@code null} for no body
     * @return the parsed response, or a {@link com.fasterxml.jackson.databind.node.MissingNode}
     *         when a successful response has no content
     * @throws RemoteApiException if the server answers with a non-2xx status
     * @throws com.barte.sdk.decode.DecodingException if a successful response is not JSON
     * @throws IOException if the request cannot be sent
     * @throws InterruptedException if the request is interrupted
     */
    JsonNode send(HttpMethod method, String path, Map<String, ?> query, Object body)
            throws IOException, InterruptedException;
}
