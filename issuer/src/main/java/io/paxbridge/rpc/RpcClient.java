package io.paxbridge.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Blocking JSON-RPC client of a bitcoind style node. No retry: callers poll again on failure.
 */
public class RpcClient {
    private static final Logger logger = LogManager.getLogger(RpcClient.class);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final URI uri;
    private final String authorization;
    private final Duration requestTimeout;
    private final AtomicLong nextId = new AtomicLong(1);

    // requestTimeout of zero means the call waits for the node indefinitely
    public RpcClient(URI uri, String user, String password, Duration requestTimeout) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .build();
        this.mapper = RpcJsonMapper.getMapper();
        this.uri = uri;
        this.authorization = user == null || user.isEmpty() ? null :
                "Basic " + Base64.getEncoder().encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
        this.requestTimeout = requestTimeout;
    }

    public URI uri() {
        return uri;
    }

    /**
     * @return the non null "result" member of the response
     * @throws RpcException on transport failure, unparseable response, node error or null result
     */
    public JsonNode call(String method, List<Object> params) throws RpcException {
        RpcRequest request = new RpcRequest(nextId.getAndIncrement(), method, params);
        String body;
        try {
            body = mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RpcException(RpcError.fromCode(RpcCode.InvalidParams, e.getMessage()), e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (authorization != null)
            builder.header("Authorization", authorization);
        if (requestTimeout != null && !requestTimeout.isZero())
            builder.timeout(requestTimeout);

        HttpResponse<String> response;
        try {
            logger.trace("{} -> {}", uri, request);
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RpcException(RpcError.fromCode(RpcCode.TransportError, method + ": " + e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(RpcError.fromCode(RpcCode.TransportError, method + ": interrupted"), e);
        }

        // bitcoind answers node errors with a non 200 status and a regular json body
        String responseBody = response.body();
        if (response.statusCode() != 200 && (responseBody == null || responseBody.isBlank()))
            throw new RpcException(RpcError.fromCode(RpcCode.TransportError,
                    String.format("%s: http status %d", method, response.statusCode())));
        return parseResponse(mapper, method, responseBody);
    }

    static JsonNode parseResponse(ObjectMapper mapper, String method, String responseBody) throws RpcException {
        JsonNode json;
        try {
            json = responseBody == null ? null : mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new RpcException(RpcError.fromCode(RpcCode.ParseError, method), e);
        }
        if (json == null || !json.isObject())
            throw new RpcException(RpcError.fromCode(RpcCode.ParseError, method));

        JsonNode error = json.get("error");
        if (error != null && !error.isNull()) {
            int code = error.path("code").asInt(RpcCode.InternalError.code);
            throw new RpcException(new RpcError(code, error.path("message").asText(""), method));
        }

        JsonNode result = json.get("result");
        if (result == null || result.isNull())
            throw new RpcException(RpcError.fromCode(RpcCode.EmptyResult, method));
        return result;
    }
}
