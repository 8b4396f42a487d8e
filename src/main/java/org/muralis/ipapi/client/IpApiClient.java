package org.muralis.ipapi.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import lombok.extern.slf4j.Slf4j;
import org.muralis.ipapi.exception.IpApiDeserializationException;
import org.muralis.ipapi.exception.IpApiException;
import org.muralis.ipapi.exception.IpApiQueryException;
import org.muralis.ipapi.exception.IpApiRateLimitException;
import org.muralis.ipapi.exception.IpApiStatusException;
import org.muralis.ipapi.exception.IpApiTransportException;
import org.muralis.ipapi.model.IpApiMessage;
import org.muralis.ipapi.model.IpData;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Performs lookups against the ip-api.com JSON API.
 * <p>
 * Every call is a single blocking HTTP exchange: no retries, no caching.
 * Failures surface as subclasses of {@link IpApiException}.
 */
@Slf4j
public class IpApiClient {

    public static final String DEFAULT_BASE_URL = "http://ip-api.com";

    static final String RATE_LIMIT_TTL_HEADER = "X-Ttl";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    /**
     * @param objectMapper copied, the copy rejects trailing content and scalar type coercions
     */
    public IpApiClient(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = strictCopy(objectMapper);
    }

    public static IpApiClient create() {
        return create(DEFAULT_BASE_URL);
    }

    public static IpApiClient create(String baseUrl) {
        return new IpApiClient(RestClient.builder().baseUrl(baseUrl).build(), new ObjectMapper());
    }

    /**
     * Looks up a single target.
     *
     * @param target an IPv4/IPv6 address, a domain name, or an empty string for the caller's own address
     */
    public IpData makeRequest(IpApiConfig config, String target) {
        IpApiConfig snapshot = config.copy();
        String query = target != null ? target : "";
        if (log.isDebugEnabled()) {
            log.debug("Looking up '{}' with fields=[{}], lang={}", query, snapshot.fieldNames(),
                    snapshot.getLanguage().getCode());
        }

        String body = retrieve(restClient.get()
                .uri(uriBuilder -> lookupUri(uriBuilder, "/json/{target}", snapshot, query)), "lookup");

        JsonNode node = parse(body);
        if (!node.isObject()) {
            throw new IpApiDeserializationException("Expected a JSON object but got " + node.getNodeType());
        }
        checkMessage(node);
        return bind(node);
    }

    /**
     * Looks up several IP addresses in one request. The result has one entry per target, in input order.
     * Any failed entry fails the whole batch.
     */
    public List<IpData> makeBatchRequest(IpApiConfig config, List<String> targets) {
        Objects.requireNonNull(targets, "targets");
        IpApiConfig snapshot = config.copy();
        if (log.isDebugEnabled()) {
            log.debug("Batch lookup of {} targets with fields=[{}], lang={}", targets.size(), snapshot.fieldNames(),
                    snapshot.getLanguage().getCode());
        }

        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(targets);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize batch targets", e);
        }

        String body = retrieve(restClient.post()
                .uri(uriBuilder -> lookupUri(uriBuilder, "/batch", snapshot))
                .contentType(MediaType.APPLICATION_JSON)
                .body(requestBody), "batch lookup");

        JsonNode node = parse(body);
        if (!node.isArray()) {
            throw new IpApiDeserializationException("Expected a JSON array but got " + node.getNodeType());
        }
        if (node.size() != targets.size()) {
            throw new IpApiDeserializationException(
                    "Expected " + targets.size() + " batch entries but got " + node.size());
        }
        for (JsonNode entry : node) {
            checkMessage(entry);
        }

        List<IpData> result = new ArrayList<>(node.size());
        for (JsonNode entry : node) {
            result.add(bind(entry));
        }
        return result;
    }

    private static ObjectMapper strictCopy(ObjectMapper source) {
        ObjectMapper mapper = source.copy()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        for (LogicalType type : new LogicalType[]{LogicalType.Integer, LogicalType.Float, LogicalType.Boolean}) {
            mapper.coercionConfigFor(type).setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        }
        return mapper;
    }

    private static URI lookupUri(UriBuilder uriBuilder, String path, IpApiConfig config, Object... uriVariables) {
        uriBuilder.path(path).queryParam("fields", config.fieldsBitmask());
        // the API answers in English when lang is absent
        if (!config.getLanguage().isDefault()) {
            uriBuilder.queryParam("lang", config.getLanguage().getCode());
        }
        return uriBuilder.build(uriVariables);
    }

    private String retrieve(RestClient.RequestHeadersSpec<?> request, String operation) {
        try {
            return request.retrieve()
                    .onStatus(status -> status.value() == HttpStatus.TOO_MANY_REQUESTS.value(), (req, response) -> {
                        int ttl = secondsToReset(response.getHeaders());
                        log.warn("ip-api rate limit reached, resets in {}s", ttl);
                        throw new IpApiRateLimitException("Rate limit exceeded on " + operation, ttl);
                    })
                    .onStatus(status -> !status.is2xxSuccessful(), (req, response) -> {
                        String msg = "Unexpected status on " + operation + ": " + response.getStatusCode();
                        throw new IpApiStatusException(msg, response.getStatusCode().value());
                    })
                    .body(String.class);
        } catch (IpApiException e) {
            throw e;
        } catch (RestClientException e) {
            log.error("Network error calling ip-api {}", operation, e);
            throw new IpApiTransportException("Network error calling ip-api " + operation, e);
        }
    }

    static int secondsToReset(HttpHeaders headers) {
        String ttl = headers.getFirst(RATE_LIMIT_TTL_HEADER);
        if (ttl == null) {
            return IpApiRateLimitException.UNKNOWN_TTL;
        }
        try {
            return Integer.parseInt(ttl.trim());
        } catch (NumberFormatException e) {
            log.warn("Unparseable {} header: {}", RATE_LIMIT_TTL_HEADER, ttl);
            return IpApiRateLimitException.UNKNOWN_TTL;
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new IpApiDeserializationException("Response is empty");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IpApiDeserializationException("Failed to parse body from the response", e);
        }
    }

    private void checkMessage(JsonNode entry) {
        IpApiMessage message;
        try {
            message = objectMapper.treeToValue(entry, IpApiMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IpApiDeserializationException("Unexpected lookup entry shape", e);
        }
        if (message != null && (message.message() != null || message.isFail())) {
            log.warn("ip-api reported a failed lookup: {}", message.message());
            throw new IpApiQueryException(message.message());
        }
    }

    private IpData bind(JsonNode entry) {
        try {
            return objectMapper.treeToValue(entry, IpData.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IpApiDeserializationException("Failed to map response to IpData", e);
        }
    }
}
