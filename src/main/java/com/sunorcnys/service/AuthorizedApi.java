package com.sunorcnys.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunorcnys.auth.OAuth2Authenticator;
import com.sunorcnys.http.ApiRequest;
import com.sunorcnys.http.ApiResponse;
import com.sunorcnys.http.FetchException;
import com.sunorcnys.http.PaginatedFetcher;
import com.sunorcnys.http.RetryingExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;
import java.util.function.Function;

/**
 * Authenticated, retried access to one service's REST API. Every request asks the authenticator
 * for a valid token first, and a 401 triggers one refresh followed by a single replay.
 */
public class AuthorizedApi {

    private static final Logger log = LoggerFactory.getLogger(AuthorizedApi.class);

    private final OAuth2Authenticator authenticator;
    private final RetryingExecutor executor;
    private final PaginatedFetcher fetcher;
    private final ObjectMapper mapper;

    public AuthorizedApi(OAuth2Authenticator authenticator, RetryingExecutor executor, ObjectMapper mapper) {
        this(authenticator, executor, new PaginatedFetcher(executor.getService()), mapper);
    }

    public AuthorizedApi(OAuth2Authenticator authenticator, RetryingExecutor executor,
                         PaginatedFetcher fetcher, ObjectMapper mapper) {
        this.authenticator = authenticator;
        this.executor = executor;
        this.fetcher = fetcher;
        this.mapper = mapper;
    }

    public String getService() {
        return executor.getService();
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public ApiResponse send(ApiRequest request, String phase) {
        String token = authenticator.ensureValidToken().getAccessToken();
        ApiResponse response = executor.execute(request.withHeader("Authorization", "Bearer " + token), phase);
        if (response.status() == 401) {
            log.info("{} rejected the access token during {}, refreshing once", getService(), phase);
            token = authenticator.refresh().getAccessToken();
            response = executor.execute(request.withHeader("Authorization", "Bearer " + token), phase);
        }
        return response;
    }

    public JsonNode getJson(URI uri, String phase) {
        return requireSuccess(send(ApiRequest.get(uri), phase), "GET", uri, phase);
    }

    /**
     * Like {@link #getJson} but a 404 means "no such resource" instead of an error.
     */
    public Optional<JsonNode> getJsonIfFound(URI uri, String phase) {
        ApiResponse response = send(ApiRequest.get(uri), phase);
        if (response.status() == 404) {
            return Optional.empty();
        }
        return Optional.of(requireSuccess(response, "GET", uri, phase));
    }

    public JsonNode postJson(URI uri, Object body, String contentType, String phase) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new FetchException(getService(), phase, "Could not encode request body for " + uri, -1, e);
        }
        return requireSuccess(send(ApiRequest.post(uri, contentType, json), phase), "POST", uri, phase);
    }

    public Iterable<JsonNode> fetchAll(URI start,
                                       Function<JsonNode, JsonNode> extractItems,
                                       Function<JsonNode, Optional<String>> extractNext) {
        return fetcher.fetchAll(start, uri -> send(ApiRequest.get(uri), "fetch-page"), extractItems, extractNext);
    }

    private JsonNode requireSuccess(ApiResponse response, String method, URI uri, String phase) {
        if (!response.isSuccess()) {
            throw new FetchException(getService(), phase,
                    method + " " + uri.getPath() + " failed with status " + response.status() + ": " + response.bodySnippet(),
                    response.status(), null);
        }
        return response.body();
    }
}
