package com.sunorcnys.http;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One HTTP call as the core describes it. The transport decides how it goes over the wire.
 */
public record ApiRequest(String method, URI uri, Map<String, String> headers, String body) {

    public static final String FORM = "application/x-www-form-urlencoded";
    public static final String JSON = "application/json";

    public ApiRequest {
        headers = (headers != null) ? Map.copyOf(headers) : Map.of();
    }

    public static ApiRequest get(URI uri) {
        return new ApiRequest("GET", uri, Map.of("Accept", JSON), null);
    }

    public static ApiRequest postForm(URI uri, Map<String, String> params) {
        return new ApiRequest("POST", uri, Map.of("Content-Type", FORM, "Accept", JSON), Urls.form(params));
    }

    public static ApiRequest post(URI uri, String contentType, String body) {
        return new ApiRequest("POST", uri, Map.of("Content-Type", contentType, "Accept", JSON), body);
    }

    public ApiRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ApiRequest(method, uri, copy, body);
    }

    @Override
    public String toString() {
        // headers and body can carry credentials
        return method + " " + uri;
    }
}
