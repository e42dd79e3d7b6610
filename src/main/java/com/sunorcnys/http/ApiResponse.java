package com.sunorcnys.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status, parsed JSON body and headers of a completed call. A body that is empty or not JSON
 * becomes a missing or text node.
 */
public record ApiResponse(int status, JsonNode body, Map<String, List<String>> headers) {

    public ApiResponse {
        body = (body != null) ? body : MissingNode.getInstance();
        headers = (headers != null) ? Map.copyOf(headers) : Map.of();
    }

    public static ApiResponse of(int status, JsonNode body) {
        return new ApiResponse(status, body, Map.of());
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isRateLimited() {
        return status == 429;
    }

    public boolean isServerError() {
        return status >= 500;
    }

    /**
     * First value of a header, matched case-insensitively.
     */
    public Optional<String> header(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)
                    && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return Optional.ofNullable(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Short, single-line excerpt of the body for log and error messages.
     */
    public String bodySnippet() {
        if (body.isMissingNode()) {
            return "";
        }
        String text = body.isTextual() ? body.asText() : body.toString();
        String normalized = text.replaceAll("\\s+", " ").trim();
        return normalized.length() <= 160 ? normalized : normalized.substring(0, 157) + "...";
    }
}
