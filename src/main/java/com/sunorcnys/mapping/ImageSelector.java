package com.sunorcnys.mapping;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.function.Function;

/**
 * Picks the largest image (width × height) from a provider image list. Ties go to the first seen.
 */
public final class ImageSelector {

    private ImageSelector() {}

    /**
     * @param images array of image objects
     * @param size   extracts the {@code width}/{@code height} holder from one image
     * @param url    extracts the URL from one image
     */
    public static Optional<String> largest(JsonNode images, Function<JsonNode, JsonNode> size, Function<JsonNode, String> url) {
        if (images == null || !images.isArray()) {
            return Optional.empty();
        }
        String best = null;
        long bestArea = -1;
        for (JsonNode image : images) {
            String href = url.apply(image);
            if (href == null || href.isBlank()) {
                continue;
            }
            JsonNode dims = size.apply(image);
            long area = dims == null ? 0 : Math.max(0, dims.path("width").asLong(0)) * Math.max(0, dims.path("height").asLong(0));
            if (area > bestArea) {
                best = href;
                bestArea = area;
            }
        }
        return Optional.ofNullable(best);
    }

    public static Optional<String> largest(JsonNode images) {
        return largest(images, Function.identity(), image -> JsonFields.text(image, "url"));
    }
}
