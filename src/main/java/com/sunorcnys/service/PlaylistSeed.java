package com.sunorcnys.service;

import java.util.List;

/**
 * Input for playlist generation.
 */
public record PlaylistSeed(String name, List<String> genres, String description, int totalSongs) {

    public static final String DEFAULT_DESCRIPTION = "Generated by Syncronus";

    public PlaylistSeed {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Playlist name is required");
        }
        genres = (genres != null) ? List.copyOf(genres) : List.of();
        if (genres.isEmpty()) {
            throw new IllegalArgumentException("At least one seed genre is required");
        }
        description = (description != null) ? description : DEFAULT_DESCRIPTION;
        totalSongs = totalSongs > 0 ? totalSongs : 25;
    }

    public static PlaylistSeed of(String name, List<String> genres) {
        return new PlaylistSeed(name, genres, null, 25);
    }
}
