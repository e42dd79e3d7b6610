package com.sunorcnys.model;

import java.util.List;

/**
 * A named, ordered collection of songs on one service. Duplicates are kept and order is significant.
 */
public final class Playlist {

    private final String id;
    private final String name;
    private final String description;
    private final List<Song> songs;
    private final String service;
    private final String coverImageUrl;
    private final String url;

    public Playlist(String id, String name, String description, List<Song> songs,
                    String service, String coverImageUrl, String url) {
        this.id = (id != null && !id.isBlank()) ? id : null;
        this.name = (name != null && !name.isBlank()) ? name : "Untitled Playlist";
        this.description = (description != null && !description.isBlank()) ? description : null;
        this.songs = (songs != null) ? List.copyOf(songs) : List.of();
        this.service = service;
        this.coverImageUrl = coverImageUrl;
        this.url = url;
    }

    public static Playlist of(String name, List<Song> songs) {
        return new Playlist(null, name, null, songs, null, null, null);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<Song> getSongs() {
        return songs;
    }

    public boolean isEmpty() {
        return songs.isEmpty();
    }

    public String getService() {
        return service;
    }

    public String getCoverImageUrl() {
        return coverImageUrl;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public String toString() {
        return "Playlist{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", service='" + service + '\'' +
                ", songs=" + songs.size() +
                '}';
    }
}
