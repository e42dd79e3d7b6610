package com.sunorcnys.sync;

import java.util.List;

/**
 * Outcome of one sync run.
 *
 * @param total     songs in the source playlist
 * @param matched   source songs that resolved to a destination track
 * @param added     tracks actually sent to the destination playlist
 * @param cancelled true when the run stopped early; chunks added before that stay in place
 */
public record SyncResult(
        String sourceName,
        String destinationService,
        String destinationPlaylistId,
        boolean createdPlaylist,
        int total,
        int matched,
        List<UnmatchedSong> unmatched,
        int added,
        boolean cancelled) {

    public SyncResult {
        unmatched = unmatched == null ? List.of() : List.copyOf(unmatched);
    }

    public String summary() {
        return String.format("%s -> %s:%s  %d/%d matched, %d added%s",
                sourceName, destinationService, destinationPlaylistId,
                matched, total, added, cancelled ? " (cancelled)" : "");
    }
}
