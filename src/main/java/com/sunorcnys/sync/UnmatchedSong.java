package com.sunorcnys.sync;

import com.sunorcnys.model.Song;

public record UnmatchedSong(Song song, UnmatchedReason reason) {}
