package com.sunorcnys.sync;

import com.sunorcnys.SyncronusException;

public class EmptyPlaylistException extends SyncronusException {

    public EmptyPlaylistException(String service, String playlistName) {
        super(service, "sync", "Cannot sync empty playlist '" + playlistName + "'");
    }
}
