package com.harmoniq.app.service;

import java.util.List;

public interface PlaylistSync {

    /**
     * Creates the playlist if absent, otherwise replaces its contents and description.
     */
    void upsertPlaylist(String name, List<String> orderedTrackIds, String description);
}
