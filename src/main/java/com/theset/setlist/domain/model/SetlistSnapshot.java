package com.theset.setlist.domain.model;

import java.util.List;

/**
 * Setlist state as seen by one participant right after an operation.
 */
public record SetlistSnapshot(
        List<SetlistEntry> setlist,
        List<Track> availableTracks,
        String selectedTrackId,
        int anonymousVoteCount,
        boolean connected
) {}
