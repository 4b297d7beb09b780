package com.theset.setlist.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Persisted artist record.
 * storedTracks is either null or a complete catalog snapshot written in one operation.
 */
public record Artist(
        String id,
        String name,
        String imageUrl,
        List<String> genres,
        int popularity,
        int upcomingShows,
        String catalogId,
        List<Track> storedTracks,
        Instant tracksLastUpdated,
        Instant updatedAt
) {
    public Artist {
        genres = genres == null ? List.of() : List.copyOf(genres);
        storedTracks = storedTracks == null ? null : List.copyOf(storedTracks);
    }

    public boolean hasStoredTracks() {
        return storedTracks != null && !storedTracks.isEmpty();
    }

    public boolean hasCatalogId() {
        return catalogId != null && !catalogId.isBlank();
    }

    public Artist withUpdatedAt(Instant timestamp) {
        return new Artist(id, name, imageUrl, genres, popularity, upcomingShows,
                catalogId, storedTracks, tracksLastUpdated, timestamp);
    }
}
