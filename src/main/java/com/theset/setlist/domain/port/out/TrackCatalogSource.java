package com.theset.setlist.domain.port.out;

import com.theset.setlist.domain.model.Track;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the external music catalog.
 * Domain doesn't care about HTTP, JSON, auth tokens, etc.
 */
public interface TrackCatalogSource {

    /**
     * Fetches the full track catalog of an artist.
     * An unavailable source completes with an empty list.
     *
     * @param catalogId the artist's id in the external catalog
     */
    CompletableFuture<List<Track>> fetchArtistTracks(String catalogId);
}
