package com.theset.setlist.domain.port.out;

import com.theset.setlist.domain.model.Artist;
import com.theset.setlist.domain.model.Track;
import java.time.Instant;
import java.util.List;

public interface ArtistStore extends EntityStore<Artist> {

    /**
     * Stored catalog snapshot of an artist, empty when none was written yet
     */
    List<Track> findStoredTracks(String artistId);

    /**
     * Replaces the whole snapshot in a single statement, stamping both
     * tracks_last_updated and updated_at with the given instant.
     *
     * @return false if no artist row with that id exists
     */
    boolean replaceStoredTracks(String artistId, List<Track> tracks, Instant updatedAt);
}
