package com.theset.setlist.domain.port.in;

import com.theset.setlist.domain.model.ArtistTracks;
import com.theset.setlist.domain.model.TrackLoadOptions;

public interface ArtistTracksQuery {

    ArtistTracks getArtistTracks(String artistId, String catalogId, TrackLoadOptions options);

    /**
     * Re-runs the lookup regardless of the immediate option.
     * Joins an in-flight fetch for the same artist instead of starting a new one.
     */
    ArtistTracks refetch(String artistId, String catalogId);
}
