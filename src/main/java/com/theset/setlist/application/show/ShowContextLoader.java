package com.theset.setlist.application.show;

import com.theset.setlist.application.sync.EntitySynchronizer;
import com.theset.setlist.domain.model.ArtistTracks;
import com.theset.setlist.domain.model.Show;
import com.theset.setlist.domain.model.ShowListing;
import com.theset.setlist.domain.model.TrackLoadOptions;
import com.theset.setlist.domain.port.in.ArtistTracksQuery;
import com.theset.setlist.domain.port.out.ShowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves a show id into the synchronized show, its artist and venue, and the artist's tracks.
 */
@Component
public class ShowContextLoader {

    private static final Logger logger = LoggerFactory.getLogger(ShowContextLoader.class);

    private final EntitySynchronizer synchronizer;
    private final ShowStore showStore;
    private final ArtistTracksQuery tracksQuery;

    public ShowContextLoader(EntitySynchronizer synchronizer, ShowStore showStore, ArtistTracksQuery tracksQuery) {
        this.synchronizer = synchronizer;
        this.showStore = showStore;
        this.tracksQuery = tracksQuery;
    }

    public Optional<ShowListing> loadListing(String showId) {
        Show show = synchronizer.fetchShowIfStale(showId);
        if (show == null) {
            logger.debug("Show {} not found", showId);
            return Optional.empty();
        }
        ShowListing stored = storedReferences(showId);
        if (stored == null) {
            return Optional.of(new ShowListing(show, null, null));
        }
        return Optional.of(new ShowListing(show, stored.artist(), stored.venue()));
    }

    public ArtistTracks tracksFor(ShowListing listing, TrackLoadOptions options) {
        return tracksQuery.getArtistTracks(listing.show().artistId(), catalogIdOf(listing), options);
    }

    public ArtistTracks refetchTracks(ShowListing listing) {
        return tracksQuery.refetch(listing.show().artistId(), catalogIdOf(listing));
    }

    private ShowListing storedReferences(String showId) {
        try {
            return showStore.findListing(showId).orElse(null);
        } catch (RuntimeException e) {
            logger.warn("Could not resolve artist and venue of show {}: {}", showId, e.getMessage());
            return null;
        }
    }

    private static String catalogIdOf(ShowListing listing) {
        return listing.artist() == null ? null : listing.artist().catalogId();
    }
}
