package com.theset.setlist.application.sync;

import com.theset.setlist.domain.model.Track;
import com.theset.setlist.domain.port.out.ArtistStore;
import com.theset.setlist.domain.port.out.TrackCatalogSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fills an artist's stored track snapshot from the external catalog.
 * Empty catalogs are never written; a snapshot is always written whole.
 */
@Component
public class TrackCatalogPopulator {

    private static final Logger logger = LoggerFactory.getLogger(TrackCatalogPopulator.class);

    private final ArtistStore artistStore;
    private final TrackCatalogSource catalogSource;
    private final Clock clock;

    public TrackCatalogPopulator(ArtistStore artistStore, TrackCatalogSource catalogSource, Clock clock) {
        this.artistStore = artistStore;
        this.catalogSource = catalogSource;
        this.clock = clock;
    }

    /**
     * Fetches the catalog and persists it when non-empty.
     * The fetched tracks are returned even if persisting them fails.
     */
    public CompletableFuture<List<Track>> fetchAndStore(String artistId, String catalogId) {
        logger.debug("Fetching catalog {} for artist {}", catalogId, artistId);
        return catalogSource.fetchArtistTracks(catalogId)
                .thenApply(tracks -> {
                    if (tracks == null || tracks.isEmpty()) {
                        logger.info("Catalog {} returned no tracks, nothing stored for artist {}", catalogId, artistId);
                        return List.<Track>of();
                    }
                    storeSnapshot(artistId, tracks);
                    return tracks;
                });
    }

    /**
     * Fire-and-forget population triggered after an artist write.
     * Skips the fetch when a snapshot was stored in the meantime.
     */
    @Async("asyncExecutor")
    public void populateAsync(String artistId, String catalogId) {
        try {
            if (!artistStore.findStoredTracks(artistId).isEmpty()) {
                logger.debug("Artist {} already has stored tracks, skipping population", artistId);
                return;
            }
            List<Track> tracks = fetchAndStore(artistId, catalogId).join();
            logger.info("Background population for artist {} finished with {} tracks", artistId, tracks.size());
        } catch (Exception e) {
            logger.error("Background track population failed for artist {}", artistId, e);
        }
    }

    void storeSnapshot(String artistId, List<Track> tracks) {
        try {
            if (artistStore.replaceStoredTracks(artistId, tracks, clock.instant())) {
                logger.info("Stored {} tracks for artist {}", tracks.size(), artistId);
            } else {
                logger.warn("Artist {} not found, tracks not stored", artistId);
            }
        } catch (Exception e) {
            logger.error("Failed to store tracks for artist {}", artistId, e);
        }
    }
}
