package com.theset.setlist.application.tracks;

import com.theset.setlist.application.sync.TrackCatalogPopulator;
import com.theset.setlist.domain.model.ArtistTracks;
import com.theset.setlist.domain.model.Track;
import com.theset.setlist.domain.model.TrackLoadOptions;
import com.theset.setlist.domain.port.in.ArtistTracksQuery;
import com.theset.setlist.domain.port.out.ArtistStore;
import com.theset.setlist.infrastructure.config.TrackCacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Read path for artist catalogs: stored snapshot first, external catalog only when
 * nothing is stored. Fetches outliving the load timeout keep running and persist
 * in the background.
 */
@Service
public class ArtistTrackCache implements ArtistTracksQuery {

    private static final Logger logger = LoggerFactory.getLogger(ArtistTrackCache.class);

    private final ArtistStore artistStore;
    private final TrackCatalogPopulator populator;
    private final TrackCacheConfig config;
    private final Map<String, CompletableFuture<List<Track>>> inFlight = new ConcurrentHashMap<>();

    public ArtistTrackCache(ArtistStore artistStore, TrackCatalogPopulator populator, TrackCacheConfig config) {
        this.artistStore = artistStore;
        this.populator = populator;
        this.config = config;
    }

    @Override
    public ArtistTracks getArtistTracks(String artistId, String catalogId, TrackLoadOptions options) {
        if (!options.immediate()) {
            logger.debug("Deferred track load for artist {}", artistId);
            return ArtistTracks.idle();
        }
        return load(artistId, catalogId, options.prioritizeStored());
    }

    @Override
    public ArtistTracks refetch(String artistId, String catalogId) {
        logger.debug("Manual track refetch for artist {}", artistId);
        return load(artistId, catalogId, true);
    }

    private ArtistTracks load(String artistId, String catalogId, boolean prioritizeStored) {
        if (artistId == null) {
            return ArtistTracks.idle();
        }

        List<Track> stored = readStored(artistId);
        if (!stored.isEmpty()) {
            logger.debug("Serving {} stored tracks for artist {}", stored.size(), artistId);
            return ArtistTracks.fromStored(stored, config.getInitialSongCount(), prioritizeStored);
        }

        if (catalogId == null || catalogId.isBlank()) {
            logger.debug("Artist {} has no catalog id, no tracks to fetch", artistId);
            return ArtistTracks.idle();
        }

        CompletableFuture<List<Track>> fetch =
                inFlight.computeIfAbsent(artistId, id -> populator.fetchAndStore(id, catalogId));
        fetch.whenComplete((tracks, error) -> inFlight.remove(artistId, fetch));

        try {
            List<Track> fetched = fetch.get(config.getLoadTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return ArtistTracks.fromFetched(fetched, config.getInitialSongCount());
        } catch (TimeoutException e) {
            logger.info("Tracks for artist {} still loading after {}", artistId, config.getLoadTimeout());
            return ArtistTracks.pending();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ArtistTracks.pending();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Failed to load tracks for artist {}", artistId, cause);
            return ArtistTracks.failed(cause.getMessage());
        }
    }

    private List<Track> readStored(String artistId) {
        try {
            List<Track> stored = artistStore.findStoredTracks(artistId);
            return stored == null ? List.of() : stored;
        } catch (Exception e) {
            logger.warn("Could not read stored tracks for artist {}: {}", artistId, e.getMessage());
            return List.of();
        }
    }
}
