package com.theset.setlist.infrastructure.adapter.catalog;

import com.theset.setlist.domain.model.Track;
import com.theset.setlist.domain.port.out.TrackCatalogSource;
import com.theset.setlist.infrastructure.adapter.mapper.TrackMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Component
public class CatalogClient implements TrackCatalogSource {

    private static final Logger logger = LoggerFactory.getLogger(CatalogClient.class);
    private final CatalogApi catalogApi;
    private final TrackMapper trackMapper;

    public CatalogClient(CatalogApi catalogApi, TrackMapper trackMapper) {
        this.catalogApi = catalogApi;
        this.trackMapper = trackMapper;
    }

    @Override
    @CircuitBreaker(name = "catalog-source", fallbackMethod = "fallbackFetchArtistTracks")
    @Retry(name = "catalog-source")
    @TimeLimiter(name = "catalog-source")
    public CompletableFuture<List<Track>> fetchArtistTracks(String catalogId) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                logger.debug("Fetching catalog tracks for {}", catalogId);
                var response = catalogApi.fetchArtistTracks(catalogId).execute();
                if (response.isSuccessful() && response.body() != null && response.body().tracks() != null) {
                    List<Track> tracks = trackMapper.mapToTracks(response.body().tracks());
                    logger.debug("Catalog returned {} tracks for {}", tracks.size(), catalogId);
                    return tracks;
                }
                if (response.code() >= 500) {
                    throw new IllegalStateException("Catalog responded with " + response.code());
                }
                logger.warn("Empty or failed catalog response for {} (HTTP {})", catalogId, response.code());
                return Collections.emptyList();
            } catch (Exception e) {
                logger.error("Exception fetching catalog tracks for {}: {}", catalogId, e.getMessage());
                throw new RuntimeException("Failed to fetch catalog tracks", e);
            }
        });
    }

    public CompletableFuture<List<Track>> fallbackFetchArtistTracks(String catalogId, Exception ex) {
        logger.warn("Fallback triggered for catalog source ({}): {}", catalogId, ex.getMessage());
        return CompletableFuture.completedFuture(Collections.emptyList());
    }
}
