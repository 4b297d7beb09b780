package com.theset.setlist.infrastructure.adapter.mapper;

import com.theset.setlist.domain.model.Track;
import com.theset.setlist.infrastructure.adapter.catalog.json.CatalogAlbumJson;
import com.theset.setlist.infrastructure.adapter.catalog.json.CatalogTrackJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
public class TrackMapper {

    private static final Logger logger = LoggerFactory.getLogger(TrackMapper.class);

    /**
     * Maps catalog JSON to domain tracks.
     * Tracks without an id are dropped; duplicate ids keep their first occurrence
     * so that a snapshot never holds the same id twice.
     */
    public List<Track> mapToTracks(List<CatalogTrackJson> catalogTracks) {
        Map<String, Track> unique = new LinkedHashMap<>();

        catalogTracks.stream()
                .filter(Objects::nonNull)
                .filter(json -> json.id() != null && !json.id().isBlank())
                .map(this::mapToTrack)
                .forEach(track -> unique.putIfAbsent(track.id(), track));

        int dropped = catalogTracks.size() - unique.size();
        if (dropped > 0) {
            logger.debug("Dropped {} catalog entries without id or with duplicate id", dropped);
        }

        return List.copyOf(unique.values());
    }

    private Track mapToTrack(CatalogTrackJson json) {
        CatalogAlbumJson album = json.album();
        return new Track(
                json.id(),
                json.name() != null ? json.name() : "Unknown track",
                json.durationMs() != null ? json.durationMs() : 0,
                json.popularity() != null ? json.popularity() : 0,
                album != null ? album.name() : null,
                album != null ? firstImage(album.images()) : null,
                json.previewUrl()
        );
    }

    private String firstImage(List<CatalogAlbumJson.ImageJson> images) {
        if (images == null || images.isEmpty()) {
            return null;
        }
        return images.get(0).url();
    }
}
