package com.theset.setlist.infrastructure.web;

import com.theset.setlist.domain.model.TrackLoadOptions;
import com.theset.setlist.domain.port.in.ArtistTracksQuery;
import com.theset.setlist.infrastructure.web.dto.ArtistTracksResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/artists")
public class ArtistController {

    private static final Logger logger = LoggerFactory.getLogger(ArtistController.class);

    private final ArtistTracksQuery artistTracks;

    public ArtistController(ArtistTracksQuery artistTracks) {
        this.artistTracks = artistTracks;
    }

    @GetMapping("/{artistId}/tracks")
    public ResponseEntity<ArtistTracksResponse> getTracks(
            @PathVariable String artistId,
            @RequestParam(value = "catalog_id", required = false) String catalogId,
            @RequestParam(value = "immediate", defaultValue = "true") boolean immediate,
            @RequestParam(value = "prioritize_stored", defaultValue = "true") boolean prioritizeStored
    ) {
        logger.info("Tracks requested for artist {}", artistId);
        try {
            var tracks = artistTracks.getArtistTracks(
                    artistId, catalogId, new TrackLoadOptions(immediate, prioritizeStored));
            return ResponseEntity.ok(ArtistTracksResponse.fromTracks(tracks));
        } catch (Exception e) {
            logger.error("Error loading tracks for artist {}", artistId, e);
            return ResponseEntity.internalServerError().build();
        }
    }
}
