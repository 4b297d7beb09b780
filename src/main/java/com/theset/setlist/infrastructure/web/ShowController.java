package com.theset.setlist.infrastructure.web;

import com.theset.setlist.domain.model.AddSongOutcome;
import com.theset.setlist.domain.model.Participant;
import com.theset.setlist.domain.model.VoteOutcome;
import com.theset.setlist.domain.port.in.SetlistVoting;
import com.theset.setlist.domain.port.in.ShowDetails;
import com.theset.setlist.infrastructure.web.dto.AddSongRequest;
import com.theset.setlist.infrastructure.web.dto.ArtistTracksResponse;
import com.theset.setlist.infrastructure.web.dto.SetlistResponse;
import com.theset.setlist.infrastructure.web.dto.ShowDetailResponse;
import com.theset.setlist.infrastructure.web.dto.TrackSelectionRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/shows")
public class ShowController {

    private static final Logger logger = LoggerFactory.getLogger(ShowController.class);

    /**
     * Session id chosen by the client. The anonymous vote quota is counted per value of this
     * header, so it only nudges casual visitors toward login: a client that rotates the id
     * gets a fresh quota. Anything stricter has to be enforced by the gateway in front of
     * this service, which is also what vouches for {@link #USER_HEADER}.
     */
    static final String PARTICIPANT_HEADER = "X-Participant-Id";
    static final String USER_HEADER = "X-Authenticated-User";

    private final ShowDetails showDetails;
    private final SetlistVoting setlistVoting;

    public ShowController(ShowDetails showDetails, SetlistVoting setlistVoting) {
        this.showDetails = showDetails;
        this.setlistVoting = setlistVoting;
    }

    @GetMapping("/{showId}")
    public ResponseEntity<ShowDetailResponse> getShow(
            @PathVariable String showId,
            @RequestHeader(PARTICIPANT_HEADER) String participantId,
            @RequestHeader(value = USER_HEADER, required = false) String user
    ) {
        logger.info("Show page requested for {}", showId);
        try {
            var detail = showDetails.getShowDetail(showId, participant(participantId, new RequestAuthProvider(user)));
            var response = ShowDetailResponse.fromDetail(detail);
            if (detail.show() == null) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
            }
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error building show page for {}", showId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/{showId}/tracks/refresh")
    public ResponseEntity<ArtistTracksResponse> refreshTracks(@PathVariable String showId) {
        logger.info("Track refresh requested for show {}", showId);
        try {
            return ResponseEntity.ok(ArtistTracksResponse.fromTracks(showDetails.loadTracks(showId)));
        } catch (Exception e) {
            logger.error("Error refreshing tracks for show {}", showId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/{showId}/setlist/selection")
    public ResponseEntity<SetlistResponse> selectTrack(
            @PathVariable String showId,
            @RequestHeader(PARTICIPANT_HEADER) String participantId,
            @RequestHeader(value = USER_HEADER, required = false) String user,
            @Valid @RequestBody TrackSelectionRequest request
    ) {
        var snapshot = setlistVoting.selectTrack(
                showId, participant(participantId, new RequestAuthProvider(user)), request.track_id());
        return ResponseEntity.ok(SetlistResponse.fromSnapshot(null, false, snapshot));
    }

    @PostMapping("/{showId}/setlist/songs")
    public ResponseEntity<SetlistResponse> addSong(
            @PathVariable String showId,
            @RequestHeader(PARTICIPANT_HEADER) String participantId,
            @RequestHeader(value = USER_HEADER, required = false) String user,
            @RequestBody(required = false) AddSongRequest request
    ) {
        String trackId = request == null ? null : request.track_id();
        AddSongOutcome outcome = setlistVoting.addSong(
                showId, participant(participantId, new RequestAuthProvider(user)), trackId);

        var body = SetlistResponse.fromSnapshot(outcome.result().name(), false, outcome.snapshot());
        if (outcome.result().isAdded()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(body);
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{showId}/setlist/songs/{songId}/votes")
    public ResponseEntity<SetlistResponse> vote(
            @PathVariable String showId,
            @PathVariable String songId,
            @RequestHeader(PARTICIPANT_HEADER) String participantId,
            @RequestHeader(value = USER_HEADER, required = false) String user
    ) {
        var auth = new RequestAuthProvider(user);
        VoteOutcome outcome = setlistVoting.vote(showId, participant(participantId, auth), songId);
        var body = SetlistResponse.fromSnapshot(outcome.result().name(), auth.loginRequested(), outcome.snapshot());

        return switch (outcome.result()) {
            case ACCEPTED -> ResponseEntity.ok(body);
            case QUOTA_EXCEEDED -> {
                logger.info("Anonymous vote limit reached by {} on show {}", participantId, showId);
                yield ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body);
            }
            case UNKNOWN_SONG -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        };
    }

    private static Participant participant(String participantId, RequestAuthProvider auth) {
        return new Participant(participantId, auth);
    }
}
