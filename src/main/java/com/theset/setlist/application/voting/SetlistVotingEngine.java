package com.theset.setlist.application.voting;

import com.theset.setlist.domain.model.AddSongOutcome;
import com.theset.setlist.domain.model.AddSongResult;
import com.theset.setlist.domain.model.ArtistTracks;
import com.theset.setlist.domain.model.Participant;
import com.theset.setlist.domain.model.SetlistEvent;
import com.theset.setlist.domain.model.SetlistSnapshot;
import com.theset.setlist.domain.model.Track;
import com.theset.setlist.domain.model.VoteOutcome;
import com.theset.setlist.domain.model.VoteResult;
import com.theset.setlist.domain.port.out.SetlistChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * One participant's view of a show's live setlist, with that participant's
 * auth capability and the artist's track catalog bound in.
 */
public class SetlistVotingEngine {

    private static final Logger logger = LoggerFactory.getLogger(SetlistVotingEngine.class);

    private final LiveSetlist setlist;
    private final Participant participant;
    private final ArtistTracks tracks;
    private final SetlistChannel channel;
    private final int anonymousVoteLimit;
    private final Clock clock;

    public SetlistVotingEngine(LiveSetlist setlist,
                               Participant participant,
                               ArtistTracks tracks,
                               SetlistChannel channel,
                               int anonymousVoteLimit,
                               Clock clock) {
        this.setlist = setlist;
        this.participant = participant;
        this.tracks = tracks;
        this.channel = channel;
        this.anonymousVoteLimit = anonymousVoteLimit;
        this.clock = clock;
    }

    public SetlistSnapshot selectTrack(String trackId) {
        setlist.select(participant.id(), trackId);
        return snapshot();
    }

    /**
     * Adds the given track, or the participant's selected one when trackId is null.
     * Missing and unresolvable tracks leave the setlist unchanged.
     */
    public AddSongOutcome addSong(String trackId) {
        String target = trackId != null && !trackId.isBlank()
                ? trackId
                : setlist.selectedTrack(participant.id());
        if (target == null) {
            return new AddSongOutcome(AddSongResult.NO_TRACK_SELECTED, snapshot());
        }

        Optional<Track> track = tracks.resolve(target);
        if (track.isEmpty()) {
            logger.debug("Track {} not in catalog of show {}", target, setlist.showId());
            return new AddSongOutcome(AddSongResult.UNKNOWN_TRACK, snapshot());
        }
        if (!setlist.add(track.get())) {
            logger.debug("Track {} already in setlist of show {}", target, setlist.showId());
            return new AddSongOutcome(AddSongResult.DUPLICATE, snapshot());
        }

        setlist.clearSelection(participant.id());
        channel.publish(SetlistEvent.songAdded(setlist.showId(), track.get(), clock.instant()));
        logger.info("Added {} to setlist of show {}", target, setlist.showId());
        return new AddSongOutcome(AddSongResult.ADDED, snapshot());
    }

    public VoteOutcome vote(String songId) {
        boolean authenticated = participant.auth().isAuthenticated();
        VoteResult result = setlist.castVote(participant.id(), songId, authenticated, anonymousVoteLimit);
        switch (result) {
            case QUOTA_EXCEEDED -> {
                logger.info("Participant {} reached the anonymous vote limit for show {}",
                        participant.id(), setlist.showId());
                participant.auth().login();
            }
            case UNKNOWN_SONG -> logger.debug("Vote for unknown song {} in show {}", songId, setlist.showId());
            case ACCEPTED -> channel.publish(SetlistEvent.voteCast(setlist.showId(), songId, clock.instant()));
        }
        return new VoteOutcome(result, snapshot());
    }

    /**
     * Stored snapshot minus the setlist when a snapshot exists, otherwise the catalog complement
     */
    public List<Track> availableTracks() {
        if (tracks.hasStoredTracks()) {
            return setlist.availableTracks(tracks.storedTracks());
        }
        return tracks.availableTracks(setlist.entries());
    }

    public SetlistSnapshot snapshot() {
        return new SetlistSnapshot(
                setlist.entries(),
                availableTracks(),
                setlist.selectedTrack(participant.id()),
                setlist.anonymousVotes(participant.id()),
                channel.isConnected());
    }
}
