package com.theset.setlist.application.voting;

import com.theset.setlist.application.show.ShowContextLoader;
import com.theset.setlist.domain.model.AddSongOutcome;
import com.theset.setlist.domain.model.AddSongResult;
import com.theset.setlist.domain.model.ArtistTracks;
import com.theset.setlist.domain.model.Participant;
import com.theset.setlist.domain.model.SetlistSnapshot;
import com.theset.setlist.domain.model.ShowListing;
import com.theset.setlist.domain.model.TrackLoadOptions;
import com.theset.setlist.domain.model.VoteOutcome;
import com.theset.setlist.domain.model.VoteResult;
import com.theset.setlist.domain.port.in.SetlistVoting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Voting surface of a show. Shows that cannot be resolved get no live setlist;
 * their operations are rejected against an empty snapshot.
 */
@Service
public class SetlistVotingUseCase implements SetlistVoting {

    private static final Logger logger = LoggerFactory.getLogger(SetlistVotingUseCase.class);

    private final ShowContextLoader contextLoader;
    private final SetlistSessionFactory sessionFactory;

    public SetlistVotingUseCase(ShowContextLoader contextLoader, SetlistSessionFactory sessionFactory) {
        this.contextLoader = contextLoader;
        this.sessionFactory = sessionFactory;
    }

    @Override
    public SetlistSnapshot selectTrack(String showId, Participant participant, String trackId) {
        return session(showId, participant)
                .map(engine -> engine.selectTrack(trackId))
                .orElseGet(sessionFactory::emptySnapshot);
    }

    @Override
    public AddSongOutcome addSong(String showId, Participant participant, String trackId) {
        AddSongOutcome outcome = session(showId, participant)
                .map(engine -> engine.addSong(trackId))
                .orElseGet(() -> new AddSongOutcome(AddSongResult.UNKNOWN_TRACK, sessionFactory.emptySnapshot()));
        logger.debug("Add song {} to show {}: {}", trackId, showId, outcome.result());
        return outcome;
    }

    @Override
    public VoteOutcome vote(String showId, Participant participant, String songId) {
        VoteOutcome outcome = session(showId, participant)
                .map(engine -> engine.vote(songId))
                .orElseGet(() -> new VoteOutcome(VoteResult.UNKNOWN_SONG, sessionFactory.emptySnapshot()));
        logger.debug("Vote for {} in show {}: {}", songId, showId, outcome.result());
        return outcome;
    }

    private Optional<SetlistVotingEngine> session(String showId, Participant participant) {
        Optional<ShowListing> listing;
        try {
            listing = contextLoader.loadListing(showId);
        } catch (RuntimeException e) {
            logger.error("Error loading show {} for voting", showId, e);
            return Optional.empty();
        }
        if (listing.isEmpty()) {
            logger.debug("No setlist session for unknown show {}", showId);
            return Optional.empty();
        }
        return Optional.of(sessionFactory.open(showId, participant, tracksFor(listing.get())));
    }

    private ArtistTracks tracksFor(ShowListing listing) {
        try {
            return contextLoader.tracksFor(listing, TrackLoadOptions.SHOW_PAGE);
        } catch (RuntimeException e) {
            logger.warn("Voting on show {} without tracks: {}", listing.show().id(), e.getMessage());
            return ArtistTracks.idle();
        }
    }
}
