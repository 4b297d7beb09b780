package com.theset.setlist.application.voting;

import com.theset.setlist.domain.model.ArtistTracks;
import com.theset.setlist.domain.model.Participant;
import com.theset.setlist.domain.model.SetlistEvent;
import com.theset.setlist.domain.model.SetlistSnapshot;
import com.theset.setlist.domain.model.Track;
import com.theset.setlist.domain.port.out.SetlistChannel;
import com.theset.setlist.infrastructure.config.VotingConfig;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Component
public class SetlistSessionFactory {

    private final LiveSetlistRegistry registry;
    private final SetlistChannel channel;
    private final VotingConfig config;
    private final Clock clock;

    public SetlistSessionFactory(LiveSetlistRegistry registry, SetlistChannel channel, VotingConfig config, Clock clock) {
        this.registry = registry;
        this.channel = channel;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Binds a participant to the live setlist of a show. The first session on this instance
     * seeds the setlist from the artist's most popular tracks and relays the seeded songs,
     * so instances that already hold the setlist converge on the same entries.
     */
    public SetlistVotingEngine open(String showId, Participant participant, ArtistTracks tracks) {
        LiveSetlist setlist = registry.get(showId);
        List<Track> seeded = setlist.seed(tracks.initialSongs());
        if (!seeded.isEmpty()) {
            Instant now = clock.instant();
            seeded.forEach(track -> channel.publish(SetlistEvent.songAdded(showId, track, now)));
        }
        return new SetlistVotingEngine(setlist, participant, tracks, channel, config.getAnonymousVoteLimit(), clock);
    }

    /**
     * Setlist view for a show that could not be resolved; no live setlist is created for it
     */
    public SetlistSnapshot emptySnapshot() {
        return new SetlistSnapshot(List.of(), List.of(), null, 0, channel.isConnected());
    }
}
