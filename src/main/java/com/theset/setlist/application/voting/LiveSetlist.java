package com.theset.setlist.application.voting;

import com.theset.setlist.domain.model.SetlistEntry;
import com.theset.setlist.domain.model.SetlistEvent;
import com.theset.setlist.domain.model.Track;
import com.theset.setlist.domain.model.VoteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-session setlist of one show plus the per-participant vote state.
 * All mutations of a show are serialized on this instance.
 */
public class LiveSetlist {

    private static final Logger logger = LoggerFactory.getLogger(LiveSetlist.class);

    private final String showId;
    private final List<SetlistEntry> entries = new ArrayList<>();
    private final Map<String, ParticipantState> participants = new HashMap<>();
    private long version;
    private boolean seeded;
    private Instant lastActivity;

    private List<Track> memoStored;
    private long memoVersion = -1;
    private List<Track> memoAvailable = List.of();

    public LiveSetlist(String showId) {
        this.showId = showId;
    }

    public String showId() {
        return showId;
    }

    /**
     * Entries in insertion order
     */
    public synchronized List<SetlistEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized long version() {
        return version;
    }

    synchronized void touch(Instant now) {
        lastActivity = now;
    }

    synchronized boolean idleSince(Instant cutoff) {
        return lastActivity == null || lastActivity.isBefore(cutoff);
    }

    /**
     * Seeds the setlist once per instance. Songs already present, for example relayed
     * from an instance that seeded first, are skipped.
     *
     * @return the songs actually appended
     */
    public synchronized List<Track> seed(List<Track> songs) {
        if (seeded || songs == null || songs.isEmpty()) {
            return List.of();
        }
        seeded = true;
        List<Track> added = new ArrayList<>();
        for (Track song : songs) {
            if (add(song)) {
                added.add(song);
            }
        }
        logger.debug("Seeded setlist of show {} with {} of {} songs", showId, added.size(), songs.size());
        return added;
    }

    /**
     * Appends the track with zero votes.
     *
     * @return false if the track is already in the setlist; the existing entry is left untouched
     */
    public synchronized boolean add(Track track) {
        boolean present = entries.stream().anyMatch(entry -> entry.songId().equals(track.id()));
        if (present) {
            return false;
        }
        entries.add(new SetlistEntry(track, 0, entries.size()));
        version++;
        return true;
    }

    /**
     * Checks the anonymous quota, then adds exactly one vote to the song.
     */
    public synchronized VoteResult castVote(String participantId, String songId, boolean authenticated, int anonymousLimit) {
        ParticipantState state = stateOf(participantId);
        if (!authenticated && state.anonymousVotes >= anonymousLimit) {
            return VoteResult.QUOTA_EXCEEDED;
        }
        if (!increment(songId)) {
            return VoteResult.UNKNOWN_SONG;
        }
        if (!authenticated) {
            state.anonymousVotes++;
        }
        return VoteResult.ACCEPTED;
    }

    /**
     * Applies a mutation published by another instance. Delivery is at-least-once,
     * so a redelivered vote counts again.
     */
    public synchronized void applyRemote(SetlistEvent event) {
        switch (event.type()) {
            case SONG_ADDED -> {
                if (event.track() == null || !add(event.track())) {
                    logger.debug("Ignoring remote add of {} to show {}", event.songId(), showId);
                }
            }
            case VOTE_CAST -> {
                if (!increment(event.songId())) {
                    logger.debug("Ignoring remote vote for unknown song {} in show {}", event.songId(), showId);
                }
            }
        }
    }

    public synchronized void select(String participantId, String trackId) {
        stateOf(participantId).selectedTrackId = trackId;
    }

    public synchronized String selectedTrack(String participantId) {
        ParticipantState state = participants.get(participantId);
        return state == null ? null : state.selectedTrackId;
    }

    public synchronized void clearSelection(String participantId) {
        ParticipantState state = participants.get(participantId);
        if (state != null) {
            state.selectedTrackId = null;
        }
    }

    public synchronized int anonymousVotes(String participantId) {
        ParticipantState state = participants.get(participantId);
        return state == null ? 0 : state.anonymousVotes;
    }

    /**
     * Stored tracks not yet in the setlist, in stored order.
     * Recomputed only when the snapshot or the setlist changed.
     */
    public synchronized List<Track> availableTracks(List<Track> storedTracks) {
        if (memoVersion == version && Objects.equals(memoStored, storedTracks)) {
            return memoAvailable;
        }
        Set<String> taken = entries.stream()
                .map(SetlistEntry::songId)
                .collect(Collectors.toSet());
        memoAvailable = storedTracks.stream()
                .filter(track -> !taken.contains(track.id()))
                .toList();
        memoStored = storedTracks;
        memoVersion = version;
        return memoAvailable;
    }

    private boolean increment(String songId) {
        for (int i = 0; i < entries.size(); i++) {
            SetlistEntry entry = entries.get(i);
            if (entry.songId().equals(songId)) {
                entries.set(i, entry.withVote());
                version++;
                return true;
            }
        }
        return false;
    }

    private ParticipantState stateOf(String participantId) {
        return participants.computeIfAbsent(participantId, id -> new ParticipantState());
    }

    private static final class ParticipantState {
        private String selectedTrackId;
        private int anonymousVotes;
    }
}
