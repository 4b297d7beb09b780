package com.theset.setlist.domain.model;

import java.time.Instant;

/**
 * A setlist mutation relayed to every participant of a show.
 * track is set for SONG_ADDED, songId for both types.
 */
public record SetlistEvent(
        Type type,
        String showId,
        String songId,
        Track track,
        Instant occurredAt
) {
    public enum Type {
        SONG_ADDED,
        VOTE_CAST
    }

    public static SetlistEvent songAdded(String showId, Track track, Instant occurredAt) {
        return new SetlistEvent(Type.SONG_ADDED, showId, track.id(), track, occurredAt);
    }

    public static SetlistEvent voteCast(String showId, String songId, Instant occurredAt) {
        return new SetlistEvent(Type.VOTE_CAST, showId, songId, null, occurredAt);
    }
}
