package com.theset.setlist.domain.model;

/**
 * A proposed song with its accumulated votes. position is the insertion order in the setlist.
 */
public record SetlistEntry(
        Track track,
        int votes,
        int position
) {
    public String songId() {
        return track.id();
    }

    public SetlistEntry withVote() {
        return new SetlistEntry(track, votes + 1, position);
    }
}
