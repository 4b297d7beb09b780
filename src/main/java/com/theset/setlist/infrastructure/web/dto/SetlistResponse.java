package com.theset.setlist.infrastructure.web.dto;

import com.theset.setlist.domain.model.SetlistSnapshot;

import java.util.List;

/**
 * @param result outcome of the operation, null for a plain selection
 */
public record SetlistResponse(
        String result,
        boolean login_required,
        List<SetlistEntryDto> setlist,
        List<TrackDto> available_tracks,
        String selected_track_id,
        int anonymous_vote_count,
        boolean connected
) {
    public static SetlistResponse fromSnapshot(String result, boolean loginRequired, SetlistSnapshot snapshot) {
        return new SetlistResponse(
                result,
                loginRequired,
                SetlistEntryDto.fromEntries(snapshot.setlist()),
                TrackDto.fromTracks(snapshot.availableTracks()),
                snapshot.selectedTrackId(),
                snapshot.anonymousVoteCount(),
                snapshot.connected()
        );
    }
}
