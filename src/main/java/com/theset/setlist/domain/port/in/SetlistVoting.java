package com.theset.setlist.domain.port.in;

import com.theset.setlist.domain.model.AddSongOutcome;
import com.theset.setlist.domain.model.Participant;
import com.theset.setlist.domain.model.SetlistSnapshot;
import com.theset.setlist.domain.model.VoteOutcome;

/**
 * Write side of the live setlist of a show.
 */
public interface SetlistVoting {

    SetlistSnapshot selectTrack(String showId, Participant participant, String trackId);

    /**
     * @param trackId explicit track, or null to add the participant's selected track
     */
    AddSongOutcome addSong(String showId, Participant participant, String trackId);

    VoteOutcome vote(String showId, Participant participant, String songId);
}
