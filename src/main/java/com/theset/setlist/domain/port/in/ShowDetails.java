package com.theset.setlist.domain.port.in;

import com.theset.setlist.domain.model.ArtistTracks;
import com.theset.setlist.domain.model.Participant;
import com.theset.setlist.domain.model.ShowDetail;

/**
 * Read side of a show page.
 */
public interface ShowDetails {

    /**
     * Composes show, tracks and live setlist into one view.
     * Never throws for store or external failures; the failed part is reported in the view.
     */
    ShowDetail getShowDetail(String showId, Participant participant);

    /**
     * Manually re-runs the track lookup for the show's artist
     */
    ArtistTracks loadTracks(String showId);
}
