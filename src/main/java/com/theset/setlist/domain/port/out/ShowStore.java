package com.theset.setlist.domain.port.out;

import com.theset.setlist.domain.model.Show;
import com.theset.setlist.domain.model.ShowListing;
import java.util.Optional;

public interface ShowStore extends EntityStore<Show> {

    /**
     * Show with its artist and venue references resolved
     */
    Optional<ShowListing> findListing(String showId);
}
