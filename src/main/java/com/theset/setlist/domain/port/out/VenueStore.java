package com.theset.setlist.domain.port.out;

import com.theset.setlist.domain.model.Venue;

public interface VenueStore extends EntityStore<Venue> {
}
