package com.theset.setlist.domain.model;

import java.time.Instant;

/**
 * timezone is the venue's IANA zone id, null when the source does not report one.
 */
public record Venue(
        String id,
        String name,
        String city,
        String state,
        String country,
        String timezone,
        Instant updatedAt
) {
    public Venue withUpdatedAt(Instant timestamp) {
        return new Venue(id, name, city, state, country, timezone, timestamp);
    }
}
