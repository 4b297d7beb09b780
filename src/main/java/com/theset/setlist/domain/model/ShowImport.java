package com.theset.setlist.domain.model;

/**
 * A ticketing record normalized at the boundary into the persisted model.
 * artist and venue are null when the ticketing source did not provide them.
 */
public record ShowImport(
        Show show,
        Artist artist,
        Venue venue
) {}
