package com.theset.setlist.domain.model;

/**
 * A show together with its resolved artist and venue. Either reference may be null
 * when the referenced record is not stored.
 */
public record ShowListing(
        Show show,
        Artist artist,
        Venue venue
) {}
