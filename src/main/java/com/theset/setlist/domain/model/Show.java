package com.theset.setlist.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Persisted show record. artistId and venueId are foreign identities resolved at read time.
 * A null date means the date is not announced yet.
 */
public record Show(
        String id,
        String name,
        String artistId,
        String venueId,
        Instant date,
        String imageUrl,
        String ticketUrl,
        List<String> genreIds,
        Instant updatedAt
) {
    public Show {
        genreIds = genreIds == null ? List.of() : List.copyOf(genreIds);
    }

    public Show withUpdatedAt(Instant timestamp) {
        return new Show(id, name, artistId, venueId, date, imageUrl, ticketUrl, genreIds, timestamp);
    }
}
