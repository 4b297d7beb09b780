package com.theset.setlist.domain.model;

import java.util.List;

/**
 * Aggregate view of a single show page. Any part may be missing or loading independently.
 */
public record ShowDetail(
        ShowListing show,
        List<SetlistEntry> setlist,
        Loading loading,
        Errors error,
        boolean connected,
        List<Track> availableTracks,
        String displayDate,
        DocumentMetadata documentMetadata
) {
    public record Loading(boolean show, boolean tracks) {}

    public record Errors(String show) {}

    public record DocumentMetadata(String title, String description) {}
}
