package com.theset.setlist.domain.model;

public record TrackLoadOptions(
        boolean immediate,
        boolean prioritizeStored
) {
    public static final TrackLoadOptions SHOW_PAGE = new TrackLoadOptions(true, true);
}
