package com.theset.setlist.domain.model;

public enum AddSongResult {
    ADDED,
    DUPLICATE,
    NO_TRACK_SELECTED,
    UNKNOWN_TRACK;

    public boolean isAdded() {
        return this == ADDED;
    }
}
