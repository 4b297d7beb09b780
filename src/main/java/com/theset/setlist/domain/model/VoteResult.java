package com.theset.setlist.domain.model;

public enum VoteResult {
    ACCEPTED,
    QUOTA_EXCEEDED,
    UNKNOWN_SONG
}
