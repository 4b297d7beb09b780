package com.theset.setlist.domain.model;

public enum EntityKind {
    ARTIST,
    SHOW,
    VENUE
}
