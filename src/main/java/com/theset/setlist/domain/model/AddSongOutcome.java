package com.theset.setlist.domain.model;

public record AddSongOutcome(
        AddSongResult result,
        SetlistSnapshot snapshot
) {}
