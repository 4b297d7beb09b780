package com.theset.setlist.domain.model;

public record VoteOutcome(
        VoteResult result,
        SetlistSnapshot snapshot
) {}
