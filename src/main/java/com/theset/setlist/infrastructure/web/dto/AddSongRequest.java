package com.theset.setlist.infrastructure.web.dto;

/**
 * @param track_id explicit track, or null to add the caller's selected track
 */
public record AddSongRequest(
        String track_id
) {}
