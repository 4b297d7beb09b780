package com.theset.setlist.infrastructure.web.dto;

import com.theset.setlist.domain.model.SetlistEntry;

import java.util.List;

public record SetlistEntryDto(
        String id,
        TrackDto track,
        int votes,
        int position
) {
    public static List<SetlistEntryDto> fromEntries(List<SetlistEntry> entries) {
        return entries.stream()
                .map(entry -> new SetlistEntryDto(
                        entry.songId(),
                        TrackDto.fromTrack(entry.track()),
                        entry.votes(),
                        entry.position()))
                .toList();
    }
}
