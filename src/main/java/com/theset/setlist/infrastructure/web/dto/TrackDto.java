package com.theset.setlist.infrastructure.web.dto;

import com.theset.setlist.domain.model.Track;

import java.util.List;

public record TrackDto(
        String id,
        String name,
        int duration_ms,
        int popularity,
        String album_name,
        String album_image_url,
        String preview_url
) {
    public static TrackDto fromTrack(Track track) {
        return new TrackDto(
                track.id(),
                track.name(),
                track.durationMs(),
                track.popularity(),
                track.albumName(),
                track.albumImageUrl(),
                track.previewUrl()
        );
    }

    public static List<TrackDto> fromTracks(List<Track> tracks) {
        return tracks.stream()
                .map(TrackDto::fromTrack)
                .toList();
    }
}
