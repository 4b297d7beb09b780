package com.theset.setlist.infrastructure.web.dto;

import com.theset.setlist.domain.model.ArtistTracks;

import java.util.List;

public record ArtistTracksResponse(
        List<TrackDto> tracks,
        List<TrackDto> initial_songs,
        List<TrackDto> stored_tracks,
        boolean loading,
        boolean error,
        String error_message
) {
    public static ArtistTracksResponse fromTracks(ArtistTracks tracks) {
        return new ArtistTracksResponse(
                TrackDto.fromTracks(tracks.tracks()),
                TrackDto.fromTracks(tracks.initialSongs()),
                TrackDto.fromTracks(tracks.storedTracks()),
                tracks.loading(),
                tracks.error(),
                tracks.errorMessage()
        );
    }
}
