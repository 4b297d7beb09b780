package com.theset.setlist.domain.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read view of an artist's catalog as served to a show page.
 * storedTracks is the authoritative snapshot when one was found in the store, otherwise empty.
 */
public record ArtistTracks(
        List<Track> tracks,
        List<Track> initialSongs,
        List<Track> storedTracks,
        boolean loading,
        boolean error,
        String errorMessage
) {
    public ArtistTracks {
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
        initialSongs = initialSongs == null ? List.of() : List.copyOf(initialSongs);
        storedTracks = storedTracks == null ? List.of() : List.copyOf(storedTracks);
    }

    public static ArtistTracks idle() {
        return new ArtistTracks(List.of(), List.of(), List.of(), false, false, null);
    }

    public static ArtistTracks pending() {
        return new ArtistTracks(List.of(), List.of(), List.of(), true, false, null);
    }

    public static ArtistTracks failed(String message) {
        return new ArtistTracks(List.of(), List.of(), List.of(), false, true, message);
    }

    public static ArtistTracks fromStored(List<Track> stored, int initialSongCount, boolean exposeStored) {
        return new ArtistTracks(stored, mostPopular(stored, initialSongCount),
                exposeStored ? stored : List.of(), false, false, null);
    }

    public static ArtistTracks fromFetched(List<Track> fetched, int initialSongCount) {
        return new ArtistTracks(fetched, mostPopular(fetched, initialSongCount), List.of(), false, false, null);
    }

    public boolean hasStoredTracks() {
        return !storedTracks.isEmpty();
    }

    /**
     * Fallback complement used when no stored snapshot is available
     */
    public List<Track> availableTracks(List<SetlistEntry> setlist) {
        Set<String> taken = setlist.stream()
                .map(SetlistEntry::songId)
                .collect(Collectors.toSet());
        return tracks.stream()
                .filter(track -> !taken.contains(track.id()))
                .toList();
    }

    /**
     * Resolves a track id against the stored snapshot first, then the fetched catalog
     */
    public Optional<Track> resolve(String trackId) {
        Optional<Track> stored = storedTracks.stream()
                .filter(track -> track.id().equals(trackId))
                .findFirst();
        if (stored.isPresent()) {
            return stored;
        }
        return tracks.stream()
                .filter(track -> track.id().equals(trackId))
                .findFirst();
    }

    private static List<Track> mostPopular(List<Track> tracks, int count) {
        return tracks.stream()
                .sorted(Comparator.comparingInt(Track::popularity).reversed())
                .limit(Math.max(count, 0))
                .toList();
    }
}
