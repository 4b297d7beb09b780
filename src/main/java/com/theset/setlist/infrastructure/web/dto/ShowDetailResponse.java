package com.theset.setlist.infrastructure.web.dto;

import com.theset.setlist.domain.model.Artist;
import com.theset.setlist.domain.model.ShowDetail;
import com.theset.setlist.domain.model.ShowListing;
import com.theset.setlist.domain.model.Venue;

import java.time.Instant;
import java.util.List;

public record ShowDetailResponse(
        ShowDto show,
        List<SetlistEntryDto> setlist,
        LoadingDto loading,
        ErrorDto error,
        boolean connected,
        List<TrackDto> available_tracks,
        MetadataDto document_metadata
) {
    public static ShowDetailResponse fromDetail(ShowDetail detail) {
        return new ShowDetailResponse(
                ShowDto.fromListing(detail.show(), detail.displayDate()),
                SetlistEntryDto.fromEntries(detail.setlist()),
                new LoadingDto(detail.loading().show(), detail.loading().tracks()),
                new ErrorDto(detail.error().show()),
                detail.connected(),
                TrackDto.fromTracks(detail.availableTracks()),
                new MetadataDto(detail.documentMetadata().title(), detail.documentMetadata().description())
        );
    }

    public record ShowDto(
            String id,
            String name,
            Instant date,
            String display_date,
            String image_url,
            String ticket_url,
            List<String> genre_ids,
            ArtistDto artist,
            VenueDto venue
    ) {
        static ShowDto fromListing(ShowListing listing, String displayDate) {
            if (listing == null) {
                return null;
            }
            var show = listing.show();
            return new ShowDto(
                    show.id(),
                    show.name(),
                    show.date(),
                    displayDate,
                    show.imageUrl(),
                    show.ticketUrl(),
                    show.genreIds(),
                    ArtistDto.fromArtist(listing.artist()),
                    VenueDto.fromVenue(listing.venue())
            );
        }
    }

    public record ArtistDto(
            String id,
            String name,
            String image_url,
            List<String> genres,
            String catalog_id
    ) {
        static ArtistDto fromArtist(Artist artist) {
            if (artist == null) {
                return null;
            }
            return new ArtistDto(artist.id(), artist.name(), artist.imageUrl(), artist.genres(), artist.catalogId());
        }
    }

    public record VenueDto(
            String id,
            String name,
            String city,
            String state,
            String country
    ) {
        static VenueDto fromVenue(Venue venue) {
            if (venue == null) {
                return null;
            }
            return new VenueDto(venue.id(), venue.name(), venue.city(), venue.state(), venue.country());
        }
    }

    public record LoadingDto(boolean show, boolean tracks) {}

    public record ErrorDto(String show) {}

    public record MetadataDto(String title, String description) {}
}
