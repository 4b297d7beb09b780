package com.theset.setlist.infrastructure.adapter.ticketing.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VenueJson(
        String id,
        String name,
        PlaceJson city,
        PlaceJson state,
        PlaceJson country,
        String timezone
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlaceJson(
            String name,
            String stateCode,
            String countryCode
    ) {}
}
