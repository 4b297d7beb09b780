package com.theset.setlist.infrastructure.adapter.ticketing.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TicketingEventJson(
        String id,
        String name,
        String url,
        List<ImageJson> images,
        DatesJson dates,
        List<ClassificationJson> classifications,

        @JsonProperty("_embedded")
        EmbeddedJson embedded
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DatesJson(
            StartJson start,
            String timezone
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StartJson(
            String dateTime,
            String localDate,
            Boolean dateTBD
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClassificationJson(
            NamedRefJson genre,
            NamedRefJson subGenre
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NamedRefJson(
            String id,
            String name
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbeddedJson(
            List<VenueJson> venues,
            List<AttractionJson> attractions
    ) {}
}
