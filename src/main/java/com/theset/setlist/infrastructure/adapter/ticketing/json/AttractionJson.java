package com.theset.setlist.infrastructure.adapter.ticketing.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AttractionJson(
        String id,
        String name,
        List<ImageJson> images,
        List<ClassificationRefJson> classifications,
        Map<String, List<LinkJson>> externalLinks,

        @JsonProperty("upcomingEvents")
        Map<String, Integer> upcomingEvents
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LinkJson(
            String url
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClassificationRefJson(
            TicketingEventJson.NamedRefJson genre
    ) {}

    public int upcomingEventCount() {
        if (upcomingEvents == null) {
            return 0;
        }
        return upcomingEvents.getOrDefault("_total", 0);
    }
}
