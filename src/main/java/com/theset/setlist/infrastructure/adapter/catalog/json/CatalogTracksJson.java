package com.theset.setlist.infrastructure.adapter.catalog.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogTracksJson(
        List<CatalogTrackJson> tracks
) {}
