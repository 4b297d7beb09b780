package com.theset.setlist.infrastructure.adapter.catalog.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogTrackJson(
        String id,
        String name,

        @JsonProperty("duration_ms")
        Integer durationMs,

        Integer popularity,

        @JsonProperty("preview_url")
        String previewUrl,

        CatalogAlbumJson album
) {}
