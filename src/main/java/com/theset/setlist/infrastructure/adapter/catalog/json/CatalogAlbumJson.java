package com.theset.setlist.infrastructure.adapter.catalog.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogAlbumJson(
        String name,
        List<ImageJson> images
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ImageJson(
            String url,
            Integer width,
            Integer height
    ) {}
}
