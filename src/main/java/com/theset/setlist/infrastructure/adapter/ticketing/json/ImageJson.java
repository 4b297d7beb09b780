package com.theset.setlist.infrastructure.adapter.ticketing.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageJson(
        String url,
        String ratio,
        Integer width,
        Integer height
) {}
