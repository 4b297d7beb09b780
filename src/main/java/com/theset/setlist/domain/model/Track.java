package com.theset.setlist.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single song of an artist's catalog. Identity is the id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Track(
        String id,
        String name,
        int durationMs,
        int popularity,
        String albumName,
        String albumImageUrl,
        String previewUrl
) {}
