package com.theset.setlist.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;

public record TrackSelectionRequest(
        @NotBlank String track_id
) {}
