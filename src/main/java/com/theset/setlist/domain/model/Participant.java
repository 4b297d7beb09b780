package com.theset.setlist.domain.model;

import com.theset.setlist.domain.port.out.AuthProvider;

/**
 * A caller of the voting surface: a stable session id plus the caller's auth capability.
 */
public record Participant(
        String id,
        AuthProvider auth
) {}
