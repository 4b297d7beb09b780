package com.theset.setlist.application.sync;

import com.theset.setlist.domain.model.Artist;
import com.theset.setlist.domain.model.EntityKind;
import com.theset.setlist.infrastructure.config.SyncConfig;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Staleness rules per entity kind.
 * A record is fresh while its age is strictly below the kind's threshold.
 */
@Component
public class FreshnessPolicy {

    private final SyncConfig config;
    private final Clock clock;

    public FreshnessPolicy(SyncConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public Duration thresholdFor(EntityKind kind) {
        return switch (kind) {
            case ARTIST -> config.getArtistStaleness();
            case SHOW -> config.getShowStaleness();
            case VENUE -> config.getVenueStaleness();
        };
    }

    public boolean isWithinThreshold(EntityKind kind, Instant lastUpdated) {
        if (lastUpdated == null) {
            return false;
        }
        Duration age = Duration.between(lastUpdated, clock.instant());
        return age.compareTo(thresholdFor(kind)) < 0;
    }

    /**
     * An artist is only fresh when it is recent, already carries a track snapshot,
     * and the incoming record brings nothing the stored one lacks.
     */
    public boolean isArtistFresh(Artist stored, Artist incoming) {
        if (!isWithinThreshold(EntityKind.ARTIST, stored.updatedAt())) {
            return false;
        }
        if (!stored.hasStoredTracks()) {
            return false;
        }
        if (incoming.hasCatalogId() && !stored.hasCatalogId()) {
            return false;
        }
        return incoming.upcomingShows() <= stored.upcomingShows();
    }
}
