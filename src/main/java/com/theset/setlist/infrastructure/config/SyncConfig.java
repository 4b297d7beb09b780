package com.theset.setlist.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Staleness thresholds per entity kind, reflecting how volatile each kind is
 */
@Component
@ConfigurationProperties(prefix = "theset.sync")
public class SyncConfig {

    private Duration artistStaleness = Duration.ofDays(7);
    private Duration showStaleness = Duration.ofHours(24);
    private Duration venueStaleness = Duration.ofDays(7);

    public Duration getArtistStaleness() {
        return artistStaleness;
    }

    public void setArtistStaleness(Duration artistStaleness) {
        this.artistStaleness = artistStaleness;
    }

    public Duration getShowStaleness() {
        return showStaleness;
    }

    public void setShowStaleness(Duration showStaleness) {
        this.showStaleness = showStaleness;
    }

    public Duration getVenueStaleness() {
        return venueStaleness;
    }

    public void setVenueStaleness(Duration venueStaleness) {
        this.venueStaleness = venueStaleness;
    }
}
