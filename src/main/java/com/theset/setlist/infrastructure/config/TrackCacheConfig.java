package com.theset.setlist.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "theset.tracks")
public class TrackCacheConfig {

    private int initialSongCount = 5;
    private Duration loadTimeout = Duration.ofSeconds(5);

    public int getInitialSongCount() {
        return initialSongCount;
    }

    public void setInitialSongCount(int initialSongCount) {
        this.initialSongCount = initialSongCount;
    }

    public Duration getLoadTimeout() {
        return loadTimeout;
    }

    public void setLoadTimeout(Duration loadTimeout) {
        this.loadTimeout = loadTimeout;
    }
}
