package com.theset.setlist.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "theset.voting")
public class VotingConfig {

    /**
     * Votes an unauthenticated participant may cast per show before having to log in
     */
    private int anonymousVoteLimit = 3;

    /**
     * Live setlists untouched for this long are dropped from memory
     */
    private Duration setlistIdleTimeout = Duration.ofHours(6);

    public int getAnonymousVoteLimit() {
        return anonymousVoteLimit;
    }

    public void setAnonymousVoteLimit(int anonymousVoteLimit) {
        this.anonymousVoteLimit = anonymousVoteLimit;
    }

    public Duration getSetlistIdleTimeout() {
        return setlistIdleTimeout;
    }

    public void setSetlistIdleTimeout(Duration setlistIdleTimeout) {
        this.setlistIdleTimeout = setlistIdleTimeout;
    }
}
