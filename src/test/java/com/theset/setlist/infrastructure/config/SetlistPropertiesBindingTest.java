package com.theset.setlist.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringJUnitConfig
@ContextConfiguration(initializers = ConfigDataApplicationContextInitializer.class)
@EnableConfigurationProperties({SyncConfig.class, TrackCacheConfig.class, VotingConfig.class, RealtimeConfig.class})
@TestPropertySource(properties = {
        "theset.sync.artist-staleness=3d",
        "theset.sync.show-staleness=12h",
        "theset.tracks.initial-song-count=8",
        "theset.tracks.load-timeout=750ms",
        "theset.voting.anonymous-vote-limit=5",
        "theset.voting.setlist-idle-timeout=90m",
        "theset.realtime.channel-prefix=test:setlist:"
})
class SetlistPropertiesBindingTest {

    @Autowired
    private SyncConfig syncConfig;

    @Autowired
    private TrackCacheConfig trackCacheConfig;

    @Autowired
    private VotingConfig votingConfig;

    @Autowired
    private RealtimeConfig realtimeConfig;

    @Test
    void shouldBindConfigurationProperties() {
        assertThat(syncConfig.getArtistStaleness()).isEqualTo(Duration.ofDays(3));
        assertThat(syncConfig.getShowStaleness()).isEqualTo(Duration.ofHours(12));
        assertThat(trackCacheConfig.getInitialSongCount()).isEqualTo(8);
        assertThat(trackCacheConfig.getLoadTimeout()).isEqualTo(Duration.ofMillis(750));
        assertThat(votingConfig.getAnonymousVoteLimit()).isEqualTo(5);
        assertThat(votingConfig.getSetlistIdleTimeout()).isEqualTo(Duration.ofMinutes(90));
        assertThat(realtimeConfig.channelFor("s1")).isEqualTo("test:setlist:s1");
    }

    @Test
    void shouldKeepApplicationDefaultsForUnsetProperties() {
        // venue staleness only comes from application.yml
        assertThat(syncConfig.getVenueStaleness()).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void shouldHaveDefaultValuesWhenNotConfigured() {
        SyncConfig defaults = new SyncConfig();

        assertThat(defaults.getArtistStaleness()).isEqualTo(Duration.ofDays(7));
        assertThat(defaults.getShowStaleness()).isEqualTo(Duration.ofHours(24));
        assertThat(new TrackCacheConfig().getInitialSongCount()).isEqualTo(5);
        assertThat(new VotingConfig().getAnonymousVoteLimit()).isEqualTo(3);
        assertThat(new VotingConfig().getSetlistIdleTimeout()).isEqualTo(Duration.ofHours(6));
    }
}
