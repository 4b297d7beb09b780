package com.theset.setlist.application.sync;

import com.theset.setlist.domain.model.Artist;
import com.theset.setlist.domain.model.EntityKind;
import com.theset.setlist.domain.model.Track;
import com.theset.setlist.infrastructure.config.SyncConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FreshnessPolicyTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    private FreshnessPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new FreshnessPolicy(new SyncConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldUseDefaultThresholdsPerKind() {
        assertThat(policy.thresholdFor(EntityKind.ARTIST)).isEqualTo(Duration.ofDays(7));
        assertThat(policy.thresholdFor(EntityKind.SHOW)).isEqualTo(Duration.ofHours(24));
        assertThat(policy.thresholdFor(EntityKind.VENUE)).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void shouldTreatShowUpdatedWithinADayAsFresh() {
        assertThat(policy.isWithinThreshold(EntityKind.SHOW, NOW.minus(Duration.ofHours(23)))).isTrue();
        assertThat(policy.isWithinThreshold(EntityKind.SHOW, NOW.minus(Duration.ofHours(25)))).isFalse();
    }

    @Test
    void shouldTreatExactThresholdAgeAsStale() {
        assertThat(policy.isWithinThreshold(EntityKind.SHOW, NOW.minus(Duration.ofHours(24)))).isFalse();
    }

    @Test
    void shouldTreatMissingTimestampAsStale() {
        assertThat(policy.isWithinThreshold(EntityKind.VENUE, null)).isFalse();
    }

    @Test
    void shouldConsiderRecentArtistWithTracksFresh() {
        // Given
        Artist stored = artist(NOW.minus(Duration.ofDays(2)), "X123", List.of(track("t1")), 4);
        Artist incoming = artist(null, "X123", null, 4);

        // When & Then
        assertThat(policy.isArtistFresh(stored, incoming)).isTrue();
    }

    @Test
    void shouldNeverConsiderArtistWithoutStoredTracksFresh() {
        Artist stored = artist(NOW.minus(Duration.ofMinutes(5)), "X123", null, 4);
        Artist incoming = artist(null, "X123", null, 4);

        assertThat(policy.isArtistFresh(stored, incoming)).isFalse();
    }

    @Test
    void shouldRefreshArtistWhenIncomingBringsCatalogId() {
        Artist stored = artist(NOW.minus(Duration.ofDays(1)), null, List.of(track("t1")), 4);
        Artist incoming = artist(null, "X123", null, 4);

        assertThat(policy.isArtistFresh(stored, incoming)).isFalse();
    }

    @Test
    void shouldRefreshArtistWhenMoreUpcomingShowsReported() {
        Artist stored = artist(NOW.minus(Duration.ofDays(1)), "X123", List.of(track("t1")), 4);
        Artist incoming = artist(null, "X123", null, 6);

        assertThat(policy.isArtistFresh(stored, incoming)).isFalse();
    }

    @Test
    void shouldRefreshArtistOlderThanAWeek() {
        Artist stored = artist(NOW.minus(Duration.ofDays(10)), "X123", List.of(track("t1")), 4);
        Artist incoming = artist(null, "X123", null, 4);

        assertThat(policy.isArtistFresh(stored, incoming)).isFalse();
    }

    private Artist artist(Instant updatedAt, String catalogId, List<Track> storedTracks, int upcomingShows) {
        return new Artist("a1", "The Band", null, List.of("rock"), 60, upcomingShows,
                catalogId, storedTracks, null, updatedAt);
    }

    private Track track(String id) {
        return new Track(id, "Song " + id, 200_000, 50, "Album", null, null);
    }
}
