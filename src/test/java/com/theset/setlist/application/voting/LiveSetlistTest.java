package com.theset.setlist.application.voting;

import com.theset.setlist.domain.model.SetlistEntry;
import com.theset.setlist.domain.model.SetlistEvent;
import com.theset.setlist.domain.model.Track;
import com.theset.setlist.domain.model.VoteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class LiveSetlistTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    private LiveSetlist setlist;

    @BeforeEach
    void setUp() {
        setlist = new LiveSetlist("s1");
    }

    @Test
    void shouldAppendSongsInInsertionOrderWithZeroVotes() {
        setlist.add(track("t1"));
        setlist.add(track("t2"));

        assertThat(setlist.entries())
                .extracting(SetlistEntry::songId, SetlistEntry::votes, SetlistEntry::position)
                .containsExactly(
                        tuple("t1", 0, 0),
                        tuple("t2", 0, 1));
    }

    @Test
    void shouldRejectDuplicateWithoutResettingVotes() {
        // Given
        setlist.add(track("t1"));
        setlist.castVote("p1", "t1", true, 3);

        // When
        boolean added = setlist.add(track("t1"));

        // Then
        assertThat(added).isFalse();
        assertThat(setlist.entries()).hasSize(1);
        assertThat(setlist.entries().get(0).votes()).isEqualTo(1);
    }

    @Test
    void shouldAddExactlyOneVoteToTargetEntryOnly() {
        setlist.add(track("t1"));
        setlist.add(track("t2"));

        VoteResult result = setlist.castVote("p1", "t2", false, 3);

        assertThat(result).isEqualTo(VoteResult.ACCEPTED);
        assertThat(setlist.entries()).extracting(SetlistEntry::votes).containsExactly(0, 1);
    }

    @Test
    void shouldRejectUnknownSongWithoutChanges() {
        setlist.add(track("t1"));
        long version = setlist.version();

        VoteResult result = setlist.castVote("p1", "nope", false, 3);

        assertThat(result).isEqualTo(VoteResult.UNKNOWN_SONG);
        assertThat(setlist.version()).isEqualTo(version);
        assertThat(setlist.anonymousVotes("p1")).isZero();
    }

    @Test
    void shouldEnforceAnonymousQuotaPerParticipant() {
        setlist.add(track("t1"));
        for (int i = 0; i < 3; i++) {
            assertThat(setlist.castVote("p1", "t1", false, 3)).isEqualTo(VoteResult.ACCEPTED);
        }

        assertThat(setlist.castVote("p1", "t1", false, 3)).isEqualTo(VoteResult.QUOTA_EXCEEDED);
        assertThat(setlist.castVote("p2", "t1", false, 3)).isEqualTo(VoteResult.ACCEPTED);
        assertThat(setlist.entries().get(0).votes()).isEqualTo(4);
    }

    @Test
    void shouldNeverLimitAuthenticatedParticipants() {
        setlist.add(track("t1"));

        IntStream.range(0, 10).forEach(i ->
                assertThat(setlist.castVote("p1", "t1", true, 3)).isEqualTo(VoteResult.ACCEPTED));

        assertThat(setlist.anonymousVotes("p1")).isZero();
    }

    @Test
    void shouldComputeAvailableTracksInStoredOrder() {
        List<Track> stored = List.of(track("t1"), track("t2"), track("t3"), track("t4"));
        setlist.add(track("t3"));
        setlist.add(track("t1"));

        assertThat(setlist.availableTracks(stored)).extracting(Track::id).containsExactly("t2", "t4");
    }

    @Test
    void shouldMemoizeAvailableTracksUntilSetlistChanges() {
        // Given
        List<Track> stored = List.of(track("t1"), track("t2"));
        List<Track> first = setlist.availableTracks(stored);

        // When
        List<Track> second = setlist.availableTracks(stored);
        setlist.add(track("t1"));
        List<Track> third = setlist.availableTracks(stored);

        // Then
        assertThat(second).isSameAs(first);
        assertThat(third).extracting(Track::id).containsExactly("t2");
    }

    @Test
    void shouldSeedOnlyOnce() {
        assertThat(setlist.seed(List.of(track("t1"), track("t2")))).extracting(Track::id).containsExactly("t1", "t2");
        assertThat(setlist.seed(List.of(track("t3")))).isEmpty();

        assertThat(setlist.entries()).extracting(SetlistEntry::songId).containsExactly("t1", "t2");
    }

    @Test
    void shouldSeedAroundSongsRelayedBeforeFirstSession() {
        // Given
        setlist.applyRemote(SetlistEvent.songAdded("s1", track("t2"), NOW));
        setlist.applyRemote(SetlistEvent.voteCast("s1", "t2", NOW));

        // When
        List<Track> seeded = setlist.seed(List.of(track("t1"), track("t2")));

        // Then
        assertThat(seeded).extracting(Track::id).containsExactly("t1");
        assertThat(setlist.entries())
                .extracting(SetlistEntry::songId, SetlistEntry::votes)
                .containsExactly(tuple("t2", 1), tuple("t1", 0));
    }

    @Test
    void shouldApplyRemoteEventsWithoutDeduplication() {
        // Given
        SetlistEvent added = SetlistEvent.songAdded("s1", track("t1"), NOW);
        SetlistEvent vote = SetlistEvent.voteCast("s1", "t1", NOW);

        // When
        setlist.applyRemote(added);
        setlist.applyRemote(added);
        setlist.applyRemote(vote);
        setlist.applyRemote(vote);

        // Then
        assertThat(setlist.entries()).hasSize(1);
        assertThat(setlist.entries().get(0).votes()).isEqualTo(2);
    }

    @Test
    void shouldNotLoseConcurrentVotes() {
        // Given
        setlist.add(track("t1"));
        ExecutorService executor = Executors.newFixedThreadPool(8);

        // When
        CompletableFuture<?>[] votes = IntStream.range(0, 200)
                .mapToObj(i -> CompletableFuture.runAsync(() -> setlist.castVote("p" + i, "t1", true, 3), executor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(votes).join();
        executor.shutdown();

        // Then
        assertThat(setlist.entries().get(0).votes()).isEqualTo(200);
    }

    private Track track(String id) {
        return new Track(id, "Song " + id, 200_000, 50, "Album", null, null);
    }
}
