package com.theset.setlist.infrastructure.web;

import com.theset.setlist.domain.model.AddSongOutcome;
import com.theset.setlist.domain.model.AddSongResult;
import com.theset.setlist.domain.model.Artist;
import com.theset.setlist.domain.model.ArtistTracks;
import com.theset.setlist.domain.model.Participant;
import com.theset.setlist.domain.model.SetlistEntry;
import com.theset.setlist.domain.model.SetlistSnapshot;
import com.theset.setlist.domain.model.Show;
import com.theset.setlist.domain.model.ShowDetail;
import com.theset.setlist.domain.model.ShowListing;
import com.theset.setlist.domain.model.Track;
import com.theset.setlist.domain.model.Venue;
import com.theset.setlist.domain.model.VoteOutcome;
import com.theset.setlist.domain.model.VoteResult;
import com.theset.setlist.domain.port.in.SetlistVoting;
import com.theset.setlist.domain.port.in.ShowDetails;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ShowController.class)
class ShowControllerContractTest {

    private static final Track MOTION_SICKNESS = new Track("t1", "Motion Sickness", 229_000, 78, "Stranger in the Alps", null, null);
    private static final Track KYOTO = new Track("t2", "Kyoto", 184_000, 74, "Punisher", null, null);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ShowDetails showDetails;

    @MockBean
    private SetlistVoting setlistVoting;

    @Test
    void shouldReturnShowPageWhenShowExists() throws Exception {
        // Given
        when(showDetails.getShowDetail(eq("s1"), any(Participant.class))).thenReturn(showDetail());

        // When & Then
        mockMvc.perform(get("/shows/s1")
                        .header(ShowController.PARTICIPANT_HEADER, "p1")
                        .contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.show.id", is("s1")))
                .andExpect(jsonPath("$.show.display_date", is("Sun, Jun 1, 2025")))
                .andExpect(jsonPath("$.show.artist.catalog_id", is("X123")))
                .andExpect(jsonPath("$.show.venue.city", is("New York")))
                .andExpect(jsonPath("$.setlist", hasSize(1)))
                .andExpect(jsonPath("$.setlist[0].track.duration_ms", is(229000)))
                .andExpect(jsonPath("$.setlist[0].votes", is(2)))
                .andExpect(jsonPath("$.available_tracks[0].id", is("t2")))
                .andExpect(jsonPath("$.loading.tracks", is(false)))
                .andExpect(jsonPath("$.error.show", nullValue()))
                .andExpect(jsonPath("$.connected", is(true)))
                .andExpect(jsonPath("$.document_metadata.title",
                        is("TheSet | Phoebe Bridgers at Madison Square Garden in New York, NY | Sun, Jun 1, 2025")));
    }

    @Test
    void shouldReturnNotFoundWithGenericMetadataWhenShowIsMissing() throws Exception {
        // Given
        var missing = new ShowDetail(null, List.of(), new ShowDetail.Loading(false, false),
                new ShowDetail.Errors("Show not found"), false, List.of(), "TBD",
                new ShowDetail.DocumentMetadata("Show Details | TheSet", "Vote on setlists"));
        when(showDetails.getShowDetail(eq("missing"), any(Participant.class))).thenReturn(missing);

        // When & Then
        mockMvc.perform(get("/shows/missing").header(ShowController.PARTICIPANT_HEADER, "p1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.show", nullValue()))
                .andExpect(jsonPath("$.error.show", is("Show not found")))
                .andExpect(jsonPath("$.document_metadata.title", is("Show Details | TheSet")));
    }

    @Test
    void shouldRejectRequestWithoutParticipantHeader() throws Exception {
        mockMvc.perform(get("/shows/s1"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(showDetails);
    }

    @Test
    void shouldReturnServerErrorWhenShowPageFails() throws Exception {
        when(showDetails.getShowDetail(eq("s1"), any(Participant.class)))
                .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/shows/s1").header(ShowController.PARTICIPANT_HEADER, "p1"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void shouldRefreshTracksOfShowArtist() throws Exception {
        // Given
        when(showDetails.loadTracks("s1")).thenReturn(ArtistTracks.fromFetched(List.of(MOTION_SICKNESS, KYOTO), 1));

        // When & Then
        mockMvc.perform(post("/shows/s1/tracks/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tracks", hasSize(2)))
                .andExpect(jsonPath("$.initial_songs", hasSize(1)))
                .andExpect(jsonPath("$.initial_songs[0].name", is("Motion Sickness")))
                .andExpect(jsonPath("$.stored_tracks", hasSize(0)))
                .andExpect(jsonPath("$.loading", is(false)));
    }

    @Test
    void shouldSelectTrack() throws Exception {
        // Given
        when(setlistVoting.selectTrack(eq("s1"), any(Participant.class), eq("t2")))
                .thenReturn(snapshot("t2", 0));

        // When & Then
        mockMvc.perform(post("/shows/s1/setlist/selection")
                        .header(ShowController.PARTICIPANT_HEADER, "p1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"track_id\":\"t2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.selected_track_id", is("t2")))
                .andExpect(jsonPath("$.result", nullValue()));
    }

    @Test
    void shouldRejectBlankTrackSelection() throws Exception {
        mockMvc.perform(post("/shows/s1/setlist/selection")
                        .header(ShowController.PARTICIPANT_HEADER, "p1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"track_id\":\"\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(setlistVoting);
    }

    @Test
    void shouldReturnCreatedWhenSongIsAdded() throws Exception {
        // Given
        when(setlistVoting.addSong(eq("s1"), any(Participant.class), eq("t2")))
                .thenReturn(new AddSongOutcome(AddSongResult.ADDED, snapshot(null, 0)));

        // When & Then
        mockMvc.perform(post("/shows/s1/setlist/songs")
                        .header(ShowController.PARTICIPANT_HEADER, "p1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"track_id\":\"t2\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.result", is("ADDED")));
    }

    @Test
    void shouldAddSelectedTrackWhenBodyIsMissing() throws Exception {
        // Given
        when(setlistVoting.addSong(eq("s1"), any(Participant.class), isNull()))
                .thenReturn(new AddSongOutcome(AddSongResult.NO_TRACK_SELECTED, snapshot(null, 0)));

        // When & Then
        mockMvc.perform(post("/shows/s1/setlist/songs")
                        .header(ShowController.PARTICIPANT_HEADER, "p1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result", is("NO_TRACK_SELECTED")));
    }

    @Test
    void shouldAcceptVote() throws Exception {
        // Given
        when(setlistVoting.vote(eq("s1"), any(Participant.class), eq("t1")))
                .thenReturn(new VoteOutcome(VoteResult.ACCEPTED, snapshot(null, 1)));

        // When & Then
        mockMvc.perform(post("/shows/s1/setlist/songs/t1/votes")
                        .header(ShowController.PARTICIPANT_HEADER, "p1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result", is("ACCEPTED")))
                .andExpect(jsonPath("$.login_required", is(false)))
                .andExpect(jsonPath("$.anonymous_vote_count", is(1)));
    }

    @Test
    void shouldAskForLoginWhenAnonymousQuotaIsExhausted() throws Exception {
        // Given
        when(setlistVoting.vote(eq("s1"), any(Participant.class), eq("t1"))).thenAnswer(invocation -> {
            Participant participant = invocation.getArgument(1);
            participant.auth().login();
            return new VoteOutcome(VoteResult.QUOTA_EXCEEDED, snapshot(null, 3));
        });

        // When & Then
        mockMvc.perform(post("/shows/s1/setlist/songs/t1/votes")
                        .header(ShowController.PARTICIPANT_HEADER, "p1"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.result", is("QUOTA_EXCEEDED")))
                .andExpect(jsonPath("$.login_required", is(true)))
                .andExpect(jsonPath("$.setlist[0].votes", is(2)));
    }

    @Test
    void shouldReturnNotFoundWhenVotingOnUnknownSong() throws Exception {
        when(setlistVoting.vote(eq("s1"), any(Participant.class), eq("ghost")))
                .thenReturn(new VoteOutcome(VoteResult.UNKNOWN_SONG, snapshot(null, 0)));

        mockMvc.perform(post("/shows/s1/setlist/songs/ghost/votes")
                        .header(ShowController.PARTICIPANT_HEADER, "p1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.result", is("UNKNOWN_SONG")));
    }

    @Test
    void shouldPassAuthenticatedUserToVoting() throws Exception {
        when(setlistVoting.vote(eq("s1"), any(Participant.class), eq("t1")))
                .thenReturn(new VoteOutcome(VoteResult.ACCEPTED, snapshot(null, 0)));

        mockMvc.perform(post("/shows/s1/setlist/songs/t1/votes")
                        .header(ShowController.PARTICIPANT_HEADER, "p1")
                        .header(ShowController.USER_HEADER, "user-42"))
                .andExpect(status().isOk());

        verify(setlistVoting).vote(eq("s1"),
                argThat((Participant participant) -> participant.auth().isAuthenticated()),
                eq("t1"));
    }

    private SetlistSnapshot snapshot(String selectedTrackId, int anonymousVotes) {
        return new SetlistSnapshot(
                List.of(new SetlistEntry(MOTION_SICKNESS, 2, 0)),
                List.of(KYOTO),
                selectedTrackId,
                anonymousVotes,
                true);
    }

    private ShowDetail showDetail() {
        Instant date = Instant.parse("2025-06-01T20:00:00Z");
        Show show = new Show("s1", "Phoebe Bridgers: Reunion Tour", "a1", "v1", date, null, null, List.of(), date);
        Artist artist = new Artist("a1", "Phoebe Bridgers", null, List.of("indie"), 80, 12, "X123", null, null, date);
        Venue venue = new Venue("v1", "Madison Square Garden", "New York", "NY", "US", "America/New_York", date);
        return new ShowDetail(
                new ShowListing(show, artist, venue),
                List.of(new SetlistEntry(MOTION_SICKNESS, 2, 0)),
                new ShowDetail.Loading(false, false),
                new ShowDetail.Errors(null),
                true,
                List.of(KYOTO),
                "Sun, Jun 1, 2025",
                new ShowDetail.DocumentMetadata(
                        "TheSet | Phoebe Bridgers at Madison Square Garden in New York, NY | Sun, Jun 1, 2025",
                        "Vote on the setlist"));
    }
}
