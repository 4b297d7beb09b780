package com.theset.setlist.infrastructure.web;

import com.theset.setlist.domain.model.ArtistTracks;
import com.theset.setlist.domain.model.Track;
import com.theset.setlist.domain.model.TrackLoadOptions;
import com.theset.setlist.domain.port.in.ArtistTracksQuery;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ArtistController.class)
class ArtistControllerContractTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ArtistTracksQuery artistTracks;

    @Test
    void shouldReturnStoredSnapshotWithDefaultOptions() throws Exception {
        // Given
        List<Track> stored = List.of(
                new Track("t1", "Garden Song", 219_000, 65, "Punisher", "https://img/punisher.jpg", null),
                new Track("t2", "Kyoto", 184_000, 74, "Punisher", "https://img/punisher.jpg", null));
        when(artistTracks.getArtistTracks("a1", "X123", TrackLoadOptions.SHOW_PAGE))
                .thenReturn(ArtistTracks.fromStored(stored, 1, true));

        // When & Then
        mockMvc.perform(get("/artists/a1/tracks").param("catalog_id", "X123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tracks", hasSize(2)))
                .andExpect(jsonPath("$.stored_tracks", hasSize(2)))
                .andExpect(jsonPath("$.initial_songs[0].id", is("t2")))
                .andExpect(jsonPath("$.initial_songs[0].album_image_url", is("https://img/punisher.jpg")))
                .andExpect(jsonPath("$.error", is(false)));
    }

    @Test
    void shouldPassLoadOptionsThrough() throws Exception {
        when(artistTracks.getArtistTracks("a1", null, new TrackLoadOptions(false, false)))
                .thenReturn(ArtistTracks.idle());

        mockMvc.perform(get("/artists/a1/tracks")
                        .param("immediate", "false")
                        .param("prioritize_stored", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tracks", hasSize(0)))
                .andExpect(jsonPath("$.loading", is(false)));
    }

    @Test
    void shouldExposeLoadFailureInBody() throws Exception {
        when(artistTracks.getArtistTracks(eq("a1"), eq("X123"), any(TrackLoadOptions.class)))
                .thenReturn(ArtistTracks.failed("catalog unavailable"));

        mockMvc.perform(get("/artists/a1/tracks").param("catalog_id", "X123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error", is(true)))
                .andExpect(jsonPath("$.error_message", is("catalog unavailable")));
    }

    @Test
    void shouldReturnServerErrorWhenLookupThrows() throws Exception {
        when(artistTracks.getArtistTracks(eq("a1"), isNull(), any(TrackLoadOptions.class)))
                .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/artists/a1/tracks"))
                .andExpect(status().isInternalServerError());
    }
}
