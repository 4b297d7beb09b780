package com.theset.setlist.application.show;

import com.theset.setlist.application.voting.SetlistSessionFactory;
import com.theset.setlist.domain.model.ArtistTracks;
import com.theset.setlist.domain.model.Participant;
import com.theset.setlist.domain.model.SetlistSnapshot;
import com.theset.setlist.domain.model.ShowDetail;
import com.theset.setlist.domain.model.ShowListing;
import com.theset.setlist.domain.model.TrackLoadOptions;
import com.theset.setlist.domain.port.in.ShowDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class ShowDetailUseCase implements ShowDetails {

    private static final Logger logger = LoggerFactory.getLogger(ShowDetailUseCase.class);

    static final String SHOW_NOT_FOUND = "Show not found";
    static final String SHOW_UNAVAILABLE = "Show could not be loaded";

    private final ShowContextLoader contextLoader;
    private final SetlistSessionFactory sessionFactory;
    private final DisplayFormatter formatter;

    public ShowDetailUseCase(ShowContextLoader contextLoader,
                             SetlistSessionFactory sessionFactory,
                             DisplayFormatter formatter) {
        this.contextLoader = contextLoader;
        this.sessionFactory = sessionFactory;
        this.formatter = formatter;
    }

    @Override
    public ShowDetail getShowDetail(String showId, Participant participant) {
        logger.debug("Building show detail for {}", showId);

        Optional<ShowListing> listing;
        String showError = null;
        try {
            listing = contextLoader.loadListing(showId);
            if (listing.isEmpty()) {
                showError = SHOW_NOT_FOUND;
            }
        } catch (Exception e) {
            logger.error("Error loading show {}", showId, e);
            listing = Optional.empty();
            showError = SHOW_UNAVAILABLE;
        }

        ArtistTracks tracks = listing.map(this::loadTracksFor).orElseGet(ArtistTracks::idle);
        SetlistSnapshot setlist = listing
                .map(resolved -> sessionFactory.open(showId, participant, tracks).snapshot())
                .orElseGet(sessionFactory::emptySnapshot);

        ShowListing show = listing.orElse(null);
        return new ShowDetail(
                show,
                setlist.setlist(),
                new ShowDetail.Loading(false, tracks.loading()),
                new ShowDetail.Errors(showError),
                setlist.connected(),
                setlist.availableTracks(),
                formatter.displayDateAtVenue(show),
                formatter.documentMetadata(show));
    }

    @Override
    public ArtistTracks loadTracks(String showId) {
        try {
            return contextLoader.loadListing(showId)
                    .map(contextLoader::refetchTracks)
                    .orElseGet(ArtistTracks::idle);
        } catch (Exception e) {
            logger.error("Error reloading tracks for show {}", showId, e);
            return ArtistTracks.failed(e.getMessage());
        }
    }

    private ArtistTracks loadTracksFor(ShowListing listing) {
        try {
            return contextLoader.tracksFor(listing, TrackLoadOptions.SHOW_PAGE);
        } catch (Exception e) {
            logger.error("Error loading tracks for show {}", listing.show().id(), e);
            return ArtistTracks.failed(e.getMessage());
        }
    }
}
