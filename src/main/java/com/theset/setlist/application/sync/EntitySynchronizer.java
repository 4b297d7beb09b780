package com.theset.setlist.application.sync;

import com.theset.setlist.domain.model.Artist;
import com.theset.setlist.domain.model.EntityKind;
import com.theset.setlist.domain.model.Show;
import com.theset.setlist.domain.model.ShowImport;
import com.theset.setlist.domain.model.Venue;
import com.theset.setlist.domain.port.out.ArtistStore;
import com.theset.setlist.domain.port.out.EntityStore;
import com.theset.setlist.domain.port.out.ShowStore;
import com.theset.setlist.domain.port.out.TicketingSource;
import com.theset.setlist.domain.port.out.VenueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Reconciles fetched artists, shows and venues with the store.
 * Fresh records are returned untouched; stale or missing ones go through the
 * upsert / insert-only / in-memory write chain. Never throws for store failures.
 */
@Service
public class EntitySynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(EntitySynchronizer.class);
    private static final String UPSERT = "upsert";

    private final ArtistStore artistStore;
    private final ShowStore showStore;
    private final VenueStore venueStore;
    private final TicketingSource ticketingSource;
    private final TrackCatalogPopulator populator;
    private final FreshnessPolicy freshnessPolicy;
    private final Clock clock;

    private final FallbackWriteChain<Artist> artistWrites;
    private final FallbackWriteChain<Show> showWrites;
    private final FallbackWriteChain<Venue> venueWrites;

    public EntitySynchronizer(ArtistStore artistStore,
                              ShowStore showStore,
                              VenueStore venueStore,
                              TicketingSource ticketingSource,
                              TrackCatalogPopulator populator,
                              FreshnessPolicy freshnessPolicy,
                              Clock clock) {
        this.artistStore = artistStore;
        this.showStore = showStore;
        this.venueStore = venueStore;
        this.ticketingSource = ticketingSource;
        this.populator = populator;
        this.freshnessPolicy = freshnessPolicy;
        this.clock = clock;
        this.artistWrites = FallbackWriteChain.upsertThenInsertOnly("artist", artistStore);
        this.showWrites = FallbackWriteChain.upsertThenInsertOnly("show", showStore);
        this.venueWrites = FallbackWriteChain.upsertThenInsertOnly("venue", venueStore);
    }

    public Artist syncArtist(Artist incoming) {
        if (incoming == null || incoming.id() == null) {
            logger.warn("Refusing to sync artist without id");
            return null;
        }
        FallbackWriteChain.WriteResult<Artist> result = sync(EntityKind.ARTIST, incoming.id(), incoming, artistStore,
                freshnessPolicy::isArtistFresh, artist -> artist.withUpdatedAt(clock.instant()), artistWrites);
        Artist synced = result.record();
        if (result.writtenBy(UPSERT) && !synced.hasStoredTracks() && synced.hasCatalogId()) {
            logger.info("Artist {} has no stored tracks, populating from catalog {}", synced.id(), synced.catalogId());
            triggerPopulation(synced);
        }
        return synced;
    }

    public Show syncShow(Show incoming) {
        if (incoming == null || incoming.id() == null) {
            logger.warn("Refusing to sync show without id");
            return null;
        }
        FallbackWriteChain.WriteResult<Show> result = sync(EntityKind.SHOW, incoming.id(), incoming, showStore,
                (stored, in) -> freshnessPolicy.isWithinThreshold(EntityKind.SHOW, stored.updatedAt()),
                show -> show.withUpdatedAt(clock.instant()), showWrites);
        return result.record();
    }

    public Venue syncVenue(Venue incoming) {
        if (incoming == null || incoming.id() == null) {
            logger.warn("Refusing to sync venue without id");
            return null;
        }
        FallbackWriteChain.WriteResult<Venue> result = sync(EntityKind.VENUE, incoming.id(), incoming, venueStore,
                (stored, in) -> freshnessPolicy.isWithinThreshold(EntityKind.VENUE, stored.updatedAt()),
                venue -> venue.withUpdatedAt(clock.instant()), venueWrites);
        return result.record();
    }

    /**
     * Returns the stored show when fresh. Otherwise refreshes it from the ticketing
     * source, falling back to the stale stored show, or null when there is none.
     */
    public Show fetchShowIfStale(String showId) {
        Optional<Show> stored = lookup(showStore, showId, EntityKind.SHOW);
        if (stored.isPresent() && freshnessPolicy.isWithinThreshold(EntityKind.SHOW, stored.get().updatedAt())) {
            logger.debug("Show {} is fresh, serving stored record", showId);
            return stored.get();
        }

        try {
            Optional<ShowImport> fetched = ticketingSource.fetchShow(showId).get();
            if (fetched.isPresent()) {
                return importShow(fetched.get());
            }
            logger.warn("Ticketing source has no show {}", showId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while refreshing show {}", showId);
        } catch (Exception e) {
            logger.error("Failed to refresh show {} from ticketing source", showId, e);
        }
        return stored.orElse(null);
    }

    private Show importShow(ShowImport fetched) {
        if (fetched.artist() != null) {
            syncArtist(fetched.artist());
        }
        if (fetched.venue() != null) {
            syncVenue(fetched.venue());
        }
        return syncShow(fetched.show());
    }

    /**
     * A fresh stored record comes back with writtenBy == null, same as an in-memory fallback.
     */
    private <T> FallbackWriteChain.WriteResult<T> sync(EntityKind kind,
                                                       String id,
                                                       T incoming,
                                                       EntityStore<T> store,
                                                       BiPredicate<T, T> isFresh,
                                                       Function<T, T> prepare,
                                                       FallbackWriteChain<T> writes) {
        Optional<T> stored = lookup(store, id, kind);
        if (stored.isPresent() && isFresh.test(stored.get(), incoming)) {
            logger.debug("{} {} is fresh, skipping write", kind, id);
            return new FallbackWriteChain.WriteResult<>(stored.get(), null);
        }

        logger.info("{} {} is {}, writing", kind, id, stored.isPresent() ? "stale" : "new");
        return writes.write(prepare.apply(incoming));
    }

    private <T> Optional<T> lookup(EntityStore<T> store, String id, EntityKind kind) {
        try {
            return store.findById(id);
        } catch (Exception e) {
            logger.warn("Freshness lookup failed for {} {}, proceeding with write: {}", kind, id, e.getMessage());
            return Optional.empty();
        }
    }

    private void triggerPopulation(Artist artist) {
        try {
            populator.populateAsync(artist.id(), artist.catalogId());
        } catch (Exception e) {
            logger.error("Could not schedule track population for artist {}", artist.id(), e);
        }
    }

}
