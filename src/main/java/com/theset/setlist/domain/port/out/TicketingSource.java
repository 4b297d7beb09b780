package com.theset.setlist.domain.port.out;

import com.theset.setlist.domain.model.ShowImport;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the external ticketing/event source.
 */
public interface TicketingSource {

    /**
     * Fetches a single show and normalizes it into the persisted model.
     * Unknown shows and an unavailable source both complete with Optional.empty().
     */
    CompletableFuture<Optional<ShowImport>> fetchShow(String showId);
}
