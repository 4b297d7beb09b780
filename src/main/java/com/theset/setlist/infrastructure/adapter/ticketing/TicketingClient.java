package com.theset.setlist.infrastructure.adapter.ticketing;

import com.theset.setlist.domain.model.ShowImport;
import com.theset.setlist.domain.port.out.TicketingSource;
import com.theset.setlist.infrastructure.adapter.mapper.ShowMapper;
import com.theset.setlist.infrastructure.config.TicketingApiConfig;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Component
public class TicketingClient implements TicketingSource {

    private static final Logger logger = LoggerFactory.getLogger(TicketingClient.class);
    private final TicketingApi ticketingApi;
    private final ShowMapper showMapper;
    private final TicketingApiConfig config;

    public TicketingClient(TicketingApi ticketingApi, ShowMapper showMapper, TicketingApiConfig config) {
        this.ticketingApi = ticketingApi;
        this.showMapper = showMapper;
        this.config = config;
    }

    @Override
    @CircuitBreaker(name = "ticketing-source", fallbackMethod = "fallbackFetchShow")
    @Retry(name = "ticketing-source")
    @TimeLimiter(name = "ticketing-source")
    public CompletableFuture<Optional<ShowImport>> fetchShow(String showId) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                logger.debug("Fetching show {} from ticketing source", showId);
                var response = ticketingApi.fetchEvent(showId, config.getApiKey()).execute();
                if (response.isSuccessful() && response.body() != null) {
                    return showMapper.mapToShowImport(response.body());
                }
                if (response.code() >= 500) {
                    throw new IllegalStateException("Ticketing source responded with " + response.code());
                }
                logger.warn("Show {} not available from ticketing source (HTTP {})", showId, response.code());
                return Optional.<ShowImport>empty();
            } catch (Exception e) {
                logger.error("Exception fetching show {} from ticketing source: {}", showId, e.getMessage());
                throw new RuntimeException("Failed to fetch show", e);
            }
        });
    }

    public CompletableFuture<Optional<ShowImport>> fallbackFetchShow(String showId, Exception ex) {
        logger.warn("Fallback triggered for ticketing source ({}): {}", showId, ex.getMessage());
        return CompletableFuture.completedFuture(Optional.empty());
    }
}
