package com.theset.setlist.application.voting;

import com.theset.setlist.domain.model.SetlistEvent;
import com.theset.setlist.domain.port.out.SetlistChannel;
import com.theset.setlist.infrastructure.config.VotingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the live setlist of every show touched on this instance, by a session or by a
 * relayed mutation, and feeds it the mutations relayed by other instances.
 * Setlists untouched for longer than the idle timeout are dropped by {@link #evictIdle()}.
 */
@Component
public class LiveSetlistRegistry {

    private static final Logger logger = LoggerFactory.getLogger(LiveSetlistRegistry.class);

    private final Map<String, LiveSetlist> setlists = new ConcurrentHashMap<>();
    private final VotingConfig config;
    private final Clock clock;

    public LiveSetlistRegistry(SetlistChannel channel, VotingConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        channel.subscribe(this::applyRemote);
    }

    public LiveSetlist get(String showId) {
        LiveSetlist setlist = setlists.computeIfAbsent(showId, LiveSetlist::new);
        setlist.touch(clock.instant());
        return setlist;
    }

    /**
     * @return the number of setlists dropped
     */
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(config.getSetlistIdleTimeout());
        int before = setlists.size();
        setlists.values().removeIf(setlist -> setlist.idleSince(cutoff));
        int evicted = before - setlists.size();
        if (evicted > 0) {
            logger.info("Evicted {} idle setlists, {} still live", evicted, setlists.size());
        }
        return evicted;
    }

    int size() {
        return setlists.size();
    }

    void applyRemote(SetlistEvent event) {
        if (event == null || event.showId() == null) {
            logger.warn("Dropping setlist event without show id");
            return;
        }
        logger.debug("Applying remote {} for show {}", event.type(), event.showId());
        get(event.showId()).applyRemote(event);
    }
}
