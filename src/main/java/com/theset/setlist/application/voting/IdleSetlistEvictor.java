package com.theset.setlist.application.voting;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class IdleSetlistEvictor {

    private final LiveSetlistRegistry registry;

    public IdleSetlistEvictor(LiveSetlistRegistry registry) {
        this.registry = registry;
    }

    @Scheduled(fixedDelayString = "${theset.voting.eviction-interval:PT10M}")
    public void run() {
        registry.evictIdle();
    }
}
