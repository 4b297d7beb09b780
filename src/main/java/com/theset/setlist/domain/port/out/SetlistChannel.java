package com.theset.setlist.domain.port.out;

import com.theset.setlist.domain.model.ChannelState;
import com.theset.setlist.domain.model.SetlistEvent;
import java.util.function.Consumer;

/**
 * Real-time channel relaying setlist mutations to every participant of a show.
 * Delivery is at-least-once and unordered.
 */
public interface SetlistChannel {

    /**
     * Broadcasts a local mutation. Never throws; a failed publish degrades the channel state.
     */
    void publish(SetlistEvent event);

    /**
     * Registers a consumer for mutations published by other instances
     */
    void subscribe(Consumer<SetlistEvent> listener);

    ChannelState state();

    default boolean isConnected() {
        return state().isConnected();
    }
}
