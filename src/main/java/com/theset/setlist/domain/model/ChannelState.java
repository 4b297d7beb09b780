package com.theset.setlist.domain.model;

/**
 * Real-time channel lifecycle. DEGRADED means subscribed but the last publish failed.
 */
public enum ChannelState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    DEGRADED;

    public boolean isConnected() {
        return this == CONNECTED || this == DEGRADED;
    }
}
