package com.theset.setlist.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "theset.realtime")
public class RealtimeConfig {

    private String channelPrefix = "theset:setlist:";

    public String getChannelPrefix() {
        return channelPrefix;
    }

    public void setChannelPrefix(String channelPrefix) {
        this.channelPrefix = channelPrefix;
    }

    public String channelFor(String showId) {
        return channelPrefix + showId;
    }
}
