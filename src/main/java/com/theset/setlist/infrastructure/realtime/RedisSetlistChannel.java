package com.theset.setlist.infrastructure.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.theset.setlist.domain.model.ChannelState;
import com.theset.setlist.domain.model.SetlistEvent;
import com.theset.setlist.domain.port.out.SetlistChannel;
import com.theset.setlist.infrastructure.config.RealtimeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Setlist channel over Redis pub/sub, one channel per show.
 * Messages carry the publishing instance's origin id so an instance never re-applies its own mutations.
 */
@Component
public class RedisSetlistChannel implements SetlistChannel, MessageListener {

    private static final Logger logger = LoggerFactory.getLogger(RedisSetlistChannel.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer container;
    private final ObjectMapper objectMapper;
    private final RealtimeConfig config;
    private final String origin = UUID.randomUUID().toString();
    private final List<Consumer<SetlistEvent>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean publishFailed = new AtomicBoolean(false);

    public RedisSetlistChannel(StringRedisTemplate redisTemplate,
                               RedisMessageListenerContainer container,
                               ObjectMapper objectMapper,
                               RealtimeConfig config) {
        this.redisTemplate = redisTemplate;
        this.container = container;
        this.objectMapper = objectMapper;
        this.config = config;
        container.addMessageListener(this, new PatternTopic(config.getChannelPrefix() + "*"));
    }

    @Override
    public void publish(SetlistEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(new ChannelMessage(origin, event));
            redisTemplate.convertAndSend(config.channelFor(event.showId()), payload);
            if (publishFailed.compareAndSet(true, false)) {
                logger.info("Setlist channel recovered");
            }
        } catch (Exception e) {
            publishFailed.set(true);
            logger.warn("Failed to publish {} for show {}: {}", event.type(), event.showId(), e.getMessage());
        }
    }

    @Override
    public void subscribe(Consumer<SetlistEvent> listener) {
        listeners.add(listener);
    }

    @Override
    public ChannelState state() {
        if (!container.isRunning()) {
            return ChannelState.DISCONNECTED;
        }
        if (!container.isListening()) {
            return ChannelState.CONNECTING;
        }
        return publishFailed.get() ? ChannelState.DEGRADED : ChannelState.CONNECTED;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        ChannelMessage received;
        try {
            received = objectMapper.readValue(new String(message.getBody(), StandardCharsets.UTF_8), ChannelMessage.class);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unreadable setlist message: {}", e.getMessage());
            return;
        }
        if (origin.equals(received.origin()) || received.event() == null) {
            return;
        }
        for (Consumer<SetlistEvent> listener : listeners) {
            try {
                listener.accept(received.event());
            } catch (RuntimeException e) {
                logger.error("Setlist listener failed for show {}", received.event().showId(), e);
            }
        }
    }

    String origin() {
        return origin;
    }

    record ChannelMessage(String origin, SetlistEvent event) {}
}
