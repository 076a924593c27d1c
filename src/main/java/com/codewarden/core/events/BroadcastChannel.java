package com.codewarden.core.events;

import com.codewarden.core.metrics.CodewardenMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of server messages to every connected {@link ClientSubscription}.
 * <p>
 * A message is serialized once and offered to each subscriber present at
 * publish time. Closed or failing subscribers are dropped and logged; there
 * is no retry and no replay for subscribers that connect later.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class BroadcastChannel {

    private static final Logger log = LoggerFactory.getLogger(BroadcastChannel.class);

    private final ObjectMapper objectMapper;
    private final CodewardenMetrics metrics;
    private final CopyOnWriteArrayList<ClientSubscription> subscribers = new CopyOnWriteArrayList<>();

    public BroadcastChannel(ObjectMapper objectMapper, CodewardenMetrics metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Adds a subscriber.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(ClientSubscription subscription) {
        subscribers.add(subscription);
        log.debug("Subscriber {} connected ({} total)", subscription.id(), subscribers.size());
        return () -> {
            if (subscribers.remove(subscription)) {
                log.debug("Subscriber {} disconnected", subscription.id());
            }
        };
    }

    /**
     * Serializes {@code message} and delivers it to every current subscriber.
     *
     * @return the number of subscribers that received it
     */
    public int publish(Object message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize broadcast message: {}", e.getMessage(), e);
            return 0;
        }
        int delivered = 0;
        for (ClientSubscription subscriber : subscribers) {
            if (deliverSafely(subscriber, payload)) {
                delivered++;
            }
        }
        return delivered;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Closes and forgets every subscriber. Safe to call repeatedly.
     */
    public void closeAll() {
        for (ClientSubscription subscriber : subscribers) {
            try {
                subscriber.close();
            } catch (RuntimeException e) {
                log.debug("Error closing subscriber {}: {}", subscriber.id(), e.getMessage());
            }
        }
        subscribers.clear();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private boolean deliverSafely(ClientSubscription subscriber, String payload) {
        if (!subscriber.isOpen()) {
            subscribers.remove(subscriber);
            metrics.recordBroadcast("dropped");
            log.debug("Dropped message for closed subscriber {}", subscriber.id());
            return false;
        }
        try {
            subscriber.send(payload);
            metrics.recordBroadcast("delivered");
            return true;
        } catch (Exception e) {
            subscribers.remove(subscriber);
            metrics.recordBroadcast("dropped");
            log.warn("Dropping subscriber {} after failed delivery: {}", subscriber.id(), e.getMessage());
            return false;
        }
    }
}
