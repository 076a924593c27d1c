package com.codewarden.core.events;

import com.codewarden.core.metrics.CodewardenMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BroadcastChannelTest {

    private SimpleMeterRegistry registry;
    private BroadcastChannel channel;

    static class FakeClient implements ClientSubscription {
        final String id;
        final List<String> received = new ArrayList<>();
        boolean open = true;
        boolean failing;
        boolean closed;

        FakeClient(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void send(String message) throws IOException {
            if (failing) {
                throw new IOException("broken pipe");
            }
            received.add(message);
        }

        @Override
        public void close() {
            closed = true;
            open = false;
        }
    }

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        channel = new BroadcastChannel(new ObjectMapper(), new CodewardenMetrics(registry));
    }

    @Test
    @DisplayName("publish delivers the same JSON to every subscriber")
    void publishToAll() {
        var a = new FakeClient("a");
        var b = new FakeClient("b");
        channel.subscribe(a);
        channel.subscribe(b);

        int delivered = channel.publish(Map.of("type", "realtime_analysis"));

        assertEquals(2, delivered);
        assertEquals(List.of("{\"type\":\"realtime_analysis\"}"), a.received);
        assertEquals(a.received, b.received);
        assertEquals(2.0, registry.get("codewarden.broadcast.messages").tag("outcome", "delivered").counter().count());
    }

    @Test
    @DisplayName("publish with no subscribers is a no-op")
    void noSubscribers() {
        assertEquals(0, channel.publish(Map.of("type", "x")));
    }

    @Test
    @DisplayName("closed and failing subscribers are dropped without affecting others")
    void dropsBrokenSubscribers() {
        var healthy = new FakeClient("healthy");
        var closed = new FakeClient("closed");
        var failing = new FakeClient("failing");
        closed.open = false;
        failing.failing = true;
        channel.subscribe(closed);
        channel.subscribe(failing);
        channel.subscribe(healthy);

        assertEquals(1, channel.publish(Map.of("n", 1)));
        assertEquals(1, channel.subscriberCount());
        assertEquals(1, healthy.received.size());
        assertEquals(2.0, registry.get("codewarden.broadcast.messages").tag("outcome", "dropped").counter().count());

        assertEquals(1, channel.publish(Map.of("n", 2)));
        assertEquals(2, healthy.received.size());
    }

    @Test
    @DisplayName("unsubscribed clients receive nothing")
    void unsubscribe() {
        var client = new FakeClient("a");
        var subscription = channel.subscribe(client);
        subscription.unsubscribe();
        subscription.unsubscribe();

        assertEquals(0, channel.publish(Map.of("n", 1)));
        assertTrue(client.received.isEmpty());
        assertEquals(0, channel.subscriberCount());
    }

    @Test
    @DisplayName("closeAll closes every subscriber")
    void closeAll() {
        var a = new FakeClient("a");
        var b = new FakeClient("b");
        channel.subscribe(a);
        channel.subscribe(b);

        channel.closeAll();
        channel.closeAll();

        assertTrue(a.closed);
        assertTrue(b.closed);
        assertEquals(0, channel.subscriberCount());
    }
}
