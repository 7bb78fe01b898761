package com.connectfood.backend.modules.telemetry.application;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

import com.connectfood.backend.modules.telemetry.domain.FreshnessReading;
import com.connectfood.backend.modules.telemetry.domain.FreshnessSensorSimulator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Pushes simulated freshness telemetry for one listing per connection at a fixed cadence.
 * The feed is cancelled when the client disconnects or a send fails.
 */
@Component
public class FreshnessFeedHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(FreshnessFeedHandler.class);

    private final TaskScheduler taskScheduler;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration interval;
    private final Map<String, ScheduledFuture<?>> feeds = new ConcurrentHashMap<>();

    public FreshnessFeedHandler(
            @Qualifier("telemetryTaskScheduler") TaskScheduler taskScheduler,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${connectfood.telemetry.interval-ms:1000}") long intervalMillis
    ) {
        this.taskScheduler = taskScheduler;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.interval = Duration.ofMillis(intervalMillis);
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws IOException {
        String listingId = extractListingId(session.getUri());
        if (listingId == null) {
            session.close(CloseStatus.BAD_DATA.withReason("listing id missing"));
            return;
        }

        FreshnessSensorSimulator simulator = newSimulator();
        ScheduledFuture<?> feed = taskScheduler.scheduleAtFixedRate(
                () -> pushReading(session, listingId, simulator),
                interval
        );
        feeds.put(session.getId(), feed);
        log.info("Freshness feed started for listing {} (session {})", listingId, session.getId());
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        cancelFeed(session.getId());
        log.info("Freshness feed closed (session {}, status {})", session.getId(), status.getCode());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.debug("Transport error on freshness feed {}: {}", session.getId(), exception.getMessage());
        cancelFeed(session.getId());
    }

    int activeFeeds() {
        return feeds.size();
    }

    protected FreshnessSensorSimulator newSimulator() {
        return new FreshnessSensorSimulator(new Random());
    }

    void pushReading(WebSocketSession session, String listingId, FreshnessSensorSimulator simulator) {
        if (!session.isOpen()) {
            cancelFeed(session.getId());
            return;
        }
        FreshnessReading reading = simulator.next();
        FreshnessUpdate update = new FreshnessUpdate(
                listingId,
                reading.freshness(),
                reading.temperatureC(),
                reading.humidity(),
                OffsetDateTime.now(clock).toString()
        );
        try {
            String payload = objectMapper.writeValueAsString(update);
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (JsonProcessingException ex) {
            log.error("Could not encode freshness update for listing {}", listingId, ex);
            cancelFeed(session.getId());
        } catch (IOException | IllegalStateException ex) {
            log.debug("Freshness feed {} stopped: {}", session.getId(), ex.getMessage());
            cancelFeed(session.getId());
        }
    }

    private void cancelFeed(String sessionId) {
        ScheduledFuture<?> feed = feeds.remove(sessionId);
        if (feed != null) {
            feed.cancel(false);
        }
    }

    static String extractListingId(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        String candidate = path.substring(path.lastIndexOf('/') + 1).trim();
        return candidate.isEmpty() || candidate.equals("freshness") ? null : candidate;
    }
}
