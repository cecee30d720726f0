package com.lpzapper.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.lpzapper.config.CaffeineConfig;
import com.lpzapper.session.config.WatcherProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;

/**
 * Per-session Reactor sink of position updates, exposed as a stream for Server-Sent Events.
 * A new subscriber first receives the latest update. The stream completes when the session's watch ends or the
 * session stays idle past the configured timeout.
 */
@Component
@Slf4j
public class SessionUpdateHub implements PositionUpdateListener {

    private final Cache<String, Sinks.Many<PositionUpdate>> sinks;

    public SessionUpdateHub(WatcherProperties watcherProperties, Clock clock) {
        this.sinks = CaffeineConfig.sessionScoped(Duration.ofMillis(watcherProperties.getSessionIdleTimeoutMs()), clock,
                (sessionId, sink, cause) -> {
                    if (sink != null) {
                        synchronized (sink) {
                            sink.tryEmitComplete();
                        }
                        log.debug("Closed update stream of session {} ({})", sessionId, cause);
                    }
                });
    }

    @Override
    public void onUpdate(PositionUpdate update) {
        Sinks.Many<PositionUpdate> sink = sink(update.sessionId());
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(update);
        }
        if (result.isFailure()) {
            log.debug("Dropped {} update for session {}: {}", update.kind(), update.sessionId(), result);
        }
    }

    @Override
    public void onWatchEnded(String sessionId) {
        sinks.invalidate(sessionId);
    }

    public Flux<PositionUpdate> updates(String sessionId) {
        return sink(sessionId).asFlux();
    }

    long openStreams() {
        sinks.cleanUp();
        return sinks.estimatedSize();
    }

    private Sinks.Many<PositionUpdate> sink(String sessionId) {
        return sinks.get(sessionId, id -> Sinks.many().replay().latest());
    }
}
