package com.spinbet.ledgersync.modules.chains.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Hands domain events to the application event bus once their transaction has committed.
 * A failing listener is logged per event and does not affect the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostCommitPublisher {

    private final ApplicationEventPublisher eventPublisher;

    /**
     * @return number of events delivered without error
     */
    public int publish(List<Object> events) {
        if (events == null || events.isEmpty()) {
            return 0;
        }
        int published = 0;
        for (Object event : events) {
            try {
                eventPublisher.publishEvent(event);
                published++;
            } catch (RuntimeException e) {
                log.error("Failed to publish {} after commit: {}", event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        return published;
    }
}
