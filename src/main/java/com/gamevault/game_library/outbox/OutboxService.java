package com.gamevault.game_library.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamevault.game_library.library.event.LibraryEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes library events to the outbox inside the transaction that changed the library.
 *
 * If the library change commits, its event is committed with it; if the change
 * rolls back, so does the event. Publishing to Kafka happens later in
 * {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String LIBRARY_AGGREGATE = "LibraryEntry";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    /**
     * Saves a library event to the outbox within the current transaction.
     *
     * @param event Event to persist; its (user, game) pair becomes the aggregate key
     * @return The saved outbox record
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveLibraryEvent(LibraryEvent event) {
        return saveEvent(LIBRARY_AGGREGATE,
            LibraryEvent.aggregateKey(event.getUserId(), event.getGameId()),
            event.getEventType(),
            event);
    }

    /**
     * Saves an event to the outbox within the current transaction.
     *
     * @param aggregateType Type of the aggregate (e.g., "LibraryEntry")
     * @param aggregateKey Key of the aggregate, also used as the Kafka record key
     * @param eventType Type of the event (e.g., "LibraryTransitioned")
     * @param payload Event payload object (serialized to JSON)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, String aggregateKey,
                                 String eventType, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateKey, eventType, jsonPayload);
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateKey={}", eventType, aggregateKey);
        return saved.toDomain();
    }

    /**
     * Fetches a batch of events ready to publish, skipping rows locked by another publisher.
     * Dead letters, and the events queued behind them for the same pair, are held back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit) {
        return repository.findPublishableEventsForUpdate(maxRetries, limit)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events written for one (user, game) pair, in write order.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForPair(UUID userId, long gameId) {
        return repository.findByAggregateTypeAndAggregateKeyOrderBySequenceNumberAsc(
                LIBRARY_AGGREGATE, LibraryEvent.aggregateKey(userId, gameId))
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
