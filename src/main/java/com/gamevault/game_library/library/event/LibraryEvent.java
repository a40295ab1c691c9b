package com.gamevault.game_library.library.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for library events published through the outbox.
 *
 * All library events share these common properties:
 * - Event ID for deduplication
 * - The (user, game) pair they are about
 * - Timestamp of when the event occurred
 */
public interface LibraryEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    UUID getUserId();

    long getGameId();

    /**
     * When this event occurred.
     */
    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();

    /**
     * Partition key: all events of one pair go to the same partition, in order.
     */
    static String aggregateKey(UUID userId, long gameId) {
        return userId + ":" + gameId;
    }
}
