package com.gamevault.game_library.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for outbox events.
 */
@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Finds publishable events in write order, skipping rows another publisher holds.
     *
     * Dead letters (retry count at the limit) are not returned, and neither is any
     * later event of the same aggregate, so a pair's events never overtake each other.
     *
     * @param maxRetries Retry count at which an event becomes a dead letter
     * @param limit Maximum number of events to fetch
     * @return List of publishable events
     */
    @Query(value = """
        SELECT * FROM outbox_events e
        WHERE e.published_at IS NULL
          AND e.retry_count < :maxRetries
          AND NOT EXISTS (
            SELECT 1 FROM outbox_events d
            WHERE d.aggregate_key = e.aggregate_key
              AND d.published_at IS NULL
              AND d.retry_count >= :maxRetries
              AND d.sequence_number < e.sequence_number
          )
        ORDER BY e.sequence_number ASC
        LIMIT :limit
        FOR UPDATE OF e SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findPublishableEventsForUpdate(@Param("maxRetries") int maxRetries,
                                                           @Param("limit") int limit);

    /**
     * Events for one (user, game) pair, oldest first.
     */
    List<OutboxEventEntity> findByAggregateTypeAndAggregateKeyOrderBySequenceNumberAsc(
        String aggregateType, String aggregateKey);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    /**
     * Counts events that have exceeded the retry threshold.
     */
    long countByPublishedAtIsNullAndRetryCountGreaterThanEqual(int retryCount);

    /**
     * Oldest unpublished event's creation timestamp, for lag monitoring.
     */
    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
