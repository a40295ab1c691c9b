package com.gamevault.game_library.library.event;

import com.gamevault.game_library.audit.AuditEntry;
import com.gamevault.game_library.library.LibraryCategory;
import com.gamevault.game_library.observability.CorrelationContext;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a library pair changes category or is removed.
 *
 * Activity feeds, analytics and achievements consume these; they never write
 * back to the library. The audit entry id lets consumers line events up with the ledger,
 * and the correlation id with the request that caused them.
 */
@Value
public class LibraryTransitionEvent implements LibraryEvent {
    UUID eventId;
    UUID userId;
    long gameId;
    LibraryCategory fromCategory;
    LibraryCategory toCategory;
    String reason;
    long auditEntryId;
    Instant occurredAt;
    String correlationId;

    public static final String TRANSITIONED = "LibraryTransitioned";
    public static final String REMOVED = "LibraryEntryRemoved";

    @Override
    public String getEventType() {
        return toCategory != null ? TRANSITIONED : REMOVED;
    }

    /**
     * Creates the event for an applied transition from its audit entry.
     */
    public static LibraryTransitionEvent fromAuditEntry(AuditEntry entry) {
        return new LibraryTransitionEvent(
            UUID.randomUUID(),
            entry.getUserId(),
            entry.getGameId(),
            entry.getFromCategory(),
            entry.getToCategory(),
            entry.getReason().getLabel(),
            entry.getId(),
            entry.getCreatedAt(),
            CorrelationContext.getCorrelationId()
        );
    }
}
