package com.gamevault.game_library.library;

import com.gamevault.game_library.audit.AuditEntry;
import com.gamevault.game_library.audit.AuditLedger;
import com.gamevault.game_library.audit.TransitionReason;
import com.gamevault.game_library.catalog.GameCatalog;
import com.gamevault.game_library.library.event.LibraryTransitionEvent;
import com.gamevault.game_library.library.exception.AlreadyAdvancedException;
import com.gamevault.game_library.library.exception.GameNotFoundException;
import com.gamevault.game_library.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies library transitions atomically.
 *
 * Each call is one transaction that:
 * 1. Locks the pair's row (a missing row is guarded by the primary key instead)
 * 2. Validates the move against the current category
 * 3. Replaces the row, appends one audit entry and writes one outbox event
 *
 * Either all of these commit or none do. Lock and duplicate-key failures
 * propagate as Spring {@code DataAccessException}s; {@link LibraryTransitionService}
 * maps and retries them.
 */
@Service
@Slf4j
public class TransitionEnforcer {

    private final LibraryStore libraryStore;
    private final AuditLedger auditLedger;
    private final GameCatalog gameCatalog;
    private final OutboxService outboxService;
    private final long lockTimeoutMs;

    public TransitionEnforcer(LibraryStore libraryStore,
                              AuditLedger auditLedger,
                              GameCatalog gameCatalog,
                              OutboxService outboxService,
                              @Value("${library.transition.lock-timeout-ms:2000}") long lockTimeoutMs) {
        this.libraryStore = libraryStore;
        this.auditLedger = auditLedger;
        this.gameCatalog = gameCatalog;
        this.outboxService = outboxService;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Moves a (user, game) pair into {@code target}.
     *
     * A request for the category the pair already holds is a no-op: the supplied
     * metadata is ignored and nothing is written.
     *
     * @param userId Owner of the library
     * @param gameId Catalog game ID
     * @param target Category to move into
     * @param metadata Category-specific details, may be null
     * @return Applied or unchanged result with the resulting entry
     * @throws GameNotFoundException if the pair is untracked and the catalog does not know the game
     * @throws AlreadyAdvancedException if the move would regress a started or completed game
     * @throws IllegalArgumentException if the request or metadata is invalid
     */
    @Transactional
    public TransitionResult transition(UUID userId, long gameId, LibraryCategory target,
                                       EntryMetadata metadata) {
        requireIds(userId, gameId);
        if (target == null) {
            throw new IllegalArgumentException("Target category is required");
        }

        libraryStore.applyLockTimeout(lockTimeoutMs);
        Optional<LibraryEntry> existing = libraryStore.findForUpdate(userId, gameId);
        LibraryCategory current = existing.map(LibraryEntry::getCategory).orElse(null);

        if (current == target) {
            log.debug("Pair already in {}, nothing to do", target.getValue());
            return TransitionResult.unchanged(existing.get());
        }
        if (current == null && !gameCatalog.exists(gameId)) {
            throw new GameNotFoundException(userId, gameId, target);
        }

        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        EntryMetadata details = metadata != null ? metadata.withMicrosecondPrecision() : null;
        LibraryEntry next = LibraryEntry.enter(userId, gameId, existing.orElse(null), target, details, now);

        if (current == null) {
            libraryStore.put(next);
        } else if (!libraryStore.replace(current, next)) {
            throw new IllegalStateException("Locked library entry changed underneath transition");
        }

        AuditEntry audit = auditLedger.append(userId, gameId, current, target,
            TransitionReason.of(current, target));
        outboxService.saveLibraryEvent(LibraryTransitionEvent.fromAuditEntry(audit));

        log.debug("Transition applied: {} -> {}, auditId={}",
            current != null ? current.getValue() : "untracked", target.getValue(), audit.getId());
        return TransitionResult.applied(next, current);
    }

    /**
     * Removes a wishlist or collection entry, returning the pair to untracked.
     *
     * Removing an untracked pair is a no-op.
     *
     * @throws AlreadyAdvancedException if the pair is started or completed
     */
    @Transactional
    public TransitionResult remove(UUID userId, long gameId) {
        requireIds(userId, gameId);

        libraryStore.applyLockTimeout(lockTimeoutMs);
        Optional<LibraryEntry> existing = libraryStore.findForUpdate(userId, gameId);
        if (existing.isEmpty()) {
            log.debug("Pair is untracked, nothing to remove");
            return TransitionResult.unchanged(null);
        }

        LibraryEntry entry = existing.get();
        LibraryCategory current = entry.getCategory();
        if (!entry.isRemovable()) {
            throw new AlreadyAdvancedException(userId, gameId, current, null);
        }

        libraryStore.remove(userId, gameId, current);
        AuditEntry audit = auditLedger.append(userId, gameId, current, null, TransitionReason.REMOVED);
        outboxService.saveLibraryEvent(LibraryTransitionEvent.fromAuditEntry(audit));

        log.debug("Entry removed from {}, auditId={}", current.getValue(), audit.getId());
        return TransitionResult.applied(null, current);
    }

    private static void requireIds(UUID userId, long gameId) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        if (gameId <= 0) {
            throw new IllegalArgumentException("Game ID must be positive, got " + gameId);
        }
    }
}
