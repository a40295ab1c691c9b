package com.gamevault.game_library.library;

import com.gamevault.game_library.library.exception.ConcurrentTransitionException;
import com.gamevault.game_library.library.exception.LibraryStorageException;
import com.gamevault.game_library.library.exception.LibraryTransitionException;
import com.gamevault.game_library.observability.CorrelationContext;
import com.gamevault.game_library.observability.LibraryMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for library mutations.
 *
 * Wraps {@link TransitionEnforcer} so that every attempt runs in its own
 * transaction. Lock timeouts, deadlocks and lost insert races become
 * {@link ConcurrentTransitionException} and are retried with exponential
 * backoff; a retry re-reads the pair and validates against whatever the
 * winning transaction committed. Any other data access failure becomes
 * {@link LibraryStorageException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LibraryTransitionService {

    private final TransitionEnforcer transitionEnforcer;
    private final LibraryMetrics libraryMetrics;

    /**
     * Moves a (user, game) pair into {@code target}, retrying on concurrent modification.
     */
    @Retryable(
        retryFor = ConcurrentTransitionException.class,
        maxAttemptsExpression = "${library.transition.retry.max-attempts:3}",
        backoff = @Backoff(
            delayExpression = "${library.transition.retry.initial-delay-ms:50}",
            multiplierExpression = "${library.transition.retry.multiplier:2.0}",
            maxDelayExpression = "${library.transition.retry.max-delay-ms:1000}"
        )
    )
    public TransitionResult transition(UUID userId, long gameId, LibraryCategory target,
                                       EntryMetadata metadata) {
        return execute(userId, gameId, target, "transition",
            () -> transitionEnforcer.transition(userId, gameId, target, metadata));
    }

    /**
     * Removes a wishlist or collection entry, retrying on concurrent modification.
     */
    @Retryable(
        retryFor = ConcurrentTransitionException.class,
        maxAttemptsExpression = "${library.transition.retry.max-attempts:3}",
        backoff = @Backoff(
            delayExpression = "${library.transition.retry.initial-delay-ms:50}",
            multiplierExpression = "${library.transition.retry.multiplier:2.0}",
            maxDelayExpression = "${library.transition.retry.max-delay-ms:1000}"
        )
    )
    public TransitionResult remove(UUID userId, long gameId) {
        return execute(userId, gameId, null, "remove",
            () -> transitionEnforcer.remove(userId, gameId));
    }

    private TransitionResult execute(UUID userId, long gameId, LibraryCategory target,
                                     String operation, Supplier<TransitionResult> attempt) {
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, String.valueOf(userId));
        MDC.put(CorrelationContext.GAME_ID_MDC_KEY, String.valueOf(gameId));
        Timer.Sample sample = libraryMetrics.startTimer();

        log.info("Library {} requested: target={}", operation,
            target != null ? target.getValue() : "untracked");
        try {
            TransitionResult result = attempt.get();
            if (result.wasChanged()) {
                libraryMetrics.recordApplied(result.getFromCategory(), result.getToCategory());
                log.info("Library {} applied: {} -> {}", operation,
                    label(result.getFromCategory()), label(result.getToCategory()));
            } else {
                libraryMetrics.recordUnchanged(result.getToCategory());
                log.info("Library {} unchanged: already {}", operation, label(result.getToCategory()));
            }
            return result;

        } catch (DuplicateKeyException | PessimisticLockingFailureException e) {
            // CannotAcquireLockException (lock_timeout) is a PessimisticLockingFailureException
            libraryMetrics.recordRetry();
            log.warn("Concurrent modification during library {}: {}", operation,
                e instanceof CannotAcquireLockException ? "lock wait timed out" : e.getClass().getSimpleName());
            throw new ConcurrentTransitionException(userId, gameId, target, e);

        } catch (DataAccessException e) {
            libraryMetrics.recordRejected("storage");
            log.error("Storage failure during library {}", operation, e);
            throw new LibraryStorageException(userId, gameId, target, e);

        } catch (LibraryTransitionException e) {
            libraryMetrics.recordRejected(e.getClass().getSimpleName());
            log.info("Library {} rejected: {}", operation, e.getMessage());
            throw e;

        } finally {
            libraryMetrics.stopTimer(sample);
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.GAME_ID_MDC_KEY);
        }
    }

    private static String label(LibraryCategory category) {
        return category != null ? category.getValue() : "untracked";
    }
}
