package com.gamevault.game_library.library.exception;

import com.gamevault.game_library.library.LibraryCategory;

import java.util.UUID;

/**
 * Thrown when another transaction held or won the pair while this transition was running:
 * a lock wait timed out, or a racing insert claimed the (user, game) key first.
 *
 * The transition service retries these with backoff; callers only see it once retries are exhausted.
 */
public class ConcurrentTransitionException extends LibraryTransitionException {

    public ConcurrentTransitionException(UUID userId, long gameId,
                                         LibraryCategory requestedCategory,
                                         Throwable cause) {
        super(String.format("Concurrent modification of library entry for game %d", gameId),
            userId, gameId, null, requestedCategory, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
