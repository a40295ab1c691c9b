package com.gamevault.game_library.library.exception;

import com.gamevault.game_library.library.LibraryCategory;
import lombok.Getter;

import java.util.UUID;

/**
 * Base type for every rejected library transition.
 *
 * Carries the pair and both categories so callers can explain why the
 * mutation did not happen. A null category means "untracked" (or removal
 * when it is the requested one).
 */
@Getter
public abstract class LibraryTransitionException extends RuntimeException {

    private final UUID userId;
    private final long gameId;
    private final LibraryCategory currentCategory;
    private final LibraryCategory requestedCategory;

    protected LibraryTransitionException(String message, UUID userId, long gameId,
                                         LibraryCategory currentCategory,
                                         LibraryCategory requestedCategory,
                                         Throwable cause) {
        super(message, cause);
        this.userId = userId;
        this.gameId = gameId;
        this.currentCategory = currentCategory;
        this.requestedCategory = requestedCategory;
    }

    /**
     * Whether the same request may succeed if simply sent again.
     */
    public boolean isRetryable() {
        return false;
    }

    protected static String label(LibraryCategory category) {
        return category != null ? category.getValue() : "untracked";
    }
}
