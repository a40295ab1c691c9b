package com.gamevault.game_library.library.exception;

import com.gamevault.game_library.library.LibraryCategory;

import java.util.UUID;

/**
 * Thrown when a transition would move a started or completed game back to an
 * earlier category (or remove it). Progression is forward-only, so this is never retried.
 */
public class AlreadyAdvancedException extends LibraryTransitionException {

    public AlreadyAdvancedException(UUID userId, long gameId,
                                    LibraryCategory currentCategory,
                                    LibraryCategory requestedCategory) {
        super(String.format("Game %d is already %s and cannot be moved to %s",
                gameId, label(currentCategory),
                requestedCategory != null ? requestedCategory.getValue() : "removed"),
            userId, gameId, currentCategory, requestedCategory, null);
    }
}
