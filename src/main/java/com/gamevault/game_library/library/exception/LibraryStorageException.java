package com.gamevault.game_library.library.exception;

import com.gamevault.game_library.library.LibraryCategory;

import java.util.UUID;

/**
 * Underlying persistence failure while applying a transition. Nothing was committed.
 */
public class LibraryStorageException extends LibraryTransitionException {

    public LibraryStorageException(UUID userId, long gameId,
                                   LibraryCategory requestedCategory,
                                   Throwable cause) {
        super(String.format("Failed to persist library transition for game %d", gameId),
            userId, gameId, null, requestedCategory, cause);
    }
}
