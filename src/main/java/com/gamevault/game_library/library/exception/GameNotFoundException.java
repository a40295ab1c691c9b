package com.gamevault.game_library.library.exception;

import com.gamevault.game_library.library.LibraryCategory;

import java.util.UUID;

/**
 * Thrown when an untracked game is added to a library but the catalog does not know it.
 */
public class GameNotFoundException extends LibraryTransitionException {

    public GameNotFoundException(UUID userId, long gameId, LibraryCategory requestedCategory) {
        super("Game not found in catalog: " + gameId,
            userId, gameId, null, requestedCategory, null);
    }
}
