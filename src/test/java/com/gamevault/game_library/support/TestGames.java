package com.gamevault.game_library.support;

import com.gamevault.game_library.catalog.JdbcGameCatalog;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Registers throwaway catalog games so tests sharing a database never collide.
 */
public final class TestGames {

    private TestGames() {
    }

    public static long register(JdbcGameCatalog catalog, String title) {
        long gameId = unknownId();
        catalog.register(gameId, title);
        return gameId;
    }

    /**
     * A game ID that is very unlikely to be in the catalog.
     */
    public static long unknownId() {
        return ThreadLocalRandom.current().nextLong(1_000_000L, Long.MAX_VALUE);
    }
}
