package com.gamevault.game_library.catalog;

/**
 * Read-only view of the external game catalog.
 *
 * The library only needs to know whether a game exists before a pair is first tracked.
 */
public interface GameCatalog {

    /**
     * @param gameId Catalog game ID
     * @return true if the catalog knows this game
     */
    boolean exists(long gameId);
}
