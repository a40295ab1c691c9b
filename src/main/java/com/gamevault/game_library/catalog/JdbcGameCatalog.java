package com.gamevault.game_library.catalog;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Game catalog backed by the {@code games} table, which the catalog sync keeps populated.
 */
@Service
public class JdbcGameCatalog implements GameCatalog {

    private final JdbcTemplate jdbcTemplate;

    public JdbcGameCatalog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean exists(long gameId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM games WHERE id = ?",
            Integer.class,
            gameId
        );
        return count != null && count > 0;
    }

    /**
     * Registers a game in the catalog projection. Used for seeding and tests;
     * re-registering an existing game keeps the stored title.
     */
    public void register(long gameId, String title) {
        jdbcTemplate.update(
            "INSERT INTO games (id, title, created_at) VALUES (?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (id) DO NOTHING",
            gameId,
            title
        );
    }
}
