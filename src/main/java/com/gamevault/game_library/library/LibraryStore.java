package com.gamevault.game_library.library;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent current category per (user, game), stored in {@code library_entries}.
 *
 * This is a plain table abstraction: it does not know the transition rules.
 * Mutations must run inside the caller's transaction (MANDATORY propagation);
 * the store never commits on its own. The primary key on (user_id, game_id)
 * turns a lost insert race into a duplicate-key error for the caller to handle.
 */
@Repository
@Slf4j
public class LibraryStore {

    private static final String COLUMNS =
        "user_id, game_id, category, priority, notes, started_at, completed_at, added_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public LibraryStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Reads the current entry without locking.
     */
    public Optional<LibraryEntry> find(UUID userId, long gameId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM library_entries WHERE user_id = ? AND game_id = ?",
            entryRowMapper(),
            userId,
            gameId
        ).stream().findFirst();
    }

    /**
     * Reads the current entry and locks its row until the surrounding transaction ends.
     * Concurrent callers for the same pair block here and then see the committed result.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<LibraryEntry> findForUpdate(UUID userId, long gameId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM library_entries WHERE user_id = ? AND game_id = ? FOR UPDATE",
            entryRowMapper(),
            userId,
            gameId
        ).stream().findFirst();
    }

    /**
     * Bounds how long row locks are waited for in the current transaction.
     * A wait beyond this fails with a lock-acquisition error instead of hanging.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyLockTimeout(long lockTimeoutMs) {
        jdbcTemplate.queryForObject(
            "SELECT set_config('lock_timeout', ?, true)",
            String.class,
            lockTimeoutMs + "ms"
        );
    }

    /**
     * Inserts the row for the entry's category.
     * Fails with a duplicate-key error if the pair already has a row.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void put(LibraryEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO library_entries (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entry.getUserId(),
            entry.getGameId(),
            entry.getCategory().name(),
            entry.getPriority(),
            entry.getNotes(),
            toTimestamp(entry.getStartedAt()),
            toTimestamp(entry.getCompletedAt()),
            toTimestamp(entry.getAddedAt()),
            toTimestamp(entry.getUpdatedAt())
        );
        log.debug("Stored library entry: category={}", entry.getCategory());
    }

    /**
     * Overwrites the pair's row in place, moving it out of {@code previous}.
     * The row keeps its identity, so transactions waiting on its lock read the new version.
     *
     * @return true if the row was still in {@code previous} and was replaced
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean replace(LibraryCategory previous, LibraryEntry entry) {
        int updated = jdbcTemplate.update(
            "UPDATE library_entries SET category = ?, priority = ?, notes = ?, started_at = ?, " +
            "completed_at = ?, added_at = ?, updated_at = ? " +
            "WHERE user_id = ? AND game_id = ? AND category = ?",
            entry.getCategory().name(),
            entry.getPriority(),
            entry.getNotes(),
            toTimestamp(entry.getStartedAt()),
            toTimestamp(entry.getCompletedAt()),
            toTimestamp(entry.getAddedAt()),
            toTimestamp(entry.getUpdatedAt()),
            entry.getUserId(),
            entry.getGameId(),
            previous.name()
        );
        log.debug("Replaced library entry: {} -> {}", previous, entry.getCategory());
        return updated > 0;
    }

    /**
     * Deletes the pair's row if it is in the given category.
     *
     * @return true if a row was deleted
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean remove(UUID userId, long gameId, LibraryCategory category) {
        int deleted = jdbcTemplate.update(
            "DELETE FROM library_entries WHERE user_id = ? AND game_id = ? AND category = ?",
            userId,
            gameId,
            category.name()
        );
        return deleted > 0;
    }

    /**
     * Lists a user's entries in one category, in the order the library UI shows them.
     */
    public List<LibraryEntry> findByCategory(UUID userId, LibraryCategory category) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM library_entries WHERE user_id = ? AND category = ? " +
            orderClause(category),
            entryRowMapper(),
            userId,
            category.name()
        );
    }

    /**
     * Counts a user's entries per category. Categories with no entries map to zero.
     */
    public Map<LibraryCategory, Long> countByCategory(UUID userId) {
        Map<LibraryCategory, Long> counts = new EnumMap<>(LibraryCategory.class);
        for (LibraryCategory category : LibraryCategory.values()) {
            counts.put(category, 0L);
        }
        jdbcTemplate.query(
            "SELECT category, COUNT(*) AS entries FROM library_entries WHERE user_id = ? GROUP BY category",
            rs -> {
                counts.put(LibraryCategory.valueOf(rs.getString("category")), rs.getLong("entries"));
            },
            userId
        );
        return counts;
    }

    private String orderClause(LibraryCategory category) {
        return switch (category) {
            case WISHLIST -> "ORDER BY priority ASC NULLS LAST, added_at DESC, game_id";
            case COLLECTION -> "ORDER BY added_at DESC, game_id";
            case STARTED -> "ORDER BY started_at DESC, game_id";
            case COMPLETED -> "ORDER BY completed_at DESC, game_id";
        };
    }

    private RowMapper<LibraryEntry> entryRowMapper() {
        return (rs, rowNum) -> new LibraryEntry(
            rs.getObject("user_id", UUID.class),
            rs.getLong("game_id"),
            LibraryCategory.valueOf(rs.getString("category")),
            (Integer) rs.getObject("priority"),
            rs.getString("notes"),
            toInstant(rs, "started_at"),
            toInstant(rs, "completed_at"),
            toInstant(rs, "added_at"),
            toInstant(rs, "updated_at")
        );
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }
}
