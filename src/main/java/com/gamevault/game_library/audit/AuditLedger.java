package com.gamevault.game_library.audit;

import com.gamevault.game_library.library.LibraryCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Append-only ledger of library transitions ({@code library_audit_log}).
 *
 * This service enforces the core invariants:
 * 1. Entries are only ever inserted; no update or delete is exposed
 *    (a database trigger rejects both as well)
 * 2. An entry is written in the same transaction as the library mutation it documents,
 *    so a rollback removes both
 * 3. The id sequence gives a total order of entries per (user, game)
 */
@Service
@Slf4j
public class AuditLedger {

    private final JdbcTemplate jdbcTemplate;

    public AuditLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends one transition record within the caller's transaction.
     *
     * IMPORTANT: MANDATORY propagation. Calling this outside a transaction fails,
     * which prevents audit entries for transitions that never committed.
     *
     * @param userId Owner of the entry
     * @param gameId Catalog game ID
     * @param from Category before the transition, null if untracked
     * @param to Category after the transition, null if removed
     * @param reason Derived transition label
     * @return The stored entry with its assigned id
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry append(UUID userId, long gameId, LibraryCategory from,
                             LibraryCategory to, TransitionReason reason) {
        if (from == null && to == null) {
            throw new IllegalArgumentException("An audit entry must have a from or a to category");
        }
        if (from != null && from == to) {
            throw new IllegalArgumentException("Self transitions are not audited: " + from.getValue());
        }

        // clock_timestamp() is the insert time, taken after any row-lock wait
        AuditEntry entry = jdbcTemplate.queryForObject(
            "INSERT INTO library_audit_log (user_id, game_id, from_category, to_category, reason, created_at) " +
            "VALUES (?, ?, ?, ?, ?, clock_timestamp()) " +
            "RETURNING id, user_id, game_id, from_category, to_category, reason, created_at",
            auditEntryRowMapper(),
            userId,
            gameId,
            from != null ? from.name() : null,
            to != null ? to.name() : null,
            reason.getLabel()
        );

        log.debug("Appended audit entry {}: {} -> {} ({})", entry.getId(),
            from != null ? from.getValue() : "untracked",
            to != null ? to.getValue() : "removed",
            reason.getLabel());
        return entry;
    }

    /**
     * Full transition history of one pair, oldest first.
     */
    public List<AuditEntry> history(UUID userId, long gameId) {
        return jdbcTemplate.query(
            "SELECT id, user_id, game_id, from_category, to_category, reason, created_at " +
            "FROM library_audit_log WHERE user_id = ? AND game_id = ? ORDER BY id",
            auditEntryRowMapper(),
            userId,
            gameId
        );
    }

    /**
     * Number of entries recorded for one pair.
     */
    public long count(UUID userId, long gameId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM library_audit_log WHERE user_id = ? AND game_id = ?",
            Long.class,
            userId,
            gameId
        );
        return count != null ? count : 0L;
    }

    private RowMapper<AuditEntry> auditEntryRowMapper() {
        return (rs, rowNum) -> new AuditEntry(
            rs.getLong("id"),
            rs.getObject("user_id", UUID.class),
            rs.getLong("game_id"),
            category(rs.getString("from_category")),
            category(rs.getString("to_category")),
            TransitionReason.fromLabel(rs.getString("reason")),
            rs.getObject("created_at", OffsetDateTime.class).toInstant()
        );
    }

    private static LibraryCategory category(String value) {
        return value != null ? LibraryCategory.valueOf(value) : null;
    }
}
