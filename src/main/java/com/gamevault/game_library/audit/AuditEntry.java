package com.gamevault.game_library.audit;

import com.gamevault.game_library.library.LibraryCategory;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One applied library transition, as recorded in the audit ledger.
 *
 * Key invariant: entries are write-once; id order is commit order per (user, game).
 * A null fromCategory means the pair was untracked; a null toCategory means it was removed.
 */
@Value
public class AuditEntry {
    long id;
    UUID userId;
    long gameId;
    LibraryCategory fromCategory;
    LibraryCategory toCategory;
    TransitionReason reason;
    Instant createdAt;
}
