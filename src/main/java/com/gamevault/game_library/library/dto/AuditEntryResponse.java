package com.gamevault.game_library.library.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gamevault.game_library.audit.AuditEntry;
import com.gamevault.game_library.audit.TransitionReason;
import com.gamevault.game_library.library.LibraryCategory;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One audit ledger entry. A null from_category means the game was untracked;
 * a null to_category means it was removed.
 */
@Value
@Builder
public class AuditEntryResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("from_category")
    LibraryCategory fromCategory;

    @JsonProperty("to_category")
    LibraryCategory toCategory;

    @JsonProperty("reason")
    TransitionReason reason;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AuditEntryResponse from(AuditEntry entry) {
        return AuditEntryResponse.builder()
            .id(entry.getId())
            .fromCategory(entry.getFromCategory())
            .toCategory(entry.getToCategory())
            .reason(entry.getReason())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
