package com.gamevault.game_library.library.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gamevault.game_library.library.LibraryCategory;
import com.gamevault.game_library.library.LibraryEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One library entry. Fields that do not apply to the category are omitted.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LibraryEntryResponse {

    @JsonProperty("game_id")
    long gameId;

    @JsonProperty("category")
    LibraryCategory category;

    @JsonProperty("priority")
    Integer priority;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("added_at")
    Instant addedAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static LibraryEntryResponse from(LibraryEntry entry) {
        if (entry == null) {
            return null;
        }
        return LibraryEntryResponse.builder()
            .gameId(entry.getGameId())
            .category(entry.getCategory())
            .priority(entry.getPriority())
            .notes(entry.getNotes())
            .startedAt(entry.getStartedAt())
            .completedAt(entry.getCompletedAt())
            .addedAt(entry.getAddedAt())
            .updatedAt(entry.getUpdatedAt())
            .build();
    }
}
