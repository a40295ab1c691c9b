package com.gamevault.game_library.library.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gamevault.game_library.library.EntryMetadata;
import com.gamevault.game_library.library.LibraryCategory;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request body for moving a game into a library category.
 *
 * Only the fields that apply to the target category are used:
 * priority and notes for wishlist, started_at and completed_at for started / completed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransitionRequest {

    @NotNull(message = "Category is required")
    @JsonProperty("category")
    private LibraryCategory category;

    @Min(value = 1, message = "Priority must be at least 1")
    @JsonProperty("priority")
    private Integer priority;

    @Size(max = EntryMetadata.MAX_NOTES_LENGTH, message = "Notes must be at most 1000 characters")
    @JsonProperty("notes")
    private String notes;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    public EntryMetadata toMetadata() {
        return EntryMetadata.builder()
            .priority(priority)
            .notes(notes)
            .startedAt(startedAt)
            .completedAt(completedAt)
            .build();
    }
}
