package com.gamevault.game_library.library.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gamevault.game_library.library.LibraryCategory;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry counts per category for one user, keyed by the lowercase category name.
 */
@Value
public class LibrarySummaryResponse {

    @JsonProperty("counts")
    Map<String, Long> counts;

    @JsonProperty("total")
    long total;

    public static LibrarySummaryResponse from(Map<LibraryCategory, Long> counts) {
        Map<String, Long> byName = new LinkedHashMap<>();
        long total = 0;
        for (LibraryCategory category : LibraryCategory.values()) {
            long count = counts.getOrDefault(category, 0L);
            byName.put(category.getValue(), count);
            total += count;
        }
        return new LibrarySummaryResponse(byName, total);
    }
}
