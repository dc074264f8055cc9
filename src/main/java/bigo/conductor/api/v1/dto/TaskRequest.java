package bigo.conductor.api.v1.dto;

import bigo.conductor.model.Tier;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for running, previewing or classifying a task.
 * POST /api/v1/tasks, /api/v1/tasks/dry-run, /api/v1/classify
 *
 * @param tier optional operator override: tier name ("critical") or level ("4", "T4")
 */
public record TaskRequest(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("tier") String tier) {

    static final int MAX_TITLE_LENGTH = 1024;

    /** Validate the request */
    public void validate() {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        forcedTier();
    }

    /** Parsed override, null when none was given. */
    @JsonIgnore
    public Tier forcedTier() {
        return tier == null || tier.isBlank() ? null : Tier.parse(tier);
    }

    public String descriptionOrEmpty() {
        return description != null ? description : "";
    }
}
