package com.bbthechange.roomsync.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Request DTO for moving a room to an entity's new slug.
 */
@Data
public class ChangeSlugRequest {

    @NotBlank(message = "New slug is required")
    @Pattern(regexp = "[a-z0-9](?:[a-z0-9._-]*[a-z0-9._])?", message = "Invalid slug format")
    private String newSlug;

    public ChangeSlugRequest() {}

    public ChangeSlugRequest(String newSlug) {
        this.newSlug = newSlug;
    }
}
