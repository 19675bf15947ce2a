package com.bbthechange.roomsync.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Request DTO for bringing a member into an entity's chat room.
 */
@Data
public class AddChatMemberRequest {

    @NotBlank(message = "User slug is required")
    @Pattern(regexp = "[a-z0-9](?:[a-z0-9._-]*[a-z0-9._])?", message = "Invalid user slug format")
    private String userSlug;

    /**
     * Optional; omitted keeps the member's current role.
     */
    private String role;

    public AddChatMemberRequest() {}

    public AddChatMemberRequest(String userSlug, String role) {
        this.userSlug = userSlug;
        this.role = role;
    }
}
