package com.bbthechange.roomsync.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChangeRoleRequest {

    @NotBlank(message = "Role is required")
    private String role;

    public ChangeRoleRequest() {}

    public ChangeRoleRequest(String role) {
        this.role = role;
    }
}
