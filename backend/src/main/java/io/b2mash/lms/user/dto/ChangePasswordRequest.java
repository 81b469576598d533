package io.b2mash.lms.user.dto;

import jakarta.validation.constraints.NotBlank;

public record ChangePasswordRequest(
    @NotBlank(message = "currentPassword is required") String currentPassword,
    @NotBlank(message = "newPassword is required") String newPassword) {}
