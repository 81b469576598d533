package io.b2mash.lms.user.dto;

import jakarta.validation.constraints.Size;
import java.util.Map;

/** Null fields are left unchanged. */
public record UpdateProfileRequest(
    @Size(max = 100) String firstName,
    @Size(max = 100) String lastName,
    @Size(max = 40) String phoneNumber,
    @Size(max = 500) String avatarUrl,
    @Size(max = 150) String jobTitle,
    @Size(max = 2000) String bio,
    @Size(max = 64) String timezone,
    @Size(max = 16) String locale,
    Map<String, String> socialLinks) {}
