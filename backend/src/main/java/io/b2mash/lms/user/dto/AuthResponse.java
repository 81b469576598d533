package io.b2mash.lms.user.dto;

import io.b2mash.lms.security.TokenPair;

public record AuthResponse(UserResponse user, TokenPair tokens) {}
