package io.b2mash.lms.user.dto;

public record UpdatePreferencesRequest(
    Boolean email, Boolean sms, Boolean push, Boolean marketingOptIn) {}
