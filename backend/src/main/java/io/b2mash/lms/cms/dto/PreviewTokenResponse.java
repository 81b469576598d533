package io.b2mash.lms.cms.dto;

public record PreviewTokenResponse(String previewToken) {}
