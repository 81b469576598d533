package io.b2mash.lms.cms.dto;

import java.time.Instant;

public record PublishCmsContentRequest(Instant publishAt) {}
