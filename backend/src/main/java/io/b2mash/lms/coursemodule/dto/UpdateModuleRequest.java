package io.b2mash.lms.coursemodule.dto;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record UpdateModuleRequest(
    @Size(min = 1, max = 300) String title, String description, @PositiveOrZero Integer ordering) {}
