package io.b2mash.lms.coursemodule.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateModuleRequest(
    @NotBlank(message = "title is required") @Size(max = 300) String title,
    String description,
    @PositiveOrZero Integer ordering) {}
