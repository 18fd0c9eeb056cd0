package dev.reviewgate.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LinkProjectRequest(@NotBlank @Size(max = 64) String externalProjectId) {}
