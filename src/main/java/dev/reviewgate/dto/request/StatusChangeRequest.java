package dev.reviewgate.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * newStatus is kept as text so an unknown value yields a field-level 400 from the service
 * instead of a generic deserialization error.
 */
public record StatusChangeRequest(@NotBlank(message = "New status is required") String newStatus) {}
