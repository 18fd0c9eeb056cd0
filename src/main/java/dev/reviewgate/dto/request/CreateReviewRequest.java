package dev.reviewgate.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Description, graph and account may be left empty while drafting; they are required to submit. */
public record CreateReviewRequest(
        @NotBlank @Size(max = 255) String title,
        @Size(max = 4000) String description,
        @Size(max = 255) String graphName,
        @Size(max = 255) String accountName) {}
