package dev.reviewgate.domain.entity;

import dev.reviewgate.domain.enums.ReviewStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores statuses by label so the column matches the CHECK constraint in V1. */
@Converter(autoApply = true)
public class ReviewStatusConverter implements AttributeConverter<ReviewStatus, String> {

    @Override
    public String convertToDatabaseColumn(ReviewStatus status) {
        return status == null ? null : status.label();
    }

    @Override
    public ReviewStatus convertToEntityAttribute(String label) {
        return label == null ? null : ReviewStatus.fromLabel(label);
    }
}
