package dev.reviewgate.infrastructure.kantata;

public record CustomFieldValue(String id, String value) {}
