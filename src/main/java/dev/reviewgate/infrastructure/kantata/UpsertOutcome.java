package dev.reviewgate.infrastructure.kantata;

public enum UpsertOutcome {
    CREATED, UPDATED
}
