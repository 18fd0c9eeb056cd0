package dev.reviewgate.exception;

public enum GuardError {
    ILLEGAL_TRANSITION, FORBIDDEN, INCOMPLETE_ENTITY
}
