package dev.reviewgate.domain.enums;

public enum Role {
    ADMIN, MEMBER
}
