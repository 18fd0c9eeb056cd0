package dev.reviewgate.domain.enums;

/**
 * State of the status value mirrored into the linked Kantata project.
 * NOT_LINKED: no external project. PENDING: push queued. FAILED: last push failed, retried by reconciliation.
 */
public enum SyncState {
    NOT_LINKED, PENDING, SYNCED, FAILED
}
