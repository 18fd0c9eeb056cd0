package dev.reviewgate.reconciliation;

/**
 * CONSISTENT: no drift. CORRECTED: drift found and Kantata reset. CORRECTION_FAILED: drift found,
 * reset failed. UNVERIFIED: Kantata state could not be read, so drift cannot be proven.
 */
public enum ReconciliationOutcome {
    CONSISTENT, CORRECTED, CORRECTION_FAILED, UNVERIFIED
}
