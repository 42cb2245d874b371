package com.rugradar.domain;

/**
 * State of one authority slot in a mint account.
 */
public enum AuthorityStatus {
    /** Slot holds the all-zero default address. */
    REVOKED,
    /** Slot holds a real address. */
    ACTIVE,
    /** Account data too short to contain the slot. */
    UNDETERMINED
}
