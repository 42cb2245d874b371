package com.rugradar.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Decoded authority slot. {@code holder} is present only when the status is {@link AuthorityStatus#ACTIVE}.
 */
public record AuthorityField(AuthorityStatus status, String holder) {

    private static final AuthorityField REVOKED = new AuthorityField(AuthorityStatus.REVOKED, null);
    private static final AuthorityField UNDETERMINED = new AuthorityField(AuthorityStatus.UNDETERMINED, null);

    public AuthorityField {
        Objects.requireNonNull(status, "status");
        if (status == AuthorityStatus.ACTIVE && (holder == null || holder.isBlank())) {
            throw new IllegalArgumentException("ACTIVE authority requires a holder address");
        }
        if (status != AuthorityStatus.ACTIVE) {
            holder = null;
        }
    }

    public static AuthorityField revoked() {
        return REVOKED;
    }

    public static AuthorityField undetermined() {
        return UNDETERMINED;
    }

    public static AuthorityField active(String holder) {
        return new AuthorityField(AuthorityStatus.ACTIVE, holder);
    }

    public boolean isRevoked() {
        return status == AuthorityStatus.REVOKED;
    }

    public Optional<String> holderAddress() {
        return Optional.ofNullable(holder);
    }
}
