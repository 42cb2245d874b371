package com.rugradar.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Mint and freeze authority slots decoded from a mint account's raw bytes.
 */
public record MintAuthorityState(AuthorityField mintAuthority, AuthorityField freezeAuthority) {

    public MintAuthorityState {
        Objects.requireNonNull(mintAuthority, "mintAuthority");
        Objects.requireNonNull(freezeAuthority, "freezeAuthority");
    }

    public boolean mintAuthorityRevoked() {
        return mintAuthority.isRevoked();
    }

    public boolean freezeAuthorityRevoked() {
        return freezeAuthority.isRevoked();
    }

    public Optional<String> mintAuthorityHolder() {
        return mintAuthority.holderAddress();
    }

    public Optional<String> freezeAuthorityHolder() {
        return freezeAuthority.holderAddress();
    }
}
