package com.rugradar.domain;

import java.util.Objects;

/**
 * A launch correlated to its transaction: who created it and which mint it produced.
 */
public record ResolvedLaunch(String signature, String creator, String mint) {

    public ResolvedLaunch {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(mint, "mint");
    }
}
