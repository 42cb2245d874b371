package com.rugradar.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of the rug-pull checks for one launch. {@code highRisk} is true iff at least one red flag was raised;
 * good signs never offset a red flag.
 */
public record RiskVerdict(String mint, String creator, List<String> goodSigns, List<String> redFlags, boolean highRisk) {

    public RiskVerdict {
        Objects.requireNonNull(mint, "mint");
        Objects.requireNonNull(creator, "creator");
        goodSigns = goodSigns == null ? List.of() : List.copyOf(goodSigns);
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
        if (highRisk != !redFlags.isEmpty()) {
            throw new IllegalArgumentException("highRisk must equal !redFlags.isEmpty()");
        }
    }

    public static RiskVerdict of(String mint, String creator, List<String> goodSigns, List<String> redFlags) {
        return new RiskVerdict(mint, creator, goodSigns, redFlags, redFlags != null && !redFlags.isEmpty());
    }
}
