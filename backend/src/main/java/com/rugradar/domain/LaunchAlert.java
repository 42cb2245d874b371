package com.rugradar.domain;

import java.util.Objects;

/**
 * What the alert sink receives for an evaluated launch.
 */
public record LaunchAlert(String signature, RiskVerdict verdict, ExplorerLinks links) {

    public LaunchAlert {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(verdict, "verdict");
        Objects.requireNonNull(links, "links");
    }

    public static LaunchAlert of(String signature, RiskVerdict verdict) {
        return new LaunchAlert(signature, verdict, ExplorerLinks.of(signature, verdict.mint()));
    }
}
