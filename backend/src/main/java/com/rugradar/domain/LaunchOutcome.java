package com.rugradar.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Tagged result of one per-launch pipeline run. Only {@link Status#ALERTED} carries an alert.
 */
public record LaunchOutcome(String signature, Status status, LaunchAlert alert, String detail) {

    public enum Status {
        ALERTED,
        NOT_FOUND,
        MINT_NOT_IDENTIFIED,
        FAILED
    }

    public LaunchOutcome {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(status, "status");
        if ((status == Status.ALERTED) != (alert != null)) {
            throw new IllegalArgumentException("alert must be present exactly when status is ALERTED");
        }
    }

    public static LaunchOutcome alerted(LaunchAlert alert) {
        return new LaunchOutcome(alert.signature(), Status.ALERTED, alert, null);
    }

    public static LaunchOutcome skipped(String signature, Status status, String detail) {
        return new LaunchOutcome(signature, status, null, detail);
    }

    public Optional<LaunchAlert> alertIfAny() {
        return Optional.ofNullable(alert);
    }
}
