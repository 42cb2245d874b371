package com.rugradar.domain;

import java.util.List;
import java.util.Objects;

/**
 * One log notification from the launchpad subscription: transaction signature plus its program log lines.
 */
public record LaunchEvent(String signature, List<String> logLines) {

    public LaunchEvent {
        Objects.requireNonNull(signature, "signature");
        logLines = logLines == null ? List.of() : List.copyOf(logLines);
    }
}
