package com.rugradar.ingestion.filter;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Flags launchpad log notifications that look like token creations: any log line containing "create",
 * case-insensitive. Non-creation matches are dropped later when no mint resolves.
 */
@Component
public class LaunchFilter {

    private static final String CREATE_MARKER = "create";

    public boolean isLaunchEvent(List<String> logLines) {
        if (logLines == null || logLines.isEmpty()) {
            return false;
        }
        for (String line : logLines) {
            if (line != null && line.toLowerCase(Locale.ROOT).contains(CREATE_MARKER)) {
                return true;
            }
        }
        return false;
    }
}
