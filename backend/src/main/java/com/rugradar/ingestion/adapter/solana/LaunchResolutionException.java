package com.rugradar.ingestion.adapter.solana;

/**
 * A launch signature could not be turned into a {@code ResolvedLaunch}. The launch is skipped, never retried.
 */
public class LaunchResolutionException extends RuntimeException {

    private final String signature;

    public LaunchResolutionException(String signature, String message) {
        super(message);
        this.signature = signature;
    }

    public String getSignature() {
        return signature;
    }
}
