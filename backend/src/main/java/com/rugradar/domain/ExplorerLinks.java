package com.rugradar.domain;

/**
 * External explorer URLs attached to every alert.
 */
public record ExplorerLinks(String transaction, String launchpad, String chart) {

    /** Pump.fun coin pages are keyed by mint; this link uses the signature prefix instead. */
    private static final int LAUNCHPAD_KEY_LENGTH = 44;

    public static ExplorerLinks of(String signature, String mint) {
        String launchpadKey = signature.length() > LAUNCHPAD_KEY_LENGTH
                ? signature.substring(0, LAUNCHPAD_KEY_LENGTH)
                : signature;
        return new ExplorerLinks(
                transactionUrl(signature),
                "https://pump.fun/" + launchpadKey,
                "https://dexscreener.com/solana/" + mint);
    }

    public static String transactionUrl(String signature) {
        return "https://solscan.io/tx/" + signature;
    }
}
