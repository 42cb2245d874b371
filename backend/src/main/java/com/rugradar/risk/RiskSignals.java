package com.rugradar.risk;

/**
 * Good-sign and red-flag texts shown in alerts.
 */
public final class RiskSignals {

    public static final String MINT_AUTHORITY_REVOKED = "Mint authority REVOKED (cannot mint more tokens)";
    public static final String FREEZE_AUTHORITY_REVOKED = "Freeze authority REVOKED (cannot freeze holders' tokens)";
    public static final String LP_BURNED = "Liquidity pool tokens BURNED (liquidity cannot be rugged)";

    public static final String MINT_ACCOUNT_UNAVAILABLE = "Mint account info unavailable (could not fetch mint account)";
    public static final String LP_NOT_BURNED = "LP tokens NOT burned (dev can pull liquidity)";

    private RiskSignals() {
    }

    public static String mintAuthorityActive(String holder) {
        return "Mint authority ACTIVE: " + holder + " (dev can dilute supply)";
    }

    public static String freezeAuthorityActive(String holder) {
        return "Freeze authority ACTIVE: " + holder + " (dev can freeze wallets)";
    }
}
