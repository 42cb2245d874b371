package com.rugradar.domain;

/**
 * Compiled-in on-chain constants. Not user-configurable.
 */
public final class SolanaPrograms {

    /** Pump.fun launchpad program. */
    public static final String PUMP_FUN_PROGRAM = "6EF8rrecthR5Dkzon8Nwu78hRvfCKubJ14M5uBEwF6P";

    /** Raydium AMM v4; LP burns reference it in their logs. */
    public static final String RAYDIUM_AMM_PROGRAM = "675kPX9MHTjS2zt1qfr1NYHuzeLXfQM9H24wFSUt1Mp8";

    /** Pump.fun mints exactly 1B base units at creation. Compared as the literal amount string. */
    public static final String INITIAL_SUPPLY_BASE_UNITS = "1000000000";

    /** Base58 form of the all-zero 32-byte key; an authority slot holding it is revoked. */
    public static final String DEFAULT_ADDRESS = "11111111111111111111111111111111";

    private SolanaPrograms() {
    }
}
