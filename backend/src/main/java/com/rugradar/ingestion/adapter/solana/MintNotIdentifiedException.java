package com.rugradar.ingestion.adapter.solana;

/**
 * No post-execution token balance equals the launchpad's initial supply.
 */
public class MintNotIdentifiedException extends LaunchResolutionException {

    public MintNotIdentifiedException(String signature) {
        super(signature, "Could not identify mint address in " + signature);
    }
}
