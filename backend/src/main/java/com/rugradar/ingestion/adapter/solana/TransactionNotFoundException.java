package com.rugradar.ingestion.adapter.solana;

/**
 * getTransaction returned no record: pruned, not yet visible at the requested commitment, or an invalid signature.
 */
public class TransactionNotFoundException extends LaunchResolutionException {

    public TransactionNotFoundException(String signature) {
        super(signature, "No transaction data available for " + signature);
    }
}
