package com.rugradar.risk;

import java.util.Optional;

/**
 * Supplies the raw data of a mint account.
 */
public interface MintAccountSource {

    /**
     * @return raw account bytes, or empty when the account does not exist or has no data
     * @throws RuntimeException when the fetch itself failed
     */
    Optional<byte[]> readMintAccount(String mintAddress);
}
