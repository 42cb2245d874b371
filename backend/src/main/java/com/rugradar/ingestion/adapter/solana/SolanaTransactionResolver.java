package com.rugradar.ingestion.adapter.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.rugradar.domain.ResolvedLaunch;
import com.rugradar.domain.SolanaPrograms;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Resolves a launch signature to its creator and newly minted token.
 * <ul>
 *   <li>creator: first account key of the transaction message (fee payer)</li>
 *   <li>mint: first post-execution token balance whose raw amount is exactly
 *       {@link SolanaPrograms#INITIAL_SUPPLY_BASE_UNITS}</li>
 * </ul>
 * The supply match assumes one mint per creation transaction and no other balance with that exact amount.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SolanaTransactionResolver {

    static final String COMMITMENT = "confirmed";

    private final SolanaRpcInvoker rpcInvoker;

    /**
     * @throws TransactionNotFoundException when the RPC returns no transaction
     * @throws MintNotIdentifiedException   when no post balance matches the initial supply
     * @throws LaunchResolutionException    when the transaction has no account keys
     * @throws com.rugradar.ingestion.adapter.RpcException on transport failure after retries
     */
    public ResolvedLaunch resolve(String signature) {
        JsonNode tx = rpcInvoker.call("getTransaction", List.of(signature, Map.of(
                "encoding", "jsonParsed",
                "maxSupportedTransactionVersion", 0,
                "commitment", COMMITMENT)));
        if (tx == null || tx.isNull() || tx.isMissingNode()) {
            throw new TransactionNotFoundException(signature);
        }
        String creator = firstAccountKey(tx);
        if (creator == null) {
            throw new LaunchResolutionException(signature, "Transaction " + signature + " has no account keys");
        }
        String mint = findInitialSupplyMint(tx);
        if (mint == null) {
            throw new MintNotIdentifiedException(signature);
        }
        log.debug("Resolved {}: creator {}, mint {}", signature, creator, mint);
        return new ResolvedLaunch(signature, creator, mint);
    }

    private static String firstAccountKey(JsonNode tx) {
        JsonNode keys = tx.path("transaction").path("message").path("accountKeys");
        if (!keys.isArray() || keys.isEmpty()) {
            return null;
        }
        JsonNode first = keys.get(0);
        // jsonParsed returns {pubkey, signer, writable, source}; legacy json returns bare strings.
        String key = first.isTextual() ? first.asText() : first.path("pubkey").asText(null);
        return key == null || key.isBlank() ? null : key;
    }

    private static String findInitialSupplyMint(JsonNode tx) {
        JsonNode balances = tx.path("meta").path("postTokenBalances");
        if (!balances.isArray()) {
            return null;
        }
        for (JsonNode balance : balances) {
            String amount = balance.path("uiTokenAmount").path("amount").asText(null);
            if (SolanaPrograms.INITIAL_SUPPLY_BASE_UNITS.equals(amount)) {
                String mint = balance.path("mint").asText(null);
                if (mint != null && !mint.isBlank()) {
                    return mint;
                }
            }
        }
        return null;
    }
}
