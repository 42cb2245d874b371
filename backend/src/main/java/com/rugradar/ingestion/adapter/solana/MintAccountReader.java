package com.rugradar.ingestion.adapter.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.rugradar.risk.MintAccountSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads raw mint account bytes via getAccountInfo with base64 encoding.
 * Response shape: {@code result.value.data = ["<base64>", "base64"]}; {@code value} is null for unknown accounts.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MintAccountReader implements MintAccountSource {

    private final SolanaRpcInvoker rpcInvoker;

    @Override
    public Optional<byte[]> readMintAccount(String mintAddress) {
        JsonNode result = rpcInvoker.call("getAccountInfo", List.of(mintAddress, Map.of(
                "encoding", "base64",
                "commitment", SolanaTransactionResolver.COMMITMENT)));
        JsonNode value = result.path("value");
        if (value.isNull() || value.isMissingNode()) {
            log.debug("No account info for mint {}", mintAddress);
            return Optional.empty();
        }
        JsonNode data = value.path("data");
        String encoded = data.isArray() ? data.path(0).asText("") : "";
        if (encoded.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Base64.getDecoder().decode(encoded));
        } catch (IllegalArgumentException e) {
            log.warn("Undecodable account data for mint {}: {}", mintAddress, e.getMessage());
            return Optional.empty();
        }
    }
}
